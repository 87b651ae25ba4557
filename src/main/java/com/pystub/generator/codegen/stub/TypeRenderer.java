package com.pystub.generator.codegen.stub;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.pystub.generator.codegen.model.core.context.EmissionContext;
import com.pystub.generator.codegen.model.type.TypeExpr;
import com.pystub.generator.codegen.model.type.TypeVar;
import com.pystub.generator.codegen.util.NamingUtil;

/**
 * Renders {@link TypeExpr}s as stub source text, adding the imports they need and recording
 * the referenced classes in the {@link EmissionContext}.
 *
 * A class of the package being generated is written with its local name when it is already
 * declared, or when the position allows a forward reference (annotations). Otherwise
 * (e.g. in a list of base classes) the fully qualified name is used.
 */
public class TypeRenderer {

    private static final String BUILTINS = "builtins";

    public String render(TypeExpr type, EmissionContext ctx) {
        return render(type, ctx, true);
    }

    public String render(TypeExpr type, EmissionContext ctx, boolean canBeDeferred) {
        String name = type.getName();
        if (name.contains(".")) {
            name = NamingUtil.pysafePath(name);
            ctx.addReferenced(name);
            int dot = name.lastIndexOf('.');
            String parent = name.substring(0, dot);
            String localName = name.substring(dot + 1);
            if (parent.equals(BUILTINS)) {
                name = localName;
            } else if (parent.equals(ctx.getSafePackageName())) {
                if (ctx.isEmitted(localName) || canBeDeferred) {
                    name = localName;
                } else {
                    ctx.getImports().addImport(name.substring(0, name.indexOf('.')));
                }
            } else {
                ctx.getImports().addImport(parent);
            }
        }
        name = name.replace('$', '.');

        if (type.hasTypeArgs() || name.isEmpty()) {
            String args = type.getTypeArgs().stream()
                    .map(arg -> render(arg, ctx))
                    .collect(Collectors.joining(", "));
            return name + "[" + args + "]";
        }
        return name;
    }

    /**
     * {@code _Foo__T = typing.TypeVar('_Foo__T', bound=Bar)  # <T>}
     */
    public String renderTypeVarDeclaration(TypeVar typeVar, EmissionContext ctx) {
        ctx.getImports().addImport("typing");
        String pythonName = typeVar.getPythonName();
        if (typeVar.getBound() != null) {
            return pythonName + " = typing.TypeVar('" + pythonName + "', bound=" + render(typeVar.getBound(), ctx)
                    + ")  # <" + typeVar.getJavaName() + ">";
        }
        return pythonName + " = typing.TypeVar('" + pythonName + "')  # <" + typeVar.getJavaName() + ">";
    }

    /**
     * Triple-quoted docstring lines for {@code doc}, or nothing for an empty doc. Backslashes and
     * embedded triple quotes are escaped so the docstring always parses.
     */
    public static List<String> docstringLines(String doc, boolean indent) {
        if (doc == null || doc.isEmpty()) {
            return List.of();
        }
        String prefix = indent ? "    " : "";
        String escaped = doc.replace("\\", "\\\\").replace("\"\"\"", "\\\"\\\"\\\"");
        List<String> body = escaped.lines().map(line -> prefix + line).toList();
        List<String> lines = new ArrayList<>();
        lines.add(prefix + "\"\"\"");
        lines.addAll(body);
        lines.add(prefix + "\"\"\"");
        return lines;
    }
}
