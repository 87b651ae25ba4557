package com.pystub.generator.codegen.stub;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;

import com.pystub.generator.codegen.model.core.context.EmissionContext;
import com.pystub.generator.codegen.model.type.TypeExpr;
import com.pystub.generator.codegen.model.type.TypeVar;
import com.pystub.generator.codegen.type.TypeTranslator;
import com.pystub.generator.codegen.util.NamingUtil;
import com.pystub.generator.reflect.Reflection;

import lombok.RequiredArgsConstructor;

/**
 * Generates {@code name: type = ...} lines for public fields. Static fields are wrapped in
 * {@code typing.ClassVar} and cannot see the class type variables.
 */
@RequiredArgsConstructor
public class FieldStubGenerator {

    private final TypeTranslator translator;
    private final TypeRenderer renderer;

    public List<String> generate(Field field, List<TypeVar> classScope, String doc, EmissionContext ctx) {
        if (!Reflection.isPublic(field)) {
            return List.of();
        }
        String name = NamingUtil.pysafe(field.getName());
        if (name == null) {
            return List.of();
        }
        boolean isStatic = Reflection.isStatic(field);
        TypeExpr type = Reflection.guard(field.getDeclaringClass().getName() + "." + field.getName(),
                () -> translator.translate(field.getGenericType(), isStatic ? List.of() : classScope));

        String annotation = renderer.render(type, ctx);
        if (isStatic) {
            ctx.getImports().addImport("typing");
            annotation = "typing.ClassVar[" + annotation + "]";
        }

        List<String> output = new ArrayList<>();
        output.add(name + ": " + annotation + " = ...");
        output.addAll(TypeRenderer.docstringLines(doc, false));
        return output;
    }
}
