package com.pystub.generator.codegen.stub;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.pystub.generator.codegen.javadoc.JavadocSplitter;
import com.pystub.generator.codegen.model.core.context.EmissionContext;
import com.pystub.generator.codegen.model.type.ArgumentSig;
import com.pystub.generator.codegen.model.type.FunctionSig;
import com.pystub.generator.codegen.model.type.TypeVar;
import com.pystub.generator.codegen.type.TypeTranslator;
import com.pystub.generator.codegen.util.NamingUtil;
import com.pystub.generator.reflect.Reflection;

import lombok.RequiredArgsConstructor;

/**
 * Generates the {@code def} lines of one method name (all overloads) or of the constructors,
 * which become {@code __init__}.
 */
@RequiredArgsConstructor
public class MethodStubGenerator {

    static final String INIT = "__init__";

    private final TypeTranslator translator;
    private final TypeRenderer renderer;
    private final JavadocSplitter splitter;

    /**
     * @param doc aggregated javadoc of all constructors, may be empty
     */
    public List<String> generateConstructors(Class<?> cls, List<TypeVar> classScope, String doc, EmissionContext ctx) {
        Constructor<?>[] constructors = Reflection.guard(cls.getName(), cls::getConstructors);
        List<FunctionSig> signatures = signatures(INIT, List.of(constructors), classScope);
        return render(signatures, cls.getSimpleName(), doc, true, ctx);
    }

    /**
     * @param pythonName Python-safe method name shared by all overloads
     * @param overloads  public methods with that name
     * @param doc        aggregated javadoc of all overloads, may be empty
     */
    public List<String> generateMethod(String pythonName, List<Method> overloads, List<TypeVar> classScope,
                                       String doc, EmissionContext ctx) {
        List<FunctionSig> signatures = signatures(pythonName, overloads, classScope);
        String documentedName = overloads.isEmpty() ? pythonName : overloads.get(0).getName();
        return render(signatures, documentedName, doc, false, ctx);
    }

    List<FunctionSig> signatures(String name, List<? extends Executable> overloads, List<TypeVar> classScope) {
        List<Executable> sorted = new ArrayList<>(overloads);
        sorted.sort(Comparator.comparing(Executable::toString));
        boolean overloaded = sorted.size() > 1;

        List<FunctionSig> signatures = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            Executable overload = sorted.get(i);
            String scopeId = overloaded ? name + "_" + i : name;
            signatures.add(Reflection.guard(overload.getDeclaringClass().getName() + "." + overload.getName(),
                    () -> signature(name, overload, scopeId, classScope)));
        }
        return signatures;
    }

    private FunctionSig signature(String name, Executable overload, String scopeId, List<TypeVar> classScope) {
        boolean constructor = overload instanceof Constructor<?>;
        boolean isStatic = !constructor && Reflection.isStatic(overload);

        List<TypeVar> methodTypeVars = new ArrayList<>();
        for (TypeVariable<?> variable : overload.getTypeParameters()) {
            methodTypeVars.add(translator.toTypeVar(variable, scopeId));
        }
        List<TypeVar> scope = new ArrayList<>(methodTypeVars);
        if (!isStatic) {
            scope.addAll(classScope);
        }

        List<ArgumentSig> args = new ArrayList<>();
        if (!isStatic) {
            args.add(ArgumentSig.SELF);
        }
        for (Parameter parameter : overload.getParameters()) {
            Type type = parameter.getParameterizedType();
            String javaTypeName = NamingUtil.simpleTypeName(type.getTypeName());
            if (parameter.isVarArgs()) {
                type = componentType(type);
            }
            String argName = parameter.isNamePresent()
                    ? parameter.getName()
                    : NamingUtil.inferArgName(type.getTypeName(), args);
            args.add(new ArgumentSig(argName, translator.translate(type, scope, true, false), parameter.isVarArgs(),
                    javaTypeName));
        }

        Type returnType = overload instanceof Method method ? method.getGenericReturnType() : null;
        return FunctionSig.builder()
                .name(name)
                .isStatic(isStatic)
                .args(args)
                .returnType(translator.translate(returnType, scope))
                .typeVars(methodTypeVars)
                .build();
    }

    private List<String> render(List<FunctionSig> signatures, String documentedName, String doc, boolean constructor,
                                EmissionContext ctx) {
        List<String> output = new ArrayList<>();
        boolean overloaded = signatures.size() > 1;

        // type variable declarations may not sit between overloads
        for (FunctionSig signature : signatures) {
            for (TypeVar typeVar : signature.getTypeVars()) {
                output.add(renderer.renderTypeVarDeclaration(typeVar, ctx));
            }
        }

        List<String> docs = doc == null || doc.isEmpty()
                ? Collections.nCopies(signatures.size(), "")
                : splitter.split(signatures, documentedName, doc);

        for (int i = 0; i < signatures.size(); i++) {
            FunctionSig signature = signatures.get(i);
            String overloadDoc = docs.get(i);
            if (overloaded) {
                ctx.getImports().addImport("typing");
                output.add("@typing.overload");
            }
            if (signature.isStatic()) {
                output.add("@staticmethod");
            }
            String args = renderArgs(signature, ctx);
            String ellipsis = overloadDoc.isEmpty() ? " ..." : "";
            if (constructor) {
                output.add("def __init__(" + args + ") -> None:" + ellipsis);
            } else {
                String returnType = renderer.render(signature.getReturnType(), ctx);
                output.add("def " + signature.getName() + "(" + args + ") -> " + returnType + ":" + ellipsis);
            }
            if (!overloadDoc.isEmpty()) {
                output.addAll(TypeRenderer.docstringLines(overloadDoc, true));
                output.add("    ...");
            }
        }
        return output;
    }

    private String renderArgs(FunctionSig signature, EmissionContext ctx) {
        List<String> rendered = new ArrayList<>();
        List<ArgumentSig> args = signature.getArgs();
        for (int i = 0; i < args.size(); i++) {
            ArgumentSig arg = args.get(i);
            if (arg.isReceiver()) {
                rendered.add(arg.getName());
                continue;
            }
            String name = NamingUtil.pysafe(arg.getName());
            if (name == null) {
                name = "invalidArgName" + i;
            }
            if (arg.isVarArgs()) {
                name = "*" + name;
            }
            rendered.add(name + ": " + renderer.render(arg.getType(), ctx));
        }
        return String.join(", ", rendered);
    }

    private static Type componentType(Type arrayType) {
        if (arrayType instanceof GenericArrayType generic) {
            return generic.getGenericComponentType();
        }
        if (arrayType instanceof Class<?> cls && cls.isArray()) {
            return cls.getComponentType();
        }
        return arrayType;
    }
}
