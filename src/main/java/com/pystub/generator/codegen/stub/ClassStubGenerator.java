package com.pystub.generator.codegen.stub;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pystub.generator.codegen.model.core.context.EmissionContext;
import com.pystub.generator.codegen.model.input.ClassDoc;
import com.pystub.generator.codegen.model.type.TypeVar;
import com.pystub.generator.codegen.type.InteropTypes;
import com.pystub.generator.codegen.type.TypeTranslator;
import com.pystub.generator.codegen.util.NamingUtil;
import com.pystub.generator.reflect.Reflection;
import com.pystub.generator.reflect.ReflectionProvider;
import com.pystub.generator.reflect.TypeLoadException;

/**
 * Generates the declaration of one top-level class, including its member classes.
 *
 * The class body is, in order: fields, constructors, methods, member classes, each indented by
 * four spaces. Type variable declarations of the class and its member classes are collected
 * separately and written before the top-level declaration.
 */
public class ClassStubGenerator {

    private static final Logger log = LoggerFactory.getLogger(ClassStubGenerator.class);

    private static final String INDENT = "    ";

    private final ReflectionProvider provider;
    private final TypeTranslator translator;
    private final TypeRenderer renderer;
    private final FieldStubGenerator fieldGenerator;
    private final MethodStubGenerator methodGenerator;

    public ClassStubGenerator(ReflectionProvider provider, TypeTranslator translator, TypeRenderer renderer,
                              FieldStubGenerator fieldGenerator, MethodStubGenerator methodGenerator) {
        this.provider = provider;
        this.translator = translator;
        this.renderer = renderer;
        this.fieldGenerator = fieldGenerator;
        this.methodGenerator = methodGenerator;
    }

    /**
     * Lines of a top-level declaration: an empty separator line, the type variable declarations,
     * then the class itself.
     *
     * @throws TypeLoadException when the class itself cannot be reflected
     */
    public List<String> generate(Class<?> cls, EmissionContext ctx) {
        List<String> typeVarOutput = new ArrayList<>();
        List<String> classOutput = generateClass(cls, ctx, typeVarOutput, List.of());
        List<String> output = new ArrayList<>();
        output.add("");
        output.addAll(typeVarOutput);
        output.addAll(classOutput);
        return output;
    }

    /**
     * Supertypes as they appear in the class header: generic superclass, then generic interfaces.
     */
    public static List<Type> superTypes(Class<?> cls) {
        return Reflection.guard(cls.getName(), () -> {
            List<Type> superTypes = new ArrayList<>();
            Type superclass = cls.getGenericSuperclass();
            if (superclass != null) {
                superTypes.add(superclass);
            }
            superTypes.addAll(Arrays.asList(cls.getGenericInterfaces()));
            return superTypes;
        });
    }

    /**
     * {@code class Foo: ...} stand-in for a class that cannot be generated.
     */
    public static String placeholder(String localName) {
        return "class " + localName.substring(localName.lastIndexOf('$') + 1) + ": ...";
    }

    private List<String> generateClass(Class<?> cls, EmissionContext ctx, List<String> typeVarOutput,
                                       List<TypeVar> enclosingScope) {
        String localName = Reflection.localName(cls);
        String scopeId = NamingUtil.classScopeId(localName);

        List<TypeVar> classTypeVars = new ArrayList<>();
        for (TypeVariable<?> variable : Reflection.guard(cls.getName(), cls::getTypeParameters)) {
            classTypeVars.add(Reflection.guard(cls.getName(), () -> translator.toTypeVar(variable, scopeId)));
        }
        for (TypeVar typeVar : classTypeVars) {
            typeVarOutput.add(renderer.renderTypeVarDeclaration(typeVar, ctx));
        }
        List<TypeVar> scope = new ArrayList<>(classTypeVars);
        if (!Reflection.isStatic(cls)) {
            scope.addAll(enclosingScope);
        }

        List<String> superTypes = renderSuperTypes(cls, scope, ctx);
        String header = superTypes.isEmpty()
                ? "class " + cls.getSimpleName() + ":"
                : "class " + cls.getSimpleName() + "(" + String.join(", ", superTypes) + "):";
        ClassDoc doc = provider.documentation(cls);

        List<String> body = new ArrayList<>();
        body.addAll(generateFields(cls, scope, doc, ctx));
        body.addAll(generateConstructors(cls, scope, doc, ctx));
        body.addAll(generateMethods(cls, scope, doc, ctx));

        List<String> nestedOutput = new ArrayList<>();
        for (Class<?> member : provider.memberClasses(cls)) {
            nestedOutput.addAll(generateMember(member, ctx, typeVarOutput, scope));
        }
        ctx.markEmitted(localName);
        repairNestedReferences(cls, ctx, nestedOutput, typeVarOutput, scope);
        body.addAll(nestedOutput);

        List<String> output = new ArrayList<>();
        List<String> docLines = TypeRenderer.docstringLines(doc.getDescription(), true);
        if (body.isEmpty() && docLines.isEmpty()) {
            output.add(header + " ...");
            return output;
        }
        output.add(header);
        output.addAll(docLines);
        if (body.isEmpty()) {
            output.add(INDENT + "...");
        }
        body.forEach(line -> output.add(INDENT + line));
        return output;
    }

    private List<String> renderSuperTypes(Class<?> cls, List<TypeVar> scope, EmissionContext ctx) {
        List<String> rendered = new ArrayList<>();
        for (Type superType : superTypes(cls)) {
            rendered.add(renderer.render(Reflection.guard(cls.getName(), () -> translator.translate(superType, scope)),
                    ctx, false));
        }
        if (InteropTypes.JAVA_THROWABLE.equals(cls.getName())) {
            ctx.getImports().addImport("builtins");
            rendered.add(InteropTypes.PY_EXCEPTION);
        }
        TypeVariable<?>[] typeParameters = cls.getTypeParameters();
        if (typeParameters.length > 0) {
            String scopeId = NamingUtil.classScopeId(Reflection.localName(cls));
            String generic = Arrays.stream(typeParameters)
                    .map(variable -> TypeVar.of(variable.getName(), scopeId, null).getPythonName())
                    .collect(Collectors.joining(", "));
            ctx.getImports().addImport("typing");
            rendered.add("typing.Generic[" + generic + "]");
        }
        return rendered;
    }

    private List<String> generateFields(Class<?> cls, List<TypeVar> scope, ClassDoc doc, EmissionContext ctx) {
        List<String> output = new ArrayList<>();
        for (Field field : Reflection.guard(cls.getName(), cls::getDeclaredFields)) {
            try {
                output.addAll(fieldGenerator.generate(field, scope, doc.fieldDoc(field.getName()), ctx));
            } catch (TypeLoadException e) {
                log.warn("Skipping field {}.{} due to {}", cls.getName(), field.getName(), e.getMessage());
            }
        }
        return output;
    }

    private List<String> generateConstructors(Class<?> cls, List<TypeVar> scope, ClassDoc doc, EmissionContext ctx) {
        try {
            return methodGenerator.generateConstructors(cls, scope, doc.getConstructorDoc(), ctx);
        } catch (TypeLoadException e) {
            log.warn("Skipping constructors of {} due to {}", cls.getName(), e.getMessage());
            return List.of();
        }
    }

    private List<String> generateMethods(Class<?> cls, List<TypeVar> scope, ClassDoc doc, EmissionContext ctx) {
        // python name -> java name of the declared public methods
        Map<String, String> methodNames = new TreeMap<>();
        for (Method method : Reflection.guard(cls.getName(), cls::getDeclaredMethods)) {
            String pythonName = NamingUtil.pysafe(method.getName());
            if (pythonName != null && Reflection.isPublic(method) && !method.isSynthetic()) {
                methodNames.putIfAbsent(pythonName, method.getName());
            }
        }
        if (methodNames.isEmpty()) {
            return List.of();
        }

        Method[] publicMethods = Reflection.guard(cls.getName(), cls::getMethods);
        List<String> output = new ArrayList<>();
        for (Map.Entry<String, String> entry : methodNames.entrySet()) {
            List<Method> overloads = Arrays.stream(publicMethods)
                    .filter(method -> !method.isSynthetic())
                    .filter(method -> entry.getKey().equals(NamingUtil.pysafe(method.getName())))
                    .toList();
            try {
                output.addAll(methodGenerator.generateMethod(entry.getKey(), overloads, scope,
                        doc.methodDoc(entry.getValue()), ctx));
            } catch (TypeLoadException e) {
                log.warn("Skipping method {}.{} due to {}", cls.getName(), entry.getValue(), e.getMessage());
            }
        }
        return output;
    }

    private List<String> generateMember(Class<?> member, EmissionContext ctx, List<String> typeVarOutput,
                                        List<TypeVar> scope) {
        List<String> memberTypeVars = new ArrayList<>();
        try {
            List<String> output = generateClass(member, ctx, memberTypeVars, scope);
            typeVarOutput.addAll(memberTypeVars);
            return output;
        } catch (TypeLoadException e) {
            String localName = Reflection.localName(member);
            log.warn("Skipping member class {} due to {}", member.getName(), e.getMessage());
            ctx.markEmitted(localName);
            return List.of(placeholder(localName));
        }
    }

    /**
     * Member classes that are referenced from the output but were not emitted (non-public
     * ones, or ones the class only inherits) are looked up once, and replaced by a placeholder
     * when they cannot be generated.
     */
    private void repairNestedReferences(Class<?> cls, EmissionContext ctx, List<String> nestedOutput,
                                        List<String> typeVarOutput, List<TypeVar> scope) {
        String localName = Reflection.localName(cls);
        String packagePrefix = ctx.getSafePackageName() + ".";
        String nestedPrefix = packagePrefix + localName + "$";
        Set<String> attempted = new HashSet<>();

        while (true) {
            List<String> missing = ctx.getReferenced().stream()
                    .filter(name -> name.startsWith(nestedPrefix))
                    .map(name -> name.substring(packagePrefix.length()))
                    .filter(name -> !ctx.isEmitted(name))
                    .toList();
            if (missing.isEmpty()) {
                return;
            }
            for (String nested : missing) {
                if (ctx.isEmitted(nested)) {
                    continue;
                }
                String simpleName = nested.substring(localName.length() + 1).split("\\$")[0];
                String directMember = localName + "$" + simpleName;
                Optional<Class<?>> member = Optional.empty();
                if (!ctx.isEmitted(directMember) && attempted.add(directMember)) {
                    member = findMember(cls, simpleName);
                }
                if (member.isPresent()) {
                    nestedOutput.addAll(generateMember(member.get(), ctx, typeVarOutput, scope));
                } else {
                    log.warn("Reference to missing inner class {}.{} - generating empty stub",
                            ctx.getPackageName(), nested);
                    nestedOutput.add(placeholder(nested));
                    ctx.markEmitted(nested);
                }
            }
        }
    }

    private Optional<Class<?>> findMember(Class<?> cls, String simpleName) {
        try {
            return provider.findMemberClass(cls, simpleName);
        } catch (TypeLoadException e) {
            log.warn("Cannot load member class {}${} due to {}", cls.getName(), simpleName, e.getMessage());
            return Optional.empty();
        }
    }
}
