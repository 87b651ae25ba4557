package com.pystub.generator.codegen.type;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.pystub.generator.codegen.model.type.TypeExpr;
import com.pystub.generator.codegen.model.type.TypeVar;
import com.pystub.generator.reflect.Reflection;

import static com.pystub.generator.codegen.type.InteropTypes.*;

/**
 * Translates Java reflective types into Python type expressions.
 *
 * The translation depends on where the type is used:
 * <ul>
 * <li>plain (return types, fields, supertypes): the natural Python type, e.g. {@code int};</li>
 * <li>argument: widened to everything the interop layer converts implicitly, e.g.
 * {@code typing.Union[int, java.jint, java.lang.Integer]};</li>
 * <li>array element: the primitive wrapper only, e.g. {@code java.jint}.</li>
 * </ul>
 * Generic bounds Python cannot express are narrowed to the first bound.
 */
public class TypeTranslator {

    public TypeExpr translate(Type javaType) {
        return translate(javaType, List.of(), false, false);
    }

    public TypeExpr translate(Type javaType, List<TypeVar> scope) {
        return translate(javaType, scope, false, false);
    }

    /**
     * @param javaType     the type to translate; null stands for the return type of a constructor
     * @param scope        type variables visible at the use site, innermost first
     * @param argument     the type is a method or constructor argument
     * @param arrayElement the type is the component of an array
     */
    public TypeExpr translate(Type javaType, List<TypeVar> scope, boolean argument, boolean arrayElement) {
        if (javaType == null) {
            return TypeExpr.of(PY_NONE);
        }
        if (javaType instanceof ParameterizedType parameterized) {
            List<TypeExpr> typeArgs = new ArrayList<>();
            for (Type typeArg : parameterized.getActualTypeArguments()) {
                typeArgs.add(translate(typeArg, scope, argument, arrayElement));
            }
            Class<?> raw = (Class<?>) parameterized.getRawType();
            return widenFunctional(raw, typeArgs, translateName(raw.getName(), typeArgs, argument, arrayElement),
                    argument && !arrayElement);
        }
        if (javaType instanceof TypeVariable<?> variable) {
            for (TypeVar candidate : scope) {
                if (candidate.getJavaName().equals(variable.getName())) {
                    return TypeExpr.of(candidate.getPythonName());
                }
            }
            return translate(firstBound(variable));
        }
        if (javaType instanceof WildcardType wildcard) {
            Type bound = wildcard.getUpperBounds()[0];
            if (JAVA_OBJECT.equals(bound.getTypeName()) && wildcard.getLowerBounds().length > 0) {
                bound = wildcard.getLowerBounds()[0];
            }
            return translate(bound, scope);
        }
        if (javaType instanceof GenericArrayType || (javaType instanceof Class<?> c && c.isArray())) {
            return translateArray(javaType, scope);
        }
        if (javaType instanceof Class<?> cls) {
            return widenFunctional(cls, null, translateName(cls.getName(), List.of(), argument, arrayElement),
                    argument && !arrayElement);
        }
        // other Type implementations carry only a name
        return translateName(javaType.getTypeName(), List.of(), argument, arrayElement);
    }

    /**
     * Declares the Python type variable for a Java one. The bound is the translation of the
     * first declared bound (raw when parameterized) and is dropped when it is {@code Object}.
     */
    public TypeVar toTypeVar(TypeVariable<?> variable, String scopeId) {
        TypeExpr bound = translate(firstBound(variable));
        if (JAVA_OBJECT.equals(bound.getName())) {
            bound = null;
        }
        return TypeVar.of(variable.getName(), scopeId, bound);
    }

    /**
     * {@code typing.Callable} form of a functional interface, or empty when {@code iface} does
     * not declare exactly one abstract method itself.
     *
     * @param typeArgs translated type arguments of the interface, or null for a raw reference
     */
    public Optional<TypeExpr> callableOf(Class<?> iface, List<TypeExpr> typeArgs) {
        Optional<Method> method = functionalMethod(iface);
        if (method.isEmpty()) {
            return Optional.empty();
        }
        List<TypeVariable<?>> typeParameters = Arrays.asList(iface.getTypeParameters());
        List<TypeExpr> parameterTypes = new ArrayList<>();
        for (Type parameterType : method.get().getGenericParameterTypes()) {
            parameterTypes.add(resolveFunctionalType(parameterType, typeParameters, typeArgs));
        }
        TypeExpr returnType = resolveFunctionalType(method.get().getGenericReturnType(), typeParameters, typeArgs);
        return Optional.of(TypeExpr.callable(parameterTypes, returnType));
    }

    /**
     * The single public abstract instance method declared by {@code iface}, ignoring methods that
     * redeclare a {@code java.lang.Object} method.
     */
    public static Optional<Method> functionalMethod(Class<?> iface) {
        if (!iface.isInterface() || iface.isAnnotation()) {
            return Optional.empty();
        }
        Method[] declared = Reflection.guard(iface.getName(), iface::getDeclaredMethods);
        List<Method> candidates = Arrays.stream(declared)
                .filter(m -> Modifier.isPublic(m.getModifiers()))
                .filter(m -> Modifier.isAbstract(m.getModifiers()))
                .filter(m -> !Modifier.isStatic(m.getModifiers()))
                .filter(m -> !m.isSynthetic() && !m.isBridge())
                .filter(m -> !Reflection.isDeclaredOnObject(m))
                .toList();
        return candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
    }

    private TypeExpr resolveFunctionalType(Type type, List<TypeVariable<?>> typeParameters, List<TypeExpr> typeArgs) {
        if (typeArgs != null && type instanceof TypeVariable<?>) {
            int index = typeParameters.indexOf(type);
            if (index >= 0 && index < typeArgs.size()) {
                return typeArgs.get(index);
            }
        }
        return translate(type);
    }

    /**
     * Arguments typed with a functional interface also accept a Python callable.
     */
    private TypeExpr widenFunctional(Class<?> cls, List<TypeExpr> typeArgs, TypeExpr translated, boolean widen) {
        if (!widen || !cls.isInterface() || !translated.getName().equals(cls.getName())) {
            return translated;
        }
        return callableOf(cls, typeArgs)
                .map(callable -> TypeExpr.union(List.of(translated, callable)))
                .orElse(translated);
    }

    private TypeExpr translateArray(Type arrayType, List<TypeVar> scope) {
        Type component = arrayType instanceof GenericArrayType generic
                ? generic.getGenericComponentType()
                : ((Class<?>) arrayType).getComponentType();
        TypeExpr element = translate(component, scope, false, true);
        return Primitive.arrayTypeForWrapper(element.getName())
                .map(TypeExpr::of)
                .orElseGet(() -> TypeExpr.of(JAVA_ARRAY, List.of(element)));
    }

    /**
     * Applies the name based rules (primitives, String, Class, Object) to a raw type name.
     */
    TypeExpr translateName(String typeName, List<TypeExpr> typeArgs, boolean argument, boolean arrayElement) {
        List<TypeExpr> union = new ArrayList<>();

        Optional<Primitive> primitive = Primitive.forJavaName(typeName);
        if (primitive.isPresent()) {
            if (argument && arrayElement) {
                throw new IllegalArgumentException(
                        "Type " + typeName + " cannot be both an array element and an argument type");
            }
            Primitive p = primitive.get();
            union.add(TypeExpr.of(arrayElement ? p.getWrapperName() : p.getPythonName()));
            if (argument) {
                union.add(TypeExpr.of(p.getWrapperName()));
                union.add(TypeExpr.of(p.getBoxedName()));
            }
        }

        switch (typeName) {
            case JAVA_STRING -> {
                if (arrayElement) {
                    union.add(TypeExpr.of(JAVA_STRING));
                } else {
                    union.add(TypeExpr.of(PY_STR));
                    if (argument) {
                        union.add(TypeExpr.of(JAVA_STRING));
                    }
                }
            }
            case JAVA_CLASS -> union.add(TypeExpr.of(PY_TYPE, typeArgs));
            case JAVA_OBJECT -> {
                union.add(TypeExpr.of(JAVA_OBJECT));
                if (argument) {
                    union.add(TypeExpr.of(PY_INT));
                    union.add(TypeExpr.of(PY_BOOL));
                    union.add(TypeExpr.of(PY_FLOAT));
                    union.add(TypeExpr.of(PY_STR));
                }
            }
            default -> {
                // not special
            }
        }

        if (union.size() == 1) {
            return union.get(0);
        }
        if (union.size() > 1) {
            return TypeExpr.union(union);
        }
        return TypeExpr.of(typeName, typeArgs);
    }

    /**
     * First declared bound; a parameterized bound ({@code E extends Enum<E>}) is reduced to its raw type.
     */
    private static Type firstBound(TypeVariable<?> variable) {
        Type bound = variable.getBounds()[0];
        if (bound instanceof ParameterizedType parameterized) {
            return parameterized.getRawType();
        }
        return bound;
    }
}
