package com.pystub.generator.codegen.model.type;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * A Python type expression: a (dotted) type name with optional type arguments.
 *
 * Two names are special: {@link #UNION} marks a union whose arguments are the alternatives,
 * and the empty name renders as a bare bracketed list (the parameter list of
 * {@code typing.Callable}).
 */
@Value
public class TypeExpr {

    public static final String UNION = "typing.Union";
    public static final String CALLABLE = "typing.Callable";

    @NonNull
    String name;

    @NonNull
    List<TypeExpr> typeArgs;

    public static TypeExpr of(String name) {
        return new TypeExpr(name, List.of());
    }

    public static TypeExpr of(String name, List<TypeExpr> typeArgs) {
        return new TypeExpr(name, typeArgs == null ? List.of() : List.copyOf(typeArgs));
    }

    public static TypeExpr union(List<TypeExpr> alternatives) {
        return of(UNION, alternatives);
    }

    /**
     * {@code typing.Callable[[params...], returnType]}
     */
    public static TypeExpr callable(List<TypeExpr> parameterTypes, TypeExpr returnType) {
        return of(CALLABLE, List.of(of("", parameterTypes), returnType));
    }

    public boolean hasTypeArgs() {
        return !typeArgs.isEmpty();
    }

    public boolean isUnion() {
        return UNION.equals(name);
    }

    @Override
    public String toString() {
        if (typeArgs.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('[');
        for (int i = 0; i < typeArgs.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(typeArgs.get(i));
        }
        return sb.append(']').toString();
    }
}
