package com.pystub.generator.codegen.model.type;

import lombok.NonNull;
import lombok.Value;

/**
 * A Python {@code typing.TypeVar} standing for a Java type variable.
 *
 * The Python name is prefixed with the id of the declaring scope ({@code _Scope__T}) since
 * Python type variables live at module or class level rather than on their declaration.
 */
@Value
public class TypeVar {

    @NonNull
    String javaName;

    @NonNull
    String pythonName;

    /** null when unbounded (or bounded by {@code java.lang.Object}) */
    TypeExpr bound;

    public static TypeVar of(String javaName, String scopeId, TypeExpr bound) {
        return new TypeVar(javaName, "_" + scopeId + "__" + javaName, bound);
    }
}
