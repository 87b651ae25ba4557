package com.pystub.generator.codegen.model.type;

import lombok.NonNull;
import lombok.Value;

/**
 * One argument of a {@link FunctionSig}. The implicit {@code self} receiver has no type.
 */
@Value
public class ArgumentSig {

    public static final ArgumentSig SELF = new ArgumentSig("self", null, false, null);

    @NonNull
    String name;

    TypeExpr type;

    boolean varArgs;

    /** simple Java type name as written in javadoc signatures, e.g. {@code List} or {@code int[]} */
    String javaTypeName;

    public boolean isReceiver() {
        return type == null;
    }
}
