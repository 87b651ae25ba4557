package com.pystub.generator.codegen.model.type;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Translated signature of one constructor or method overload.
 */
@Value
@Builder(toBuilder = true)
public class FunctionSig {

    @NonNull
    String name;

    boolean isStatic;

    @Singular
    List<ArgumentSig> args;

    @NonNull
    TypeExpr returnType;

    @Singular
    List<TypeVar> typeVars;

    /**
     * Arguments without the {@code self} receiver.
     */
    public List<ArgumentSig> declaredArgs() {
        return args.stream().filter(a -> !a.isReceiver()).toList();
    }
}
