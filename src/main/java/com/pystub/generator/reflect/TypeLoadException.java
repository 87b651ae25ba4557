package com.pystub.generator.reflect;

/**
 * Raised when a class, or a type referenced from one of its signatures, cannot be loaded
 * (missing dependency on the classpath, incompatible class file, broken generic signature).
 *
 * Callers catch it per class or member and continue with the rest of the package.
 */
public class TypeLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String typeName;

    public TypeLoadException(String typeName, Throwable cause) {
        super("Cannot load " + typeName + ": " + cause, cause);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
