package com.pystub.generator.codegen.model.output;

/**
 * Categories of written stub files.
 */
public enum GeneratedFileType {
    /** {@code __init__.pyi} of a Java package */
    PACKAGE_STUB,
    /** interop binding module of the {@code java} package */
    BINDINGS
}
