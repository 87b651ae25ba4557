package com.pystub.generator.codegen.type;

/**
 * Names of Java and Python types with special treatment during translation.
 */
public final class InteropTypes {

    public static final String JAVA_OBJECT = "java.lang.Object";
    public static final String JAVA_STRING = "java.lang.String";
    public static final String JAVA_CLASS = "java.lang.Class";
    public static final String JAVA_THROWABLE = "java.lang.Throwable";

    public static final String PY_NONE = "None";
    public static final String PY_STR = "str";
    public static final String PY_INT = "int";
    public static final String PY_BOOL = "bool";
    public static final String PY_FLOAT = "float";
    public static final String PY_TYPE = "typing.Type";
    public static final String PY_EXCEPTION = "builtins.Exception";

    public static final String JAVA_ARRAY = "java.chaquopy.JavaArray";

    private InteropTypes() {
        // Constants class
    }
}
