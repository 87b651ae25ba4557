package com.pystub.generator.codegen.type;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Java primitives with their boxed class, the interop wrapper type ({@code java.jint}, ...)
 * and the native Python type they convert to.
 */
@Getter
@RequiredArgsConstructor
public enum Primitive {

    VOID("void", "java.lang.Void", "java.jvoid", "None", null),
    BYTE("byte", "java.lang.Byte", "java.jbyte", "int", "java.chaquopy.JavaArrayJByte"),
    SHORT("short", "java.lang.Short", "java.jshort", "int", "java.chaquopy.JavaArrayJShort"),
    INT("int", "java.lang.Integer", "java.jint", "int", "java.chaquopy.JavaArrayJInt"),
    LONG("long", "java.lang.Long", "java.jlong", "int", "java.chaquopy.JavaArrayJLong"),
    BOOLEAN("boolean", "java.lang.Boolean", "java.jboolean", "bool", "java.chaquopy.JavaArrayJBoolean"),
    DOUBLE("double", "java.lang.Double", "java.jdouble", "float", "java.chaquopy.JavaArrayJDouble"),
    FLOAT("float", "java.lang.Float", "java.jfloat", "float", "java.chaquopy.JavaArrayJFloat"),
    CHAR("char", "java.lang.Character", "java.jchar", "str", "java.chaquopy.JavaArrayJChar");

    private static final Map<String, Primitive> BY_JAVA_NAME = new HashMap<>();
    private static final Map<String, Primitive> BY_WRAPPER = new HashMap<>();

    static {
        for (Primitive p : values()) {
            BY_JAVA_NAME.put(p.javaName, p);
            BY_JAVA_NAME.put(p.boxedName, p);
            BY_WRAPPER.put(p.wrapperName, p);
        }
    }

    private final String javaName;
    private final String boxedName;
    private final String wrapperName;
    private final String pythonName;
    private final String arrayTypeName;

    /**
     * Looks up a primitive by its keyword ({@code int}) or boxed class name ({@code java.lang.Integer}).
     */
    public static Optional<Primitive> forJavaName(String typeName) {
        return Optional.ofNullable(BY_JAVA_NAME.get(typeName));
    }

    /**
     * Specialized array type for arrays whose element translates to {@code wrapperName}.
     */
    public static Optional<String> arrayTypeForWrapper(String wrapperName) {
        return Optional.ofNullable(BY_WRAPPER.get(wrapperName)).map(p -> p.arrayTypeName);
    }
}
