package com.pystub.generator.reflect;

import java.lang.reflect.Member;
import java.lang.reflect.MalformedParameterizedTypeException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.function.Supplier;

/**
 * Small helpers around {@code java.lang.reflect}.
 */
public final class Reflection {

    private Reflection() {
        // Utility class
    }

    /**
     * Runs a reflective lookup, normalizing the different ways a missing or broken type
     * surfaces into {@link TypeLoadException}.
     */
    public static <T> T guard(String typeName, Supplier<T> lookup) {
        try {
            return lookup.get();
        } catch (TypeLoadException e) {
            throw e;
        } catch (LinkageError | TypeNotPresentException | MalformedParameterizedTypeException
                 | SecurityException e) {
            throw new TypeLoadException(typeName, e);
        }
    }

    public static boolean isPublic(Member member) {
        return Modifier.isPublic(member.getModifiers());
    }

    public static boolean isStatic(Member member) {
        return Modifier.isStatic(member.getModifiers());
    }

    public static boolean isAbstract(Member member) {
        return Modifier.isAbstract(member.getModifiers());
    }

    public static boolean isStatic(Class<?> cls) {
        return Modifier.isStatic(cls.getModifiers());
    }

    /**
     * A "real" class: excludes synthetic, anonymous and local classes.
     */
    public static boolean isJavaClass(Class<?> cls) {
        return !cls.isAnonymousClass() && !cls.isLocalClass() && !cls.isSynthetic();
    }

    /**
     * Binary name relative to its package, e.g. {@code Outer$Inner}.
     */
    public static String localName(Class<?> cls) {
        String name = cls.getName();
        return name.substring(name.lastIndexOf('.') + 1);
    }

    /**
     * Whether {@code java.lang.Object} declares a method with the same name and parameter types.
     * Such methods do not count towards the single abstract method of a functional interface.
     */
    public static boolean isDeclaredOnObject(Method method) {
        try {
            Object.class.getDeclaredMethod(method.getName(), method.getParameterTypes());
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }
}
