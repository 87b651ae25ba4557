package com.pystub.generator.reflect;

import java.util.List;
import java.util.Optional;

import com.pystub.generator.codegen.model.input.ClassDoc;

/**
 * Read-only view of the Java packages and classes available to one generation run.
 *
 * All calls are made from a single thread. Methods that load classes report broken
 * classes through {@link TypeLoadException}; enumeration methods skip them instead.
 */
public interface ReflectionProvider extends AutoCloseable {

    boolean packageExists(String packageName);

    /**
     * Fully qualified names of the direct child packages, sorted.
     */
    List<String> subpackages(String packageName);

    /**
     * A package that has neither classes nor subpackages (e.g. a directory that only exists in
     * a javadoc jar), or whose name contains the nested class separator. Such packages cannot be
     * imported and are never emitted.
     */
    boolean isPseudoPackage(String packageName);

    /**
     * Public top-level classes directly owned by the package, loaded without initialization.
     */
    List<Class<?>> packageClasses(String packageName);

    /**
     * Direct lookup of a class of the package by its binary name relative to the package
     * ({@code Foo} or {@code Outer$Inner}), regardless of its visibility.
     *
     * @throws TypeLoadException when the class exists but cannot be loaded
     */
    Optional<Class<?>> findClass(String packageName, String localName);

    /**
     * Public member classes of {@code cls}, excluding synthetic, anonymous and local ones,
     * sorted by simple name.
     */
    List<Class<?>> memberClasses(Class<?> cls);

    /**
     * Public or protected member class of {@code outer} with the given simple name.
     */
    Optional<Class<?>> findMemberClass(Class<?> outer, String simpleName);

    /**
     * Best-effort documentation of {@code cls}; {@link ClassDoc#empty()} when none is available.
     */
    ClassDoc documentation(Class<?> cls);

    @Override
    void close();
}
