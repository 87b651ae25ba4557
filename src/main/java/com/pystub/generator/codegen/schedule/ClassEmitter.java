package com.pystub.generator.codegen.schedule;

import java.util.Optional;
import java.util.Set;

import com.pystub.generator.codegen.model.core.context.EmissionContext;

/**
 * What the {@link DependencyScheduler} needs to know about, and do with, the classes of one package.
 *
 * @param <T> class handle type
 */
public interface ClassEmitter<T> {

    /**
     * Local binary name of the class ({@code Foo}, {@code Foo$Bar}).
     */
    String nameOf(T cls);

    /**
     * Whether every supertype of {@code cls} (and of its member classes) that lives in the
     * same package has been emitted already.
     */
    boolean isReady(T cls, EmissionContext ctx);

    /**
     * Local names of the same-package supertypes of {@code cls} (and of its member classes)
     * that have not been emitted yet.
     */
    Set<String> pendingSupertypes(T cls, EmissionContext ctx);

    /**
     * Emits the full declaration of {@code cls}, marking it and its member classes emitted.
     *
     * @throws com.pystub.generator.reflect.TypeLoadException when the class cannot be reflected
     */
    void emit(T cls, EmissionContext ctx);

    /**
     * Looks up a class of the package by local name, including non-public classes.
     *
     * @throws com.pystub.generator.reflect.TypeLoadException when it exists but cannot be loaded
     */
    Optional<T> lookup(String localName);

    /**
     * Emits an empty stand-in declaration and marks {@code localName} emitted.
     */
    void emitPlaceholder(String localName, EmissionContext ctx);
}
