package com.pystub.generator.codegen.model.input;

import java.util.List;
import java.util.SortedSet;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One Java package collected by the walker.
 */
@Value
@Builder(toBuilder = true)
public class PackageUnit {

    @NonNull
    String qualifiedName;

    /** public top-level classes, sorted by name */
    @Singular
    List<Class<?>> directClasses;

    /** names of the direct child packages that were collected too */
    @NonNull
    SortedSet<String> directSubpackages;
}
