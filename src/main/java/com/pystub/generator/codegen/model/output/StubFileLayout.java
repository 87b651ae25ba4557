package com.pystub.generator.codegen.model.output;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Where each package's stub file goes, for every collected package and all of their parents.
 */
@Value
@Builder(toBuilder = true)
public class StubFileLayout {

    /** package name -> path of its {@code __init__.pyi} */
    @NonNull
    Map<String, Path> stubFiles;

    /** package name -> simple names of its direct subpackages */
    @NonNull
    Map<String, SortedSet<String>> subpackages;

    public Set<String> packageNames() {
        return Collections.unmodifiableSet(stubFiles.keySet());
    }

    public Path stubFile(String packageName) {
        return stubFiles.get(packageName);
    }

    public SortedSet<String> subpackagesOf(String packageName) {
        return Collections.unmodifiableSortedSet(subpackages.getOrDefault(packageName, new TreeSet<>()));
    }
}
