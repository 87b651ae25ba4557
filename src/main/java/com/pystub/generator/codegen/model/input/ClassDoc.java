package com.pystub.generator.codegen.model.input;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Documentation of one class as extracted from its javadoc page.
 *
 * Constructor and method entries hold the concatenated {@code signature\n\ndescription\n}
 * blocks of all overloads; field entries hold the description only.
 */
@Value
@Builder(toBuilder = true)
public class ClassDoc {

    private static final ClassDoc EMPTY = ClassDoc.builder().build();

    @NonNull
    @Builder.Default
    String description = "";

    @NonNull
    @Builder.Default
    String constructorDoc = "";

    @Singular("methodDoc")
    Map<String, String> methodDocByName;

    @Singular("fieldDoc")
    Map<String, String> fieldDocByName;

    public static ClassDoc empty() {
        return EMPTY;
    }

    public String methodDoc(String methodName) {
        return methodDocByName.getOrDefault(methodName, "");
    }

    public String fieldDoc(String fieldName) {
        return fieldDocByName.getOrDefault(fieldName, "");
    }
}
