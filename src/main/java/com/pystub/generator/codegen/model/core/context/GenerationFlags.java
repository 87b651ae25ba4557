package com.pystub.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Value;

/**
 * Boolean switches of a generation run.
 */
@Value
@Builder(toBuilder = true)
public class GenerationFlags {
    /** attach javadoc found on the classpath as docstrings */
    @Builder.Default
    boolean includeJavadoc = true;
    /** name the top-level directories {@code <package>-stubs} (PEP 561) */
    @Builder.Default
    boolean stubsSuffix = true;
    /** make the packages of the running JDK available */
    @Builder.Default
    boolean includeJdk = true;
    /** delete the stub directories of the requested packages first */
    boolean clean;
}
