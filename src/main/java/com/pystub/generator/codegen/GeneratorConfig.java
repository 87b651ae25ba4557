package com.pystub.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import com.pystub.generator.codegen.model.core.context.GenerationFlags;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the stub generator.
 */
@Data
@Builder
public class GeneratorConfig {
    /** jar files and class directories to load classes from */
    private List<Path> classpath;
    private Path outputDir;
    /** root packages; their subpackages are generated as well */
    private List<String> packagePrefixes;
    private GenerationFlags flags;
}
