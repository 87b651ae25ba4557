package com.pystub.generator.codegen;

import java.nio.file.Path;

import com.pystub.generator.codegen.model.core.context.GenerationStats;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a stub generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private GenerationStats stats;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
