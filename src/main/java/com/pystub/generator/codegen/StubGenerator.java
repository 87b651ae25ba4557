package com.pystub.generator.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pystub.generator.codegen.model.core.context.GenerationFlags;
import com.pystub.generator.codegen.model.core.context.GenerationStats;
import com.pystub.generator.codegen.model.input.PackageUnit;
import com.pystub.generator.codegen.model.output.GeneratedFile;
import com.pystub.generator.codegen.model.output.PackageStub;
import com.pystub.generator.codegen.model.output.StubFileLayout;
import com.pystub.generator.codegen.stub.PackageStubGenerator;
import com.pystub.generator.codegen.util.FileWriteUtil;
import com.pystub.generator.codegen.walker.PackageWalker;
import com.pystub.generator.reflect.ClasspathReflectionProvider;
import com.pystub.generator.reflect.ReflectionProvider;

/**
 * Main stub generator: recursively generates Python stubs for the requested Java packages
 * and all of their subpackages.
 *
 * Failing to generate one class never stops the run; such classes are skipped and reported.
 */
public class StubGenerator {
    private static final Logger log = LoggerFactory.getLogger(StubGenerator.class);

    private final GeneratorConfig config;

    public StubGenerator(GeneratorConfig config) {
        this.config = config;
    }

    /**
     * Generate the stub tree.
     */
    public GeneratorResult generate() {
        GenerationFlags flags = config.getFlags();
        try {
            log.info("Starting stub generation...");

            // Step 1: Index the classpath
            log.info("Step 1: Indexing classpath...");
            try (ReflectionProvider provider = new ClasspathReflectionProvider(
                    config.getClasspath(), flags.isIncludeJdk(), flags.isIncludeJavadoc())) {

                // Step 2: Collect packages
                log.info("Step 2: Collecting packages...");
                PackageWalker walker = new PackageWalker(provider);
                Map<String, PackageUnit> packages = walker.collect(config.getPackagePrefixes());
                StubFileLayout layout = walker.layout(packages.keySet(), config.getOutputDir(), flags.isStubsSuffix());

                // Step 3: Clean previous output
                if (flags.isClean()) {
                    log.info("Step 3: Removing previous stubs...");
                    cleanPreviousStubs(layout);
                }

                // Step 4: Generate package stubs
                log.info("Step 4: Generating package stubs...");
                GenerationStats stats = new GenerationStats();
                PackageStubGenerator packageGenerator = new PackageStubGenerator(provider);
                for (String packageName : layout.packageNames()) {
                    Path stubFile = layout.stubFile(packageName);
                    createDirectories(stubFile.getParent());

                    PackageUnit unit = packages.get(packageName);
                    if (unit == null) {
                        // parent of a requested package, directory only
                        continue;
                    }
                    PackageStub stub = packageGenerator.generate(unit, layout);
                    stats.addPackage(packageName, stub.getReport());
                    for (GeneratedFile file : stub.getFiles()) {
                        write(file);
                        stats.addFileWritten();
                    }
                }

                log.info("Stub generation complete!");

                return GeneratorResult.builder()
                        .success(true)
                        .outputPath(config.getOutputDir())
                        .stats(stats)
                        .build();
            }
        } catch (Exception e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }

    private void cleanPreviousStubs(StubFileLayout layout) {
        for (String prefix : config.getPackagePrefixes()) {
            Path stubFile = layout.stubFile(prefix);
            if (stubFile == null) {
                continue;
            }
            Path directory = stubFile.getParent();
            try {
                FileWriteUtil.deleteDirectory(directory);
                log.info("Removed {}", directory);
            } catch (IOException e) {
                throw new StubGenerationException("Failed to remove " + directory, e);
            }
        }
    }

    private static void createDirectories(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StubGenerationException("Failed to create directory " + directory, e);
        }
    }

    private static void write(GeneratedFile file) {
        try {
            FileWriteUtil.safeWriteString(file.getPath(), file.getContents());
            log.debug("Wrote {}", file.getPath());
        } catch (IOException e) {
            throw new StubGenerationException("Failed to write " + file.getPath(), e);
        }
    }
}
