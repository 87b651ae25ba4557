package com.pystub.generator.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pystub.generator.cli.model.GenerateOptions;
import com.pystub.generator.cli.model.ValidatedGenerateOptions;
import com.pystub.generator.codegen.GeneratorResult;
import com.pystub.generator.codegen.model.core.context.GenerationStats;

/**
 * Responsible only for printing CLI output for the stub generation command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    /** longest list of class names printed in the summary */
    private static final int MAX_LISTED = 20;

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Python Stub Generator for Java Packages");
        log.info("=================================================");
        log.info("Package Prefixes: {}", String.join(", ", v.getPackagePrefixes()));
        log.info("Class Path Entries: {}", v.getClasspath().size());
        v.getClasspath().forEach(entry -> log.debug("  {}", entry.toAbsolutePath()));
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Javadoc: {}", o.isNoJavadoc() ? "disabled" : "enabled");
        log.info("Stubs Suffix: {}", o.isNoStubsSuffix() ? "disabled" : "enabled");
        log.info("JDK Packages: {}", o.isNoJdk() ? "disabled" : "enabled");
        if (o.isClean()) {
            log.info("Clean: previous stubs will be removed");
        }
        log.info("=================================================");
    }

    public void printSuccess(ValidatedGenerateOptions v, GeneratorResult result) {
        GenerationStats stats = result.getStats();

        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", v.getNormalizedOutputDir());
        log.info("Packages Generated: {}", stats.getPackagesGenerated());
        log.info("Classes Generated: {}", stats.getClassesGenerated());
        log.info("Files Written: {}", stats.getFilesWritten());

        if (!stats.getFailedClasses().isEmpty() || !stats.getPlaceholderClasses().isEmpty()) {
            log.info("");
            log.info("Incomplete Classes:");
            printNames("Skipped (could not be loaded)", stats.getFailedClasses().size(),
                    String.join(", ", head(stats.getFailedClasses())));
            printNames("Empty placeholders", stats.getPlaceholderClasses().size(),
                    String.join(", ", head(stats.getPlaceholderClasses())));
        }
        if (!stats.getFallbackClasses().isEmpty()) {
            log.info("Emitted with fully qualified base classes: {}", stats.getFallbackClasses().size());
        }

        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }

    private void printNames(String label, int count, String names) {
        if (count == 0) {
            return;
        }
        log.info("  {}: {}", label, count);
        log.info("    {}{}", names, count > MAX_LISTED ? ", ..." : "");
    }

    private static List<String> head(List<String> names) {
        return names.size() > MAX_LISTED ? names.subList(0, MAX_LISTED) : names;
    }
}
