package com.pystub.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pystub.generator.cli.exception.OptionsValidationException;
import com.pystub.generator.cli.model.GenerateOptions;
import com.pystub.generator.cli.model.ValidatedGenerateOptions;
import com.pystub.generator.cli.output.GenerateResultsPrinter;
import com.pystub.generator.cli.validation.GenerateOptionsValidator;
import com.pystub.generator.codegen.GeneratorConfig;
import com.pystub.generator.codegen.GeneratorResult;
import com.pystub.generator.codegen.StubGenerator;
import com.pystub.generator.codegen.model.core.context.GenerationFlags;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command generating Python type stubs for Java packages used through Chaquopy.
 */
@Command(
        name = "pystub-generator",
        mixinStandardHelpOptions = true,
        version = "pystub-generator 1.0.0",
        description = "Generates Python type stubs (.pyi) for Java packages and all of their subpackages."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    static final int EXIT_GENERATION_FAILED = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("Invalid option: {}", error));
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(options, validated);

        GeneratorConfig config = GeneratorConfig.builder()
                .classpath(validated.getClasspath())
                .outputDir(validated.getNormalizedOutputDir())
                .packagePrefixes(validated.getPackagePrefixes())
                .flags(GenerationFlags.builder()
                        .includeJavadoc(!options.isNoJavadoc())
                        .stubsSuffix(!options.isNoStubsSuffix())
                        .includeJdk(!options.isNoJdk())
                        .clean(options.isClean())
                        .build())
                .build();

        GeneratorResult result = new StubGenerator(config).generate();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return EXIT_GENERATION_FAILED;
        }

        printer.printSuccess(validated, result);
        return 0;
    }
}
