package com.pystub.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the stub generation command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Parameters(arity = "1..*", paramLabel = "PREFIX", description = "Package prefixes to generate stubs for (e.g. org.myproject)")
	private List<String> prefixes;

	@Option(names = { "--classpath", "-cp" }, defaultValue = ".", description = "Java class path, separated by ':'. "
			+ "Glob patterns (e.g. lib/*.jar) are expanded (default: ${DEFAULT-VALUE})")
	private String classpath;

	@Option(names = { "--output-dir", "-o" }, defaultValue = ".", description = "Directory to write the stubs to (default: ${DEFAULT-VALUE})")
	private Path outputDir;

	@Option(names = { "--no-javadoc" }, description = "Do not generate docstrings from javadoc where available")
	private boolean noJavadoc;

	@Option(names = { "--no-stubs-suffix" }, description = "Do not use the PEP 561 '-stubs' suffix for top-level packages")
	private boolean noStubsSuffix;

	@Option(names = { "--no-jdk" }, description = "Do not make the packages of the running JDK available")
	private boolean noJdk;

	@Option(names = { "--clean" }, description = "Delete the stubs of the requested packages before generating")
	private boolean clean;

	// ---- Getters (no setters needed; picocli sets fields reflectively) ----

}
