package com.pystub.generator.cli.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pystub.generator.cli.exception.OptionsValidationException;
import com.pystub.generator.cli.model.GenerateOptions;
import com.pystub.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

	private static final Logger log = LoggerFactory.getLogger(GenerateOptionsValidator.class);

	private static final Pattern PACKAGE_NAME = Pattern
			.compile("[\\p{L}_$][\\p{L}\\p{N}_$]*(\\.[\\p{L}_$][\\p{L}\\p{N}_$]*)*");

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		List<String> prefixes = o.getPrefixes() == null ? List.of() : o.getPrefixes();
		if (prefixes.isEmpty()) {
			errors.add("At least one package prefix is required.");
		}
		for (String prefix : prefixes) {
			if (!PACKAGE_NAME.matcher(prefix).matches()) {
				errors.add("Not a valid Java package name: " + prefix);
			}
		}

		List<Path> classpath = expandClasspath(o.getClasspath(), errors);
		if (classpath.isEmpty()) {
			errors.add("Class path does not contain any existing entry: " + o.getClasspath());
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();
		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(List.copyOf(prefixes), classpath, normalizedOutputDir);
	}

	/**
	 * Splits the class path on ':' and expands glob patterns in the file name part of each
	 * entry. Entries that match nothing are dropped.
	 */
	static List<Path> expandClasspath(String raw, List<String> errors) {
		List<Path> result = new ArrayList<>();
		if (raw == null || raw.isBlank()) {
			return result;
		}
		for (String entry : raw.split(":")) {
			String trimmed = entry.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			if (!isGlob(trimmed)) {
				Path path = Path.of(trimmed);
				if (Files.exists(path)) {
					result.add(path);
				} else {
					log.warn("Ignoring missing class path entry: {}", trimmed);
				}
				continue;
			}
			result.addAll(expandGlob(trimmed, errors));
		}
		return result;
	}

	private static List<Path> expandGlob(String pattern, List<String> errors) {
		Path path = Path.of(pattern);
		Path parent = path.getParent() == null ? Path.of(".") : path.getParent();
		String glob = path.getFileName().toString();
		List<Path> matches = new ArrayList<>();
		if (!Files.isDirectory(parent)) {
			log.warn("Ignoring class path pattern {}: {} is not a directory", pattern, parent);
			return matches;
		}
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(parent, glob)) {
			stream.forEach(matches::add);
		} catch (IOException e) {
			errors.add("Cannot expand class path pattern " + pattern + ": " + e.getMessage());
		}
		matches.sort(null);
		return matches;
	}

	private static boolean isGlob(String entry) {
		return entry.indexOf('*') >= 0 || entry.indexOf('?') >= 0 || entry.indexOf('[') >= 0;
	}
}
