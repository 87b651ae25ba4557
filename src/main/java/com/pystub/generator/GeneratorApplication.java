package com.pystub.generator;

import com.pystub.generator.cli.GenerateCommand;

import picocli.CommandLine;

/**
 * Main entry point for the Python stub generator.
 *
 * The JVM is halted rather than exited: classes loaded from the user's classpath may have
 * started non-daemon threads or registered shutdown hooks.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand()).execute(args);
        Runtime.getRuntime().halt(exitCode);
    }
}
