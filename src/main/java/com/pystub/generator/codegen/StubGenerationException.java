package com.pystub.generator.codegen;

/**
 * Fatal failure of a generation run (missing root package, unwritable output).
 */
public class StubGenerationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public StubGenerationException(String message) {
		super(message);
	}

	public StubGenerationException(String message, Throwable cause) {
		super(message, cause);
	}
}
