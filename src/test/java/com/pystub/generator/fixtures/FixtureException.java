package com.pystub.generator.fixtures;

public class FixtureException extends RuntimeException {

    private static final long serialVersionUID = 1L;
}
