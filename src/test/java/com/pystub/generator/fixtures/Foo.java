package com.pystub.generator.fixtures;

import java.util.List;

/**
 * Members whose names or types need special handling in stubs.
 */
public class Foo {

    public static final int CONSTANT = 1;

    public String in;

    public List<String> names;

    protected int hidden;

    public Foo() {
    }

    public Foo(Foo foo, Foo other) {
    }

    public void bar(int value) {
    }

    public int bar(String value) {
        return 0;
    }

    public void print(String message) {
    }

    public void log(String... messages) {
    }

    public void __init__() {
    }

    public Object anything(Object value) {
        return value;
    }

    public static Foo create() {
        return new Foo();
    }

    public int[] numbers() {
        return new int[0];
    }
}
