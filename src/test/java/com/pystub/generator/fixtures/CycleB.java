package com.pystub.generator.fixtures;

public class CycleB {

    public static class Inner extends CycleA {
    }
}
