package com.pystub.generator.fixtures;

public class Fruit {

    public String name() {
        return "fruit";
    }
}
