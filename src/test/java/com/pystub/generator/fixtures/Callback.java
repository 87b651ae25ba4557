package com.pystub.generator.fixtures;

@FunctionalInterface
public interface Callback {

    void onEvent(String event);
}
