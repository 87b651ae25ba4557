package com.pystub.generator.fixtures;

class Secret {

    public void reveal() {
    }
}
