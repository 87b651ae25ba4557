package com.pystub.generator.fixtures.sub;

abstract class BasePanel {

    public String title() {
        return "";
    }
}
