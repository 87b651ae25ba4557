package com.pystub.generator.fixtures;

public class Apple extends Fruit {
}
