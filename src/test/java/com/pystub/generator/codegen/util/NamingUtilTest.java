package com.pystub.generator.codegen.util;

import com.pystub.generator.codegen.model.type.ArgumentSig;
import com.pystub.generator.codegen.model.type.TypeExpr;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NamingUtil.
 */
class NamingUtilTest {

    @ParameterizedTest
    @CsvSource({
            "foo, foo",
            "in, in_",
            "lambda, lambda_",
            "None, None_",
            "print, print_",
            "exec, exec_",
            "_private, _private",
            "__, __"
    })
    void testPysafe(String name, String expected) {
        assertThat(NamingUtil.pysafe(name)).isEqualTo(expected);
    }

    @Test
    void testPysafeRejectsDunderNames() {
        assertThat(NamingUtil.pysafe("__init__")).isNull();
        assertThat(NamingUtil.pysafe("__x__")).isNull();
        assertThat(NamingUtil.isDunder("__")).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
            "com.example, com.example",
            "org.python.lambda.core, org.python.lambda_.core",
            "java.lang, java.lang"
    })
    void testPysafePath(String name, String expected) {
        assertThat(NamingUtil.pysafePath(name)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "java.lang.String, string",
            "int, int",
            "int[], intArray",
            "java.util.List<java.lang.String>, list",
            "'java.util.Map$Entry<K, V>[]', entryArray",
            "com.example.URLFactory, uRLFactory"
    })
    void testInferArgName(String javaTypeName, String expected) {
        assertThat(NamingUtil.inferArgName(javaTypeName, List.of())).isEqualTo(expected);
    }

    @Test
    void testInferArgNameNumbersRepeatedNames() {
        ArgumentSig first = arg("foo");
        ArgumentSig second = arg("foo2");

        assertThat(NamingUtil.inferArgName("com.example.Foo", List.of(ArgumentSig.SELF, first))).isEqualTo("foo2");
        assertThat(NamingUtil.inferArgName("com.example.Foo", List.of(first, second))).isEqualTo("foo3");
        assertThat(NamingUtil.inferArgName("com.example.Food", List.of(first))).isEqualTo("food");
    }

    @Test
    void testInferArgNameIgnoresDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(NamingUtil.inferArgName("com.example.Item", List.of())).isEqualTo("item");
            assertThat(NamingUtil.decapitalize("Item")).isEqualTo("item");
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void testInferArgNameWithoutType() {
        assertThat(NamingUtil.inferArgName(null, List.of(ArgumentSig.SELF, arg("x")))).isEqualTo("arg2");
    }

    @ParameterizedTest
    @CsvSource({
            "Foo, Foo",
            "Outer$Inner, Outer__Inner",
            "Map.Entry, Map_Entry"
    })
    void testClassScopeId(String localName, String expected) {
        assertThat(NamingUtil.classScopeId(localName)).isEqualTo(expected);
    }

    private static ArgumentSig arg(String name) {
        return new ArgumentSig(name, TypeExpr.of("Foo"), false, "Foo");
    }
}
