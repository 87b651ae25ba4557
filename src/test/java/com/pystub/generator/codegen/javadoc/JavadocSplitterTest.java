package com.pystub.generator.codegen.javadoc;

import com.pystub.generator.codegen.model.type.ArgumentSig;
import com.pystub.generator.codegen.model.type.FunctionSig;
import com.pystub.generator.codegen.model.type.TypeExpr;
import com.pystub.generator.codegen.model.type.TypeVar;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for JavadocSplitter.
 */
class JavadocSplitterTest {

    private static final String FOO_DOC = """
            public void foo(int count)

            Counts.
            public void foo(java.lang.String text)

            Prints.
            """;

    private final JavadocSplitter splitter = new JavadocSplitter();

    @Test
    void testSplitByParameterTypes() {
        FunctionSig byInt = method("foo", "int");
        FunctionSig byString = method("foo", "String");

        List<String> parts = splitter.split(List.of(byString, byInt), "foo", FOO_DOC);

        assertThat(parts).hasSize(2);
        assertThat(parts.get(0).strip()).isEqualTo("Prints.");
        assertThat(parts.get(1).strip()).isEqualTo("Counts.");
    }

    @Test
    void testSplitByArity() {
        String doc = """
                public Widget()

                Creates an empty widget.
                public Widget(int width, int height)

                Creates a sized widget.
                Both values are in pixels.
                """;
        FunctionSig noArgs = constructor();
        FunctionSig twoArgs = constructor("int", "int");

        List<String> parts = splitter.split(List.of(noArgs, twoArgs), "Widget", doc);

        assertThat(parts.get(0).strip()).isEqualTo("Creates an empty widget.");
        assertThat(parts.get(1).strip()).isEqualTo("Creates a sized widget.\nBoth values are in pixels.");
    }

    @Test
    void testSameArityWithUnknownTypesTakesFirstUnclaimed() {
        String doc = """
                public void foo(Alpha a)

                First.
                public void foo(Beta b)

                Second.
                """;

        List<String> parts = splitter.split(List.of(method("foo", "int"), method("foo", "long")), "foo", doc);

        assertThat(parts.get(0).strip()).isEqualTo("First.");
        assertThat(parts.get(1).strip()).isEqualTo("Second.");
    }

    @Test
    void testTextBeforeFirstHeaderIsDropped() {
        String doc = "Stray text.\npublic void foo(int count)\n\nCounts.\n";

        List<String> parts = splitter.split(List.of(method("foo", "int")), "foo", doc);

        assertThat(parts).containsExactly("Counts.\n");
    }

    @Test
    void testUnmatchedDocumentationGivesEmptyParts() {
        List<String> parts = splitter.split(List.of(method("foo", "int"), method("foo")), "foo",
                "public void bar(int count)\n\nSomething else.\n");

        assertThat(parts).containsExactly("", "");
    }

    @Test
    void testEmptyDocumentation() {
        assertThat(splitter.split(List.of(method("foo")), "foo", "")).containsExactly("");
        assertThat(splitter.split(List.of(), "foo", FOO_DOC)).isEmpty();
    }

    @Test
    void testHeaderParameterTypes() {
        assertThat(JavadocSplitter.headerParameterTypes("public void foo(java.util.List<String> a, int[] b)"))
                .containsExactly("List", "int[]");
        assertThat(JavadocSplitter.headerParameterTypes("public void foo(java.util.Map<K, V> map, String... rest)"))
                .containsExactly("Map", "String[]");
        assertThat(JavadocSplitter.headerParameterTypes("public void foo()")).isEmpty();
    }

    @Test
    void testStaticGenericHeaderPattern() {
        FunctionSig first = FunctionSig.builder()
                .name("first")
                .isStatic(true)
                .arg(new ArgumentSig("eArray", TypeExpr.of("E"), false, "E[]"))
                .returnType(TypeExpr.of("E"))
                .typeVar(TypeVar.of("E", "first", null))
                .build();

        assertThat(JavadocSplitter.header(first, "first").matches("public static <E> E first(E[] elements)")).isTrue();
        assertThat(JavadocSplitter.header(first, "first").matches("public E first(E[] elements)")).isFalse();
        assertThat(JavadocSplitter.header(first, "first")
                .matches("public static <E, F> E first(E[] elements)")).isFalse();
    }

    @Test
    void testHeaderCountsTopLevelParameters() {
        FunctionSig pair = method("put", "Map", "int");

        assertThat(JavadocSplitter.header(pair, "put").matches("public void put(java.util.Map<K, V> map, int count)"))
                .isTrue();
        assertThat(JavadocSplitter.header(pair, "put").matches("public void put(java.util.Map<K, V> map)")).isFalse();
        assertThat(JavadocSplitter.header(method("put"), "put").matches("public void put()")).isTrue();
    }

    @Test
    @Timeout(10)
    void testNearlyMatchingLongLinesAreRejectedQuickly() {
        String[] types = new String[12];
        Arrays.fill(types, "int");
        FunctionSig wide = method("foo", types);
        StringBuilder parameters = new StringBuilder();
        for (int i = 0; parameters.length() < 300; i++) {
            parameters.append("int a").append(i).append(", ");
        }
        String unclosed = "public void foo(" + parameters;
        String closed = "public void foo(" + parameters + "int)";
        String doc = unclosed + "\n\n" + closed + "\n\nNot a header.\n";

        List<String> parts = splitter.split(List.of(wide), "foo", doc);

        assertThat(parts).containsExactly("");
        assertThat(JavadocSplitter.header(wide, "foo").matches(closed)).isFalse();
    }

    private static FunctionSig method(String name, String... javaTypes) {
        FunctionSig.FunctionSigBuilder builder = FunctionSig.builder()
                .name(name)
                .arg(ArgumentSig.SELF)
                .returnType(TypeExpr.of("None"));
        for (int i = 0; i < javaTypes.length; i++) {
            builder.arg(new ArgumentSig("arg" + i, TypeExpr.of(javaTypes[i]), false, javaTypes[i]));
        }
        return builder.build();
    }

    private static FunctionSig constructor(String... javaTypes) {
        return method("__init__", javaTypes);
    }
}
