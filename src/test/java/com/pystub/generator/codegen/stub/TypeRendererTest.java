package com.pystub.generator.codegen.stub;

import com.pystub.generator.codegen.model.core.context.EmissionContext;
import com.pystub.generator.codegen.model.type.TypeExpr;
import com.pystub.generator.codegen.model.type.TypeVar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TypeRenderer.
 */
class TypeRendererTest {

    private final TypeRenderer renderer = new TypeRenderer();
    private EmissionContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new EmissionContext("com.example");
    }

    @Test
    void testSamePackageClasses() {
        TypeExpr foo = TypeExpr.of("com.example.Foo");

        assertThat(renderer.render(foo, ctx)).isEqualTo("Foo");
        assertThat(renderer.render(foo, ctx, false)).isEqualTo("com.example.Foo");
        assertThat(ctx.getImports().getImports()).containsExactly("import com");

        ctx.markEmitted("Foo");
        assertThat(renderer.render(foo, ctx, false)).isEqualTo("Foo");
        assertThat(ctx.getReferenced()).containsExactly("com.example.Foo");
    }

    @Test
    void testOtherPackagesAreImported() {
        TypeExpr list = TypeExpr.of("java.util.List", List.of(TypeExpr.of("str")));

        assertThat(renderer.render(list, ctx)).isEqualTo("java.util.List[str]");
        assertThat(renderer.render(TypeExpr.of("org.lambda.Expression"), ctx)).isEqualTo("org.lambda_.Expression");
        assertThat(ctx.getImports().getImports()).containsExactly("import java.util", "import org.lambda_");
    }

    @Test
    void testNestedAndBuiltinNames() {
        assertThat(renderer.render(TypeExpr.of("com.example.Outer$Inner"), ctx)).isEqualTo("Outer.Inner");
        assertThat(renderer.render(TypeExpr.of("builtins.Exception"), ctx)).isEqualTo("Exception");
        assertThat(ctx.getImports().getImports()).isEmpty();
    }

    @Test
    void testCallable() {
        TypeExpr callable = TypeExpr.callable(List.of(TypeExpr.of("str"), TypeExpr.of("int")), TypeExpr.of("None"));

        assertThat(renderer.render(callable, ctx)).isEqualTo("typing.Callable[[str, int], None]");
        assertThat(renderer.render(TypeExpr.callable(List.of(), TypeExpr.of("None")), ctx))
                .isEqualTo("typing.Callable[[], None]");
    }

    @Test
    void testTypeVarDeclaration() {
        TypeVar bounded = TypeVar.of("T", "Box", TypeExpr.of("java.lang.Number"));
        TypeVar unbounded = TypeVar.of("E", "first", null);

        assertThat(renderer.renderTypeVarDeclaration(bounded, ctx))
                .isEqualTo("_Box__T = typing.TypeVar('_Box__T', bound=java.lang.Number)  # <T>");
        assertThat(renderer.renderTypeVarDeclaration(unbounded, ctx))
                .isEqualTo("_first__E = typing.TypeVar('_first__E')  # <E>");
        assertThat(ctx.getImports().getImports()).containsExactly("import java.lang", "import typing");
    }

    @Test
    void testDocstringLines() {
        assertThat(TypeRenderer.docstringLines("", true)).isEmpty();
        assertThat(TypeRenderer.docstringLines("First.\nSecond.", false))
                .containsExactly("\"\"\"", "First.", "Second.", "\"\"\"");
        assertThat(TypeRenderer.docstringLines("Use \"\"\" and \\n.", true))
                .containsExactly("    \"\"\"", "    Use \\\"\\\"\\\" and \\\\n.", "    \"\"\"");
    }
}
