package com.pystub.generator.codegen.stub;

import com.pystub.generator.codegen.model.input.PackageUnit;
import com.pystub.generator.codegen.model.output.GeneratedFile;
import com.pystub.generator.codegen.model.output.GeneratedFileType;
import com.pystub.generator.codegen.model.output.PackageStub;
import com.pystub.generator.codegen.model.output.StubFileLayout;
import com.pystub.generator.codegen.walker.PackageWalker;
import com.pystub.generator.fixtures.Apple;
import com.pystub.generator.fixtures.Fruit;
import com.pystub.generator.reflect.ClasspathReflectionProvider;
import com.pystub.generator.reflect.ReflectionProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PackageStubGenerator.
 */
class PackageStubGeneratorTest {

    private ReflectionProvider provider;
    private PackageStubGenerator generator;

    @BeforeEach
    void setUp() {
        // no classpath: classes are passed in directly
        provider = new ClasspathReflectionProvider(List.of(), false, false);
        generator = new PackageStubGenerator(provider);
    }

    @AfterEach
    void tearDown() {
        provider.close();
    }

    @Test
    void testJavaPackageGetsInteropBindings() {
        StubFileLayout layout = new PackageWalker(provider).layout(List.of("java.lang"), Path.of("out"), false);
        PackageUnit unit = PackageUnit.builder()
                .qualifiedName("java")
                .directSubpackages(new TreeSet<>(List.of("java.lang")))
                .build();

        PackageStub stub = generator.generate(unit, layout);

        assertThat(stub.getFiles()).extracting(GeneratedFile::getType)
                .containsExactly(GeneratedFileType.PACKAGE_STUB, GeneratedFileType.BINDINGS, GeneratedFileType.BINDINGS);
        assertThat(stub.getFiles()).extracting(file -> file.getPath().getFileName().toString())
                .containsExactly("__init__.pyi", "chaquopy.pyi", "primitive.pyi");
        String init = stub.getFiles().get(0).getContents();
        assertThat(init).startsWith("from java.chaquopy import (\n");
        assertThat(init).contains("from java.primitive import (\n", "import java.lang\n", "__all__ = [\n");
        assertThat(stub.getReport().getEmitted()).isEmpty();
    }

    @Test
    void testOrdinaryPackage() {
        StubFileLayout layout = new PackageWalker(provider)
                .layout(List.of("com.pystub.generator.fixtures"), Path.of("out"), true);
        PackageUnit unit = PackageUnit.builder()
                .qualifiedName("com.pystub.generator.fixtures")
                .directClass(Apple.class)
                .directClass(Fruit.class)
                .directSubpackages(new TreeSet<>())
                .build();

        PackageStub stub = generator.generate(unit, layout);

        assertThat(stub.getFiles()).hasSize(1);
        assertThat(stub.getFiles().get(0).getPath())
                .isEqualTo(Path.of("out", "com-stubs", "pystub", "generator", "fixtures", "__init__.pyi"));
        assertThat(stub.getReport().getEmitted()).containsExactly("Fruit", "Apple");
        assertThat(stub.getFiles().get(0).getContents()).isEqualTo("""
                import java.lang


                
                class Fruit(java.lang.Object):
                    def __init__(self) -> None: ...
                    def name(self) -> str: ...
                
                class Apple(Fruit):
                    def __init__(self) -> None: ...
                """);
    }

    @Test
    void testPlaceholder() {
        assertThat(ClassStubGenerator.placeholder("Outer$Hidden")).isEqualTo("class Hidden: ...");
        assertThat(ClassStubGenerator.placeholder("Gone")).isEqualTo("class Gone: ...");
    }
}
