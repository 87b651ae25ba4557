package com.pystub.generator.reflect;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ClasspathIndex.
 */
class ClasspathIndexTest {

    @TempDir
    Path tempDir;

    private Path classes;
    private Path jar;

    @BeforeEach
    void setUp() throws IOException {
        classes = tempDir.resolve("classes");
        touch(classes.resolve("com/example/Foo.class"));
        touch(classes.resolve("com/example/Foo$Bar.class"));
        touch(classes.resolve("com/example/package-info.class"));
        touch(classes.resolve("com/example/impl/Impl.class"));
        touch(classes.resolve("com/example/res/readme.txt"));
        touch(classes.resolve("META-INF/versions/9/module-info.class"));
        touch(classes.resolve("my-dir/Thing.class"));

        // jar without directory entries
        jar = tempDir.resolve("lib.jar");
        try (OutputStream out = Files.newOutputStream(jar); JarOutputStream jarOut = new JarOutputStream(out)) {
            jarOut.putNextEntry(new JarEntry("org/lib/Util.class"));
            jarOut.closeEntry();
            jarOut.putNextEntry(new JarEntry("org/lib/internal/"));
            jarOut.closeEntry();
        }
    }

    @Test
    void testScanClassDirectory() {
        ClasspathIndex index = ClasspathIndex.scan(List.of(classes), false);

        assertThat(index.containsPackage("com")).isTrue();
        assertThat(index.containsPackage("com.example")).isTrue();
        assertThat(index.classNames("com.example")).containsExactly("Foo", "Foo$Bar");
        assertThat(index.subpackages("com.example")).containsExactly("com.example.impl", "com.example.res");
        assertThat(index.classNames("com.example.res")).isEmpty();
        assertThat(index.containsPackage("my-dir")).isFalse();
        assertThat(index.containsPackage("META-INF")).isFalse();
    }

    @Test
    void testScanJarRegistersParentPackages() {
        ClasspathIndex index = ClasspathIndex.scan(List.of(jar), false);

        assertThat(index.containsPackage("org")).isTrue();
        assertThat(index.containsClass("org.lib", "Util")).isTrue();
        assertThat(index.subpackages("org.lib")).containsExactly("org.lib.internal");
        assertThat(index.subpackages("org")).containsExactly("org.lib");
    }

    @Test
    void testMissingAndCombinedEntries() {
        ClasspathIndex index = ClasspathIndex.scan(List.of(tempDir.resolve("missing.jar"), classes, jar), false);

        assertThat(index.containsPackage("com.example")).isTrue();
        assertThat(index.containsPackage("org.lib")).isTrue();
    }

    @Test
    void testSubpackagesExcludeSiblingsWithSamePrefix() throws IOException {
        touch(classes.resolve("com/examples/Other.class"));
        touch(classes.resolve("com/example/impl/deep/Deep.class"));

        ClasspathIndex index = ClasspathIndex.scan(List.of(classes), false);

        assertThat(index.subpackages("com.example")).containsExactly("com.example.impl", "com.example.res");
        assertThat(index.subpackages("com")).containsExactly("com.example", "com.examples");
    }

    @Test
    void testToPackageName() {
        assertThat(ClasspathIndex.toPackageName("com/example")).isEqualTo("com.example");
        assertThat(ClasspathIndex.toPackageName("META-INF/versions")).isNull();
        assertThat(ClasspathIndex.toPackageName("1abc")).isNull();
        assertThat(ClasspathIndex.toPackageName("")).isNull();
    }

    private static void touch(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[0]);
    }
}
