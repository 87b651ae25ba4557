package com.pystub.generator.reflect;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.FileSystem;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.NavigableMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Index of the packages and class files found on a classpath, optionally including the
 * modules of the running JDK.
 *
 * Every directory seen in a jar or class directory is recorded as a package, even when it
 * holds no class files, so that parent packages and resource-only directories are visible.
 */
public final class ClasspathIndex {

    private static final Logger log = LoggerFactory.getLogger(ClasspathIndex.class);

    private static final String CLASS_SUFFIX = ".class";

    /** package name -> local class names ({@code Foo}, {@code Foo$Bar}) */
    private final NavigableMap<String, SortedSet<String>> classesByPackage = new TreeMap<>();

    private ClasspathIndex() {
    }

    /**
     * Scans the given jar files and class directories. Entries that do not exist are skipped;
     * entries that exist but cannot be read are logged and skipped.
     */
    public static ClasspathIndex scan(List<Path> classpath, boolean includeRuntimeImage) {
        ClasspathIndex index = new ClasspathIndex();
        for (Path entry : classpath) {
            try {
                if (Files.isDirectory(entry)) {
                    index.scanDirectory(entry);
                } else if (Files.isRegularFile(entry)) {
                    index.scanJar(entry);
                } else {
                    log.warn("Classpath entry does not exist: {}", entry);
                }
            } catch (IOException | UncheckedIOException e) {
                log.warn("Skipping unreadable classpath entry {}: {}", entry, e.getMessage());
            }
        }
        if (includeRuntimeImage) {
            index.scanRuntimeImage();
        }
        log.debug("Indexed {} packages", index.classesByPackage.size());
        return index;
    }

    public boolean containsPackage(String packageName) {
        return classesByPackage.containsKey(packageName);
    }

    public boolean containsClass(String packageName, String localName) {
        return classNames(packageName).contains(localName);
    }

    /**
     * Local names of all class files directly in the package, nested classes included.
     */
    public SortedSet<String> classNames(String packageName) {
        SortedSet<String> names = classesByPackage.get(packageName);
        return names == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(names);
    }

    /**
     * Fully qualified names of the direct child packages, sorted.
     */
    public List<String> subpackages(String packageName) {
        String prefix = packageName + ".";
        List<String> children = new ArrayList<>();
        // '/' sorts right after '.', so this view holds exactly the names starting with prefix
        for (String candidate : classesByPackage.subMap(prefix, true, packageName + "/", false).keySet()) {
            if (candidate.indexOf('.', prefix.length()) < 0) {
                children.add(candidate);
            }
        }
        return children;
    }

    public int packageCount() {
        return classesByPackage.size();
    }

    private void scanDirectory(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            walk.filter(p -> !p.equals(root)).forEach(p -> {
                String relative = toEntryName(root.relativize(p));
                if (Files.isDirectory(p)) {
                    registerDirectory(relative);
                } else {
                    registerFile(relative);
                }
            });
        }
    }

    private void scanJar(Path jar) throws IOException {
        try (JarFile jarFile = new JarFile(jar.toFile())) {
            Enumeration<JarEntry> entries = jarFile.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                String name = entry.getName();
                if (entry.isDirectory()) {
                    registerDirectory(name.endsWith("/") ? name.substring(0, name.length() - 1) : name);
                } else {
                    registerFile(name);
                }
            }
        }
    }

    private void scanRuntimeImage() {
        FileSystem jrt;
        try {
            jrt = FileSystems.getFileSystem(URI.create("jrt:/"));
        } catch (FileSystemNotFoundException | IllegalArgumentException e) {
            log.warn("JDK runtime image not available, JDK packages are not indexed: {}", e.getMessage());
            return;
        }
        Path modules = jrt.getPath("/modules");
        try (Stream<Path> moduleRoots = Files.list(modules)) {
            for (Path moduleRoot : moduleRoots.toList()) {
                scanDirectory(moduleRoot);
            }
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to index the JDK runtime image: {}", e.getMessage());
        }
    }

    private void registerDirectory(String entryName) {
        String packageName = toPackageName(entryName);
        if (packageName != null) {
            registerPackage(packageName);
        }
    }

    private void registerFile(String entryName) {
        if (!entryName.endsWith(CLASS_SUFFIX)) {
            return;
        }
        int slash = entryName.lastIndexOf('/');
        if (slash < 0) {
            // default package
            return;
        }
        String packageName = toPackageName(entryName.substring(0, slash));
        String localName = entryName.substring(slash + 1, entryName.length() - CLASS_SUFFIX.length());
        if (packageName == null || localName.equals("module-info") || localName.equals("package-info")) {
            return;
        }
        registerPackage(packageName).add(localName);
    }

    private SortedSet<String> registerPackage(String packageName) {
        // parents first, so intermediate directories missing from a jar are still known
        int dot = packageName.lastIndexOf('.');
        if (dot > 0 && !classesByPackage.containsKey(packageName.substring(0, dot))) {
            registerPackage(packageName.substring(0, dot));
        }
        return classesByPackage.computeIfAbsent(packageName, k -> new TreeSet<>());
    }

    /**
     * @return the dotted package name, or null for directories that cannot be Java packages
     */
    static String toPackageName(String directory) {
        if (directory.isEmpty() || directory.startsWith("META-INF")) {
            return null;
        }
        String[] segments = directory.split("/");
        for (String segment : segments) {
            if (!isIdentifier(segment)) {
                return null;
            }
        }
        return String.join(".", segments);
    }

    private static boolean isIdentifier(String segment) {
        if (segment.isEmpty() || !Character.isJavaIdentifierStart(segment.charAt(0))) {
            return false;
        }
        for (int i = 1; i < segment.length(); i++) {
            if (!Character.isJavaIdentifierPart(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String toEntryName(Path relative) {
        List<String> parts = new ArrayList<>();
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }
}
