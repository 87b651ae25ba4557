package com.pystub.generator.reflect;

import java.io.IOException;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pystub.generator.codegen.model.input.ClassDoc;

/**
 * {@link ReflectionProvider} over a user supplied classpath, backed by a dedicated
 * {@link URLClassLoader} whose parent is the platform class loader. Classes are loaded
 * without being initialized.
 */
public class ClasspathReflectionProvider implements ReflectionProvider {

    private static final Logger log = LoggerFactory.getLogger(ClasspathReflectionProvider.class);

    private final ClasspathIndex index;
    private final URLClassLoader loader;
    private final JavadocExtractor javadocExtractor;

    /**
     * @param classpath           jar files and class directories
     * @param includeRuntimeImage also index the packages of the running JDK
     * @param includeJavadoc      look up javadoc pages for documentation
     */
    public ClasspathReflectionProvider(List<Path> classpath, boolean includeRuntimeImage, boolean includeJavadoc) {
        this.index = ClasspathIndex.scan(classpath, includeRuntimeImage);
        this.loader = new URLClassLoader("pystub-classpath", toUrls(classpath), ClassLoader.getPlatformClassLoader());
        this.javadocExtractor = includeJavadoc ? new JavadocExtractor() : null;
        log.info("Indexed {} packages from {} classpath entries", index.packageCount(), classpath.size());
    }

    @Override
    public boolean packageExists(String packageName) {
        return index.containsPackage(packageName);
    }

    @Override
    public List<String> subpackages(String packageName) {
        return index.subpackages(packageName);
    }

    @Override
    public boolean isPseudoPackage(String packageName) {
        return packageName.contains("$")
                || (index.classNames(packageName).isEmpty() && index.subpackages(packageName).isEmpty());
    }

    @Override
    public List<Class<?>> packageClasses(String packageName) {
        List<Class<?>> classes = new ArrayList<>();
        for (String localName : index.classNames(packageName)) {
            if (localName.contains("$")) {
                continue;
            }
            try {
                Class<?> cls = load(packageName + "." + localName);
                if (Modifier.isPublic(cls.getModifiers()) && Reflection.isJavaClass(cls)
                        && cls.getEnclosingClass() == null) {
                    classes.add(cls);
                }
            } catch (TypeLoadException e) {
                log.warn("Skipping class {}.{}: {}", packageName, localName, e.getCause().toString());
            }
        }
        classes.sort(Comparator.comparing(Class::getName));
        return classes;
    }

    @Override
    public Optional<Class<?>> findClass(String packageName, String localName) {
        if (!index.containsClass(packageName, localName)) {
            return Optional.empty();
        }
        return Optional.of(load(packageName + "." + localName));
    }

    @Override
    public List<Class<?>> memberClasses(Class<?> cls) {
        return Reflection.guard(cls.getName(), () -> Arrays.stream(cls.getDeclaredClasses())
                .filter(c -> Modifier.isPublic(c.getModifiers()))
                .filter(Reflection::isJavaClass)
                .sorted(Comparator.comparing(Class::getSimpleName))
                .toList());
    }

    @Override
    public Optional<Class<?>> findMemberClass(Class<?> outer, String simpleName) {
        return Reflection.guard(outer.getName(), () -> Arrays.stream(outer.getDeclaredClasses())
                .filter(c -> c.getSimpleName().equals(simpleName))
                .filter(c -> Modifier.isPublic(c.getModifiers()) || Modifier.isProtected(c.getModifiers()))
                .findFirst());
    }

    @Override
    public ClassDoc documentation(Class<?> cls) {
        if (javadocExtractor == null) {
            return ClassDoc.empty();
        }
        return javadocExtractor.extract(cls, loader);
    }

    @Override
    public void close() {
        try {
            loader.close();
        } catch (IOException e) {
            log.warn("Failed to close class loader: {}", e.getMessage());
        }
    }

    private Class<?> load(String className) {
        return Reflection.guard(className, () -> {
            try {
                return Class.forName(className, false, loader);
            } catch (ClassNotFoundException e) {
                throw new TypeLoadException(className, e);
            }
        });
    }

    private static URL[] toUrls(List<Path> classpath) {
        List<URL> urls = new ArrayList<>();
        for (Path entry : classpath) {
            try {
                urls.add(entry.toAbsolutePath().toUri().toURL());
            } catch (MalformedURLException e) {
                log.warn("Ignoring classpath entry {}: {}", entry, e.getMessage());
            }
        }
        return urls.toArray(new URL[0]);
    }
}
