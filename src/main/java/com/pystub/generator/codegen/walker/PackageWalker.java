package com.pystub.generator.codegen.walker;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pystub.generator.codegen.StubGenerationException;
import com.pystub.generator.codegen.model.input.PackageUnit;
import com.pystub.generator.codegen.model.output.StubFileLayout;
import com.pystub.generator.codegen.util.NamingUtil;
import com.pystub.generator.reflect.ReflectionProvider;

/**
 * Collects the packages to generate and decides where their stub files go.
 */
public class PackageWalker {

    private static final Logger log = LoggerFactory.getLogger(PackageWalker.class);

    static final String STUB_FILE = "__init__.pyi";
    static final String STUBS_SUFFIX = "-stubs";

    private final ReflectionProvider provider;

    public PackageWalker(ReflectionProvider provider) {
        this.provider = provider;
    }

    /**
     * Every root package plus all of its descendants that are real packages, depth first.
     *
     * @throws StubGenerationException when a root package does not exist
     */
    public Map<String, PackageUnit> collect(List<String> roots) {
        Map<String, PackageUnit> packages = new LinkedHashMap<>();
        for (String root : roots) {
            if (!provider.packageExists(root)) {
                throw new StubGenerationException("Package not found on the classpath: " + root);
            }
            walk(root, packages);
        }
        log.info("Collected {} packages", packages.size());
        return packages;
    }

    private void walk(String packageName, Map<String, PackageUnit> packages) {
        if (packages.containsKey(packageName)) {
            return;
        }
        SortedSet<String> children = new TreeSet<>();
        for (String child : provider.subpackages(packageName)) {
            if (!provider.isPseudoPackage(child)) {
                children.add(child);
            }
        }
        packages.put(packageName, PackageUnit.builder()
                .qualifiedName(packageName)
                .directClasses(provider.packageClasses(packageName))
                .directSubpackages(children)
                .build());
        for (String child : children) {
            try {
                walk(child, packages);
            } catch (RuntimeException e) {
                log.warn("Skipping package {}: {}", child, e.getMessage());
            }
        }
    }

    /**
     * Stub file paths for all collected packages and every one of their parent packages.
     * Keyword segments get a trailing underscore; the first segment's directory gets the
     * {@code -stubs} suffix when requested.
     */
    public StubFileLayout layout(Iterable<String> packageNames, Path outputDir, boolean stubsSuffix) {
        Map<String, Path> stubFiles = new TreeMap<>();
        Map<String, SortedSet<String>> subpackages = new TreeMap<>();

        for (String packageName : packageNames) {
            Path directory = outputDir;
            String prefix = "";
            for (String segment : packageName.split("\\.")) {
                String directoryName = NamingUtil.isReservedWord(segment) ? segment + "_" : segment;
                if (prefix.isEmpty()) {
                    directory = directory.resolve(stubsSuffix ? directoryName + STUBS_SUFFIX : directoryName);
                    prefix = segment;
                } else {
                    subpackages.computeIfAbsent(prefix, k -> new TreeSet<>()).add(segment);
                    directory = directory.resolve(directoryName);
                    prefix = prefix + "." + segment;
                }
                stubFiles.put(prefix, directory.resolve(STUB_FILE));
            }
        }
        return StubFileLayout.builder()
                .stubFiles(stubFiles)
                .subpackages(subpackages)
                .build();
    }
}
