package com.pystub.generator.codegen.util;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects the import lines of one generated stub module, sorted and de-duplicated.
 */
public class ImportManager {

    private final Set<String> imports = new TreeSet<>();

    /**
     * Adds {@code import module}.
     */
    public void addImport(String module) {
        if (module == null || module.isEmpty()) {
            return;
        }
        imports.add("import " + module);
    }

    /**
     * Adds a complete import statement, e.g. a multi-line {@code from x import (...)} block.
     */
    public void addStatement(String statement) {
        imports.add(statement);
    }

    public Set<String> getImports() {
        return Collections.unmodifiableSet(imports);
    }

    /**
     * Import statements, one per line, in sorted order.
     */
    public String generateImports() {
        if (imports.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        for (String imp : imports) {
            sb.append(imp).append("\n");
        }
        return sb.toString();
    }
}
