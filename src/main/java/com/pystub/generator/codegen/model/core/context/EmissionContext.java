package com.pystub.generator.codegen.model.core.context;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

import com.pystub.generator.codegen.util.ImportManager;
import com.pystub.generator.codegen.util.NamingUtil;

import lombok.Getter;

/**
 * Mutable state shared by every class emitted into one package stub.
 *
 * Class names are local binary names ({@code Foo}, {@code Foo$Bar}). While a top-level class
 * is being emitted, the names it declares go to a pending set: they are visible to later
 * siblings at once, but only become part of {@link #getEmitted()} when the whole top-level
 * declaration has been appended to the output ({@link #commitClass()}). A failed emission
 * discards them ({@link #rollbackClass()}).
 */
public class EmissionContext {

    @Getter
    private final String packageName;

    @Getter
    private final ImportManager imports = new ImportManager();

    private final Set<String> emitted = new LinkedHashSet<>();
    private final Set<String> pending = new LinkedHashSet<>();
    private final Set<String> referenced = new TreeSet<>();
    private final Set<String> failed = new TreeSet<>();

    private boolean classOpen;

    public EmissionContext(String packageName) {
        this.packageName = packageName;
    }

    public void beginClass() {
        if (classOpen) {
            throw new IllegalStateException("A class emission is already in progress");
        }
        classOpen = true;
    }

    public void commitClass() {
        emitted.addAll(pending);
        pending.clear();
        classOpen = false;
    }

    public void rollbackClass() {
        pending.clear();
        classOpen = false;
    }

    /**
     * Records a class as declared. Inside {@link #beginClass()}/{@link #commitClass()} the name
     * stays pending until the commit.
     */
    public void markEmitted(String localName) {
        if (classOpen) {
            pending.add(localName);
        } else {
            emitted.add(localName);
        }
    }

    public boolean isEmitted(String localName) {
        return emitted.contains(localName) || pending.contains(localName);
    }

    /**
     * Committed class names, in emission order.
     */
    public Set<String> getEmitted() {
        return Collections.unmodifiableSet(emitted);
    }

    /**
     * Records a (Python-safe, dotted) type name mentioned by the output.
     */
    public void addReferenced(String qualifiedName) {
        referenced.add(qualifiedName);
    }

    public Set<String> getReferenced() {
        return Collections.unmodifiableSet(referenced);
    }

    public void markFailed(String localName) {
        failed.add(localName);
    }

    public boolean isFailed(String localName) {
        return failed.contains(localName);
    }

    public Set<String> getFailed() {
        return Collections.unmodifiableSet(failed);
    }

    /**
     * Python-safe form of this package's name, as it appears in rendered type names.
     */
    public String getSafePackageName() {
        return NamingUtil.pysafePath(packageName);
    }

    /**
     * Top-level classes of this package that are referenced but not declared yet, sorted.
     */
    public Set<String> getUnresolvedReferences() {
        String prefix = getSafePackageName() + ".";
        Set<String> unresolved = new TreeSet<>();
        for (String name : referenced) {
            if (!name.startsWith(prefix)) {
                continue;
            }
            String localName = name.substring(prefix.length());
            if (!localName.contains(".") && !localName.contains("$") && !isEmitted(localName)) {
                unresolved.add(localName);
            }
        }
        return unresolved;
    }
}
