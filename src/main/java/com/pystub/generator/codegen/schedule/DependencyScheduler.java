package com.pystub.generator.codegen.schedule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pystub.generator.codegen.model.core.context.EmissionContext;
import com.pystub.generator.reflect.TypeLoadException;

/**
 * Orders the classes of one package so that a class is declared after its in-package
 * supertypes, as Python requires for base classes.
 *
 * Each pass emits, by name, every remaining class whose dependencies are satisfied. When no
 * class is ready, the missing same-package supertypes (non-public ones are not listed in the
 * package) are looked up and queued first. If that finds nothing, all remaining classes are
 * emitted anyway (their bases are then written fully qualified), which guarantees termination
 * on cycles. After every pass, classes of the package
 * that are referenced but not declared are looked up and queued, or replaced by an empty
 * placeholder when they cannot be found.
 *
 * @param <T> class handle type
 */
public class DependencyScheduler<T> {

    private static final Logger log = LoggerFactory.getLogger(DependencyScheduler.class);

    private final ClassEmitter<T> emitter;

    public DependencyScheduler(ClassEmitter<T> emitter) {
        this.emitter = emitter;
    }

    public ScheduleReport schedule(List<T> classes, EmissionContext ctx) {
        ScheduleReport report = new ScheduleReport();
        Comparator<T> byName = Comparator.comparing(emitter::nameOf);
        List<T> remaining = new ArrayList<>(classes);
        Set<String> lookedUp = new HashSet<>();

        while (!remaining.isEmpty()) {
            List<T> ready = remaining.stream().filter(cls -> emitter.isReady(cls, ctx)).toList();
            if (ready.isEmpty() && queueBlockingSupertypes(remaining, lookedUp, ctx)) {
                continue;
            }
            boolean fallback = ready.isEmpty();
            if (fallback) {
                log.debug("No class of {} has its supertypes declared, emitting {} remaining classes",
                        ctx.getPackageName(), remaining.size());
                ready = List.copyOf(remaining);
            }

            for (T cls : ready.stream().sorted(byName).toList()) {
                String name = emitter.nameOf(cls);
                try {
                    emitter.emit(cls, ctx);
                    report.getEmitted().add(name);
                    if (fallback) {
                        report.getEmittedByFallback().add(name);
                    }
                } catch (TypeLoadException e) {
                    log.warn("Skipping {}.{} due to {}", ctx.getPackageName(), name, e.getMessage());
                    ctx.markFailed(name);
                    report.getFailed().add(name);
                }
                remaining.remove(cls);
            }

            Set<String> queued = new HashSet<>();
            remaining.forEach(cls -> queued.add(emitter.nameOf(cls)));
            for (String missing : ctx.getUnresolvedReferences()) {
                if (queued.contains(missing)) {
                    continue;
                }
                Optional<T> found = Optional.empty();
                if (!ctx.isFailed(missing) && lookedUp.add(missing)) {
                    found = lookup(missing, ctx);
                }
                if (found.isPresent()) {
                    remaining.add(found.get());
                    queued.add(missing);
                } else {
                    log.warn("Reference to missing class {}.{} - generating empty stub", ctx.getPackageName(), missing);
                    emitter.emitPlaceholder(missing, ctx);
                    report.getPlaceholders().add(missing);
                }
            }
        }
        return report;
    }

    /**
     * Looks up the not yet declared same-package supertypes that keep the remaining classes
     * from being ready (typically non-public base classes) and queues those that are found.
     *
     * @return whether anything was queued
     */
    private boolean queueBlockingSupertypes(List<T> remaining, Set<String> lookedUp, EmissionContext ctx) {
        Set<String> queued = new HashSet<>();
        remaining.forEach(cls -> queued.add(emitter.nameOf(cls)));
        List<T> found = new ArrayList<>();
        for (T cls : remaining) {
            Set<String> pending;
            try {
                pending = emitter.pendingSupertypes(cls, ctx);
            } catch (TypeLoadException e) {
                continue;
            }
            for (String pendingName : pending) {
                // member classes are declared with their top-level class
                int nested = pendingName.indexOf('$');
                String supertype = nested < 0 ? pendingName : pendingName.substring(0, nested);
                if (queued.contains(supertype) || ctx.isFailed(supertype) || !lookedUp.add(supertype)) {
                    continue;
                }
                Optional<T> match = lookup(supertype, ctx);
                if (match.isPresent()) {
                    log.debug("Queueing supertype {}.{} of {}", ctx.getPackageName(), supertype, emitter.nameOf(cls));
                    found.add(match.get());
                    queued.add(supertype);
                }
            }
        }
        remaining.addAll(found);
        return !found.isEmpty();
    }

    private Optional<T> lookup(String localName, EmissionContext ctx) {
        try {
            return emitter.lookup(localName);
        } catch (TypeLoadException e) {
            log.warn("Skipping missing class {}.{} due to {}", ctx.getPackageName(), localName, e.getMessage());
            return Optional.empty();
        }
    }
}
