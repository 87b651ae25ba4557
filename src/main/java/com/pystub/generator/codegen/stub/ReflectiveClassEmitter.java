package com.pystub.generator.codegen.stub;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.pystub.generator.codegen.model.core.context.EmissionContext;
import com.pystub.generator.codegen.model.type.TypeExpr;
import com.pystub.generator.codegen.schedule.ClassEmitter;
import com.pystub.generator.codegen.type.TypeTranslator;
import com.pystub.generator.reflect.Reflection;
import com.pystub.generator.reflect.ReflectionProvider;
import com.pystub.generator.reflect.TypeLoadException;

/**
 * Emits reflected classes of one package into a shared list of output lines.
 */
public class ReflectiveClassEmitter implements ClassEmitter<Class<?>> {

    private final ReflectionProvider provider;
    private final TypeTranslator translator;
    private final ClassStubGenerator classGenerator;
    private final String packageName;
    private final List<String> output = new ArrayList<>();

    public ReflectiveClassEmitter(ReflectionProvider provider, TypeTranslator translator,
                                  ClassStubGenerator classGenerator, String packageName) {
        this.provider = provider;
        this.translator = translator;
        this.classGenerator = classGenerator;
        this.packageName = packageName;
    }

    public List<String> getOutput() {
        return Collections.unmodifiableList(output);
    }

    @Override
    public String nameOf(Class<?> cls) {
        return Reflection.localName(cls);
    }

    @Override
    public boolean isReady(Class<?> cls, EmissionContext ctx) {
        try {
            return pendingSupertypes(cls, ctx).isEmpty();
        } catch (TypeLoadException e) {
            return false;
        }
    }

    /**
     * @throws TypeLoadException when a supertype cannot be reflected
     */
    @Override
    public Set<String> pendingSupertypes(Class<?> cls, EmissionContext ctx) {
        Set<String> pending = new LinkedHashSet<>();
        collectPendingSupertypes(cls, nameOf(cls), ctx, pending);
        return pending;
    }

    /**
     * Supertypes declared inside {@code root} itself cannot be emitted first and are ignored.
     */
    private void collectPendingSupertypes(Class<?> cls, String root, EmissionContext ctx, Set<String> pending) {
        for (Type superType : ClassStubGenerator.superTypes(cls)) {
            TypeExpr translated = Reflection.guard(cls.getName(), () -> translator.translate(superType));
            String name = translated.getName();
            int dot = name.lastIndexOf('.');
            if (dot < 0 || !name.substring(0, dot).equals(packageName)) {
                continue;
            }
            String localName = name.substring(dot + 1);
            boolean ownNesting = localName.equals(root) || localName.startsWith(root + "$");
            if (!ownNesting && !ctx.isEmitted(localName)) {
                pending.add(localName);
            }
        }
        for (Class<?> member : provider.memberClasses(cls)) {
            collectPendingSupertypes(member, root, ctx, pending);
        }
    }

    @Override
    public void emit(Class<?> cls, EmissionContext ctx) {
        ctx.beginClass();
        try {
            output.addAll(classGenerator.generate(cls, ctx));
            ctx.commitClass();
        } catch (RuntimeException e) {
            ctx.rollbackClass();
            throw e;
        }
    }

    @Override
    public Optional<Class<?>> lookup(String localName) {
        return provider.findClass(packageName, localName);
    }

    @Override
    public void emitPlaceholder(String localName, EmissionContext ctx) {
        output.add("");
        output.add(ClassStubGenerator.placeholder(localName));
        ctx.markEmitted(localName);
    }
}
