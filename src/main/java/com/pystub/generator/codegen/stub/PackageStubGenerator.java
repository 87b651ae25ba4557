package com.pystub.generator.codegen.stub;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pystub.generator.codegen.bindings.InteropBindingsGenerator;
import com.pystub.generator.codegen.javadoc.JavadocSplitter;
import com.pystub.generator.codegen.model.core.context.EmissionContext;
import com.pystub.generator.codegen.model.input.PackageUnit;
import com.pystub.generator.codegen.model.output.GeneratedFile;
import com.pystub.generator.codegen.model.output.GeneratedFileType;
import com.pystub.generator.codegen.model.output.PackageStub;
import com.pystub.generator.codegen.model.output.StubFileLayout;
import com.pystub.generator.codegen.schedule.DependencyScheduler;
import com.pystub.generator.codegen.schedule.ScheduleReport;
import com.pystub.generator.codegen.type.TypeTranslator;
import com.pystub.generator.codegen.util.NamingUtil;
import com.pystub.generator.reflect.ReflectionProvider;

/**
 * Generates the {@code __init__.pyi} module of one Java package: sorted imports, two blank
 * lines, then the class declarations in dependency order.
 */
public class PackageStubGenerator {

    private static final Logger log = LoggerFactory.getLogger(PackageStubGenerator.class);

    private final ReflectionProvider provider;
    private final TypeTranslator translator;
    private final ClassStubGenerator classGenerator;
    private final InteropBindingsGenerator bindingsGenerator;

    public PackageStubGenerator(ReflectionProvider provider) {
        this.provider = provider;
        this.translator = new TypeTranslator();
        TypeRenderer renderer = new TypeRenderer();
        this.classGenerator = new ClassStubGenerator(provider, translator, renderer,
                new FieldStubGenerator(translator, renderer),
                new MethodStubGenerator(translator, renderer, new JavadocSplitter()));
        this.bindingsGenerator = new InteropBindingsGenerator();
    }

    public PackageStub generate(PackageUnit unit, StubFileLayout layout) {
        String packageName = unit.getQualifiedName();
        Path stubFile = layout.stubFile(packageName);
        SortedSet<String> subpackages = layout.subpackagesOf(packageName);
        log.info("Generating stubs for {} ({} classes, {} subpackages)",
                packageName, unit.getDirectClasses().size(), subpackages.size());

        EmissionContext ctx = new EmissionContext(packageName);
        ReflectiveClassEmitter emitter = new ReflectiveClassEmitter(provider, translator, classGenerator, packageName);
        ScheduleReport report = new DependencyScheduler<>(emitter).schedule(unit.getDirectClasses(), ctx);

        for (String subpackage : subpackages) {
            ctx.getImports().addImport(NamingUtil.pysafePath(packageName + "." + subpackage));
        }

        List<String> classOutput = new ArrayList<>(emitter.getOutput());
        List<GeneratedFile> files = new ArrayList<>();
        if (InteropBindingsGenerator.JAVA_PACKAGE.equals(packageName)) {
            bindingsGenerator.importStatements().forEach(ctx.getImports()::addStatement);
            classOutput.add(bindingsGenerator.exports());
            files.addAll(bindingsGenerator.bindingFiles(stubFile.getParent()));
        }

        StringBuilder contents = new StringBuilder(ctx.getImports().generateImports());
        contents.append("\n\n");
        for (String line : classOutput) {
            contents.append(line).append('\n');
        }
        files.add(0, GeneratedFile.builder()
                .path(stubFile)
                .contents(contents.toString())
                .type(GeneratedFileType.PACKAGE_STUB)
                .build());
        return new PackageStub(packageName, files, report);
    }
}
