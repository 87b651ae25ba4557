package com.pystub.generator.codegen.bindings;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.pystub.generator.codegen.StubGenerationException;
import com.pystub.generator.codegen.model.output.GeneratedFile;
import com.pystub.generator.codegen.model.output.GeneratedFileType;
import com.pystub.generator.codegen.type.Primitive;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Adds the Chaquopy interop API (casts, proxies, arrays, primitive wrappers) to the stubs of
 * the top-level {@code java} package.
 */
public class InteropBindingsGenerator {

    public static final String JAVA_PACKAGE = "java";

    private static final List<String> CHAQUOPY_NAMES = List.of(
            "cast", "detach", "jarray", "jclass", "set_import_enabled", "dynamic_proxy", "static_proxy",
            "constructor", "method", "Override");

    private static final List<Primitive> PRIMITIVE_ORDER = List.of(
            Primitive.VOID, Primitive.BOOLEAN, Primitive.BYTE, Primitive.SHORT, Primitive.INT, Primitive.LONG,
            Primitive.FLOAT, Primitive.DOUBLE, Primitive.CHAR);

    private final Configuration freemarkerConfig;

    public InteropBindingsGenerator() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * The {@code from java.chaquopy import (...)} and {@code from java.primitive import (...)} blocks.
     */
    public List<String> importStatements() {
        return List.of(
                importBlock("java.chaquopy", CHAQUOPY_NAMES),
                importBlock("java.primitive", primitiveWrapperNames()));
    }

    /**
     * The {@code __all__} list re-exporting the interop API from the {@code java} package.
     */
    public String exports() {
        List<String> names = new ArrayList<>(CHAQUOPY_NAMES);
        names.addAll(primitiveWrapperNames());
        return render("java_exports.ftl", Map.of("names", names)).stripTrailing();
    }

    /**
     * {@code chaquopy.pyi} and {@code primitive.pyi}, next to the {@code java} package stub.
     */
    public List<GeneratedFile> bindingFiles(Path javaPackageDir) {
        Map<String, Object> model = new HashMap<>();
        model.put("arrayTypes", arrayTypes());
        model.put("intTypes", wrapperNames(Primitive.BYTE, Primitive.SHORT, Primitive.INT, Primitive.LONG));
        model.put("floatTypes", wrapperNames(Primitive.FLOAT, Primitive.DOUBLE));

        return List.of(
                GeneratedFile.builder()
                        .path(javaPackageDir.resolve("chaquopy.pyi"))
                        .contents(render("chaquopy.pyi.ftl", model))
                        .type(GeneratedFileType.BINDINGS)
                        .build(),
                GeneratedFile.builder()
                        .path(javaPackageDir.resolve("primitive.pyi"))
                        .contents(render("primitive.pyi.ftl", model))
                        .type(GeneratedFileType.BINDINGS)
                        .build());
    }

    private String importBlock(String module, List<String> names) {
        return render("import_block.ftl", Map.of("module", module, "names", names)).stripTrailing();
    }

    private static List<String> primitiveWrapperNames() {
        return PRIMITIVE_ORDER.stream().map(InteropBindingsGenerator::simpleName).toList();
    }

    private static List<String> wrapperNames(Primitive... primitives) {
        List<String> names = new ArrayList<>();
        for (Primitive primitive : primitives) {
            names.add(simpleName(primitive));
        }
        return names;
    }

    /**
     * One entry per primitive with a specialized array type: alias name, wrapper name, the
     * Python element type and what the array constructor accepts.
     */
    private static List<Map<String, String>> arrayTypes() {
        List<Map<String, String>> arrayTypes = new ArrayList<>();
        for (Primitive primitive : PRIMITIVE_ORDER) {
            if (primitive.getArrayTypeName() == null) {
                continue;
            }
            String element = primitive.getPythonName();
            Map<String, String> arrayType = new LinkedHashMap<>();
            arrayType.put("alias", primitive.getArrayTypeName().substring(primitive.getArrayTypeName().lastIndexOf('.') + 1));
            arrayType.put("wrapper", simpleName(primitive));
            arrayType.put("element", element);
            arrayType.put("initValue", primitive == Primitive.CHAR
                    ? "typing.Union[int, str]"
                    : "typing.Union[int, typing.Sequence[" + element + "]]");
            arrayTypes.add(arrayType);
        }
        return arrayTypes;
    }

    private static String simpleName(Primitive primitive) {
        String wrapper = primitive.getWrapperName();
        return wrapper.substring(wrapper.lastIndexOf('.') + 1);
    }

    private String render(String templateName, Map<String, Object> model) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new StubGenerationException("Failed to render template " + templateName, e);
        }
    }
}
