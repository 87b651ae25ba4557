package com.pystub.generator.reflect;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pystub.generator.codegen.model.input.ClassDoc;

import lombok.Value;

/**
 * Reads class documentation from javadoc HTML pages found as class loader resources
 * (i.e. {@code -javadoc.jar} files on the classpath).
 *
 * Understands the layout of current javadoc ({@code section.method-details}) as well as the
 * older {@code blockList} layout with {@code method.detail} anchors.
 */
public class JavadocExtractor {

    private static final Logger log = LoggerFactory.getLogger(JavadocExtractor.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern THROWS_CLAUSE = Pattern.compile("\\s+throws\\s+.*$");
    private static final Pattern LEADING_ANNOTATIONS = Pattern.compile("^(@\\S+\\s+)+");

    /**
     * Documentation for {@code cls}, or {@link ClassDoc#empty()} when there is no page for it
     * or the page cannot be read.
     */
    public ClassDoc extract(Class<?> cls, ClassLoader loader) {
        String resource = resourcePath(cls);
        URL url = loader.getResource(resource);
        if (url == null) {
            return ClassDoc.empty();
        }
        try (InputStream in = url.openStream()) {
            return extract(Jsoup.parse(in, "UTF-8", url.toExternalForm()));
        } catch (IOException | RuntimeException e) {
            log.debug("Unreadable javadoc page {}: {}", resource, e.getMessage());
            return ClassDoc.empty();
        }
    }

    public ClassDoc extract(Document page) {
        ClassDoc.ClassDocBuilder builder = ClassDoc.builder();

        Element description = page.selectFirst(
                "section.class-description div.block, div.description div.block");
        if (description != null) {
            builder.description(sanitize(blockText(description)).strip());
        }

        StringBuilder constructors = new StringBuilder();
        for (MemberDoc ctor : members(page, "constructor-details", "constructor.detail")) {
            constructors.append(ctor.render());
        }
        builder.constructorDoc(constructors.toString());

        Map<String, StringBuilder> methods = new LinkedHashMap<>();
        for (MemberDoc method : members(page, "method-details", "method.detail")) {
            methods.computeIfAbsent(method.getName(), k -> new StringBuilder()).append(method.render());
        }
        methods.forEach((name, doc) -> builder.methodDoc(name, doc.toString()));

        for (MemberDoc field : members(page, "field-details", "field.detail")) {
            if (!field.getDescription().isEmpty()) {
                builder.fieldDoc(field.getName(), field.getDescription());
            }
        }
        return builder.build();
    }

    static String resourcePath(Class<?> cls) {
        String packageName = cls.getPackageName();
        String localName = Reflection.localName(cls).replace('$', '.');
        return packageName.isEmpty()
                ? localName + ".html"
                : packageName.replace('.', '/') + "/" + localName + ".html";
    }

    /**
     * Replaces the escapes and special spaces javadoc uses inside signatures.
     */
    static String sanitize(String html) {
        if (html == null) {
            return "";
        }
        return html.replace("\u200b", " ")
                .replace("\u00a0", " ")
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">");
    }

    private List<MemberDoc> members(Document page, String sectionClass, String legacyAnchor) {
        List<MemberDoc> result = new ArrayList<>();
        Element section = page.selectFirst("section." + sectionClass);
        if (section != null) {
            for (Element detail : section.select("section.detail")) {
                addMember(result, detail.selectFirst("h3"), detail.selectFirst("div.member-signature"),
                        detail.selectFirst("div.block"));
            }
            return result;
        }

        Element anchor = page.selectFirst("a[name=" + legacyAnchor + "], a[id=" + legacyAnchor + "]");
        if (anchor == null || anchor.parent() == null) {
            return result;
        }
        Element container = anchor.parent();
        for (Element item : container.select("ul > li.blockList")) {
            if (item == container) {
                continue;
            }
            addMember(result, item.selectFirst("h4"), item.selectFirst("pre"), item.selectFirst("div.block"));
        }
        return result;
    }

    private void addMember(List<MemberDoc> result, Element name, Element signature, Element block) {
        if (name == null || signature == null) {
            return;
        }
        String cleanSignature = normalizeSignature(signature.text());
        String description = block == null ? "" : sanitize(blockText(block)).strip();
        result.add(new MemberDoc(name.text().strip(), cleanSignature, description));
    }

    private static String normalizeSignature(String signature) {
        String text = WHITESPACE.matcher(sanitize(signature.replace("\u200b", ""))).replaceAll(" ").strip();
        text = LEADING_ANNOTATIONS.matcher(text).replaceFirst("");
        return THROWS_CLAUSE.matcher(text).replaceFirst("");
    }

    /**
     * Flattens a documentation block to plain text, keeping paragraph and list structure.
     */
    private static String blockText(Element block) {
        StringBuilder sb = new StringBuilder();
        block.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode text) {
                    sb.append(WHITESPACE.matcher(text.getWholeText()).replaceAll(" "));
                } else if (node instanceof Element el) {
                    switch (el.tagName().toLowerCase(Locale.ROOT)) {
                        case "p", "ul", "ol", "dl" -> paragraph(sb);
                        case "br" -> sb.append('\n');
                        case "li" -> sb.append("\n- ");
                        default -> {
                            // inline element, text follows
                        }
                    }
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element el && el.tagName().equalsIgnoreCase("p")) {
                    paragraph(sb);
                }
            }
        });
        return sb.toString()
                .replaceAll("[ \\t]+\\n", "\n")
                .replaceAll("\\n[ \\t]+", "\n")
                .replaceAll("\\n{3,}", "\n\n");
    }

    private static void paragraph(StringBuilder sb) {
        if (sb.length() > 0 && !sb.toString().endsWith("\n\n")) {
            sb.append(sb.charAt(sb.length() - 1) == '\n' ? "\n" : "\n\n");
        }
    }

    @Value
    private static class MemberDoc {
        String name;
        String signature;
        String description;

        String render() {
            return signature + "\n\n" + description + "\n";
        }
    }
}
