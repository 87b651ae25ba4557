package com.pystub.generator.codegen.javadoc;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pystub.generator.codegen.model.type.ArgumentSig;
import com.pystub.generator.codegen.model.type.FunctionSig;
import com.pystub.generator.codegen.util.NamingUtil;

/**
 * Splits the documentation of an overloaded method (or of all constructors) into one part per
 * overload.
 *
 * The input text is a sequence of blocks {@code signature\n\ndescription\n}. A line that looks
 * like the javadoc rendering of one of the signatures starts that overload's part; the blank
 * line after it is skipped. The matching is approximate: text before the first recognized
 * header is dropped, and this class never fails on malformed input.
 */
public class JavadocSplitter {

    private static final Logger log = LoggerFactory.getLogger(JavadocSplitter.class);

    private static final String IDENTIFIER = "[a-zA-Z0-9_?]+";
    private static final String TYPE = "[a-zA-Z0-9_?.,:`~\\s]+(<[a-zA-Z0-9_?.,:~\\s<>\\[\\]/=-]+>)?`?(\\[\\])*\\s?";
    private static final Pattern PARAMETER = Pattern.compile(TYPE + " " + IDENTIFIER);

    /** longer lines are never headers */
    static final int MAX_HEADER_LENGTH = 400;

    /**
     * @param signatures     overloads in output order
     * @param documentedName the name used in the javadoc signatures: the Java method name, or
     *                       the simple class name for constructors
     * @param doc            aggregated documentation of all overloads
     * @return one (possibly empty) text per signature, same order
     */
    public List<String> split(List<FunctionSig> signatures, String documentedName, String doc) {
        List<List<String>> buckets = new ArrayList<>();
        for (int i = 0; i < signatures.size(); i++) {
            buckets.add(new ArrayList<>());
        }
        if (doc == null || doc.isEmpty() || signatures.isEmpty()) {
            return join(buckets);
        }

        List<Header> headers = signatures.stream()
                .map(signature -> header(signature, documentedName))
                .toList();
        String[] lines = doc.split("\n", -1);
        Set<Integer> claimed = new HashSet<>();
        Integer current = null;
        int line = 0;
        while (line < lines.length) {
            List<Integer> matches = matchingSignatures(headers, lines[line]);
            if (!matches.isEmpty()) {
                current = choose(matches, headerParameterTypes(lines[line]), signatures, claimed);
                claimed.add(current);
                line += 2;
            }
            if (current != null && line < lines.length) {
                buckets.get(current).add(lines[line]);
            }
            line++;
        }
        if (current == null) {
            log.debug("No overload of {} matched its documentation", documentedName);
        }
        return join(buckets);
    }

    /**
     * Header recognizer of one signature. The line is matched up to the parameter list by a
     * regex; type parameters and parameters are then split on top-level commas and counted,
     * and each parameter is checked on its own.
     */
    static Header header(FunctionSig signature, String documentedName) {
        StringBuilder regex = new StringBuilder("(default\\s)?(public|protected|private)?\\s?");
        if (signature.isStatic()) {
            regex.append("static\\s");
        }
        int typeVarCount = signature.getTypeVars().size();
        if (typeVarCount > 0) {
            regex.append("<(?<typeParams>[^()]+?)>\\s");
        }
        // return type, absent for constructors
        regex.append('(').append(TYPE).append(")?");
        regex.append("\\s?").append(Pattern.quote(documentedName));
        regex.append("\\s?\\((?<params>[^()]*)\\)");
        return new Header(Pattern.compile(regex.toString()), typeVarCount, signature.declaredArgs().size());
    }

    private static List<Integer> matchingSignatures(List<Header> headers, String line) {
        if (line.length() > MAX_HEADER_LENGTH || line.indexOf('(') < 0 || !line.endsWith(")")) {
            return List.of();
        }
        List<Integer> matches = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
            if (headers.get(i).matches(line)) {
                matches.add(i);
            }
        }
        return matches;
    }

    /**
     * Several overloads of the same arity match the same header: prefer the one whose Java
     * parameter types equal those of the header, then the first one without a header yet.
     */
    private static int choose(List<Integer> matches, List<String> headerTypes, List<FunctionSig> signatures,
                              Set<Integer> claimed) {
        if (matches.size() == 1) {
            return matches.get(0);
        }
        for (int candidate : matches) {
            List<String> javaTypes = signatures.get(candidate).declaredArgs().stream()
                    .map(ArgumentSig::getJavaTypeName)
                    .toList();
            if (javaTypes.equals(headerTypes)) {
                return candidate;
            }
        }
        for (int candidate : matches) {
            if (!claimed.contains(candidate)) {
                return candidate;
            }
        }
        return matches.get(0);
    }

    /**
     * Simple parameter type names of a header line, e.g. {@code foo(List<String> a, int[] b)}
     * gives {@code [List, int[]]}.
     */
    static List<String> headerParameterTypes(String header) {
        int open = header.indexOf('(');
        int close = header.lastIndexOf(')');
        if (open < 0 || close <= open) {
            return List.of();
        }
        List<String> types = new ArrayList<>();
        for (String parameter : splitTopLevel(header.substring(open + 1, close))) {
            String trimmed = parameter.strip();
            int space = trimmed.lastIndexOf(' ');
            if (space < 0) {
                continue;
            }
            String type = trimmed.substring(0, space).strip().replace("...", "[]");
            types.add(NamingUtil.simpleTypeName(type).replace(" ", ""));
        }
        return types;
    }

    private static List<String> splitTopLevel(String parameters) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < parameters.length(); i++) {
            char c = parameters.charAt(i);
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(parameters.substring(start, i));
                start = i + 1;
            }
        }
        if (start < parameters.length()) {
            parts.add(parameters.substring(start));
        }
        return parts;
    }

    private static List<String> join(List<List<String>> buckets) {
        return buckets.stream().map(lines -> String.join("\n", lines)).toList();
    }

    static final class Header {
        private final Pattern pattern;
        private final int typeVarCount;
        private final int argCount;

        private Header(Pattern pattern, int typeVarCount, int argCount) {
            this.pattern = pattern;
            this.typeVarCount = typeVarCount;
            this.argCount = argCount;
        }

        boolean matches(String line) {
            Matcher matcher = pattern.matcher(line);
            if (!matcher.matches()) {
                return false;
            }
            if (typeVarCount > 0 && splitTopLevel(matcher.group("typeParams")).size() != typeVarCount) {
                return false;
            }
            String params = matcher.group("params");
            List<String> parameters = params.isBlank() ? List.of() : splitTopLevel(params);
            if (parameters.size() != argCount) {
                return false;
            }
            return parameters.stream().allMatch(parameter -> PARAMETER.matcher(parameter.strip()).matches());
        }
    }
}
