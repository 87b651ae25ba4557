package com.pystub.generator.codegen.util;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.pystub.generator.codegen.model.type.ArgumentSig;

/**
 * Utility for mapping Java identifiers onto names that are legal in Python stubs.
 */
public class NamingUtil {

    private static final Set<String> RESERVED_WORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield",
            // keywords in Python 2, still rejected by some tools
            "exec", "print");

    private NamingUtil() {
        // Utility class
    }

    public static boolean isReservedWord(String word) {
        return RESERVED_WORDS.contains(word);
    }

    /**
     * Shaped like a special method name ({@code __x__}).
     */
    public static boolean isDunder(String name) {
        return name.length() >= 4 && name.startsWith("__") && name.endsWith("__");
    }

    /**
     * Python-safe form of a Java identifier: reserved words get a trailing underscore.
     *
     * @return the safe name, or null for dunder-shaped names, which cannot be used at all
     */
    public static String pysafe(String name) {
        if (isDunder(name)) {
            return null;
        }
        if (isReservedWord(name)) {
            return name + "_";
        }
        return name;
    }

    /**
     * Applies {@link #pysafe(String)} to each segment of a dotted name. Unusable segments become empty.
     */
    public static String pysafePath(String dottedName) {
        return Arrays.stream(dottedName.split("\\.", -1))
                .map(segment -> {
                    String safe = pysafe(segment);
                    return safe == null ? "" : safe;
                })
                .collect(Collectors.joining("."));
    }

    /**
     * Derives an argument name from its type when the class file carries no parameter names:
     * the decapitalized simple type name, with an {@code Array} suffix for arrays, numbered from
     * 2 when the same name already occurs among the previous arguments.
     *
     * @param javaTypeName {@link java.lang.reflect.Type#getTypeName()} of the argument, or null
     */
    public static String inferArgName(String javaTypeName, List<ArgumentSig> previousArgs) {
        if (javaTypeName == null) {
            return "arg" + previousArgs.size();
        }
        boolean array = javaTypeName.endsWith("[]");
        String simple = simpleTypeName(javaTypeName).replace("[]", "");
        String base = decapitalize(simple) + (array ? "Array" : "");

        Pattern sameBase = Pattern.compile(Pattern.quote(base) + "\\d*");
        long occurrences = previousArgs.stream()
                .filter(arg -> sameBase.matcher(arg.getName()).matches())
                .count();
        return occurrences == 0 ? base : base + (occurrences + 1);
    }

    /**
     * {@code java.util.Map$Entry<K, V>[]} -> {@code Entry[]}
     */
    public static String simpleTypeName(String javaTypeName) {
        String name = javaTypeName;
        int generic = name.indexOf('<');
        if (generic >= 0) {
            String suffix = name.endsWith("[]") ? name.substring(name.lastIndexOf('>') + 1) : "";
            name = name.substring(0, generic) + suffix;
        }
        name = name.substring(name.lastIndexOf('$') + 1);
        return name.substring(name.lastIndexOf('.') + 1);
    }

    public static String decapitalize(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return name.substring(0, 1).toLowerCase(Locale.ROOT) + name.substring(1);
    }

    /**
     * Scope id used to prefix the type variables of a class: {@code Outer$Inner} -> {@code Outer__Inner}.
     */
    public static String classScopeId(String localName) {
        return localName.replace(".", "_").replace("$", "__");
    }
}
