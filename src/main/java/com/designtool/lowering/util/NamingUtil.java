package com.designtool.lowering.util;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Turns designer-authored layer names into identifiers.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Splits on camelCase boundaries and on anything that is not a letter or digit.
     */
    public static List<String> words(String name) {
        if (name == null) {
            return List.of();
        }
        String spaced = name
                .replaceAll("([a-z])([A-Z])", "$1 $2")
                .replaceAll("[^a-zA-Z0-9]", " ")
                .trim();
        if (spaced.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(spaced.split("\\s+"));
    }

    /**
     * Converts "Product Card" or "product-card" to camelCase. Names without
     * usable characters become {@code element}; a leading digit gets a
     * {@code style} prefix.
     */
    public static String toValidIdentifier(String name) {
        List<String> words = words(name);
        if (words.isEmpty()) {
            return "element";
        }
        StringBuilder sb = new StringBuilder(words.get(0).toLowerCase(Locale.ROOT));
        for (int i = 1; i < words.size(); i++) {
            sb.append(capitalize(words.get(i)));
        }
        String identifier = sb.toString();
        if (Character.isDigit(identifier.charAt(0))) {
            return "style" + identifier;
        }
        return identifier;
    }

    /**
     * Converts a layer name to PascalCase for component names.
     */
    public static String toPascalCase(String name) {
        String pascal = words(name).stream()
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
        if (pascal.isEmpty()) {
            return "Element";
        }
        if (Character.isDigit(pascal.charAt(0))) {
            return "Element" + pascal;
        }
        return pascal;
    }

    /**
     * Converts name to SCREAMING_SNAKE_CASE for data constants.
     */
    public static String toScreamingSnakeCase(String name) {
        List<String> words = words(name);
        if (words.isEmpty()) {
            return "ELEMENT";
        }
        return words.stream()
                .map(w -> w.toUpperCase(Locale.ROOT))
                .collect(Collectors.joining("_"));
    }

    /**
     * "Item 12" becomes "Item".
     */
    public static String stripTrailingDigits(String name) {
        if (name == null) {
            return "";
        }
        return name.replaceAll("\\d+$", "").trim();
    }

    /**
     * Returns {@code baseName} if free, otherwise the first of {@code baseName2},
     * {@code baseName3}, ... that is.
     */
    public static String disambiguate(String baseName, Predicate<String> taken) {
        if (!taken.test(baseName)) {
            return baseName;
        }
        int suffix = 2;
        String candidate;
        do {
            candidate = baseName + suffix;
            suffix++;
        } while (taken.test(candidate));

        return candidate;
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1).toLowerCase(Locale.ROOT);
    }
}
