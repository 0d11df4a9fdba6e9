package com.e2eq.relations.util;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pure string transforms used to derive names from record-kind names.
 *
 * <p>Pluralization is a best-effort English heuristic. Words that are not in the small irregular
 * table below will be pluralized by suffix rules, so "criterion" becomes "criterions".</p>
 */
public final class Inflector {

    private static final Set<String> UNCOUNTABLE = Set.of(
            "equipment", "information", "rice", "money", "species", "series", "fish", "sheep",
            "deer", "news", "data", "metadata", "feedback", "staff");

    private static final Map<String, String> IRREGULAR = Map.of(
            "person", "people",
            "man", "men",
            "woman", "women",
            "child", "children",
            "tooth", "teeth",
            "foot", "feet",
            "mouse", "mice",
            "goose", "geese",
            "ox", "oxen");

    private static final Set<String> F_TO_VES = Set.of(
            "leaf", "wolf", "half", "shelf", "calf", "loaf", "thief", "knife", "wife", "life");

    private static final Set<String> O_TO_OES = Set.of("hero", "potato", "tomato", "echo", "veto");

    private Inflector() {
    }

    /**
     * Splits a name into words on non alphanumeric characters and on case or character type
     * changes. "HTTPServer" gives [HTTP, Server], "user_profile" gives [user, profile].
     *
     * @param value the name to split, may be null
     * @return the words in order, never null
     */
    public static List<String> words(String value) {
        List<String> words = new ArrayList<>();
        if (value == null || value.isEmpty()) {
            return words;
        }
        for (String token : StringUtils.splitByCharacterTypeCamelCase(value)) {
            if (StringUtils.isAlphanumeric(token)) {
                words.add(token);
            }
        }
        return words;
    }

    /**
     * Lower camel case: "UserProfile" to "userProfile", "user-profile" to "userProfile",
     * "HTTPServer" to "httpServer".
     */
    public static String camelCase(String value) {
        List<String> words = words(value);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < words.size(); i++) {
            String w = words.get(i).toLowerCase(Locale.ROOT);
            sb.append(i == 0 ? w : StringUtils.capitalize(w));
        }
        return sb.toString();
    }

    /**
     * Upper cases the first character only, "id" to "Id", "uuid" to "Uuid".
     */
    public static String upperFirst(String value) {
        return StringUtils.capitalize(value);
    }

    /**
     * Pluralizes the last word of a (camel cased) name, "pet" to "pets", "userCategory" to
     * "userCategories", "person" to "people".
     */
    public static String pluralize(String value) {
        if (value == null || value.isBlank()) {
            return value;
        }
        List<String> words = words(value);
        if (words.isEmpty()) {
            return value;
        }
        String last = words.get(words.size() - 1);
        int idx = value.lastIndexOf(last);
        String prefix = value.substring(0, idx);
        return prefix + pluralizeWord(last) + value.substring(idx + last.length());
    }

    private static String pluralizeWord(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (UNCOUNTABLE.contains(lower) || StringUtils.isNumeric(word)) {
            return word;
        }
        String irregular = IRREGULAR.get(lower);
        if (irregular != null) {
            return matchFirstLetterCase(word, irregular);
        }
        if (F_TO_VES.contains(lower)) {
            String stem = lower.endsWith("fe") ? word.substring(0, word.length() - 2) : word.substring(0, word.length() - 1);
            return stem + "ves";
        }
        if (O_TO_OES.contains(lower)) {
            return word + "es";
        }
        if (lower.length() > 1 && lower.endsWith("y") && !isVowel(lower.charAt(lower.length() - 2))) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("z")
                || lower.endsWith("ch") || lower.endsWith("sh")) {
            return word + "es";
        }
        return word + "s";
    }

    private static String matchFirstLetterCase(String original, String replacement) {
        if (Character.isUpperCase(original.charAt(0))) {
            return StringUtils.capitalize(replacement);
        }
        return replacement;
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }
}
