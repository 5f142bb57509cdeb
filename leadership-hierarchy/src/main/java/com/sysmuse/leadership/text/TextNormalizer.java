package com.sysmuse.leadership.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cleans cell text exported from spreadsheets.
 * Sheets and Excel exports carry invisible bidi and zero-width marks (U+202C and friends)
 * that break equality checks and end up in JSON output.
 */
public final class TextNormalizer {

    // Bidi embedding/override/isolate marks, zero-width chars, BOM.
    private static final Pattern INVISIBLE_MARKS =
            Pattern.compile("[\\u200B-\\u200F\\u202A-\\u202E\\u2060-\\u2069\\uFEFF]");

    // C0/C1 control chars; tabs and newlines included so they turn into spaces.
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\u0000-\\u001F\\u007F-\\u009F]");

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private static final Pattern DASHES = Pattern.compile("[\\u2010-\\u2015\\u2212]");

    private static final Pattern TOKEN_SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private TextNormalizer() {
    }

    /**
     * Strip invisible marks and control characters, then trim. Case is kept.
     */
    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = INVISIBLE_MARKS.matcher(text).replaceAll("");
        cleaned = CONTROL_CHARS.matcher(cleaned).replaceAll(" ");
        return cleaned.trim();
    }

    /**
     * Matching form of a cell: cleaned, whitespace collapsed, lower case,
     * en/em dashes folded to an ASCII hyphen.
     */
    public static String normalize(String text) {
        String cleaned = clean(text);
        cleaned = DASHES.matcher(cleaned).replaceAll("-");
        cleaned = WHITESPACE_RUN.matcher(cleaned).replaceAll(" ");
        return cleaned.toLowerCase(Locale.ROOT);
    }

    /**
     * Lower-case word tokens, split on whitespace and punctuation, in first-seen order.
     * "Director of Bowling, Sunday" gives [director, of, bowling, sunday].
     */
    public static Set<String> tokenize(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : TOKEN_SEPARATORS.split(normalized)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Tokens of a configured term, keeping duplicates out. Used for multi-word terms
     * such as "operations manager".
     */
    public static List<String> termTokens(String term) {
        return new ArrayList<>(tokenize(term));
    }

    /**
     * snake_case key for free text: "Social Media Coordinator" gives social_media_coordinator.
     */
    public static String toSnakeCase(String text) {
        String normalized = normalize(text);
        String snake = NON_ALNUM.matcher(normalized).replaceAll("_");
        int start = 0;
        int end = snake.length();
        while (start < end && snake.charAt(start) == '_') {
            start++;
        }
        while (end > start && snake.charAt(end - 1) == '_') {
            end--;
        }
        return snake.substring(start, end);
    }

    public static boolean isBlank(String text) {
        return clean(text).isEmpty();
    }
}
