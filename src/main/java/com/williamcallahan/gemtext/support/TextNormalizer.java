package com.williamcallahan.gemtext.support;

import java.util.regex.Pattern;

/**
 * Locale-independent text helpers shared by the gemtext renderer.
 *
 * <p>"Space" here means Unicode white space, including the no-break space produced by
 * {@code &nbsp;} and NEL, so that trimming treats non-breaking padding in HTML the same
 * way as ordinary blanks.</p>
 */
public final class TextNormalizer {

    private static final int CASE_OFFSET = 'a' - 'A';
    private static final int NEXT_LINE = 0x85;

    /** Runs of HTML inter-element white space: space, tab, CR and LF. */
    private static final Pattern HTML_SPACING = Pattern.compile("[ \\r\\n\\t]+");

    /** Any run of Unicode white space. */
    private static final Pattern ANY_SPACING = Pattern.compile("[\\s\\u00A0\\u0085\\p{Zs}]+");

    private TextNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Converts ASCII uppercase letters to lowercase, leaving other characters unchanged.
     *
     * @param text the input text to normalize (may be null)
     * @return the normalized text with ASCII letters lowercased, or empty string if null
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= 'A' && current <= 'Z') {
                normalized.append((char) (current + CASE_OFFSET));
            } else {
                normalized.append(current);
            }
        }
        return normalized.toString();
    }

    /**
     * Returns whether a code point is white space in the Unicode sense.
     *
     * @param codePoint code point to test
     * @return true for white space, including no-break space and NEL
     */
    public static boolean isSpace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint) || codePoint == NEXT_LINE;
    }

    /**
     * Removes leading and trailing Unicode white space.
     *
     * @param text text to strip (may be null)
     * @return stripped text, or empty string if null
     */
    public static String strip(String text) {
        if (text == null) {
            return "";
        }
        int start = 0;
        int end = text.length();
        while (start < end) {
            int codePoint = text.codePointAt(start);
            if (!isSpace(codePoint)) {
                break;
            }
            start += Character.charCount(codePoint);
        }
        while (end > start) {
            int codePoint = text.codePointBefore(end);
            if (!isSpace(codePoint)) {
                break;
            }
            end -= Character.charCount(codePoint);
        }
        return text.substring(start, end);
    }

    /**
     * Collapses HTML inter-element white space to single spaces and strips the result.
     *
     * @param text raw text node content
     * @return collapsed text
     */
    public static String collapseHtmlSpacing(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return strip(HTML_SPACING.matcher(text).replaceAll(" "));
    }

    /**
     * Collapses every run of white space, line breaks included, to a single space.
     *
     * @param text text to flatten
     * @return single-line text without leading or trailing space
     */
    public static String flatten(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return strip(ANY_SPACING.matcher(text).replaceAll(" "));
    }

    /**
     * Counts white-space separated words.
     *
     * @param text text to count
     * @return number of words, zero for blank text
     */
    public static int wordCount(String text) {
        String flattened = flatten(text);
        if (flattened.isEmpty()) {
            return 0;
        }
        return flattened.split(" ").length;
    }
}
