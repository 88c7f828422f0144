package com.williamcallahan.gemtext.service.gemtext;

import com.williamcallahan.gemtext.support.TextNormalizer;

import java.util.regex.Pattern;

/**
 * Tidies the raw emitter output into its final form.
 *
 * <p>Blank-line runs are collapsed and empty quote lines at the edges of blockquotes
 * are dropped. A run of empty quote lines where a nested quote opens keeps only its
 * first line. Fenced blocks, from an opening {@code ```} line through its closing line,
 * are copied unchanged so preformatted text and table grids keep their spacing.</p>
 */
final class GemtextNormalizer {

    private static final Pattern FENCE_LINE = Pattern.compile("^[> ]*```[ ]*$");
    private static final Pattern LEADING_LINE_SPACE = Pattern.compile("\n ");
    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\n\n+");
    private static final Pattern QUOTE_OPENER = Pattern.compile("\n *\n+> \n");
    private static final Pattern EMPTY_QUOTE_RUN = Pattern.compile("(\n>+ )(?:\n>+ )+(?=\n)");
    private static final Pattern QUOTE_CLOSER = Pattern.compile("\n> \n\n+");
    private static final String PARAGRAPH_BREAK = "\n\n";

    private GemtextNormalizer() {
    }

    /**
     * Normalizes rendered gemtext.
     *
     * @param text raw emitter output
     * @return trimmed text with collapsed blank lines outside fenced blocks
     */
    static String normalize(String text) {
        StringBuilder normalized = new StringBuilder(text.length());
        boolean inFence = false;
        int proseStart = 0;
        int fenceStart = 0;
        int lineStart = 0;
        while (lineStart <= text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            if (lineEnd < 0) {
                lineEnd = text.length();
            }
            if (FENCE_LINE.matcher(text.substring(lineStart, lineEnd)).matches()) {
                if (inFence) {
                    normalized.append(text, fenceStart, lineEnd);
                    proseStart = lineEnd;
                } else {
                    normalized.append(tidyProse(text.substring(proseStart, lineStart)));
                    fenceStart = lineStart;
                }
                inFence = !inFence;
            }
            lineStart = lineEnd + 1;
        }
        if (inFence) {
            normalized.append(text, fenceStart, text.length());
        } else {
            normalized.append(tidyProse(text.substring(proseStart)));
        }
        return TextNormalizer.strip(normalized.toString());
    }

    private static String tidyProse(String prose) {
        String tidied = LEADING_LINE_SPACE.matcher(prose).replaceAll("\n");
        tidied = BLANK_LINE_RUN.matcher(tidied).replaceAll(PARAGRAPH_BREAK);
        // a nested quote opens right below the empty line of its parent
        tidied = EMPTY_QUOTE_RUN.matcher(tidied).replaceAll("$1");
        tidied = QUOTE_OPENER.matcher(tidied).replaceAll(PARAGRAPH_BREAK);
        // a closer can expose another closer right behind it
        tidied = QUOTE_CLOSER.matcher(tidied).replaceAll(PARAGRAPH_BREAK);
        return QUOTE_CLOSER.matcher(tidied).replaceAll(PARAGRAPH_BREAK);
    }
}
