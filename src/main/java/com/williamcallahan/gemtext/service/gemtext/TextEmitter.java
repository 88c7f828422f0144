package com.williamcallahan.gemtext.service.gemtext;

import com.williamcallahan.gemtext.support.TextNormalizer;

/**
 * Append-only output buffer that keeps consecutive fragments from running together.
 *
 * <p>A single space is inserted between two fragments unless one side already supplies
 * white space or punctuation that hugs its neighbour. Every newline is followed by the
 * current line prefix, which is how blockquote markers reach continuation lines.</p>
 */
final class TextEmitter {

    private final StringBuilder buffer = new StringBuilder();
    private String linePrefix = "";
    private boolean endsWithSpace;
    private boolean preformatted;
    private int lineLength;

    /**
     * Appends a fragment, inserting a separating space when needed.
     *
     * @param fragment text to append; empty fragments are ignored
     */
    void emit(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return;
        }
        if (preformatted) {
            copy(fragment);
            endsWithSpace = TextNormalizer.isSpace(fragment.codePointBefore(fragment.length()));
            return;
        }
        int first = fragment.codePointAt(0);
        int last = fragment.codePointBefore(fragment.length());
        boolean startsWithSpace = TextNormalizer.isSpace(first) || noSpaceBefore(first);
        if (!startsWithSpace && !endsWithSpace) {
            buffer.append(' ');
            lineLength++;
        }
        endsWithSpace = TextNormalizer.isSpace(last) || noSpaceAfter(last);
        copy(fragment);
    }

    /**
     * Appends text untouched by separator logic or line prefixes, leaving the emitter
     * positioned at the start of a fresh line.
     *
     * @param text text to append verbatim
     */
    void writeRaw(String text) {
        buffer.append(text);
        lineLength = 0;
        endsWithSpace = true;
    }

    /**
     * Starts a new line unless the current one is still empty.
     */
    void ensureLineStart() {
        if (lineLength > 0) {
            emit("\n");
        }
    }

    private void copy(String fragment) {
        for (int index = 0; index < fragment.length(); index++) {
            char character = fragment.charAt(index);
            buffer.append(character);
            lineLength++;
            if (character == '\n') {
                lineLength = 0;
                if (!linePrefix.isEmpty()) {
                    buffer.append(linePrefix);
                }
            }
        }
    }

    private static boolean noSpaceBefore(int codePoint) {
        return switch (codePoint) {
            case '.', ',', ';', '!', '?', ')', ']', '>' -> true;
            default -> false;
        };
    }

    private static boolean noSpaceAfter(int codePoint) {
        return switch (codePoint) {
            case '(', '[', '<' -> true;
            default -> false;
        };
    }

    String text() {
        return buffer.toString();
    }

    int lineLength() {
        return lineLength;
    }

    String linePrefix() {
        return linePrefix;
    }

    void setLinePrefix(String linePrefix) {
        this.linePrefix = linePrefix == null ? "" : linePrefix;
    }

    boolean isPreformatted() {
        return preformatted;
    }

    void setPreformatted(boolean preformatted) {
        this.preformatted = preformatted;
    }
}
