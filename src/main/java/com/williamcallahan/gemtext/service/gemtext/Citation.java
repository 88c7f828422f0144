package com.williamcallahan.gemtext.service.gemtext;

import java.util.Objects;

/**
 * A hyperlink found while walking the tree, numbered in order of discovery.
 *
 * @param index citation number shown in {@code [n]} markers
 * @param url link target, with literal spaces already escaped
 * @param display text the link was shown with, possibly empty
 */
public record Citation(int index, String url, String display) {

    public Citation {
        Objects.requireNonNull(url, "Citation URL cannot be null");
        display = display == null ? "" : display;
    }

    /**
     * Formats the in-text marker for this citation.
     *
     * @return {@code [index]}
     */
    public String marker() {
        return "[" + index + "]";
    }

    /**
     * Formats the gemtext link line for this citation.
     *
     * @param numbered include the {@code [index]} marker after the URL
     * @return {@code => url [index] display} without empty parts
     */
    public String toLinkLine(boolean numbered) {
        StringBuilder line = new StringBuilder("=> ").append(url);
        if (numbered) {
            line.append(' ').append(marker());
        }
        if (!display.isEmpty()) {
            line.append(' ').append(display);
        }
        return line.toString();
    }
}
