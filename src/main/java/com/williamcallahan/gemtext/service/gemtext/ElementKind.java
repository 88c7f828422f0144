package com.williamcallahan.gemtext.service.gemtext;

import java.util.HashMap;
import java.util.Map;

/**
 * HTML element kinds the tree walker treats differently. Everything else is {@link #OTHER}.
 */
enum ElementKind {
    HEADING_1("h1"),
    HEADING_2("h2"),
    HEADING_3("h3"),
    PARAGRAPH("p"),
    DIVISION("div"),
    LIST_ITEM("li"),
    UNORDERED_LIST("ul"),
    ANCHOR("a"),
    IMAGE("img"),
    BLOCKQUOTE("blockquote"),
    TABLE("table"),
    TABLE_ROW("tr"),
    TABLE_HEADER_CELL("th"),
    TABLE_DATA_CELL("td"),
    TABLE_FOOTER("tfoot"),
    PREFORMATTED("pre"),
    LINE_BREAK("br"),
    STYLE("style"),
    SCRIPT("script"),
    HEAD("head"),
    FOOTER("footer"),
    NAV("nav"),
    OTHER("");

    private static final Map<String, ElementKind> BY_TAG = new HashMap<>();

    static {
        for (ElementKind kind : values()) {
            if (!kind.tagName.isEmpty()) {
                BY_TAG.put(kind.tagName, kind);
            }
        }
    }

    private final String tagName;

    ElementKind(String tagName) {
        this.tagName = tagName;
    }

    /**
     * Maps a normalized (lower-case) tag name to its kind.
     *
     * @param normalName tag name as reported by {@code Element.normalName()}
     * @return matching kind, or {@link #OTHER}
     */
    static ElementKind fromTag(String normalName) {
        return BY_TAG.getOrDefault(normalName, OTHER);
    }

    /**
     * Returns whether the subtree under this element produces no output at all.
     */
    boolean isSkipped() {
        return this == STYLE || this == SCRIPT || this == HEAD || this == FOOTER || this == NAV;
    }

    /**
     * Returns the gemtext heading marker, including the trailing space.
     */
    String headingMarker() {
        return switch (this) {
            case HEADING_1 -> "# ";
            case HEADING_2 -> "## ";
            case HEADING_3 -> "### ";
            default -> throw new GemtextRenderException("Not a heading: " + this);
        };
    }
}
