package com.williamcallahan.gemtext.domain.render;

import java.util.Objects;

/**
 * Toggles and overrides controlling how HTML is rendered as gemtext.
 *
 * <p>Construction uses {@link #builder()} so call sites name the options they change;
 * every unset option keeps the value of {@link #defaults()}.</p>
 *
 * @param prettyTables render tables as ASCII grids instead of flattened paragraphs
 * @param tableStyle grid layout knobs used when {@code prettyTables} is on
 * @param omitLinks drop citation registration and markers entirely
 * @param citationStart number given to the first citation of a document
 * @param citationMarkers write {@code [n]} after the referencing text
 * @param numberedLinks write {@code [n]} in flushed {@code =>} link lines
 * @param linkEmitFrequency paragraph-like blocks to pass before pending citations are flushed
 * @param emitImagesAsLinks register a citation for each image source
 * @param imageMarkerPrefix glyph written before bracketed image text
 * @param emptyLinkPrefix marker written for a link whose only content is an image
 * @param listItemLinkWordThreshold word count below which a single-link block becomes a link line
 */
public record RenderOptions(
    boolean prettyTables,
    TableStyle tableStyle,
    boolean omitLinks,
    int citationStart,
    boolean citationMarkers,
    boolean numberedLinks,
    int linkEmitFrequency,
    boolean emitImagesAsLinks,
    String imageMarkerPrefix,
    String emptyLinkPrefix,
    int listItemLinkWordThreshold
) {

    public static final int DEFAULT_CITATION_START = 1;
    public static final int DEFAULT_LINK_EMIT_FREQUENCY = 2;
    public static final String DEFAULT_IMAGE_MARKER_PREFIX = "‡";
    public static final String DEFAULT_EMPTY_LINK_PREFIX = ">>";
    public static final int DEFAULT_LIST_ITEM_LINK_WORD_THRESHOLD = 30;

    public RenderOptions {
        Objects.requireNonNull(tableStyle, "Table style cannot be null");
        imageMarkerPrefix = imageMarkerPrefix == null ? "" : imageMarkerPrefix;
        emptyLinkPrefix = emptyLinkPrefix == null ? "" : emptyLinkPrefix;
        if (citationStart < 0) {
            throw new IllegalArgumentException("Citation start must be non-negative");
        }
        if (linkEmitFrequency < 0) {
            throw new IllegalArgumentException("Link emit frequency must be non-negative");
        }
        if (listItemLinkWordThreshold < 1) {
            throw new IllegalArgumentException("List item link word threshold must be positive");
        }
    }

    /** Returns the default rendering options. */
    public static RenderOptions defaults() {
        return builder().build();
    }

    /** Creates a builder pre-filled with the default options. */
    public static Builder builder() {
        return new Builder();
    }

    /** Creates a builder pre-filled with these options. */
    public Builder toBuilder() {
        return new Builder()
            .prettyTables(prettyTables)
            .tableStyle(tableStyle)
            .omitLinks(omitLinks)
            .citationStart(citationStart)
            .citationMarkers(citationMarkers)
            .numberedLinks(numberedLinks)
            .linkEmitFrequency(linkEmitFrequency)
            .emitImagesAsLinks(emitImagesAsLinks)
            .imageMarkerPrefix(imageMarkerPrefix)
            .emptyLinkPrefix(emptyLinkPrefix)
            .listItemLinkWordThreshold(listItemLinkWordThreshold);
    }

    /**
     * Fluent builder for {@link RenderOptions}.
     */
    public static final class Builder {
        private boolean prettyTables;
        private TableStyle tableStyle = TableStyle.defaults();
        private boolean omitLinks;
        private int citationStart = DEFAULT_CITATION_START;
        private boolean citationMarkers = true;
        private boolean numberedLinks = true;
        private int linkEmitFrequency = DEFAULT_LINK_EMIT_FREQUENCY;
        private boolean emitImagesAsLinks = true;
        private String imageMarkerPrefix = DEFAULT_IMAGE_MARKER_PREFIX;
        private String emptyLinkPrefix = DEFAULT_EMPTY_LINK_PREFIX;
        private int listItemLinkWordThreshold = DEFAULT_LIST_ITEM_LINK_WORD_THRESHOLD;

        private Builder() {
        }

        public Builder prettyTables(boolean prettyTables) {
            this.prettyTables = prettyTables;
            return this;
        }

        public Builder tableStyle(TableStyle tableStyle) {
            this.tableStyle = tableStyle;
            return this;
        }

        public Builder omitLinks(boolean omitLinks) {
            this.omitLinks = omitLinks;
            return this;
        }

        public Builder citationStart(int citationStart) {
            this.citationStart = citationStart;
            return this;
        }

        public Builder citationMarkers(boolean citationMarkers) {
            this.citationMarkers = citationMarkers;
            return this;
        }

        public Builder numberedLinks(boolean numberedLinks) {
            this.numberedLinks = numberedLinks;
            return this;
        }

        public Builder linkEmitFrequency(int linkEmitFrequency) {
            this.linkEmitFrequency = linkEmitFrequency;
            return this;
        }

        public Builder emitImagesAsLinks(boolean emitImagesAsLinks) {
            this.emitImagesAsLinks = emitImagesAsLinks;
            return this;
        }

        public Builder imageMarkerPrefix(String imageMarkerPrefix) {
            this.imageMarkerPrefix = imageMarkerPrefix;
            return this;
        }

        public Builder emptyLinkPrefix(String emptyLinkPrefix) {
            this.emptyLinkPrefix = emptyLinkPrefix;
            return this;
        }

        public Builder listItemLinkWordThreshold(int listItemLinkWordThreshold) {
            this.listItemLinkWordThreshold = listItemLinkWordThreshold;
            return this;
        }

        /** Builds the immutable options record. */
        public RenderOptions build() {
            return new RenderOptions(
                prettyTables,
                tableStyle,
                omitLinks,
                citationStart,
                citationMarkers,
                numberedLinks,
                linkEmitFrequency,
                emitImagesAsLinks,
                imageMarkerPrefix,
                emptyLinkPrefix,
                listItemLinkWordThreshold
            );
        }
    }
}
