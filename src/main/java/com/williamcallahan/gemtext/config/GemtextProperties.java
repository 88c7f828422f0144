package com.williamcallahan.gemtext.config;

import com.williamcallahan.gemtext.domain.render.RenderOptions;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Rendering and conversion settings bound from {@code gemtext.*} properties.
 */
@ConfigurationProperties(prefix = "gemtext")
public class GemtextProperties {

    private static final int MIN_POSITIVE = 1;
    private static final int MIN_NON_NEG = 0;
    private static final String CITATION_START_KEY = "gemtext.citation-start";
    private static final String EMIT_FREQUENCY_KEY = "gemtext.link-emit-frequency";
    private static final String WORD_THRESHOLD_KEY = "gemtext.list-item-link-word-threshold";
    private static final String IMAGE_PREFIX_KEY = "gemtext.image-marker-prefix";
    private static final String EMPTY_LINK_PREFIX_KEY = "gemtext.empty-link-prefix";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";
    private static final String NULL_TEXT_FMT = "%s must not be null.";

    private boolean prettyTables;
    private boolean omitLinks;
    private int citationStart = RenderOptions.DEFAULT_CITATION_START;
    private boolean citationMarkers = true;
    private boolean numberedLinks = true;
    private int linkEmitFrequency = RenderOptions.DEFAULT_LINK_EMIT_FREQUENCY;
    private boolean emitImagesAsLinks = true;
    private String imageMarkerPrefix = RenderOptions.DEFAULT_IMAGE_MARKER_PREFIX;
    private String emptyLinkPrefix = RenderOptions.DEFAULT_EMPTY_LINK_PREFIX;
    private int listItemLinkWordThreshold = RenderOptions.DEFAULT_LIST_ITEM_LINK_WORD_THRESHOLD;
    private TableLayoutConfig tables = new TableLayoutConfig();
    private ConverterConfig cli = new ConverterConfig();

    /**
     * Validates all rendering and conversion settings.
     *
     * @throws IllegalArgumentException when a numeric setting is out of range
     * @throws IllegalStateException when a text setting is unusable
     */
    public void validateConfiguration() {
        if (citationStart < MIN_NON_NEG) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, CITATION_START_KEY));
        }
        if (linkEmitFrequency < MIN_NON_NEG) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, EMIT_FREQUENCY_KEY));
        }
        if (listItemLinkWordThreshold < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, WORD_THRESHOLD_KEY));
        }
        requireNonNullText(IMAGE_PREFIX_KEY, imageMarkerPrefix);
        requireNonNullText(EMPTY_LINK_PREFIX_KEY, emptyLinkPrefix);
        tables.validateConfiguration();
        cli.validateConfiguration();
    }

    /**
     * Builds the render options described by these settings.
     *
     * @return render options
     */
    public RenderOptions toRenderOptions() {
        return RenderOptions.builder()
                .prettyTables(prettyTables)
                .tableStyle(tables.toTableStyle())
                .omitLinks(omitLinks)
                .citationStart(citationStart)
                .citationMarkers(citationMarkers)
                .numberedLinks(numberedLinks)
                .linkEmitFrequency(linkEmitFrequency)
                .emitImagesAsLinks(emitImagesAsLinks)
                .imageMarkerPrefix(imageMarkerPrefix)
                .emptyLinkPrefix(emptyLinkPrefix)
                .listItemLinkWordThreshold(listItemLinkWordThreshold)
                .build();
    }

    private static void requireNonNullText(final String propertyKey, final String text) {
        if (text == null) {
            throw new IllegalStateException(String.format(Locale.ROOT, NULL_TEXT_FMT, propertyKey));
        }
    }

    public boolean isPrettyTables() { return prettyTables; }
    public void setPrettyTables(boolean prettyTables) { this.prettyTables = prettyTables; }

    public boolean isOmitLinks() { return omitLinks; }
    public void setOmitLinks(boolean omitLinks) { this.omitLinks = omitLinks; }

    public int getCitationStart() { return citationStart; }
    public void setCitationStart(int citationStart) { this.citationStart = citationStart; }

    public boolean isCitationMarkers() { return citationMarkers; }
    public void setCitationMarkers(boolean citationMarkers) { this.citationMarkers = citationMarkers; }

    public boolean isNumberedLinks() { return numberedLinks; }
    public void setNumberedLinks(boolean numberedLinks) { this.numberedLinks = numberedLinks; }

    public int getLinkEmitFrequency() { return linkEmitFrequency; }
    public void setLinkEmitFrequency(int linkEmitFrequency) { this.linkEmitFrequency = linkEmitFrequency; }

    public boolean isEmitImagesAsLinks() { return emitImagesAsLinks; }
    public void setEmitImagesAsLinks(boolean emitImagesAsLinks) { this.emitImagesAsLinks = emitImagesAsLinks; }

    public String getImageMarkerPrefix() { return imageMarkerPrefix; }
    public void setImageMarkerPrefix(String imageMarkerPrefix) { this.imageMarkerPrefix = imageMarkerPrefix; }

    public String getEmptyLinkPrefix() { return emptyLinkPrefix; }
    public void setEmptyLinkPrefix(String emptyLinkPrefix) { this.emptyLinkPrefix = emptyLinkPrefix; }

    public int getListItemLinkWordThreshold() { return listItemLinkWordThreshold; }
    public void setListItemLinkWordThreshold(int listItemLinkWordThreshold) {
        this.listItemLinkWordThreshold = listItemLinkWordThreshold;
    }

    public TableLayoutConfig getTables() { return tables; }
    public void setTables(TableLayoutConfig tables) { this.tables = tables; }

    public ConverterConfig getCli() { return cli; }
    public void setCli(ConverterConfig cli) { this.cli = cli; }
}
