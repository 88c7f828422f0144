package com.williamcallahan.gemtext.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.gemtext.domain.render.CellAlignment;
import com.williamcallahan.gemtext.domain.render.RenderOptions;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies validation of gemtext properties and their mapping onto render options.
 */
class GemtextPropertiesValidationTest {

    @Test
    void acceptsDefaults() {
        assertDoesNotThrow(new GemtextProperties()::validateConfiguration);
    }

    @Test
    void rejectsNegativeCitationStart() {
        GemtextProperties properties = new GemtextProperties();
        properties.setCitationStart(-1);

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsNegativeLinkEmitFrequency() {
        GemtextProperties properties = new GemtextProperties();
        properties.setLinkEmitFrequency(-1);

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveWordThreshold() {
        GemtextProperties properties = new GemtextProperties();
        properties.setListItemLinkWordThreshold(0);

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsMissingImagePrefix() {
        GemtextProperties properties = new GemtextProperties();
        properties.setImageMarkerPrefix(null);

        assertThrows(IllegalStateException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveColumnWidth() {
        GemtextProperties properties = new GemtextProperties();
        properties.getTables().setColWidth(0);

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsMultiCharacterSeparators() {
        GemtextProperties properties = new GemtextProperties();
        properties.getTables().setColumnSeparator("||");

        IllegalStateException failure = assertThrows(IllegalStateException.class, properties::validateConfiguration);
        assertTrue(failure.getMessage().contains("gemtext.tables.column-separator"), failure.getMessage());
    }

    @Test
    void rejectsEmptyColumnAlignmentEntries() {
        GemtextProperties properties = new GemtextProperties();
        properties.getTables().setColumnAlignment(Arrays.asList(CellAlignment.LEFT, null));

        assertThrows(IllegalStateException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsBlankOutputExtension() {
        GemtextProperties properties = new GemtextProperties();
        properties.getCli().setExtension(" ");

        assertThrows(IllegalStateException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsEmptyInputExtensionList() {
        GemtextProperties properties = new GemtextProperties();
        properties.getCli().setInputExtensions(List.of());

        assertThrows(IllegalStateException.class, properties::validateConfiguration);
    }

    @Test
    void dropsLeadingDotOfOutputExtension() {
        ConverterConfig converter = new ConverterConfig();
        converter.setExtension(".gemini");

        assertEquals("gemini", converter.getExtension());
    }

    @Test
    void mapsPropertiesOntoRenderOptions() {
        GemtextProperties properties = new GemtextProperties();
        properties.setPrettyTables(true);
        properties.setCitationStart(7);
        properties.setEmptyLinkPrefix("->");
        properties.getTables().setColWidth(12);
        properties.getTables().getBorders().setLeft(false);

        RenderOptions options = properties.toRenderOptions();

        assertTrue(options.prettyTables());
        assertEquals(7, options.citationStart());
        assertEquals("->", options.emptyLinkPrefix());
        assertEquals(12, options.tableStyle().colWidth());
        assertEquals(false, options.tableStyle().borders().left());
        assertEquals(RenderOptions.DEFAULT_LINK_EMIT_FREQUENCY, options.linkEmitFrequency());
    }
}
