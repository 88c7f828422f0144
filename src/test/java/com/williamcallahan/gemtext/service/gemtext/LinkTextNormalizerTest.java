package com.williamcallahan.gemtext.service.gemtext;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Verifies link target cleanup and image text derivation.
 */
class LinkTextNormalizerTest {

    private static final String PREFIX = "‡";

    @Test
    void stripsMailtoSchemeCaseInsensitively() {
        assertEquals("a@b.example", LinkTextNormalizer.normalizeHref(" MAILTO:a@b.example "));
        assertEquals("http://x/", LinkTextNormalizer.normalizeHref("http://x/"));
        assertEquals("", LinkTextNormalizer.normalizeHref(null));
    }

    @Test
    void prefersAltText() {
        assertEquals("[" + PREFIX + " A cat]", LinkTextNormalizer.imageText("  A\n cat ", "x.png", PREFIX));
    }

    @Test
    void fallsBackToFileNameWithoutExtensionOrQuery() {
        assertEquals("[" + PREFIX + " photo.large]",
            LinkTextNormalizer.imageText(null, "/img/photo.large.jpg?size=2#top", PREFIX));
    }

    @Test
    void turnsUnderscoresAndHyphensIntoSpaces() {
        assertEquals("[" + PREFIX + " a b c]", LinkTextNormalizer.imageText("a-b_c", null, PREFIX));
    }

    @Test
    void returnsEmptyWithoutAltOrSource() {
        assertEquals("", LinkTextNormalizer.imageText(" ", null, PREFIX));
        assertEquals("", LinkTextNormalizer.imageText("", "", PREFIX));
    }

    @Test
    void derivesFileStem() {
        assertEquals("dir", LinkTextNormalizer.fileStem("http://x/dir/"));
        assertEquals(".hidden", LinkTextNormalizer.fileStem(".hidden"));
        assertEquals("x", LinkTextNormalizer.fileStem("http://x/?q=1"));
        assertEquals("", LinkTextNormalizer.fileStem(""));
    }
}
