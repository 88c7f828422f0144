package com.williamcallahan.gemtext.service.gemtext;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Verifies blank-line collapsing, quote edge cleanup and fence preservation.
 */
class GemtextNormalizerTest {

    @Test
    void collapsesBlankLineRunsAndTrims() {
        assertEquals("a\n\nb", GemtextNormalizer.normalize("  a\n\n\n\nb  "));
    }

    @Test
    void dropsSingleLeadingSpaceOfLines() {
        assertEquals("a\nb", GemtextNormalizer.normalize("a\n b"));
    }

    @Test
    void copiesFencedBlocksVerbatim() {
        String raw = "x\n\n\n```\na\n\n\n  b\n```\n\n\ny";

        assertEquals("x\n\n```\na\n\n\n  b\n```\n\ny", GemtextNormalizer.normalize(raw));
    }

    @Test
    void removesEmptyQuoteLinesAtBlockquoteEdges() {
        String raw = "Text\n\n> \n> Quote\n> \n\nAfter";

        assertEquals("Text\n\n> Quote\n\nAfter", GemtextNormalizer.normalize(raw));
    }

    @Test
    void keepsOnlyFirstOfConsecutiveEmptyQuoteLines() {
        assertEquals("a\n> \n>> b", GemtextNormalizer.normalize("a\n> \n>> \n>> b"));
        assertEquals("a\n> \n>>> b", GemtextNormalizer.normalize("a\n> \n>> \n>>> \n>>> b"));
    }

    @Test
    void keepsUnterminatedFenceToEnd() {
        assertEquals("a\n\n```\n  x", GemtextNormalizer.normalize("a\n\n\n\n```\n  x"));
        assertEquals("```\n  x\n\n\n  y", GemtextNormalizer.normalize("```\n  x\n\n\n  y"));
    }

    @Test
    void returnsEmptyTextForBlankInput() {
        assertEquals("", GemtextNormalizer.normalize(" \n\n \n"));
    }
}
