package com.williamcallahan.gemtext.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Verifies locale-independent case folding, trimming and white-space collapsing.
 */
class TextNormalizerTest {

    @Test
    void lowercasesOnlyAsciiLetters() {
        assertEquals("Àbc-1", TextNormalizer.toLowerAscii("ÀBC-1"));
        assertEquals("", TextNormalizer.toLowerAscii(null));
    }

    @Test
    void recognisesUnicodeSpaces() {
        assertTrue(TextNormalizer.isSpace(' '));
        assertTrue(TextNormalizer.isSpace(0x00A0));
        assertTrue(TextNormalizer.isSpace(0x0085));
        assertTrue(TextNormalizer.isSpace(0x2003));
        assertFalse(TextNormalizer.isSpace('x'));
    }

    @Test
    void stripsUnicodeSpacesFromBothEnds() {
        assertEquals("x y", TextNormalizer.strip("\u00A0 x y \u0085\n"));
        assertEquals("", TextNormalizer.strip(null));
    }

    @Test
    void collapsesHtmlSpacingButKeepsNoBreakSpace() {
        assertEquals("a b", TextNormalizer.collapseHtmlSpacing(" a \n\t b "));
        assertEquals("a\u00A0 b", TextNormalizer.collapseHtmlSpacing("a\u00A0 \n b"));
    }

    @Test
    void flattensEveryWhitespaceRun() {
        assertEquals("a b", TextNormalizer.flatten("a\u00A0\n  b"));
        assertEquals("", TextNormalizer.flatten(null));
    }

    @Test
    void countsWords() {
        assertEquals(3, TextNormalizer.wordCount("  one two\nthree "));
        assertEquals(0, TextNormalizer.wordCount(" "));
    }
}
