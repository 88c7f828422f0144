package com.williamcallahan.gemtext.service.gemtext;

import com.williamcallahan.gemtext.support.TextNormalizer;

/**
 * Normalizes link targets and derives the display text of images.
 */
final class LinkTextNormalizer {

    private static final String MAILTO_PREFIX = "mailto:";

    private LinkTextNormalizer() {
    }

    /**
     * Trims a link target and removes a {@code mailto:} scheme.
     *
     * @param href raw attribute value (may be null)
     * @return normalized target, empty when there is none
     */
    static String normalizeHref(String href) {
        String link = TextNormalizer.strip(href);
        if (TextNormalizer.toLowerAscii(link).startsWith(MAILTO_PREFIX)) {
            link = link.substring(MAILTO_PREFIX.length());
        }
        return link;
    }

    /**
     * Derives the bracketed text shown for an image.
     *
     * @param alt {@code alt} attribute (may be null)
     * @param src {@code src} attribute (may be null)
     * @param markerPrefix glyph written inside the brackets before the text
     * @return {@code [prefix text]} with underscores and hyphens turned into spaces,
     *     or empty when the image has neither alt text nor a source file name
     */
    static String imageText(String alt, String src, String markerPrefix) {
        String text = TextNormalizer.collapseHtmlSpacing(alt);
        if (text.isEmpty()) {
            text = fileStem(src);
        }
        if (text.isEmpty()) {
            return "";
        }
        String bracketed = "[" + markerPrefix + " " + text + "]";
        return bracketed.replace('_', ' ').replace('-', ' ').replace("  ", " ");
    }

    /**
     * Returns the last path segment of a URL without its extension.
     *
     * @param src image source (may be null)
     * @return file name stem, empty when there is none
     */
    static String fileStem(String src) {
        String path = TextNormalizer.strip(src);
        int queryStart = indexOfAny(path, '?', '#');
        if (queryStart >= 0) {
            path = path.substring(0, queryStart);
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        int extensionStart = fileName.lastIndexOf('.');
        return extensionStart > 0 ? fileName.substring(0, extensionStart) : fileName;
    }

    private static int indexOfAny(String text, char first, char second) {
        int firstIndex = text.indexOf(first);
        int secondIndex = text.indexOf(second);
        if (firstIndex < 0) {
            return secondIndex;
        }
        return secondIndex < 0 ? firstIndex : Math.min(firstIndex, secondIndex);
    }
}
