package com.williamcallahan.gemtext.domain.render;

/**
 * Horizontal alignment of text inside a pretty-table cell.
 */
public enum CellAlignment {
    /**
     * Centered for header and footer cells; right-aligned for numeric body cells,
     * left-aligned for every other body cell.
     */
    DEFAULT,

    /**
     * Text starts at the left edge of the cell.
     */
    LEFT,

    /**
     * Text is centered; the odd padding space goes to the right.
     */
    CENTER,

    /**
     * Text ends at the right edge of the cell.
     */
    RIGHT
}
