package com.williamcallahan.gemtext.domain.render;

/**
 * Which outer edges of a pretty table are drawn.
 *
 * @param left draw the leading column separator on every line
 * @param right draw the trailing column separator on every line
 * @param top draw the border line above the first row
 * @param bottom draw the border line below the last row
 */
public record TableBorders(boolean left, boolean right, boolean top, boolean bottom) {

    /**
     * Returns borders on all four sides.
     *
     * @return fully bordered configuration
     */
    public static TableBorders all() {
        return new TableBorders(true, true, true, true);
    }
}
