package com.williamcallahan.gemtext.service.gemtext;

/**
 * Depth of open pretty tables in one render, shared with the cell sub-renders.
 *
 * <p>Only the outermost table writes code fences, and citations are held back while
 * any table is open.</p>
 */
final class TableNesting {

    private int depth;

    /**
     * Records entry into a table.
     *
     * @return true when the entered table is the outermost one
     */
    boolean enter() {
        return depth++ == 0;
    }

    /**
     * Records exit from a table.
     *
     * @return true when the exited table was the outermost one
     */
    boolean exit() {
        if (depth == 0) {
            throw new GemtextRenderException("Table exit without a matching table entry");
        }
        return --depth == 0;
    }

    boolean insideTable() {
        return depth > 0;
    }

    int depth() {
        return depth;
    }
}
