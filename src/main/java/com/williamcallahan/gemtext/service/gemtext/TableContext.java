package com.williamcallahan.gemtext.service.gemtext;

import java.util.ArrayList;
import java.util.List;

/**
 * Cell text of the table currently being walked, grouped into header, body and footer.
 */
final class TableContext {

    private final List<String> header = new ArrayList<>();
    private final List<List<String>> body = new ArrayList<>();
    private final List<String> footer = new ArrayList<>();
    private boolean inFooter;
    private int currentRow;

    /**
     * Clears all grids before a new table is walked.
     */
    void reset() {
        header.clear();
        body.clear();
        footer.clear();
        inFooter = false;
        currentRow = 0;
    }

    /**
     * Opens a new body row.
     */
    void openRow() {
        body.add(new ArrayList<>());
    }

    /**
     * Moves the cursor past the row just walked.
     */
    void closeRow() {
        currentRow++;
    }

    void addHeaderCell(String text) {
        header.add(text);
    }

    /**
     * Adds a data cell to the footer or to the open body row.
     *
     * @param text rendered cell text
     */
    void addDataCell(String text) {
        if (inFooter) {
            footer.add(text);
            return;
        }
        // cells outside any row get one of their own
        while (body.size() <= currentRow) {
            body.add(new ArrayList<>());
        }
        body.get(currentRow).add(text);
    }

    /**
     * Returns whether the walk is inside a footer section; rows there feed the footer.
     */
    boolean isInFooter() {
        return inFooter;
    }

    void setInFooter(boolean inFooter) {
        this.inFooter = inFooter;
    }

    List<String> header() {
        return header;
    }

    List<List<String>> body() {
        return body;
    }

    List<String> footer() {
        return footer;
    }
}
