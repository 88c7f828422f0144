package com.williamcallahan.gemtext.config;

import com.williamcallahan.gemtext.domain.render.CellAlignment;
import com.williamcallahan.gemtext.domain.render.TableBorders;
import com.williamcallahan.gemtext.domain.render.TableStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * ASCII grid layout settings for pretty tables.
 */
public class TableLayoutConfig {

    private static final int MIN_POSITIVE = 1;
    private static final String COL_WIDTH_KEY = "gemtext.tables.col-width";
    private static final String COLUMN_SEP_KEY = "gemtext.tables.column-separator";
    private static final String ROW_SEP_KEY = "gemtext.tables.row-separator";
    private static final String CENTER_SEP_KEY = "gemtext.tables.center-separator";
    private static final String ALIGNMENT_KEY = "gemtext.tables.column-alignment";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String SEPARATOR_FMT = "%s must be exactly one character (got '%s').";
    private static final String NULL_ENTRY_FMT = "%s must not contain empty entries.";

    private boolean autoFormatHeader = true;
    private boolean autoWrapText = true;
    private boolean reflowDuringAutoWrap = true;
    private int colWidth = TableStyle.DEFAULT_COL_WIDTH;
    private String columnSeparator = "|";
    private String rowSeparator = "-";
    private String centerSeparator = "+";
    private CellAlignment headerAlignment = CellAlignment.DEFAULT;
    private CellAlignment footerAlignment = CellAlignment.DEFAULT;
    private CellAlignment alignment = CellAlignment.DEFAULT;
    private List<CellAlignment> columnAlignment = new ArrayList<>();
    private boolean headerLine = true;
    private boolean rowLine;
    private Borders borders = new Borders();

    /**
     * Creates table layout configuration.
     */
    public TableLayoutConfig() {
    }

    /**
     * Validates table layout settings.
     */
    public void validateConfiguration() {
        if (colWidth < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, COL_WIDTH_KEY));
        }
        requireSingleCharacter(COLUMN_SEP_KEY, columnSeparator);
        requireSingleCharacter(ROW_SEP_KEY, rowSeparator);
        requireSingleCharacter(CENTER_SEP_KEY, centerSeparator);
        if (columnAlignment.contains(null)) {
            throw new IllegalStateException(String.format(Locale.ROOT, NULL_ENTRY_FMT, ALIGNMENT_KEY));
        }
    }

    /**
     * Builds the grid style described by these settings.
     *
     * @return table style
     */
    public TableStyle toTableStyle() {
        return new TableStyle(
                autoFormatHeader,
                autoWrapText,
                reflowDuringAutoWrap,
                colWidth,
                columnSeparator,
                rowSeparator,
                centerSeparator,
                headerAlignment,
                footerAlignment,
                alignment,
                columnAlignment,
                TableStyle.DEFAULT_NEW_LINE,
                headerLine,
                rowLine,
                borders.toTableBorders());
    }

    private static void requireSingleCharacter(final String propertyKey, final String separator) {
        if (separator == null || separator.isBlank() || separator.codePointCount(0, separator.length()) != 1) {
            throw new IllegalStateException(String.format(Locale.ROOT, SEPARATOR_FMT, propertyKey, separator));
        }
    }

    public boolean isAutoFormatHeader() {
        return autoFormatHeader;
    }

    public void setAutoFormatHeader(final boolean autoFormatHeader) {
        this.autoFormatHeader = autoFormatHeader;
    }

    public boolean isAutoWrapText() {
        return autoWrapText;
    }

    public void setAutoWrapText(final boolean autoWrapText) {
        this.autoWrapText = autoWrapText;
    }

    public boolean isReflowDuringAutoWrap() {
        return reflowDuringAutoWrap;
    }

    public void setReflowDuringAutoWrap(final boolean reflowDuringAutoWrap) {
        this.reflowDuringAutoWrap = reflowDuringAutoWrap;
    }

    /**
     * Returns the width at which cell text is wrapped.
     *
     * @return wrap width in characters
     */
    public int getColWidth() {
        return colWidth;
    }

    /**
     * Sets the width at which cell text is wrapped.
     *
     * @param colWidth wrap width in characters
     */
    public void setColWidth(final int colWidth) {
        this.colWidth = colWidth;
    }

    public String getColumnSeparator() {
        return columnSeparator;
    }

    public void setColumnSeparator(final String columnSeparator) {
        this.columnSeparator = columnSeparator;
    }

    public String getRowSeparator() {
        return rowSeparator;
    }

    public void setRowSeparator(final String rowSeparator) {
        this.rowSeparator = rowSeparator;
    }

    public String getCenterSeparator() {
        return centerSeparator;
    }

    public void setCenterSeparator(final String centerSeparator) {
        this.centerSeparator = centerSeparator;
    }

    public CellAlignment getHeaderAlignment() {
        return headerAlignment;
    }

    public void setHeaderAlignment(final CellAlignment headerAlignment) {
        this.headerAlignment = headerAlignment;
    }

    public CellAlignment getFooterAlignment() {
        return footerAlignment;
    }

    public void setFooterAlignment(final CellAlignment footerAlignment) {
        this.footerAlignment = footerAlignment;
    }

    public CellAlignment getAlignment() {
        return alignment;
    }

    public void setAlignment(final CellAlignment alignment) {
        this.alignment = alignment;
    }

    /**
     * Returns the per-column body alignment overrides, first column first.
     *
     * @return column alignments
     */
    public List<CellAlignment> getColumnAlignment() {
        return columnAlignment;
    }

    /**
     * Sets the per-column body alignment overrides.
     *
     * @param columnAlignment column alignments, first column first
     */
    public void setColumnAlignment(final List<CellAlignment> columnAlignment) {
        this.columnAlignment = columnAlignment == null ? new ArrayList<>() : new ArrayList<>(columnAlignment);
    }

    public boolean isHeaderLine() {
        return headerLine;
    }

    public void setHeaderLine(final boolean headerLine) {
        this.headerLine = headerLine;
    }

    public boolean isRowLine() {
        return rowLine;
    }

    public void setRowLine(final boolean rowLine) {
        this.rowLine = rowLine;
    }

    public Borders getBorders() {
        return borders;
    }

    public void setBorders(final Borders borders) {
        this.borders = borders == null ? new Borders() : borders;
    }

    /**
     * Outer grid borders; all drawn by default.
     */
    public static class Borders {
        private boolean left = true;
        private boolean right = true;
        private boolean top = true;
        private boolean bottom = true;

        public boolean isLeft() { return left; }
        public void setLeft(final boolean left) { this.left = left; }

        public boolean isRight() { return right; }
        public void setRight(final boolean right) { this.right = right; }

        public boolean isTop() { return top; }
        public void setTop(final boolean top) { this.top = top; }

        public boolean isBottom() { return bottom; }
        public void setBottom(final boolean bottom) { this.bottom = bottom; }

        TableBorders toTableBorders() {
            return new TableBorders(left, right, top, bottom);
        }
    }
}
