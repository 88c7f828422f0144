package com.williamcallahan.gemtext.domain.render;

import java.util.List;
import java.util.Objects;

/**
 * Layout knobs for ASCII grid rendering of HTML tables.
 *
 * @param autoFormatHeader upper-case header and footer text, turning underscores into spaces
 * @param autoWrapText word-wrap cell text at {@code colWidth}
 * @param reflowDuringAutoWrap join the lines of a cell into one paragraph before wrapping
 * @param colWidth maximum column width used when wrapping
 * @param columnSeparator vertical separator between cells
 * @param rowSeparator horizontal fill character of border lines
 * @param centerSeparator junction character of border lines
 * @param headerAlignment alignment of header cells
 * @param footerAlignment alignment of footer cells
 * @param alignment alignment of body cells
 * @param columnAlignment per-column body alignment overriding {@code alignment}
 * @param newLine line terminator written after every grid line
 * @param headerLine draw a border line below the header
 * @param rowLine draw a border line between body rows
 * @param borders outer borders
 */
public record TableStyle(
    boolean autoFormatHeader,
    boolean autoWrapText,
    boolean reflowDuringAutoWrap,
    int colWidth,
    String columnSeparator,
    String rowSeparator,
    String centerSeparator,
    CellAlignment headerAlignment,
    CellAlignment footerAlignment,
    CellAlignment alignment,
    List<CellAlignment> columnAlignment,
    String newLine,
    boolean headerLine,
    boolean rowLine,
    TableBorders borders
) {

    /** Default wrap width of a column. */
    public static final int DEFAULT_COL_WIDTH = 30;

    /** Line terminator written after every grid line. */
    public static final String DEFAULT_NEW_LINE = "\n";

    public TableStyle {
        Objects.requireNonNull(columnSeparator, "Column separator cannot be null");
        Objects.requireNonNull(rowSeparator, "Row separator cannot be null");
        Objects.requireNonNull(centerSeparator, "Center separator cannot be null");
        Objects.requireNonNull(headerAlignment, "Header alignment cannot be null");
        Objects.requireNonNull(footerAlignment, "Footer alignment cannot be null");
        Objects.requireNonNull(alignment, "Alignment cannot be null");
        Objects.requireNonNull(newLine, "New line cannot be null");
        Objects.requireNonNull(borders, "Borders cannot be null");
        if (colWidth < 1) {
            throw new IllegalArgumentException("Column width must be positive");
        }
        columnAlignment = columnAlignment == null ? List.of() : List.copyOf(columnAlignment);
    }

    /**
     * Returns the classic grid look: centered upper-case header, wrapped cells, all borders.
     *
     * @return default table style
     */
    public static TableStyle defaults() {
        return new TableStyle(
            true,
            true,
            true,
            DEFAULT_COL_WIDTH,
            "|",
            "-",
            "+",
            CellAlignment.DEFAULT,
            CellAlignment.DEFAULT,
            CellAlignment.DEFAULT,
            List.of(),
            DEFAULT_NEW_LINE,
            true,
            false,
            TableBorders.all()
        );
    }

    /**
     * Returns the body alignment configured for a column.
     *
     * @param columnIndex zero-based column
     * @return column override when present, otherwise the table-wide body alignment
     */
    public CellAlignment bodyAlignment(int columnIndex) {
        return columnIndex < columnAlignment.size() ? columnAlignment.get(columnIndex) : alignment;
    }
}
