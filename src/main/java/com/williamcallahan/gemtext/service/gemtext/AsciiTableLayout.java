package com.williamcallahan.gemtext.service.gemtext;

import com.williamcallahan.gemtext.domain.render.CellAlignment;
import com.williamcallahan.gemtext.domain.render.TableStyle;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lays out buffered table cells as a fixed-width bordered ASCII grid.
 *
 * <p>Column widths come from the widest (wrapped) line in each column. A logical row
 * spans as many physical lines as its tallest cell; shorter cells are padded with blank
 * lines so every column stays aligned.</p>
 */
final class AsciiTableLayout {

    private static final Pattern DECIMAL = Pattern.compile("^-?(?:\\d{1,3}(?:,\\d{3})*|\\d+)(?:\\.\\d+)?$");
    private static final Pattern PERCENT = Pattern.compile("^-?\\d+(?:\\.\\d+)?%$");

    private enum Section { HEADER, BODY, FOOTER }

    private final TableStyle style;

    AsciiTableLayout(TableStyle style) {
        this.style = style;
    }

    /**
     * Renders the grid.
     *
     * @param header header cell texts, possibly empty
     * @param body body rows; rows without cells are skipped
     * @param footer footer cell texts, possibly empty
     * @return grid text with every line terminated, or empty when there are no cells
     */
    String render(List<String> header, List<List<String>> body, List<String> footer) {
        List<List<String>> rows = new ArrayList<>();
        for (List<String> row : body) {
            if (!row.isEmpty()) {
                rows.add(row);
            }
        }
        int columnCount = Math.max(header.size(), footer.size());
        for (List<String> row : rows) {
            columnCount = Math.max(columnCount, row.size());
        }
        if (columnCount == 0) {
            return "";
        }

        int[] widths = new int[columnCount];
        List<List<String>> headerCells = header.isEmpty() ? List.of() : layoutRow(titled(header), columnCount, widths);
        List<List<List<String>>> bodyCells = new ArrayList<>();
        for (List<String> row : rows) {
            bodyCells.add(layoutRow(row, columnCount, widths));
        }
        List<List<String>> footerCells = footer.isEmpty() ? List.of() : layoutRow(titled(footer), columnCount, widths);

        StringBuilder grid = new StringBuilder();
        String borderLine = borderLine(widths);
        if (style.borders().top()) {
            appendLine(grid, borderLine);
        }
        if (!headerCells.isEmpty()) {
            appendRow(grid, headerCells, widths, Section.HEADER);
            if (style.headerLine()) {
                appendLine(grid, borderLine);
            }
        }
        for (int rowIndex = 0; rowIndex < bodyCells.size(); rowIndex++) {
            if (rowIndex > 0 && style.rowLine()) {
                appendLine(grid, borderLine);
            }
            appendRow(grid, bodyCells.get(rowIndex), widths, Section.BODY);
        }
        if (!footerCells.isEmpty()) {
            appendLine(grid, borderLine);
            appendRow(grid, footerCells, widths, Section.FOOTER);
        }
        if (style.borders().bottom()) {
            appendLine(grid, borderLine);
        }
        return grid.toString();
    }

    private List<String> titled(List<String> cells) {
        if (!style.autoFormatHeader()) {
            return cells;
        }
        List<String> titled = new ArrayList<>(cells.size());
        for (String cell : cells) {
            titled.add(cell.replace('_', ' ').strip().toUpperCase(Locale.ROOT));
        }
        return titled;
    }

    private List<List<String>> layoutRow(List<String> row, int columnCount, int[] widths) {
        List<List<String>> cells = new ArrayList<>(columnCount);
        for (int column = 0; column < columnCount; column++) {
            String text = column < row.size() ? row.get(column) : "";
            List<String> lines = cellLines(text);
            for (String line : lines) {
                widths[column] = Math.max(widths[column], WordWrapper.displayWidth(line));
            }
            cells.add(lines);
        }
        return cells;
    }

    private List<String> cellLines(String text) {
        List<String> lines = List.of(text.split("\n", -1));
        if (!style.autoWrapText()) {
            return lines;
        }
        int widest = 0;
        for (String line : lines) {
            widest = Math.max(widest, WordWrapper.displayWidth(line));
        }
        int limit = Math.min(widest, style.colWidth());
        List<String> paragraphs = style.reflowDuringAutoWrap() ? List.of(String.join(" ", lines)) : lines;
        List<String> wrapped = new ArrayList<>();
        for (int index = 0; index < paragraphs.size(); index++) {
            if (index > 0) {
                wrapped.add("");
            }
            wrapped.addAll(WordWrapper.wrap(paragraphs.get(index), limit));
        }
        return wrapped;
    }

    private void appendRow(StringBuilder grid, List<List<String>> cells, int[] widths, Section section) {
        int height = 1;
        for (List<String> lines : cells) {
            height = Math.max(height, lines.size());
        }
        String separator = style.columnSeparator();
        for (int lineIndex = 0; lineIndex < height; lineIndex++) {
            StringBuilder line = new StringBuilder();
            if (style.borders().left()) {
                line.append(separator);
            }
            for (int column = 0; column < widths.length; column++) {
                List<String> lines = cells.get(column);
                String text = lineIndex < lines.size() ? lines.get(lineIndex) : "";
                line.append(' ').append(align(text, widths[column], alignmentFor(section, column, text))).append(' ');
                if (column < widths.length - 1 || style.borders().right()) {
                    line.append(separator);
                }
            }
            appendLine(grid, line.toString());
        }
    }

    private CellAlignment alignmentFor(Section section, int column, String text) {
        CellAlignment configured = switch (section) {
            case HEADER -> style.headerAlignment();
            case FOOTER -> style.footerAlignment();
            case BODY -> style.bodyAlignment(column);
        };
        if (configured != CellAlignment.DEFAULT) {
            return configured;
        }
        if (section != Section.BODY) {
            return CellAlignment.CENTER;
        }
        return isNumeric(text) ? CellAlignment.RIGHT : CellAlignment.LEFT;
    }

    static boolean isNumeric(String text) {
        String trimmed = text.strip();
        return DECIMAL.matcher(trimmed).matches() || PERCENT.matcher(trimmed).matches();
    }

    static String align(String text, int width, CellAlignment alignment) {
        int gap = width - WordWrapper.displayWidth(text);
        if (gap <= 0) {
            return text;
        }
        return switch (alignment) {
            case RIGHT -> " ".repeat(gap) + text;
            case CENTER -> " ".repeat(gap / 2) + text + " ".repeat(gap - gap / 2);
            default -> text + " ".repeat(gap);
        };
    }

    private String borderLine(int[] widths) {
        StringBuilder line = new StringBuilder();
        if (style.borders().left()) {
            line.append(style.centerSeparator());
        }
        for (int column = 0; column < widths.length; column++) {
            line.append(style.rowSeparator().repeat(widths[column] + 2));
            if (column < widths.length - 1 || style.borders().right()) {
                line.append(style.centerSeparator());
            }
        }
        return line.toString();
    }

    private void appendLine(StringBuilder grid, String line) {
        grid.append(line).append(style.newLine());
    }
}
