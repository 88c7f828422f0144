package com.williamcallahan.gemtext.service.gemtext;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.gemtext.domain.render.RenderOptions;
import java.util.Collections;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

/**
 * Verifies ASCII grid rendering of tables with pretty tables enabled.
 */
class PrettyTableRenderingTest {

    private final GemtextRenderer renderer = new GemtextRenderer(RenderOptions.builder().prettyTables(true).build());

    @Test
    void rendersSingleRowTableInsideFence() {
        String gemtext = renderer.render("<table><tr><td>cell1</td><td>cell2</td></tr></table>");

        assertEquals("```\n+-------+-------+\n| cell1 | cell2 |\n+-------+-------+\n```", gemtext);
    }

    @Test
    void rendersEmptyCellsAsBorderedGrid() {
        String gemtext = renderer.render("<table><tr><td></td><td></td></tr></table>");

        assertEquals("```\n+--+--+\n|  |  |\n+--+--+\n```", gemtext);
    }

    @Test
    void stacksRowsWithoutSeparatorLines() {
        String gemtext = renderer.render("<table><tr><td>row1</td></tr><tr><td>row2</td></tr></table>");

        assertEquals("```\n+------+\n| row1 |\n| row2 |\n+------+\n```", gemtext);
    }

    @Test
    void rendersHeaderAndFooterSections() {
        String gemtext = renderer.render("""
            <table>
              <thead>
                <tr><th>Header 1</th><th>Header 2</th></tr>
              </thead>
              <tfoot>
                <tr><td>Footer 1</td><td>Footer 2</td></tr>
              </tfoot>
              <tbody>
                <tr><td>Row 1 Col 1</td><td>Row 1 Col 2</td></tr>
                <tr><td>Row 2 Col 1</td><td>Row 2 Col 2</td></tr>
              </tbody>
            </table>""");

        String expected = """
            ```
            +-------------+-------------+
            |  HEADER 1   |  HEADER 2   |
            +-------------+-------------+
            | Row 1 Col 1 | Row 1 Col 2 |
            | Row 2 Col 1 | Row 2 Col 2 |
            +-------------+-------------+
            |  FOOTER 1   |  FOOTER 2   |
            +-------------+-------------+
            ```""";
        assertEquals(expected, gemtext);
    }

    @Test
    void wrapsLongCellTextAndKeepsRowsAligned() {
        String gemtext = renderer.render("""
            <table>
              <tr><th>Item</th><th>Description</th><th>Price</th></tr>
              <tr>
                <td>Golang</td>
                <td>Open source programming language that makes it easy to build simple, reliable, and efficient software</td>
                <td>$10.99</td>
              </tr>
              <tr>
                <td>Hermes</td>
                <td>Programmatically create beautiful e-mails using Golang.</td>
                <td>$1.99</td>
              </tr>
            </table>""");

        String expected = """
            ```
            +--------+--------------------------------+--------+
            |  ITEM  |          DESCRIPTION           | PRICE  |
            +--------+--------------------------------+--------+
            | Golang | Open source programming        | $10.99 |
            |        | language that makes it easy    |        |
            |        | to build simple, reliable, and |        |
            |        | efficient software             |        |
            | Hermes | Programmatically create        | $1.99  |
            |        | beautiful e-mails using        |        |
            |        | Golang.                        |        |
            +--------+--------------------------------+--------+
            ```""";
        assertEquals(expected, gemtext);
    }

    @Test
    void joinsParagraphsOfOneCellBeforeWrapping() {
        String gemtext = renderer.render("""
            <table>
              <tbody>
                <tr><td><p>Row-1-Col-1-Msg123456789012345</p><p>Row-1-Col-1-Msg2</p></td><td>Row-1-Col-2</td></tr>
                <tr><td>Row-2-Col-1</td><td>Row-2-Col-2</td></tr>
              </tbody>
            </table>""");

        String expected = """
            ```
            +--------------------------------+-------------+
            | Row-1-Col-1-Msg123456789012345 | Row-1-Col-2 |
            | Row-1-Col-1-Msg2               |             |
            | Row-2-Col-1                    | Row-2-Col-2 |
            +--------------------------------+-------------+
            ```""";
        assertEquals(expected, gemtext);
    }

    @Test
    void wrapsVeryLargeCellIntoAlignedGrid() {
        String cell = String.join(" ", Collections.nCopies(20_000, "word"));

        String gemtext = renderer.render("<table><tr><td>" + cell + "</td></tr></table>");

        String[] lines = gemtext.split("\n");
        assertEquals("```", lines[0]);
        assertEquals("```", lines[lines.length - 1]);
        for (int index = 1; index < lines.length - 1; index++) {
            assertEquals(lines[1].length(), lines[index].length(), "Line width differs: " + lines[index]);
        }
    }

    @Test
    void separatesTableFromSurroundingText() {
        String gemtext = renderer.render("_<table><tr><td>cell</td></tr></table>_");

        assertEquals("_\n\n```\n+------+\n| cell |\n+------+\n```\n\n_", gemtext);
    }

    @Test
    void holdsCellCitationsUntilTableCloses() {
        String gemtext = renderer.render("<table><tr><td><a href=\"http://x/\">x link</a></td></tr></table>");

        assertEquals("```\n+------------+\n| x link [1] |\n+------------+\n```\n\n=> http://x/ [1] x link", gemtext);
    }

    @Test
    void rejectsTablePartsWhenPrettyTablesAreOff() {
        RenderContext context = RenderContext.create(RenderOptions.defaults());
        TableRenderer tableRenderer = new TableRenderer(new HtmlTreeWalker(context), context);
        Element table = Jsoup.parse("<table><tr><td>x</td></tr></table>").selectFirst("table");

        assertThrows(GemtextRenderException.class, () -> tableRenderer.render(table, ElementKind.TABLE));
    }
}
