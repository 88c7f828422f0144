package com.williamcallahan.gemtext.service.gemtext;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Buffers the cells of a table subtree and writes the finished ASCII grid when the
 * table closes. Only used with pretty tables enabled.
 */
final class TableRenderer {

    private static final Logger logger = LoggerFactory.getLogger(TableRenderer.class);

    private static final String OPENING_FENCE = "\n\n```\n";
    private static final String CLOSING_FENCE = "```\n\n";
    private static final String NESTED_SEPARATOR = "\n\n";

    private final HtmlTreeWalker walker;
    private final RenderContext context;
    private final AsciiTableLayout layout;

    TableRenderer(HtmlTreeWalker walker, RenderContext context) {
        this.walker = walker;
        this.context = context;
        this.layout = new AsciiTableLayout(context.options().tableStyle());
    }

    /**
     * Handles one element of the table family.
     *
     * @param element table, section, row or cell element
     * @param kind kind of {@code element}
     * @throws GemtextRenderException when pretty tables are disabled or the kind is not a table part
     */
    void render(Element element, ElementKind kind) {
        if (!context.options().prettyTables()) {
            throw new GemtextRenderException("Pretty table rendering is disabled for <" + element.normalName() + ">");
        }
        TableContext table = context.tableContext();
        switch (kind) {
            case TABLE -> renderTable(element);
            case TABLE_FOOTER -> {
                table.setInFooter(true);
                walker.traverseChildren(element);
                table.setInFooter(false);
            }
            case TABLE_ROW -> renderRow(element, table);
            case TABLE_HEADER_CELL -> table.addHeaderCell(renderCell(element));
            case TABLE_DATA_CELL -> table.addDataCell(renderCell(element));
            default -> throw new GemtextRenderException("Not a table element: " + kind);
        }
    }

    private void renderTable(Element element) {
        TableNesting nesting = context.tableNesting();
        boolean outermost = nesting.enter();
        context.emit(outermost ? OPENING_FENCE : NESTED_SEPARATOR);

        TableContext table = context.tableContext();
        table.reset();
        walker.traverseChildren(element);
        String grid = layout.render(table.header(), table.body(), table.footer());
        logger.debug("Laid out table at depth {} with {} body rows", nesting.depth(), table.body().size());
        context.emit(grid);

        nesting.exit();
        context.emit(outermost ? CLOSING_FENCE : NESTED_SEPARATOR);
    }

    private void renderRow(Element element, TableContext table) {
        // footer rows feed the footer grid and leave the body cursor alone
        boolean bodyRow = !table.isInFooter();
        if (bodyRow) {
            table.openRow();
        }
        walker.traverseChildren(element);
        if (bodyRow) {
            table.closeRow();
        }
    }

    /**
     * Renders each child of a cell as a document of its own and joins the results
     * with line breaks.
     */
    private String renderCell(Element cell) {
        StringBuilder text = new StringBuilder();
        List<Node> children = cell.childNodes();
        for (int index = 0; index < children.size(); index++) {
            if (index > 0) {
                text.append('\n');
            }
            text.append(GemtextRenderer.render(children.get(index), context.forTableCell()));
        }
        return text.toString();
    }
}
