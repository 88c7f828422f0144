package com.williamcallahan.gemtext.service.gemtext;

import com.williamcallahan.gemtext.domain.render.RenderOptions;
import com.williamcallahan.gemtext.support.TextNormalizer;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Depth-first walk over a jsoup node tree that writes gemtext into a {@link RenderContext}.
 *
 * <p>Text nodes are emitted with HTML white space collapsed, except inside {@code pre}.
 * Elements dispatch on their {@link ElementKind}; unknown elements are transparent.</p>
 */
final class HtmlTreeWalker {

    private static final Logger logger = LoggerFactory.getLogger(HtmlTreeWalker.class);

    private static final String PARAGRAPH_BREAK = "\n\n";
    private static final String CODE_FENCE = "```";
    private static final String PLAIN_TABLE_MARKER = "⊞ table ⊞";
    private static final String LINK_LINE_PREFIX = "=> ";
    private static final String BULLET = "* ";

    private final RenderContext context;
    private final TableRenderer tableRenderer;

    HtmlTreeWalker(RenderContext context) {
        this.context = context;
        this.tableRenderer = new TableRenderer(this, context);
    }

    /**
     * Renders a node and its subtree.
     *
     * @param node node to render
     */
    void traverse(Node node) {
        if (node instanceof TextNode textNode) {
            emitText(textNode);
        } else if (node instanceof Element element) {
            handleElement(element);
        } else {
            traverseChildren(node);
        }
    }

    void traverseChildren(Node node) {
        for (Node child : node.childNodes()) {
            traverse(child);
        }
    }

    private void emitText(TextNode textNode) {
        TextEmitter emitter = context.emitter();
        if (emitter.isPreformatted()) {
            emitter.emit(textNode.getWholeText());
        } else {
            emitter.emit(TextNormalizer.collapseHtmlSpacing(textNode.getWholeText()));
        }
    }

    private void handleElement(Element element) {
        context.setJustClosedDivision(false);
        ElementKind kind = ElementKind.fromTag(element.normalName());
        if (kind.isSkipped()) {
            return;
        }
        switch (kind) {
            case LINE_BREAK -> context.emit("\n");
            case HEADING_1, HEADING_2, HEADING_3 -> renderHeading(element, kind);
            case BLOCKQUOTE -> renderBlockquote(element);
            case DIVISION -> renderDivision(element);
            case LIST_ITEM -> renderListItem(element);
            case PARAGRAPH -> renderParagraph(element);
            case UNORDERED_LIST -> paragraphBlock(() -> traverseChildren(element));
            case ANCHOR -> renderAnchor(element);
            case IMAGE -> renderImage(element);
            case TABLE, TABLE_ROW, TABLE_HEADER_CELL, TABLE_DATA_CELL, TABLE_FOOTER -> renderTablePart(element, kind);
            case PREFORMATTED -> renderPreformatted(element);
            default -> traverseChildren(element);
        }
    }

    private void renderHeading(Element element, ElementKind kind) {
        context.citations().flush(context.emitter());
        context.emit(PARAGRAPH_BREAK + kind.headingMarker());
        traverseChildren(element);
        context.emit(PARAGRAPH_BREAK);
    }

    private void renderBlockquote(Element element) {
        context.citations().flush(context.emitter());
        context.enterBlockquote();
        context.emit(PARAGRAPH_BREAK);
        traverseChildren(element);
        context.exitBlockquote();
        context.emit(PARAGRAPH_BREAK);
    }

    private void renderDivision(Element element) {
        if (context.emitter().lineLength() > 0) {
            context.emit("\n");
        }
        traverseChildren(element);
        // adjacent divisions share one line break
        if (!context.justClosedDivision()) {
            context.emit("\n");
        }
        context.setJustClosedDivision(true);
    }

    private void renderListItem(Element element) {
        PeekResult peek = peek(element);
        if (peek.isShortSingleLink(context.options())) {
            emitLinkLine(peek);
            return;
        }
        if (peek.links().isEmpty()) {
            // scratch text as rendered, so line breaks and fenced blocks survive
            context.emitter().ensureLineStart();
            context.emit(BULLET + peek.text() + "\n");
            return;
        }
        context.emitter().ensureLineStart();
        context.emit(BULLET);
        traverseChildren(element);
        context.emit("\n");
    }

    private void renderParagraph(Element element) {
        PeekResult peek = peek(element);
        if (peek.isShortSingleLink(context.options())) {
            emitLinkLine(peek);
        } else if (peek.links().isEmpty()) {
            paragraphBlock(() -> context.emit(peek.text()));
        } else {
            paragraphBlock(() -> traverseChildren(element));
        }
    }

    /**
     * Renders the children of a block into a scratch context to see what links they hold.
     */
    private PeekResult peek(Element element) {
        RenderContext scratch = context.scratch();
        new HtmlTreeWalker(scratch).traverseChildren(element);
        return new PeekResult(TextNormalizer.strip(scratch.emitter().text()), scratch.citations().citations());
    }

    private void emitLinkLine(PeekResult peek) {
        Citation peeked = peek.links().get(0);
        String display = TextNormalizer.flatten(peek.text());
        Citation citation = context.citations().recordWritten(peeked.url(), display);
        logger.debug("Collapsed block into link line for citation {}", citation.index());
        context.emitter().ensureLineStart();
        if (display.isEmpty()) {
            context.emit(LINK_LINE_PREFIX + citation.url() + "\n");
        } else {
            context.emit(LINK_LINE_PREFIX + citation.url() + " " + display + "\n");
        }
    }

    private void renderAnchor(Element element) {
        RenderOptions options = context.options();
        List<Node> children = element.childNodes();
        Node soleChild = children.size() == 1 ? children.get(0) : null;
        String linkText = "";
        if (soleChild instanceof TextNode textNode) {
            linkText = TextNormalizer.collapseHtmlSpacing(textNode.getWholeText());
        }

        traverseChildren(element);

        if (soleChild instanceof Element image
            && ElementKind.fromTag(image.normalName()) == ElementKind.IMAGE
            && !options.omitLinks()) {
            linkText = options.emptyLinkPrefix();
            context.emit(" " + linkText);
        }

        String href = LinkTextNormalizer.normalizeHref(element.attr("href"));
        if (!options.omitLinks() && !href.isEmpty() && !href.equals(linkText)) {
            context.emit(context.citations().register(href, linkText));
        }
    }

    private void renderImage(Element element) {
        RenderOptions options = context.options();
        String imageText = LinkTextNormalizer.imageText(
            element.attr("alt"), element.attr("src"), options.imageMarkerPrefix());
        if (imageText.isEmpty()) {
            return;
        }
        context.emit(imageText);
        if (!options.emitImagesAsLinks() || options.omitLinks()) {
            return;
        }
        String src = LinkTextNormalizer.normalizeHref(element.attr("src"));
        if (!src.isEmpty() && !src.equals(imageText)) {
            context.emit(context.citations().register(src, imageText));
        }
    }

    private void renderTablePart(Element element, ElementKind kind) {
        if (context.options().prettyTables()) {
            tableRenderer.render(element, kind);
            return;
        }
        switch (kind) {
            case TABLE -> {
                context.emit(PARAGRAPH_BREAK + PLAIN_TABLE_MARKER + PARAGRAPH_BREAK);
                paragraphBlock(() -> traverseChildren(element));
            }
            case TABLE_ROW -> {
                context.emit("\n");
                traverseChildren(element);
            }
            default -> traverseChildren(element);
        }
    }

    private void renderPreformatted(Element element) {
        TextEmitter emitter = context.emitter();
        context.emit(PARAGRAPH_BREAK + CODE_FENCE + "\n");
        emitter.setPreformatted(true);
        try {
            traverseChildren(element);
        } finally {
            emitter.setPreformatted(false);
        }
        context.emit("\n" + CODE_FENCE + PARAGRAPH_BREAK);
    }

    /**
     * Writes a paragraph-like block: counts it towards the citation flush, then surrounds
     * the body with blank lines.
     */
    private void paragraphBlock(Runnable body) {
        context.citations().checkFlush(context.emitter());
        context.emit(PARAGRAPH_BREAK);
        body.run();
        context.emit(PARAGRAPH_BREAK);
    }

    /**
     * Outcome of a peek-ahead render.
     *
     * @param text scratch output, trimmed
     * @param links citations the scratch render registered
     */
    private record PeekResult(String text, List<Citation> links) {

        boolean isShortSingleLink(RenderOptions options) {
            return links.size() == 1 && TextNormalizer.wordCount(text) < options.listItemLinkWordThreshold();
        }
    }
}
