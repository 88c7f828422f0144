package com.williamcallahan.gemtext.service.gemtext;

import com.williamcallahan.gemtext.domain.render.RenderOptions;

/**
 * Mutable state of one render: output, blockquote nesting, table buffers and citations.
 *
 * <p>A context is owned by exactly one walk. Peek-ahead renders get a {@link #scratch()}
 * context that shares nothing with this one; table cells get a {@link #forTableCell()}
 * context that shares the citations and the table nesting counter so numbering and flush
 * suppression carry through the cell.</p>
 */
final class RenderContext {

    private final RenderOptions options;
    private final TextEmitter emitter = new TextEmitter();
    private final TableContext tableContext = new TableContext();
    private final TableNesting tableNesting;
    private final CitationAccumulator citations;
    private int blockquoteDepth;
    private boolean justClosedDivision;

    private RenderContext(RenderOptions options, TableNesting tableNesting, CitationAccumulator citations) {
        this.options = options;
        this.tableNesting = tableNesting;
        this.citations = citations;
    }

    /**
     * Creates the context of a top-level render.
     *
     * @param options render options
     * @return a fresh context
     */
    static RenderContext create(RenderOptions options) {
        TableNesting nesting = new TableNesting();
        return new RenderContext(options, nesting, new CitationAccumulator(options, nesting));
    }

    /**
     * Creates an isolated context for a peek-ahead render. Citation markers are turned
     * off so the peek text reads as plain link text.
     */
    RenderContext scratch() {
        return create(options.toBuilder().citationMarkers(false).build());
    }

    /**
     * Creates the context a table cell is rendered in.
     */
    RenderContext forTableCell() {
        RenderContext cell = new RenderContext(options, tableNesting, citations);
        cell.emitter.setPreformatted(emitter.isPreformatted());
        return cell;
    }

    void emit(String fragment) {
        emitter.emit(fragment);
    }

    RenderOptions options() {
        return options;
    }

    TextEmitter emitter() {
        return emitter;
    }

    TableContext tableContext() {
        return tableContext;
    }

    TableNesting tableNesting() {
        return tableNesting;
    }

    CitationAccumulator citations() {
        return citations;
    }

    /**
     * Enters a blockquote and sets the line prefix for its depth.
     */
    void enterBlockquote() {
        blockquoteDepth++;
        emitter.setLinePrefix(quotePrefix(blockquoteDepth));
    }

    /**
     * Leaves a blockquote and restores the prefix of the enclosing level.
     */
    void exitBlockquote() {
        if (blockquoteDepth == 0) {
            throw new GemtextRenderException("Blockquote closed more often than opened");
        }
        blockquoteDepth--;
        emitter.setLinePrefix(quotePrefix(blockquoteDepth));
    }

    int blockquoteDepth() {
        return blockquoteDepth;
    }

    boolean justClosedDivision() {
        return justClosedDivision;
    }

    void setJustClosedDivision(boolean justClosedDivision) {
        this.justClosedDivision = justClosedDivision;
    }

    private static String quotePrefix(int depth) {
        return depth == 0 ? "" : ">".repeat(depth) + " ";
    }
}
