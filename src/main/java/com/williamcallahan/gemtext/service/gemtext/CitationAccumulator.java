package com.williamcallahan.gemtext.service.gemtext;

import com.williamcallahan.gemtext.domain.render.RenderOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Collects the links of one render and decides when they are written out as a
 * block of gemtext {@code =>} lines.
 *
 * <p>Citations are numbered consecutively from the configured start. A citation is
 * written at most once, either by a flush or directly as a link line in the body.</p>
 */
final class CitationAccumulator {

    private static final Logger logger = LoggerFactory.getLogger(CitationAccumulator.class);

    private static final String SAME_PAGE_PREFIX = "#";
    private static final String ESCAPED_SPACE = "%20";

    private final List<Citation> citations = new ArrayList<>();
    private final RenderOptions options;
    private final TableNesting tableNesting;
    private final BitSet written = new BitSet();
    private int paragraphsSinceFlush;

    CitationAccumulator(RenderOptions options, TableNesting tableNesting) {
        this.options = options;
        this.tableNesting = tableNesting;
    }

    /**
     * Registers a link and returns the marker to write at the point of reference.
     *
     * @param url normalized link target
     * @param display text the link is shown with
     * @return {@code [n]} when citation markers are on, otherwise empty; empty for same-page links
     */
    String register(String url, String display) {
        if (url == null || url.isEmpty() || url.startsWith(SAME_PAGE_PREFIX)) {
            return "";
        }
        Citation citation = append(url, display);
        return options.citationMarkers() ? citation.marker() : "";
    }

    /**
     * Records a link the caller has already written as its own link line, so that it
     * keeps its place in the numbering but never appears in a flushed block.
     *
     * @param url link target
     * @param display text the link was written with
     * @return the recorded citation
     */
    Citation recordWritten(String url, String display) {
        Citation citation = append(url, display);
        written.set(citations.size() - 1);
        return citation;
    }

    private Citation append(String url, String display) {
        Citation citation = new Citation(
            citations.size() + options.citationStart(),
            url.replace(" ", ESCAPED_SPACE),
            display
        );
        citations.add(citation);
        logger.debug("Registered citation {} -> {}", citation.index(), citation.url());
        return citation;
    }

    /**
     * Counts a closed paragraph-like block and flushes once enough blocks have passed
     * since the last flush.
     *
     * @param emitter output to flush into
     */
    void checkFlush(TextEmitter emitter) {
        paragraphsSinceFlush++;
        if (paragraphsSinceFlush > options.linkEmitFrequency() && hasPending()) {
            flush(emitter);
        }
    }

    /**
     * Writes every pending citation as a link block. Held back while a table is open.
     *
     * @param emitter output to flush into
     */
    void flush(TextEmitter emitter) {
        if (tableNesting.insideTable()) {
            return;
        }
        if (!hasPending()) {
            paragraphsSinceFlush = 0;
            return;
        }
        StringBuilder block = new StringBuilder("\n\n");
        int flushedLines = 0;
        for (int position = firstPending(); position < citations.size(); position++) {
            if (!written.get(position)) {
                block.append(citations.get(position).toLinkLine(options.numberedLinks())).append('\n');
                flushedLines++;
            }
        }
        block.append('\n');
        emitter.writeRaw(block.toString());
        logger.debug("Flushed {} citations through {}", flushedLines, lastIndex());
        written.set(0, citations.size());
        paragraphsSinceFlush = 0;
    }

    boolean hasPending() {
        return firstPending() < citations.size();
    }

    /**
     * Returns the index of the last citation up to which everything has been written,
     * or one less than the citation start when nothing has been written yet.
     */
    int flushedThrough() {
        int writtenPrefix = firstPending();
        return writtenPrefix == 0 ? options.citationStart() - 1 : citations.get(writtenPrefix - 1).index();
    }

    private int firstPending() {
        return Math.min(written.nextClearBit(0), citations.size());
    }

    List<Citation> citations() {
        return List.copyOf(citations);
    }

    int size() {
        return citations.size();
    }

    int paragraphsSinceFlush() {
        return paragraphsSinceFlush;
    }

    private int lastIndex() {
        return citations.get(citations.size() - 1).index();
    }
}
