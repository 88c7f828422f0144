package com.williamcallahan.gemtext.service.gemtext;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.gemtext.domain.render.RenderOptions;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

/**
 * Verifies walker state handling: peek-ahead isolation, link-line bookkeeping and contexts.
 */
class HtmlTreeWalkerTest {

    private static RenderContext walk(String html) {
        RenderContext context = RenderContext.create(RenderOptions.defaults());
        new HtmlTreeWalker(context).traverse(Jsoup.parse(html).body());
        return context;
    }

    @Test
    void linkLineAdvancesFlushCursorByOne() {
        RenderContext context = walk("<p><a href=\"x\">short</a></p>");

        assertEquals(1, context.citations().flushedThrough());
        assertFalse(context.citations().hasPending());
        assertTrue(context.emitter().text().contains("=> x short\n"));
    }

    @Test
    void peekAheadDoesNotRegisterCitationsTwice() {
        RenderContext context = walk("<p>See <a href=\"http://a/\">a</a> and <a href=\"http://b/\">b</a></p>");

        assertEquals(2, context.citations().size());
        assertEquals("http://b/", context.citations().citations().get(1).url());
    }

    @Test
    void scratchContextSharesNothing() {
        RenderContext context = RenderContext.create(RenderOptions.defaults());
        RenderContext scratch = context.scratch();

        assertNotSame(context.citations(), scratch.citations());
        assertNotSame(context.tableNesting(), scratch.tableNesting());
        assertFalse(scratch.options().citationMarkers());
    }

    @Test
    void tableCellContextSharesCitationsAndNesting() {
        RenderContext context = RenderContext.create(RenderOptions.defaults());
        context.emitter().setPreformatted(true);
        RenderContext cell = context.forTableCell();

        assertSame(context.citations(), cell.citations());
        assertSame(context.tableNesting(), cell.tableNesting());
        assertNotSame(context.emitter(), cell.emitter());
        assertTrue(cell.emitter().isPreformatted());
    }

    @Test
    void rejectsUnbalancedBlockquoteExit() {
        RenderContext context = RenderContext.create(RenderOptions.defaults());
        context.enterBlockquote();
        context.enterBlockquote();
        context.exitBlockquote();
        assertEquals(1, context.blockquoteDepth());
        context.exitBlockquote();

        assertThrows(GemtextRenderException.class, context::exitBlockquote);
    }

    @Test
    void nestedBlockquoteOpensBelowParentsEmptyLine() {
        String gemtext = new GemtextRenderer().render(
            "<div>level 0<blockquote>level 1<br><blockquote>level 2</blockquote>level 1</blockquote>"
                + "<div>level 0</div></div>");

        assertEquals("level 0\n> \n> level 1\n> \n>> level 2\n> \n> level 1\n\nlevel 0", gemtext);
    }
}
