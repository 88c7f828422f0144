package com.williamcallahan.gemtext.service.gemtext;

import com.williamcallahan.gemtext.domain.render.RenderOptions;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Renders HTML as gemtext.
 *
 * <p>Headings, lists, blockquotes and preformatted blocks map onto their gemtext forms.
 * Links are numbered in the text and written out as {@code =>} link lines in blocks
 * after every few paragraphs, before headings and blockquotes, and at the end of the
 * document. Tables become ASCII grids when pretty tables are enabled.</p>
 *
 * <p>The renderer holds no per-document state; every call walks the tree with its own
 * context, so one instance can serve concurrent callers.</p>
 */
public final class GemtextRenderer {

    private static final Logger logger = LoggerFactory.getLogger(GemtextRenderer.class);

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final RenderOptions options;

    public GemtextRenderer() {
        this(RenderOptions.defaults());
    }

    public GemtextRenderer(RenderOptions options) {
        this.options = Objects.requireNonNull(options, "Render options cannot be null");
    }

    /**
     * Renders an already parsed node tree.
     *
     * @param root document or any node within one
     * @return normalized gemtext
     * @throws GemtextRenderException when the walk reaches an inconsistent state
     */
    public String render(Node root) {
        Objects.requireNonNull(root, "Root node cannot be null");
        RenderContext context = RenderContext.create(options);
        String gemtext = render(root, context);
        logger.debug("Rendered {} characters of gemtext with {} citations",
            gemtext.length(), context.citations().size());
        return gemtext;
    }

    /**
     * Parses and renders an HTML string. A leading byte order mark is ignored.
     *
     * @param html HTML source
     * @return normalized gemtext
     */
    public String render(String html) {
        Objects.requireNonNull(html, "HTML cannot be null");
        String source = html.startsWith(BYTE_ORDER_MARK) ? html.substring(BYTE_ORDER_MARK.length()) : html;
        return render(Jsoup.parse(source));
    }

    /**
     * Parses and renders HTML bytes, detecting the charset from a byte order mark or a
     * {@code meta} declaration and falling back to UTF-8.
     *
     * @param html encoded HTML
     * @return normalized gemtext
     */
    public String render(byte[] html) {
        Objects.requireNonNull(html, "HTML cannot be null");
        try {
            return render(new ByteArrayInputStream(html));
        } catch (IOException readFailure) {
            throw new UncheckedIOException("Failed to read in-memory HTML", readFailure);
        }
    }

    /**
     * Parses and renders HTML read from a stream. The stream is read to its end but not closed.
     *
     * @param html encoded HTML
     * @return normalized gemtext
     * @throws IOException when the stream cannot be read
     */
    public String render(InputStream html) throws IOException {
        Objects.requireNonNull(html, "HTML stream cannot be null");
        Document document = Jsoup.parse(html, null, "");
        return render(document);
    }

    public RenderOptions options() {
        return options;
    }

    /**
     * Walks a tree in the given context, writes the remaining citations and normalizes
     * the output. Also used for the sub-documents inside table cells.
     */
    static String render(Node root, RenderContext context) {
        new HtmlTreeWalker(context).traverse(root);
        context.citations().flush(context.emitter());
        return GemtextNormalizer.normalize(context.emitter().text());
    }
}
