package com.williamcallahan.chatlatex.service.latex;

import com.williamcallahan.chatlatex.domain.latex.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts one chat message from extended markdown into a LaTeX fragment.
 *
 * <p>The message is segmented, then each plain-text segment runs through protection, escaping,
 * inline formatting, newline normalization and restoration with a store of its own. Code blocks,
 * tables and rules are rendered directly; table cells re-enter the inline pipeline. Nothing is
 * shared between calls, so one instance serves any number of threads.</p>
 *
 * <p>Rendering never throws. A segment that fails is logged and emitted as escaped text.</p>
 */
@Service
public class LatexFragmentRenderer {

    private static final Logger logger = LoggerFactory.getLogger(LatexFragmentRenderer.class);

    private static final Pattern AUDIO_TAG = Pattern.compile("\\n?<audio_file>.*?</audio_file>", Pattern.DOTALL);
    private static final String HORIZONTAL_RULE = "\\par\\noindent\\rule{\\linewidth}{0.4pt}\\par\n";

    private final RegionProtector regionProtector;

    /**
     * Creates a renderer that resolves image tags with the given resolver.
     *
     * @param imageSourceResolver lookup for {@code <img>} sources
     */
    public LatexFragmentRenderer(ImageSourceResolver imageSourceResolver) {
        this.regionProtector = new RegionProtector(imageSourceResolver);
    }

    /**
     * Renders a message that does not belong to a stored chat.
     *
     * @param content message text
     * @return LaTeX fragment
     */
    public String render(String content) {
        return render(content, null);
    }

    /**
     * Renders a message, resolving images against the given chat.
     *
     * @param content message text, null treated as empty
     * @param chatId chat id for image lookup, may be null
     * @return LaTeX fragment
     */
    public String render(String content, String chatId) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        String message = stripAudioTags(content.replace("\r\n", "\n").replace('\r', '\n'));
        List<Segment> segments = MessageSegmenter.segment(message);
        StringBuilder latex = new StringBuilder(message.length() + message.length() / 2);
        for (Segment segment : segments) {
            latex.append(renderSegment(segment, chatId));
        }
        return latex.toString();
    }

    /**
     * Removes recorded audio tags together with one preceding newline.
     */
    static String stripAudioTags(String message) {
        return AUDIO_TAG.matcher(message).replaceAll("");
    }

    private String renderSegment(Segment segment, String chatId) {
        try {
            return switch (segment.kind()) {
                case CODE_BLOCK -> renderCodeBlock(segment);
                case TABLE -> TableConverter.convert(segment.body(), cell -> renderCell(cell, chatId));
                case HORIZONTAL_RULE -> HORIZONTAL_RULE;
                case PLAIN_TEXT -> renderPlainText(segment.body(), chatId);
            };
        } catch (RuntimeException segmentFailure) {
            logger.warn("Rendering {} segment failed, falling back to escaped text", segment.kind(), segmentFailure);
            return LatexEscaper.escape(segment.raw());
        }
    }

    private static String renderCodeBlock(Segment segment) {
        String languageOption = ListingLanguages.forFenceTag(segment.language())
            .map(language -> "[language=" + language + "]")
            .orElse("");
        return "\\begin{lstlisting}" + languageOption + "\n" + segment.body() + "\n\\end{lstlisting}\n";
    }

    private String renderPlainText(String text, String chatId) {
        ProtectedRegionStore store = new ProtectedRegionStore();
        String carrier = regionProtector.protect(text, store, chatId, true);
        String formatted = InlineFormatter.format(LatexEscaper.escapeCarrier(carrier, store));
        return PlaceholderRestorer.restore(NewlineNormalizer.normalize(formatted, store), store);
    }

    /**
     * Renders one table cell. The cell is segmented like a message, but every segment goes
     * through the inline pipeline: a cell holds one line, so a rule-shaped cell stays text.
     */
    String renderCell(String cell, String chatId) {
        StringBuilder latex = new StringBuilder(cell.length() + 16);
        for (Segment segment : MessageSegmenter.segment(cell)) {
            ProtectedRegionStore store = new ProtectedRegionStore();
            String carrier = regionProtector.protect(segment.raw(), store, chatId, false);
            String formatted = InlineFormatter.format(LatexEscaper.escapeCarrier(carrier, store));
            latex.append(PlaceholderRestorer.restore(formatted, store));
        }
        return latex.toString();
    }
}
