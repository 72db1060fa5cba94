package com.williamcallahan.chatlatex.domain.latex;

import java.util.Objects;

/**
 * One typed, non-overlapping chunk of a chat message.
 *
 * <p>The {@code raw} text is exactly the slice of the message this segment covers, so
 * concatenating the raw text of every segment reproduces the message. {@code body} is the
 * payload the renderer works on: the code between the fences, the table lines, or the raw
 * text itself for plain text and rules.</p>
 *
 * @param kind segment classification
 * @param raw exact source slice, including fences and line terminators
 * @param language fence language tag, empty when absent or not a code block
 * @param body content the renderer consumes
 */
public record Segment(SegmentKind kind, String raw, String language, String body) {

    public Segment {
        Objects.requireNonNull(kind, "Segment kind cannot be null");
        Objects.requireNonNull(raw, "Segment raw text cannot be null");
        language = language == null ? "" : language;
        body = body == null ? raw : body;
    }

    /**
     * Creates a plain text segment whose body is its raw text.
     *
     * @param raw source slice
     * @return plain text segment
     */
    public static Segment plainText(String raw) {
        return new Segment(SegmentKind.PLAIN_TEXT, raw, "", raw);
    }

    /**
     * Creates a horizontal rule segment.
     *
     * @param raw source slice containing the rule marker
     * @return horizontal rule segment
     */
    public static Segment horizontalRule(String raw) {
        return new Segment(SegmentKind.HORIZONTAL_RULE, raw, "", "");
    }

    /**
     * Creates a fenced code block segment.
     *
     * @param raw source slice including both fences
     * @param language language tag after the opening fence
     * @param code code between the fences, without the final line terminator
     * @return code block segment
     */
    public static Segment codeBlock(String raw, String language, String code) {
        return new Segment(SegmentKind.CODE_BLOCK, raw, language, code);
    }

    /**
     * Creates a table segment.
     *
     * @param raw source slice covering every table line
     * @param tableLines table lines joined by newlines, without a trailing terminator
     * @return table segment
     */
    public static Segment table(String raw, String tableLines) {
        return new Segment(SegmentKind.TABLE, raw, "", tableLines);
    }

    public boolean isPlainText() {
        return kind == SegmentKind.PLAIN_TEXT;
    }
}
