package com.williamcallahan.chatlatex.service.latex;

import com.williamcallahan.chatlatex.domain.latex.Segment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a message into code block, table, horizontal rule and plain text segments.
 *
 * <p>Works line by line and keeps line terminators in each segment's raw text, so the raw texts
 * of the returned segments concatenate back to the input. An unclosed fence runs to the end of
 * the message.</p>
 */
final class MessageSegmenter {

    static final String HORIZONTAL_LINE_MARKER = "---HORIZONTAL-LINE---";

    private static final Pattern THEMATIC_BREAK = Pattern.compile("-{3,}|\\*{3,}|_{3,}");

    private MessageSegmenter() {
    }

    /**
     * Segments a message.
     *
     * @param message message text with LF line endings
     * @return ordered segments, empty for empty input
     */
    static List<Segment> segment(String message) {
        List<Segment> segments = new ArrayList<>();
        if (message == null || message.isEmpty()) {
            return segments;
        }
        List<String> lines = splitLines(message);
        StringBuilder plainText = new StringBuilder();
        int lineIndex = 0;
        while (lineIndex < lines.size()) {
            String line = lines.get(lineIndex);
            String content = withoutTerminator(line);

            CodeFenceStateTracker.FenceMarker opening = CodeFenceStateTracker.scanFenceLine(content);
            if (opening != null) {
                flushPlainText(plainText, segments);
                lineIndex = readCodeBlock(lines, lineIndex, opening, segments);
                continue;
            }
            if (isHorizontalRule(content)) {
                flushPlainText(plainText, segments);
                segments.add(Segment.horizontalRule(line));
                lineIndex++;
                continue;
            }
            if (lineIndex + 1 < lines.size()
                && TableRowParser.isTableRow(content)
                && TableRowParser.isDelimiterRow(withoutTerminator(lines.get(lineIndex + 1)))) {
                flushPlainText(plainText, segments);
                lineIndex = readTable(lines, lineIndex, segments);
                continue;
            }
            plainText.append(line);
            lineIndex++;
        }
        flushPlainText(plainText, segments);
        return segments;
    }

    static boolean isHorizontalRule(String lineContent) {
        String trimmed = lineContent.trim();
        return HORIZONTAL_LINE_MARKER.equals(trimmed) || THEMATIC_BREAK.matcher(trimmed).matches();
    }

    private static int readCodeBlock(
        List<String> lines,
        int openingIndex,
        CodeFenceStateTracker.FenceMarker opening,
        List<Segment> segments
    ) {
        CodeFenceStateTracker fenceTracker = new CodeFenceStateTracker();
        fenceTracker.enterFence(opening);
        StringBuilder raw = new StringBuilder(lines.get(openingIndex));
        List<String> codeLines = new ArrayList<>();
        int lineIndex = openingIndex + 1;
        while (lineIndex < lines.size() && fenceTracker.isInsideFence()) {
            String line = lines.get(lineIndex);
            String content = withoutTerminator(line);
            raw.append(line);
            if (fenceTracker.wouldCloseFence(CodeFenceStateTracker.scanFenceLine(content))) {
                fenceTracker.exitFence();
            } else {
                codeLines.add(content);
            }
            lineIndex++;
        }
        segments.add(Segment.codeBlock(raw.toString(), opening.language(), String.join("\n", codeLines)));
        return lineIndex;
    }

    private static int readTable(List<String> lines, int headerIndex, List<Segment> segments) {
        StringBuilder raw = new StringBuilder();
        List<String> tableLines = new ArrayList<>();
        int lineIndex = headerIndex;
        while (lineIndex < lines.size()) {
            String content = withoutTerminator(lines.get(lineIndex));
            boolean structuralRow = lineIndex <= headerIndex + 1;
            if (!structuralRow && !TableRowParser.isTableRow(content)) {
                break;
            }
            raw.append(lines.get(lineIndex));
            tableLines.add(content);
            lineIndex++;
        }
        segments.add(Segment.table(raw.toString(), String.join("\n", tableLines)));
        return lineIndex;
    }

    private static void flushPlainText(StringBuilder plainText, List<Segment> segments) {
        if (plainText.length() > 0) {
            segments.add(Segment.plainText(plainText.toString()));
            plainText.setLength(0);
        }
    }

    private static List<String> splitLines(String message) {
        List<String> lines = new ArrayList<>();
        int lineStart = 0;
        while (lineStart < message.length()) {
            int newline = message.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? message.length() : newline + 1;
            lines.add(message.substring(lineStart, lineEnd));
            lineStart = lineEnd;
        }
        return lines;
    }

    private static String withoutTerminator(String line) {
        return line.endsWith("\n") ? line.substring(0, line.length() - 1) : line;
    }
}
