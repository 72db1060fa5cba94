package com.williamcallahan.chatlatex.service.latex;

import com.williamcallahan.chatlatex.domain.latex.RegionKind;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Adds forced line breaks ({@code \\}) at single newlines of carrier text.
 *
 * <p>A line keeps its plain end when it is blank, is the last line, precedes a blank line,
 * already ends with a forced break, opens with a sectioning command, or ends with a display
 * block (display math or an image). Everything else would make {@code pdflatex} report
 * "There's no line here to end".</p>
 */
final class NewlineNormalizer {

    private static final String FORCED_BREAK = "\\\\";
    private static final Pattern SECTIONING_LINE =
        Pattern.compile("^\\s*\\\\(section|subsection|subsubsection|paragraph)\\*?\\{");

    private NewlineNormalizer() {
    }

    /**
     * Normalizes newlines in one plain-text chunk.
     *
     * @param text formatted carrier text; placeholders never contain newlines
     * @param store placeholders known to the current call
     * @return text with forced breaks added
     */
    static String normalize(String text, ProtectedRegionStore store) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String[] lines = text.split("\n", -1);
        StringBuilder normalized = new StringBuilder(text.length() + lines.length * 2);
        for (int lineIndex = 0; lineIndex < lines.length; lineIndex++) {
            String line = lines[lineIndex];
            normalized.append(line);
            boolean lastLine = lineIndex == lines.length - 1;
            if (!lastLine && needsForcedBreak(line, lines[lineIndex + 1], store)) {
                normalized.append(FORCED_BREAK);
            }
            if (!lastLine) {
                normalized.append('\n');
            }
        }
        return normalized.toString();
    }

    private static boolean needsForcedBreak(String line, String nextLine, ProtectedRegionStore store) {
        if (line.isBlank() || nextLine.isBlank()) {
            return false;
        }
        if (SECTIONING_LINE.matcher(line).find()) {
            return false;
        }
        String trimmed = line.stripTrailing();
        if (trimmed.endsWith(FORCED_BREAK)) {
            return false;
        }
        List<ProtectedRegionStore.TextToken> tokens = store.tokenize(line.strip());
        if (tokens.isEmpty()) {
            return true;
        }
        ProtectedRegionStore.TextToken first = tokens.get(0);
        if (first.isPlaceholder() && first.region().kind() == RegionKind.HEADER) {
            return false;
        }
        ProtectedRegionStore.TextToken last = tokens.get(tokens.size() - 1);
        if (last.isPlaceholder()) {
            RegionKind kind = last.region().kind();
            if (kind == RegionKind.DISPLAYMATH || kind == RegionKind.IMAGE || kind == RegionKind.HEADER) {
                return false;
            }
            return !last.region().latex().stripTrailing().endsWith(FORCED_BREAK);
        }
        return true;
    }
}
