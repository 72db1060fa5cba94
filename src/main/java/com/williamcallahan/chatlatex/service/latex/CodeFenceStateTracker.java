package com.williamcallahan.chatlatex.service.latex;

/**
 * Tracks fenced code block state while a message is scanned line by line.
 *
 * <p>A fence is three or more backticks or tildes at the start of a line, optionally indented.
 * It closes on a later line holding only the same fence character, repeated at least as many
 * times as the opening fence. The same backtick-run helpers are used when table rows are split
 * so that a {@code |} inside inline code does not end a cell.</p>
 */
final class CodeFenceStateTracker {

    /** Minimum fence length for a valid code fence. */
    static final int FENCE_MIN_LENGTH = 3;

    private static final char BACKTICK = '`';
    private static final char TILDE = '~';

    private boolean inFence;
    private char fenceChar;
    private int fenceLength;

    /**
     * Describes a fence found at the start of a line.
     *
     * @param character the fence character (backtick or tilde)
     * @param length number of consecutive fence characters
     * @param infoString text after the fence characters, trimmed
     */
    record FenceMarker(char character, int length, String infoString) {

        /**
         * Returns the language tag: the first word of the info string, or empty.
         */
        String language() {
            int end = 0;
            while (end < infoString.length() && !Character.isWhitespace(infoString.charAt(end))) {
                end++;
            }
            return infoString.substring(0, end);
        }
    }

    /**
     * Scans a single line (without its terminator) for a fence marker.
     *
     * @param line line content
     * @return fence marker if the line opens or closes a fence, null otherwise
     */
    static FenceMarker scanFenceLine(String line) {
        if (line == null) {
            return null;
        }
        int start = 0;
        while (start < line.length() && (line.charAt(start) == ' ' || line.charAt(start) == '\t')) {
            start++;
        }
        if (start >= line.length()) {
            return null;
        }
        char markerChar = line.charAt(start);
        if (markerChar != BACKTICK && markerChar != TILDE) {
            return null;
        }
        int length = 0;
        while (start + length < line.length() && line.charAt(start + length) == markerChar) {
            length++;
        }
        if (length < FENCE_MIN_LENGTH) {
            return null;
        }
        String infoString = line.substring(start + length).trim();
        // "```inline``` text" is backtick-delimited prose, not a fence
        if (markerChar == BACKTICK && infoString.indexOf(BACKTICK) >= 0) {
            return null;
        }
        return new FenceMarker(markerChar, length, infoString);
    }

    /**
     * Counts the backticks starting at {@code index}.
     *
     * @param text source text
     * @param index position to scan from
     * @return run length, zero when the character is not a backtick
     */
    static int backtickRunLength(String text, int index) {
        int length = 0;
        while (index + length < text.length() && text.charAt(index + length) == BACKTICK) {
            length++;
        }
        return length;
    }

    /**
     * Finds the closing backtick run of exactly {@code runLength} after an opening run.
     *
     * @param text source text
     * @param startIndex position of the opening run
     * @param runLength length of the opening run
     * @return index of the closing run, or -1 when the span is unclosed
     */
    static int findClosingBacktickRun(String text, int startIndex, int runLength) {
        int scanIndex = startIndex + runLength;
        while (scanIndex < text.length()) {
            int nextBacktickIndex = text.indexOf(BACKTICK, scanIndex);
            if (nextBacktickIndex < 0) {
                return -1;
            }
            int matchLength = backtickRunLength(text, nextBacktickIndex);
            if (matchLength == runLength) {
                return nextBacktickIndex;
            }
            scanIndex = nextBacktickIndex + matchLength;
        }
        return -1;
    }

    boolean isInsideFence() {
        return inFence;
    }

    void enterFence(FenceMarker marker) {
        this.inFence = true;
        this.fenceChar = marker.character();
        this.fenceLength = marker.length();
    }

    void exitFence() {
        this.inFence = false;
        this.fenceChar = 0;
        this.fenceLength = 0;
    }

    /**
     * Checks if a marker closes the open fence: same character, at least as long, no info string.
     */
    boolean wouldCloseFence(FenceMarker marker) {
        return inFence
            && marker != null
            && marker.character() == fenceChar
            && marker.length() >= fenceLength
            && marker.infoString().isEmpty();
    }
}
