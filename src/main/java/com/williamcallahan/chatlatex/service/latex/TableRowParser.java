package com.williamcallahan.chatlatex.service.latex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line-level helpers for pipe-delimited markdown tables.
 */
final class TableRowParser {

    private static final Pattern DELIMITER_CELL = Pattern.compile(":?-+:?");
    private static final char PIPE = '|';
    private static final char BACKSLASH = '\\';

    private TableRowParser() {
    }

    /**
     * A row candidate is any non-blank line containing an unescaped pipe outside inline code.
     */
    static boolean isTableRow(String line) {
        if (line == null || line.isBlank()) {
            return false;
        }
        return splitCells(line).size() > 1 || hasOuterPipe(line);
    }

    /**
     * A delimiter row holds only {@code ---}, {@code :--}, {@code --:} or {@code :-:} cells and
     * at least one pipe.
     */
    static boolean isDelimiterRow(String line) {
        if (line == null || line.indexOf(PIPE) < 0) {
            return false;
        }
        List<String> cells = splitCells(line);
        if (cells.isEmpty()) {
            return false;
        }
        for (String cell : cells) {
            if (!DELIMITER_CELL.matcher(cell).matches()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Splits a row into trimmed cells, dropping one leading and one trailing outer pipe.
     *
     * <p>Pipes inside a backtick code span or escaped as {@code \|} stay in the cell; the escape
     * backslash is removed.</p>
     *
     * @param line table row without line terminator
     * @return cells in column order
     */
    static List<String> splitCells(String line) {
        String row = line.trim();
        if (row.length() > 0 && row.charAt(0) == PIPE) {
            row = row.substring(1);
        }
        if (row.length() > 0 && row.charAt(row.length() - 1) == PIPE
            && (row.length() == 1 || row.charAt(row.length() - 2) != BACKSLASH)) {
            row = row.substring(0, row.length() - 1);
        }

        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        int cursor = 0;
        while (cursor < row.length()) {
            char current = row.charAt(cursor);
            if (current == '`') {
                int runLength = CodeFenceStateTracker.backtickRunLength(row, cursor);
                int closing = CodeFenceStateTracker.findClosingBacktickRun(row, cursor, runLength);
                if (closing >= 0) {
                    cell.append(row, cursor, closing + runLength);
                    cursor = closing + runLength;
                } else {
                    cell.append(row, cursor, cursor + runLength);
                    cursor += runLength;
                }
                continue;
            }
            if (current == BACKSLASH && cursor + 1 < row.length() && row.charAt(cursor + 1) == PIPE) {
                cell.append(PIPE);
                cursor += 2;
                continue;
            }
            if (current == PIPE) {
                cells.add(cell.toString().trim());
                cell.setLength(0);
                cursor++;
                continue;
            }
            cell.append(current);
            cursor++;
        }
        cells.add(cell.toString().trim());
        return cells;
    }

    private static boolean hasOuterPipe(String line) {
        String trimmed = line.trim();
        return trimmed.length() > 1 && trimmed.charAt(0) == PIPE;
    }
}
