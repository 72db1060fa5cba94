package com.williamcallahan.chatlatex.domain.latex;

/**
 * Horizontal alignment of a table column, derived from the markdown delimiter row.
 */
public enum ColumnAlignment {
    LEFT('l'),
    CENTER('c'),
    RIGHT('r');

    private final char columnSpec;

    ColumnAlignment(char columnSpec) {
        this.columnSpec = columnSpec;
    }

    /**
     * Returns the {@code tabular} column-spec letter for this alignment.
     */
    public char columnSpec() {
        return columnSpec;
    }

    /**
     * Reads a delimiter cell such as {@code ---}, {@code :--}, {@code --:} or {@code :-:}.
     *
     * @param delimiterCell trimmed delimiter cell text
     * @return alignment for the column, LEFT when the cell carries no colon hints
     */
    public static ColumnAlignment fromDelimiter(String delimiterCell) {
        if (delimiterCell == null) {
            return LEFT;
        }
        String trimmed = delimiterCell.trim();
        boolean leadingColon = trimmed.startsWith(":");
        boolean trailingColon = trimmed.length() > 1 && trimmed.endsWith(":");
        if (leadingColon && trailingColon) {
            return CENTER;
        }
        if (trailingColon) {
            return RIGHT;
        }
        return LEFT;
    }
}
