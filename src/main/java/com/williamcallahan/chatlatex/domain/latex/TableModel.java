package com.williamcallahan.chatlatex.domain.latex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsed markdown table with every row normalized to the header width.
 *
 * @param headers header cells
 * @param alignments one alignment per header column
 * @param rows body rows, each exactly {@code headers.size()} cells wide
 */
public record TableModel(List<String> headers, List<ColumnAlignment> alignments, List<List<String>> rows) {

    public TableModel {
        Objects.requireNonNull(headers, "Table headers cannot be null");
        Objects.requireNonNull(alignments, "Table alignments cannot be null");
        Objects.requireNonNull(rows, "Table rows cannot be null");
        int width = headers.size();
        alignments = List.copyOf(fitToWidth(alignments, width, ColumnAlignment.LEFT));
        List<List<String>> normalizedRows = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            normalizedRows.add(List.copyOf(fitToWidth(row, width, "")));
        }
        headers = List.copyOf(headers);
        rows = List.copyOf(normalizedRows);
    }

    /**
     * Returns the number of columns, which is the header width.
     */
    public int columnCount() {
        return headers.size();
    }

    /**
     * Builds the {@code tabular} column specification, one letter per column.
     */
    public String columnSpec() {
        StringBuilder spec = new StringBuilder(alignments.size());
        for (ColumnAlignment alignment : alignments) {
            spec.append(alignment.columnSpec());
        }
        return spec.toString();
    }

    private static <T> List<T> fitToWidth(List<T> cells, int width, T filler) {
        List<T> fitted = new ArrayList<>(width);
        for (int columnIndex = 0; columnIndex < width; columnIndex++) {
            fitted.add(columnIndex < cells.size() && cells.get(columnIndex) != null ? cells.get(columnIndex) : filler);
        }
        return fitted;
    }
}
