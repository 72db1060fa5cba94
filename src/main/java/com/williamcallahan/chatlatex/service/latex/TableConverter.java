package com.williamcallahan.chatlatex.service.latex;

import com.williamcallahan.chatlatex.domain.latex.ColumnAlignment;
import com.williamcallahan.chatlatex.domain.latex.TableModel;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Converts a pipe table segment into a {@code tabular} environment.
 */
final class TableConverter {

    private static final String ROW_END = " \\\\";
    private static final String CELL_SEPARATOR = " & ";

    private TableConverter() {
    }

    /**
     * Parses table lines into a model whose rows all match the header width.
     *
     * @param tableLines header, delimiter and body lines joined by newlines
     * @return parsed table
     * @throws LatexProcessingException when the header or delimiter row is missing
     */
    static TableModel parse(String tableLines) {
        String[] lines = tableLines.split("\n");
        if (lines.length < 2 || !TableRowParser.isDelimiterRow(lines[1])) {
            throw new LatexProcessingException("Table block has no delimiter row");
        }
        List<String> headers = TableRowParser.splitCells(lines[0]);
        List<ColumnAlignment> alignments = new ArrayList<>();
        for (String delimiterCell : TableRowParser.splitCells(lines[1])) {
            alignments.add(ColumnAlignment.fromDelimiter(delimiterCell));
        }
        List<List<String>> rows = new ArrayList<>();
        for (int lineIndex = 2; lineIndex < lines.length; lineIndex++) {
            rows.add(TableRowParser.splitCells(lines[lineIndex]));
        }
        return new TableModel(headers, alignments, rows);
    }

    /**
     * Renders a table, running every cell through {@code cellRenderer}.
     *
     * @param tableLines raw table lines
     * @param cellRenderer inline pipeline for one cell
     * @return LaTeX for the table, ending with a newline
     */
    static String convert(String tableLines, UnaryOperator<String> cellRenderer) {
        TableModel table = parse(tableLines);
        StringBuilder latex = new StringBuilder(tableLines.length() * 2);
        latex.append("\\par\\noindent\n");
        latex.append("\\begin{tabular}{").append(table.columnSpec()).append("}\n");
        latex.append("\\hline\n");
        latex.append(renderRow(table.headers(), cellRenderer)).append(" \\hline\n");
        for (List<String> row : table.rows()) {
            latex.append(renderRow(row, cellRenderer)).append('\n');
        }
        latex.append("\\hline\n");
        latex.append("\\end{tabular}\\par\n");
        return latex.toString();
    }

    private static String renderRow(List<String> cells, UnaryOperator<String> cellRenderer) {
        List<String> renderedCells = new ArrayList<>(cells.size());
        for (String cell : cells) {
            renderedCells.add(cell.isEmpty() ? "" : cellRenderer.apply(cell));
        }
        return String.join(CELL_SEPARATOR, renderedCells) + ROW_END;
    }
}
