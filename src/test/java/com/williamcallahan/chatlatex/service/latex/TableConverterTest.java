package com.williamcallahan.chatlatex.service.latex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.chatlatex.domain.latex.TableModel;
import java.util.List;
import org.junit.jupiter.api.Test;

class TableConverterTest {

    @Test
    void normalizesRowsToHeaderWidth() {
        TableModel table = TableConverter.parse("| a | b | c |\n|:--|:-:|--:|\n| 1 | 2 | 3 | 4 |\n| only |");

        assertEquals("lcr", table.columnSpec());
        assertEquals(List.of("1", "2", "3"), table.rows().get(0));
        assertEquals(List.of("only", "", ""), table.rows().get(1));
    }

    @Test
    void keepsEscapedPipesAndPipesInCode() {
        TableModel table = TableConverter.parse("| a | b |\n|---|---|\n| x \\| y | `p|q` |");

        assertEquals(List.of("x | y", "`p|q`"), table.rows().get(0));
    }

    @Test
    void rejectsTableWithoutDelimiter() {
        assertThrows(LatexProcessingException.class, () -> TableConverter.parse("| a |\n| b |"));
    }

    @Test
    void rendersCellsThroughGivenPipeline() {
        String latex = TableConverter.convert("| a |\n|---|\n| b |", cell -> cell.toUpperCase());

        assertEquals("\\par\\noindent\n\\begin{tabular}{l}\n\\hline\nA \\\\ \\hline\nB \\\\\n\\hline\n\\end{tabular}\\par\n", latex);
    }
}
