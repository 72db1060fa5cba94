package com.williamcallahan.chatlatex.domain.latex;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class ColumnAlignmentTest {

    @Test
    void readsColonHints() {
        assertEquals(ColumnAlignment.LEFT, ColumnAlignment.fromDelimiter("---"));
        assertEquals(ColumnAlignment.LEFT, ColumnAlignment.fromDelimiter(":--"));
        assertEquals(ColumnAlignment.RIGHT, ColumnAlignment.fromDelimiter("--:"));
        assertEquals(ColumnAlignment.CENTER, ColumnAlignment.fromDelimiter(":-:"));
        assertEquals(ColumnAlignment.LEFT, ColumnAlignment.fromDelimiter(":"));
    }

    @Test
    void tableModelPadsAlignmentsToHeaderWidth() {
        TableModel table = new TableModel(List.of("a", "b", "c"), List.of(ColumnAlignment.RIGHT), List.of());

        assertEquals("rll", table.columnSpec());
        assertEquals(3, table.columnCount());
    }
}
