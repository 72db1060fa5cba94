package com.williamcallahan.chatlatex.service.latex;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class InlineFormatterTest {

    @Test
    void convertsBoldThenItalic() {
        assertEquals("\\textbf{bold} and \\textit{it}", InlineFormatter.format("**bold** and *it*"));
    }

    @Test
    void leavesArithmeticAsterisksAlone() {
        assertEquals("2 * 3 * 4", InlineFormatter.format("2 * 3 * 4"));
    }

    @Test
    void convertsIndentedBullets() {
        assertEquals("\\textbullet{} a\n  \\textbullet{} b", InlineFormatter.format("* a\n  + b"));
    }

    @Test
    void doesNotSpanLines() {
        assertEquals("**open\nclose**", InlineFormatter.format("**open\nclose**"));
    }
}
