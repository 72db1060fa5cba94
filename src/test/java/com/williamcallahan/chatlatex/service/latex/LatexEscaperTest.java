package com.williamcallahan.chatlatex.service.latex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.williamcallahan.chatlatex.domain.latex.RegionKind;
import org.junit.jupiter.api.Test;

class LatexEscaperTest {

    @Test
    void escapesMetaCharacters() {
        assertEquals("a\\_b\\{c\\} \\# \\& \\% \\$", LatexEscaper.escape("a_b{c} # & % $"));
        assertEquals("\\textasciitilde{}\\textasciicircum{}\\textbackslash{}", LatexEscaper.escape("~^\\"));
        assertEquals("\\textless{}tag\\textgreater{} \\textbar{}", LatexEscaper.escape("<tag> |"));
    }

    @Test
    void foldsTypographicPunctuation() {
        assertEquals("``quoted'' \\textemdash{} it's", LatexEscaper.escape("“quoted” — it’s"));
    }

    @Test
    void returnsSameInstanceWhenNothingToEscape() {
        String plain = "nothing special here";

        assertSame(plain, LatexEscaper.escape(plain));
    }

    @Test
    void carrierEscapingSkipsPlaceholders() {
        ProtectedRegionStore store = new ProtectedRegionStore();
        String placeholder = store.protect(RegionKind.INLINECODE, "`x`", "\\lstinline|x|");

        assertEquals("50\\% " + placeholder + " a\\_b", LatexEscaper.escapeCarrier("50% " + placeholder + " a_b", store));
    }
}
