package com.williamcallahan.chatlatex.service.latex;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.chatlatex.domain.latex.RegionKind;
import org.junit.jupiter.api.Test;

/**
 * Verifies where forced line breaks are and are not inserted.
 */
class NewlineNormalizerTest {

    private final ProtectedRegionStore store = new ProtectedRegionStore();

    @Test
    void breaksSingleNewlinesOnly() {
        assertEquals("a\\\\\nb\n\nc", NewlineNormalizer.normalize("a\nb\n\nc", store));
    }

    @Test
    void keepsExistingForcedBreak() {
        assertEquals("a\\\\\nb", NewlineNormalizer.normalize("a\\\\\nb", store));
    }

    @Test
    void skipsSectioningLines() {
        assertEquals("\\section*{X}\nb", NewlineNormalizer.normalize("\\section*{X}\nb", store));
    }

    @Test
    void skipsLinesEndingInDisplayBlocks() {
        String math = store.protect(RegionKind.DISPLAYMATH, "$$x$$", "$$x$$");
        String image = store.protect(RegionKind.IMAGE, "<img>", "\\textit{[Image unavailable]}");

        String text = "see " + math + "\nthen " + image + "\nend";

        assertEquals(text, NewlineNormalizer.normalize(text, store));
    }

    @Test
    void breaksAfterInlineRegions() {
        String code = store.protect(RegionKind.INLINECODE, "`x`", "\\lstinline|x|");

        assertEquals("run " + code + "\\\\\nnext", NewlineNormalizer.normalize("run " + code + "\nnext", store));
    }

    @Test
    void skipsLinesStartingWithHeader() {
        String header = store.protect(RegionKind.HEADER, "# T", "\\section*{T}");

        assertEquals(header + "\nbody", NewlineNormalizer.normalize(header + "\nbody", store));
    }
}
