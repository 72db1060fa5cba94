package com.williamcallahan.chatlatex.service.math;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import com.williamcallahan.chatlatex.config.AppProperties;
import com.williamcallahan.chatlatex.domain.latex.RgbColor;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MathImageSubstitutionServiceTest {

    private MathImageCache cache;
    private MathImageSubstitutionService substitution;

    @BeforeEach
    void setUp() {
        cache = mock(MathImageCache.class);
        substitution = new MathImageSubstitutionService(cache, new AppProperties());
    }

    @Test
    void replacesDisplayAndInlineFormulas() {
        given(cache.renderToFile(eq("E=mc^2"), eq(true), any(RgbColor.class), eq(200)))
            .willReturn(Optional.of(Path.of("/cache/formula_a.png")));
        given(cache.renderToFile(eq("x"), eq(false), any(RgbColor.class), eq(200)))
            .willReturn(Optional.of(Path.of("/cache/formula_b.png")));

        String text = substitution.substitute("See \\[ E=mc^2 \\] and \\(x\\).", "#ffffff", 0);

        assertEquals("See <img src=\"/cache/formula_a.png\"/> and <img src=\"/cache/formula_b.png\"/>.", text);
    }

    @Test
    void keepsLiteralWhenRenderingFails() {
        given(cache.renderToFile(anyString(), anyBoolean(), any(RgbColor.class), anyInt())).willReturn(Optional.empty());

        assertEquals("bad \\(\\frac{\\)", substitution.substitute("bad \\(\\frac{\\)", "#000000", 150));
    }

    @Test
    void usesRequestedColor() {
        RgbColor red = RgbColor.parse("#ff0000");
        given(cache.renderToFile("y", false, red, 120)).willReturn(Optional.of(Path.of("/c/y.png")));

        assertEquals("<img src=\"/c/y.png\"/>", substitution.substitute("\\(y\\)", "#ff0000", 120));
    }
}
