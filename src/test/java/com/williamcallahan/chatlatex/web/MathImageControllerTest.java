package com.williamcallahan.chatlatex.web;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.chatlatex.config.AppProperties;
import com.williamcallahan.chatlatex.domain.latex.RgbColor;
import com.williamcallahan.chatlatex.domain.math.MathCacheClearOutcome;
import com.williamcallahan.chatlatex.domain.math.MathCacheStatsSnapshot;
import com.williamcallahan.chatlatex.service.math.MathImageCache;
import com.williamcallahan.chatlatex.service.math.MathImageSubstitutionService;
import java.io.IOException;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Verifies formula bitmap and cache endpoints under WebMvcTest.
 */
@WebMvcTest(controllers = MathImageController.class)
@Import({AppProperties.class, ExceptionResponseBuilder.class})
class MathImageControllerTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    MathImageCache mathImageCache;

    @MockitoBean
    MathImageSubstitutionService substitutionService;

    @Test
    void rendersPngWithDefaultDpi() throws Exception {
        given(mathImageCache.renderBytes("x^2", true, RgbColor.parse("#ff0000"), 200)).willReturn(Optional.of(PNG));

        mockMvc.perform(post("/api/latex/math")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"expression\": \"x^2\", \"display\": true, \"color\": \"#ff0000\"}"))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.IMAGE_PNG))
            .andExpect(content().bytes(PNG));
    }

    @Test
    void failedRenderReturnsLiteralExpression() throws Exception {
        given(mathImageCache.renderBytes(anyString(), anyBoolean(), any(RgbColor.class), anyInt()))
            .willReturn(Optional.empty());

        mockMvc.perform(post("/api/latex/math")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"expression\": \"\\\\frac{1\", \"dpi\": 150}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.details").value("\\frac{1"));
    }

    @Test
    void blankExpressionIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/latex/math")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"expression\": \"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void substitutesFormulas() throws Exception {
        given(substitutionService.substitute(eq("see \\(x\\)"), eq("#000000"), eq(0)))
            .willReturn("see <img src=\"/c/f.png\"/>");

        mockMvc.perform(post("/api/latex/math/substitute")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\": \"see \\\\(x\\\\)\", \"color\": \"#000000\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.text").value("see <img src=\"/c/f.png\"/>"));
    }

    @Test
    void reportsCacheStats() throws Exception {
        given(mathImageCache.stats()).willReturn(new MathCacheStatsSnapshot(3, 1, 0, 2, 4, "75.00%"));

        mockMvc.perform(get("/api/latex/math/cache/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hitCount").value(3))
            .andExpect(jsonPath("$.diskEntries").value(4))
            .andExpect(jsonPath("$.hitRate").value("75.00%"));
    }

    @Test
    void clearsCache() throws Exception {
        given(mathImageCache.clear()).willReturn(MathCacheClearOutcome.success(2, 5));

        mockMvc.perform(post("/api/latex/math/cache/clear"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.message").value("Formula cache cleared: 2 in memory, 5 files"));
    }

    @Test
    void clearFailureIsServerError() throws Exception {
        given(mathImageCache.clear()).willThrow(new IOException("read-only"));

        mockMvc.perform(post("/api/latex/math/cache/clear"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message").value("Failed to clear formula cache"))
            .andExpect(jsonPath("$.details").value("IOException: read-only"));
    }
}
