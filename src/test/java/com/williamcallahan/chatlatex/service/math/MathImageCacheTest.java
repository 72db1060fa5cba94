package com.williamcallahan.chatlatex.service.math;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.williamcallahan.chatlatex.config.AppProperties;
import com.williamcallahan.chatlatex.domain.latex.RgbColor;
import com.williamcallahan.chatlatex.domain.math.MathCacheClearOutcome;
import com.williamcallahan.chatlatex.domain.math.MathCacheStatsSnapshot;
import com.williamcallahan.chatlatex.service.ContentHasher;
import com.williamcallahan.chatlatex.service.FileOperationsService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies the memory and disk tiers of the formula cache.
 */
class MathImageCacheTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};

    @TempDir
    Path cacheDir;

    private MathImageRenderer renderer;
    private AppProperties appProperties;
    private MathImageCache cache;

    @BeforeEach
    void setUp() {
        renderer = mock(MathImageRenderer.class);
        appProperties = new AppProperties();
        appProperties.getMath().setCacheDir(cacheDir.toString());
        cache = newCache();
    }

    @Test
    void callersCannotCorruptCachedBytes() {
        given(renderer.render("z", false, RgbColor.WHITE, 200)).willReturn(Optional.of(PNG.clone()));

        cache.renderBytes("z", false, RgbColor.WHITE, 200).orElseThrow()[0] = 0;
        byte[] served = cache.renderBytes("z", false, RgbColor.WHITE, 200).orElseThrow();
        served[1] = 0;

        assertArrayEquals(PNG, cache.renderBytes("z", false, RgbColor.WHITE, 200).orElseThrow());
    }

    @Test
    void rendersOnceThenServesFromMemory() {
        given(renderer.render("x^2", false, RgbColor.WHITE, 200)).willReturn(Optional.of(PNG));

        assertArrayEquals(PNG, cache.renderBytes("x^2", false, RgbColor.WHITE, 200).orElseThrow());
        assertArrayEquals(PNG, cache.renderBytes("x^2", false, RgbColor.WHITE, 200).orElseThrow());

        verify(renderer, times(1)).render(anyString(), anyBoolean(), any(RgbColor.class), anyInt());
        MathCacheStatsSnapshot stats = cache.stats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(1, stats.diskEntries());
    }

    @Test
    void freshInstanceReadsDiskTier() {
        given(renderer.render("y", true, RgbColor.WHITE, 200)).willReturn(Optional.of(PNG));
        cache.renderBytes("y", true, RgbColor.WHITE, 200);

        MathImageCache restarted = newCache();

        assertArrayEquals(PNG, restarted.renderBytes("y", true, RgbColor.WHITE, 200).orElseThrow());
        verify(renderer, times(1)).render(anyString(), anyBoolean(), any(RgbColor.class), anyInt());
    }

    @Test
    void keyDependsOnEveryInput() {
        String key = cache.cacheKey("x", false, RgbColor.WHITE, 200);

        assertEquals(16, key.length());
        assertNotEquals(key, cache.cacheKey("x", true, RgbColor.WHITE, 200));
        assertNotEquals(key, cache.cacheKey("x", false, RgbColor.parse("#000000"), 200));
        assertNotEquals(key, cache.cacheKey("x", false, RgbColor.WHITE, 300));
    }

    @Test
    void failedRenderIsNotCached() {
        given(renderer.render(anyString(), anyBoolean(), any(RgbColor.class), anyInt())).willReturn(Optional.empty());

        assertTrue(cache.renderBytes("\\broken{", false, RgbColor.WHITE, 200).isEmpty());
        assertTrue(cache.renderToFile("\\broken{", false, RgbColor.WHITE, 200).isEmpty());
        assertEquals(0, cache.stats().diskEntries());
    }

    @Test
    void renderToFileRewritesDeletedFile() throws Exception {
        given(renderer.render("z", false, RgbColor.WHITE, 200)).willReturn(Optional.of(PNG));
        Path file = cache.renderToFile("z", false, RgbColor.WHITE, 200).orElseThrow();
        Files.delete(file);

        Path again = cache.renderToFile("z", false, RgbColor.WHITE, 200).orElseThrow();

        assertEquals(file, again);
        assertArrayEquals(PNG, Files.readAllBytes(again));
        assertTrue(file.getFileName().toString().startsWith("formula_"));
        verify(renderer, times(1)).render(anyString(), anyBoolean(), any(RgbColor.class), anyInt());
    }

    @Test
    void clearEmptiesBothTiers() throws Exception {
        given(renderer.render("a", false, RgbColor.WHITE, 200)).willReturn(Optional.of(PNG));
        cache.renderBytes("a", false, RgbColor.WHITE, 200);
        Files.writeString(cacheDir.resolve("unrelated.txt"), "keep");

        MathCacheClearOutcome outcome = cache.clear();

        assertEquals(1, outcome.memoryEntriesCleared());
        assertEquals(1, outcome.diskFilesDeleted());
        assertTrue(Files.exists(cacheDir.resolve("unrelated.txt")));
        cache.renderBytes("a", false, RgbColor.WHITE, 200);
        verify(renderer, times(2)).render(anyString(), anyBoolean(), any(RgbColor.class), anyInt());
    }

    @Test
    void blankExpressionNeverReachesRendererThroughSubstitution() {
        MathImageSubstitutionService substitution = new MathImageSubstitutionService(cache, appProperties);

        assertEquals("\\( \\)", substitution.substitute("\\( \\)", "#fff", 0));
        verify(renderer, never()).render(anyString(), anyBoolean(), any(RgbColor.class), anyInt());
    }

    private MathImageCache newCache() {
        return new MathImageCache(renderer, new ContentHasher(), new FileOperationsService(), appProperties);
    }
}
