package com.williamcallahan.chatlatex.service.math;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.williamcallahan.chatlatex.config.AppProperties;
import com.williamcallahan.chatlatex.config.MathRenderConfig;
import com.williamcallahan.chatlatex.domain.latex.RgbColor;
import com.williamcallahan.chatlatex.domain.math.MathCacheClearOutcome;
import com.williamcallahan.chatlatex.domain.math.MathCacheStatsSnapshot;
import com.williamcallahan.chatlatex.service.ContentHasher;
import com.williamcallahan.chatlatex.service.FileOperationsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Two-tier cache in front of a {@link MathImageRenderer}: a bounded Caffeine map over a
 * directory of {@code formula_<hash>.png} files.
 *
 * <p>The key is the first 16 hex characters of the SHA-256 over expression, display flag, color
 * and resolution. Files are written through a temporary sibling and moved into place, so calls
 * for distinct keys never interfere and two writers of the same key leave one complete file.</p>
 */
@Service
public class MathImageCache {

    private static final Logger logger = LoggerFactory.getLogger(MathImageCache.class);
    private static final Duration MEMORY_TTL = Duration.ofMinutes(30);
    private static final String FILE_PREFIX = "formula_";
    private static final String FILE_SUFFIX = ".png";

    private final MathImageRenderer renderer;
    private final ContentHasher contentHasher;
    private final FileOperationsService fileOperations;
    private final Path cacheDirectory;
    private final Cache<String, byte[]> memoryCache;

    public MathImageCache(MathImageRenderer renderer, ContentHasher contentHasher,
                          FileOperationsService fileOperations, AppProperties appProperties) {
        MathRenderConfig mathConfig = appProperties.getMath();
        this.renderer = renderer;
        this.contentHasher = contentHasher;
        this.fileOperations = fileOperations;
        this.cacheDirectory = Path.of(mathConfig.getCacheDir());
        this.memoryCache = Caffeine.newBuilder()
            .maximumSize(mathConfig.getMemoryCacheSize())
            .expireAfterWrite(MEMORY_TTL)
            .recordStats()
            .build();
    }

    /**
     * Returns the PNG for a formula, rendering and storing it on a miss.
     *
     * @return a copy of the PNG bytes, empty when rendering fails
     */
    public Optional<byte[]> renderBytes(String expression, boolean display, RgbColor color, int dpi) {
        String key = cacheKey(expression, display, color, dpi);
        byte[] cached = memoryCache.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached.clone());
        }
        Path cacheFile = cacheFile(key);
        if (fileOperations.fileExists(cacheFile)) {
            try {
                byte[] stored = Files.readAllBytes(cacheFile);
                memoryCache.put(key, stored);
                return Optional.of(stored.clone());
            } catch (IOException readFailure) {
                logger.warn("Unreadable cached formula {}, rendering again: {}", cacheFile, readFailure.getMessage());
            }
        }
        Optional<byte[]> rendered = renderer.render(expression, display, color, dpi);
        rendered.ifPresent(png -> store(key, cacheFile, png.clone()));
        return rendered;
    }

    /**
     * Returns the cache file of a formula, rendering it on a miss.
     *
     * @return path of the PNG, empty when rendering fails
     */
    public Optional<Path> renderToFile(String expression, boolean display, RgbColor color, int dpi) {
        String key = cacheKey(expression, display, color, dpi);
        Path cacheFile = cacheFile(key);
        if (fileOperations.fileExists(cacheFile)) {
            return Optional.of(cacheFile);
        }
        Optional<byte[]> rendered = renderBytes(expression, display, color, dpi);
        if (rendered.isEmpty()) {
            return Optional.empty();
        }
        if (!fileOperations.fileExists(cacheFile)) {
            // memory hit for a file removed since it was cached
            try {
                fileOperations.writeAtomically(cacheFile, rendered.get());
            } catch (IOException writeFailure) {
                logger.warn("Could not write formula cache file {}: {}", cacheFile, writeFailure.getMessage());
                return Optional.empty();
            }
        }
        return Optional.of(cacheFile);
    }

    String cacheKey(String expression, boolean display, RgbColor color, int dpi) {
        return contentHasher.formulaKey(expression, display, color.toLatexRgb(), dpi);
    }

    Path cacheFile(String key) {
        return cacheDirectory.resolve(FILE_PREFIX + key + FILE_SUFFIX);
    }

    private void store(String key, Path cacheFile, byte[] png) {
        memoryCache.put(key, png);
        try {
            fileOperations.writeAtomically(cacheFile, png);
        } catch (IOException writeFailure) {
            logger.warn("Could not write formula cache file {}: {}", cacheFile, writeFailure.getMessage());
        }
    }

    /**
     * Reports memory tier statistics and the number of cached files.
     */
    public MathCacheStatsSnapshot stats() {
        CacheStats stats = memoryCache.stats();
        return new MathCacheStatsSnapshot(
            stats.hitCount(),
            stats.missCount(),
            stats.evictionCount(),
            memoryCache.estimatedSize(),
            countDiskEntries(),
            String.format(Locale.ROOT, "%.2f%%", stats.hitRate() * 100));
    }

    /**
     * Empties both tiers.
     *
     * @throws IOException when cached files cannot be listed or deleted
     */
    public MathCacheClearOutcome clear() throws IOException {
        long memoryEntries = memoryCache.estimatedSize();
        memoryCache.invalidateAll();
        int deleted = fileOperations.deleteMatching(cacheDirectory, FILE_PREFIX + "*" + FILE_SUFFIX);
        logger.info("Formula cache cleared ({} in memory, {} files)", memoryEntries, deleted);
        return MathCacheClearOutcome.success(memoryEntries, deleted);
    }

    private long countDiskEntries() {
        if (!Files.isDirectory(cacheDirectory)) {
            return 0;
        }
        long count = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(cacheDirectory, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path ignored : entries) {
                count++;
            }
        } catch (IOException listFailure) {
            logger.warn("Could not list formula cache {}: {}", cacheDirectory, listFailure.getMessage());
        }
        return count;
    }
}
