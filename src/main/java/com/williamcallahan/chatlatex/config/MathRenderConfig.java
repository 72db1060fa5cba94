package com.williamcallahan.chatlatex.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Formula bitmap rendering configuration.
 */
public class MathRenderConfig {

    private static final String LATEX_DEF = "latex";
    private static final String DVIPNG_DEF = "dvipng";
    private static final int DPI_DEF = 200;
    private static final String CACHE_DIR_DEF = "data/formula-cache";
    private static final int MEMORY_CACHE_DEF = 500;
    private static final Duration TIMEOUT_DEF = Duration.ofSeconds(30);
    private static final int MIN_POSITIVE = 1;
    private static final String LATEX_KEY = "app.math.latex-command";
    private static final String DVIPNG_KEY = "app.math.dvipng-command";
    private static final String DPI_KEY = "app.math.default-dpi";
    private static final String CACHE_DIR_KEY = "app.math.cache-dir";
    private static final String MEMORY_CACHE_KEY = "app.math.memory-cache-size";
    private static final String TIMEOUT_KEY = "app.math.render-timeout";
    private static final String BLANK_TEXT_FMT = "%s must not be blank.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private String latexCommand = LATEX_DEF;
    private String dvipngCommand = DVIPNG_DEF;
    private int defaultDpi = DPI_DEF;
    private String cacheDir = CACHE_DIR_DEF;
    private int memoryCacheSize = MEMORY_CACHE_DEF;
    private Duration renderTimeout = TIMEOUT_DEF;

    /**
     * Validates math rendering settings.
     */
    public void validateConfiguration() {
        requireText(LATEX_KEY, latexCommand);
        requireText(DVIPNG_KEY, dvipngCommand);
        requireText(CACHE_DIR_KEY, cacheDir);
        requirePositive(DPI_KEY, defaultDpi);
        requirePositive(MEMORY_CACHE_KEY, memoryCacheSize);
        if (renderTimeout == null || renderTimeout.isZero() || renderTimeout.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, TIMEOUT_KEY));
        }
    }

    public String getLatexCommand() { return latexCommand; }
    public void setLatexCommand(String latexCommand) { this.latexCommand = latexCommand; }

    public String getDvipngCommand() { return dvipngCommand; }
    public void setDvipngCommand(String dvipngCommand) { this.dvipngCommand = dvipngCommand; }

    public int getDefaultDpi() { return defaultDpi; }
    public void setDefaultDpi(int defaultDpi) { this.defaultDpi = defaultDpi; }

    public String getCacheDir() { return cacheDir; }
    public void setCacheDir(String cacheDir) { this.cacheDir = cacheDir; }

    public int getMemoryCacheSize() { return memoryCacheSize; }
    public void setMemoryCacheSize(int memoryCacheSize) { this.memoryCacheSize = memoryCacheSize; }

    public Duration getRenderTimeout() { return renderTimeout; }
    public void setRenderTimeout(Duration renderTimeout) { this.renderTimeout = renderTimeout; }

    private static void requireText(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_TEXT_FMT, key));
        }
    }

    private static void requirePositive(String key, int value) {
        if (value < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }
}
