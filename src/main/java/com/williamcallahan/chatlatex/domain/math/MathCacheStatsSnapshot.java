package com.williamcallahan.chatlatex.domain.math;

import java.util.Objects;

/**
 * Captures statistics of the formula bitmap cache.
 *
 * @param hitCount memory tier hits
 * @param missCount memory tier misses
 * @param evictionCount memory tier evictions
 * @param size entries held in memory
 * @param diskEntries bitmaps stored in the cache directory
 * @param hitRate memory hit rate formatted as a percentage
 */
public record MathCacheStatsSnapshot(
    long hitCount,
    long missCount,
    long evictionCount,
    long size,
    long diskEntries,
    String hitRate
) {
    public MathCacheStatsSnapshot {
        Objects.requireNonNull(hitRate, "Hit rate string cannot be null");
        if (hitCount < 0 || missCount < 0 || evictionCount < 0 || size < 0 || diskEntries < 0) {
            throw new IllegalArgumentException("Cache stats must be non-negative");
        }
    }
}
