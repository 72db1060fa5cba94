package com.williamcallahan.chatlatex.domain.math;

/**
 * Result of clearing the formula bitmap cache.
 *
 * @param status fixed "success" indicator
 * @param memoryEntriesCleared entries dropped from memory
 * @param diskFilesDeleted bitmap files removed from disk
 */
public record MathCacheClearOutcome(String status, long memoryEntriesCleared, int diskFilesDeleted) {

    public static MathCacheClearOutcome success(long memoryEntriesCleared, int diskFilesDeleted) {
        return new MathCacheClearOutcome("success", memoryEntriesCleared, diskFilesDeleted);
    }
}
