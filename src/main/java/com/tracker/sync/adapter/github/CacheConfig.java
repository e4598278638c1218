package com.tracker.sync.adapter.github;

/**
 * Configuration for the issue lookup cache.
 *
 * @param maxSize    maximum number of entries
 * @param ttlSeconds time-to-live in seconds for each entry
 */
public record CacheConfig(int maxSize, int ttlSeconds) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default configuration: 10,000 entries, one hour, longer than any single pass.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 3600);
    }
}
