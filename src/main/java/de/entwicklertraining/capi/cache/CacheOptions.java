package de.entwicklertraining.capi.cache;

import java.time.Duration;

/**
 * Options applied by {@link CacheManager} on top of any backend.
 *
 * @param defaultTtl  TTL used when a caller passes none
 * @param maxSize     capacity used when the manager creates its own memory backend
 * @param enableETags whether ETags are kept next to cached payloads
 */
public record CacheOptions(Duration defaultTtl, int maxSize, boolean enableETags) {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    public static CacheOptions defaults() {
        return new CacheOptions(DEFAULT_TTL, MemoryCache.DEFAULT_MAX_SIZE, true);
    }
}
