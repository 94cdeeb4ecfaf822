package de.entwicklertraining.capi.cache;

/**
 * Snapshot of the counters of a {@link CacheManager}.
 */
public record CacheStats(long hits, long misses, long sets) {

    /**
     * @return hits / (hits + misses), or 0 if nothing was looked up yet
     */
    public double hitRate() {
        long total = hits + misses;
        if (total == 0) {
            return 0.0;
        }
        return (double) hits / total;
    }
}
