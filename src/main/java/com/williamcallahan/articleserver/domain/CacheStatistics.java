package com.williamcallahan.articleserver.domain;

/**
 * Point-in-time view of render cache hit/miss counters.
 *
 * @param hitCount lookups served from the cache
 * @param missCount lookups that required a load and render
 * @param hitRate hit percentage in {@code [0, 100]}, zero when nothing was counted
 */
public record CacheStatistics(long hitCount, long missCount, double hitRate) {

    /**
     * Builds statistics from raw counters, deriving the hit rate.
     */
    public static CacheStatistics of(long hitCount, long missCount) {
        long total = hitCount + missCount;
        double hitRate = total == 0 ? 0.0 : (double) hitCount / total * 100.0;
        return new CacheStatistics(hitCount, missCount, hitRate);
    }
}
