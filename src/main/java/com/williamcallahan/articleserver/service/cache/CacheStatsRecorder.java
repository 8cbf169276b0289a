package com.williamcallahan.articleserver.service.cache;

import com.williamcallahan.articleserver.config.AppProperties;
import com.williamcallahan.articleserver.domain.CacheStatistics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Counts render cache hits and misses.
 *
 * <p>The resettable counters back the stats API. Micrometer counters are incremented alongside
 * them and are never reset, so dashboards see lifetime totals.</p>
 */
@Component
public class CacheStatsRecorder {
    private static final Logger log = LoggerFactory.getLogger(CacheStatsRecorder.class);

    private static final Counter HIT_COUNTER = Metrics.counter("articles.cache.hits");
    private static final Counter MISS_COUNTER = Metrics.counter("articles.cache.misses");

    private final boolean enabled;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * Creates a recorder that counts only when {@code app.cache.record-stats} is enabled.
     *
     * @param appProperties application configuration
     */
    @Autowired
    public CacheStatsRecorder(AppProperties appProperties) {
        this(appProperties.getCache().isRecordStats());
    }

    CacheStatsRecorder(boolean enabled) {
        this.enabled = enabled;
        if (!enabled) {
            log.info("Cache statistics recording is disabled");
        }
    }

    public void recordHit() {
        if (enabled) {
            hits.incrementAndGet();
            HIT_COUNTER.increment();
        }
    }

    public void recordMiss() {
        if (enabled) {
            misses.incrementAndGet();
            MISS_COUNTER.increment();
        }
    }

    /**
     * Returns current counters with the derived hit rate. The two counters are read one after the
     * other, so a snapshot taken during heavy traffic may lag one of them by a few events.
     */
    public CacheStatistics snapshot() {
        return CacheStatistics.of(hits.get(), misses.get());
    }

    /**
     * Zeroes both counters. Every event is counted either before or after the reset, never lost.
     */
    public void reset() {
        long clearedHits = hits.getAndSet(0);
        long clearedMisses = misses.getAndSet(0);
        log.info("Cache statistics reset (cleared {} hits, {} misses)", clearedHits, clearedMisses);
    }
}
