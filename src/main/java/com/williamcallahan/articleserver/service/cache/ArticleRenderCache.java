package com.williamcallahan.articleserver.service.cache;

import com.williamcallahan.articleserver.domain.Article;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded least-recently-used cache of rendered articles.
 *
 * <p>Backed by an access-ordered {@link LinkedHashMap}: {@code get} and {@code put} move an entry
 * to the most-recent end and eviction removes the head, all in constant time under one short lock.
 * Lookups record hits and misses on the shared {@link CacheStatsRecorder}; {@link #clear()} leaves
 * the statistics alone.</p>
 */
public class ArticleRenderCache {
    private static final Logger log = LoggerFactory.getLogger(ArticleRenderCache.class);
    private static final Counter EVICTION_COUNTER = Metrics.counter("articles.cache.evictions");

    private final int capacity;
    private final CacheStatsRecorder statsRecorder;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<Integer, Article> entries;

    /**
     * Creates an empty cache.
     *
     * @param capacity maximum number of entries, must be positive
     * @param statsRecorder hit/miss recorder
     */
    public ArticleRenderCache(int capacity, CacheStatsRecorder statsRecorder) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.statsRecorder = Objects.requireNonNull(statsRecorder, "statsRecorder");
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    /**
     * Returns the cached article and marks it most recently used, or empty on a miss.
     */
    public Optional<Article> get(int id) {
        Article article;
        lock.lock();
        try {
            article = entries.get(id);
        } finally {
            lock.unlock();
        }
        if (article == null) {
            statsRecorder.recordMiss();
            log.debug("Render cache miss for article {}", id);
            return Optional.empty();
        }
        statsRecorder.recordHit();
        log.debug("Render cache hit for article {}", id);
        return Optional.of(article);
    }

    /**
     * Same as {@link #get(int)} but records neither a hit nor a miss. Used for the second look a
     * request takes after winning the in-flight registration, so one lookup is not counted twice.
     */
    public Optional<Article> getUncounted(int id) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(id));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts or replaces an entry and marks it most recently used, evicting the least recently
     * used entry when the cache is over capacity.
     */
    public void put(int id, Article article) {
        Objects.requireNonNull(article, "article");
        Integer evicted;
        lock.lock();
        try {
            evicted = insert(id, article);
        } finally {
            lock.unlock();
        }
        recordEviction(evicted);
    }

    /**
     * Inserts or replaces an entry only if {@code stillValid} holds. The condition is evaluated under
     * the cache lock, so an invalidation that follows a change of the condition cannot be overtaken
     * by this insert.
     *
     * @return true if the entry was stored
     */
    public boolean putIf(int id, Article article, BooleanSupplier stillValid) {
        return conditionalPut(id, article, stillValid, false);
    }

    /**
     * Like {@link #putIf} but also leaves an existing entry for {@code id} in place.
     *
     * @return true if the entry was stored
     */
    public boolean putIfAbsent(int id, Article article, BooleanSupplier stillValid) {
        return conditionalPut(id, article, stillValid, true);
    }

    private boolean conditionalPut(int id, Article article, BooleanSupplier stillValid, boolean onlyIfAbsent) {
        Objects.requireNonNull(article, "article");
        Objects.requireNonNull(stillValid, "stillValid");
        Integer evicted;
        lock.lock();
        try {
            if ((onlyIfAbsent && entries.containsKey(id)) || !stillValid.getAsBoolean()) {
                return false;
            }
            evicted = insert(id, article);
        } finally {
            lock.unlock();
        }
        recordEviction(evicted);
        return true;
    }

    // caller holds the lock; returns the evicted id or null
    private Integer insert(int id, Article article) {
        Integer evicted = null;
        entries.put(id, article);
        if (entries.size() > capacity) {
            Iterator<Integer> eldest = entries.keySet().iterator();
            evicted = eldest.next();
            eldest.remove();
        }
        if (entries.size() > capacity) {
            throw new IllegalStateException(
                    "Render cache holds " + entries.size() + " entries, capacity is " + capacity);
        }
        return evicted;
    }

    private static void recordEviction(Integer evicted) {
        if (evicted != null) {
            EVICTION_COUNTER.increment();
            log.debug("Evicted article {} from render cache", evicted);
        }
    }

    /**
     * Removes the entry for {@code id} if present.
     *
     * @return true if an entry was removed
     */
    public boolean invalidate(int id) {
        lock.lock();
        try {
            return entries.remove(id) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry. Statistics are not reset.
     *
     * @return number of entries removed
     */
    public int clear() {
        lock.lock();
        try {
            int removed = entries.size();
            entries.clear();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports whether {@code id} is cached without touching recency or statistics.
     */
    public boolean contains(int id) {
        lock.lock();
        try {
            return entries.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
