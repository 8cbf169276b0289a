package com.williamcallahan.articleserver.service.cache;

import static com.williamcallahan.articleserver.ArticleFixtures.meta;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.articleserver.domain.Article;
import com.williamcallahan.articleserver.domain.CacheStatistics;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies capacity, recency and statistics behavior of {@link ArticleRenderCache}.
 */
class ArticleRenderCacheTest {

    private CacheStatsRecorder statsRecorder;
    private ArticleRenderCache cache;

    @BeforeEach
    void setUp() {
        statsRecorder = new CacheStatsRecorder(true);
        cache = new ArticleRenderCache(3, statsRecorder);
    }

    @Test
    void put_neverExceedsCapacity() {
        for (int id = 0; id < 10; id++) {
            cache.put(id, article(id));
            assertTrue(cache.size() <= cache.capacity(), "size after inserting " + id);
        }

        assertEquals(3, cache.size());
        assertFalse(cache.contains(6));
        assertTrue(cache.contains(7) && cache.contains(8) && cache.contains(9));
    }

    @Test
    void get_protectsEntryFromNextEviction() {
        cache.put(1, article(1));
        cache.put(2, article(2));
        cache.put(3, article(3));

        cache.get(1);
        cache.put(4, article(4));

        assertTrue(cache.contains(1));
        assertFalse(cache.contains(2));

        cache.put(5, article(5));
        assertFalse(cache.contains(3));
        assertTrue(cache.contains(1));

        cache.put(6, article(6));
        assertFalse(cache.contains(1));
    }

    @Test
    void put_overwritingExistingEntryMarksItRecentWithoutEvicting() {
        cache.put(1, article(1));
        cache.put(2, article(2));
        cache.put(3, article(3));

        Article replacement = article(1);
        cache.put(1, replacement);

        assertEquals(3, cache.size());
        cache.put(4, article(4));
        cache.put(5, article(5));

        assertFalse(cache.contains(2));
        assertFalse(cache.contains(3));
        assertSame(replacement, cache.get(1).orElseThrow());
    }

    @Test
    void get_recordsHitsAndMisses() {
        cache.get(1);
        cache.put(1, article(1));
        cache.get(1);

        CacheStatistics stats = statsRecorder.snapshot();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(50.0, stats.hitRate());
    }

    @Test
    void getUncounted_leavesStatisticsAlone() {
        cache.put(1, article(1));

        assertTrue(cache.getUncounted(1).isPresent());
        assertTrue(cache.getUncounted(2).isEmpty());

        assertEquals(0, statsRecorder.snapshot().hitCount());
        assertEquals(0, statsRecorder.snapshot().missCount());
    }

    @Test
    void contains_doesNotTouchRecencyOrStatistics() {
        cache.put(1, article(1));
        cache.put(2, article(2));
        cache.put(3, article(3));

        assertTrue(cache.contains(1));
        cache.put(4, article(4));

        assertFalse(cache.contains(1));
        assertEquals(0, statsRecorder.snapshot().hitCount());
    }

    @Test
    void putIf_skipsInsertWhenConditionFails() {
        assertFalse(cache.putIf(1, article(1), () -> false));
        assertFalse(cache.contains(1));

        assertTrue(cache.putIf(1, article(1), () -> true));
        assertTrue(cache.contains(1));
    }

    @Test
    void putIf_replacesExistingEntryWhenConditionHolds() {
        cache.put(1, article(1));
        Article replacement = article(1);

        assertTrue(cache.putIf(1, replacement, () -> true));

        assertSame(replacement, cache.getUncounted(1).orElseThrow());
    }

    @Test
    void putIfAbsent_keepsExistingEntry() {
        Article existing = article(1);
        cache.put(1, existing);

        assertFalse(cache.putIfAbsent(1, article(1), () -> true));

        assertSame(existing, cache.getUncounted(1).orElseThrow());
    }

    @Test
    void putIfAbsent_evaluatesConditionUnderCacheLock() throws Exception {
        CountDownLatch insideCondition = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Thread writer = new Thread(() -> cache.putIfAbsent(1, article(1), () -> {
            insideCondition.countDown();
            awaitQuietly(release);
            return true;
        }));
        writer.start();
        assertTrue(insideCondition.await(5, TimeUnit.SECONDS));

        Thread invalidator = new Thread(() -> cache.invalidate(1));
        invalidator.start();
        awaitParked(invalidator);
        assertTrue(invalidator.isAlive());
        release.countDown();
        writer.join(5_000);
        invalidator.join(5_000);

        // the invalidation waited for the insert and removed it
        assertFalse(cache.contains(1));
    }

    @Test
    void invalidate_isIdempotent() {
        cache.put(1, article(1));

        assertTrue(cache.invalidate(1));
        assertFalse(cache.invalidate(1));
        assertFalse(cache.contains(1));
    }

    @Test
    void clear_removesEntriesButKeepsStatistics() {
        cache.put(1, article(1));
        cache.put(2, article(2));
        cache.get(1);
        cache.get(5);

        assertEquals(2, cache.clear());

        assertEquals(0, cache.size());
        CacheStatistics stats = statsRecorder.snapshot();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ArticleRenderCache(0, statsRecorder));
    }

    private static void awaitParked(Thread thread) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (thread.getState() != Thread.State.WAITING && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(Thread.State.WAITING, thread.getState());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Article article(int id) {
        return new Article(meta(id, 20240101), "<p>article " + id + "</p>");
    }
}
