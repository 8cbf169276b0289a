package com.williamcallahan.articleserver.service;

import com.williamcallahan.articleserver.config.AppProperties;
import com.williamcallahan.articleserver.domain.Article;
import com.williamcallahan.articleserver.domain.ArticleMeta;
import com.williamcallahan.articleserver.domain.ArticlePage;
import com.williamcallahan.articleserver.domain.CacheStatistics;
import com.williamcallahan.articleserver.domain.TagCount;
import com.williamcallahan.articleserver.domain.index.IndexBuildOutcome;
import com.williamcallahan.articleserver.service.cache.ArticleRenderCache;
import com.williamcallahan.articleserver.service.cache.CacheStatsRecorder;
import com.williamcallahan.articleserver.service.cache.RenderCoalescer;
import com.williamcallahan.articleserver.service.index.ArticleIndex;
import com.williamcallahan.articleserver.service.index.ArticleIndexBuilder;
import com.williamcallahan.articleserver.service.index.ArticleIndexHolder;
import com.williamcallahan.articleserver.service.index.IndexBuildResult;
import jakarta.annotation.PostConstruct;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Serves article lookups and listings and carries out the admin operations on index and cache.
 *
 * <p>Every read works against one index snapshot taken at the start of the call, so a concurrent
 * rebuild never mixes two indexes into one answer. Content requests go through the render cache;
 * on a miss the load and render for an id runs once no matter how many requests are waiting on it.
 * Rebuilds are serialized with each other but never block readers.</p>
 */
@Service
public class ArticleService {
    private static final Logger log = LoggerFactory.getLogger(ArticleService.class);

    private final ArticleIndexHolder indexHolder;
    private final ArticleIndexBuilder indexBuilder;
    private final ArticleRenderCache renderCache;
    private final RenderCoalescer<Integer, Article> renderCoalescer;
    private final CacheStatsRecorder statsRecorder;
    private final ArticleContentLoader contentLoader;
    private final Path articlesRoot;
    private final int defaultPageSize;
    private final ReentrantLock rebuildLock = new ReentrantLock();

    /**
     * Creates the article service.
     *
     * @param indexHolder live index pointer
     * @param indexBuilder directory scanner
     * @param renderCache LRU cache of rendered articles
     * @param renderCoalescer per-id in-flight render registry
     * @param statsRecorder hit/miss counters
     * @param contentLoader markdown reader and renderer
     * @param appProperties application configuration
     */
    public ArticleService(
            ArticleIndexHolder indexHolder,
            ArticleIndexBuilder indexBuilder,
            ArticleRenderCache renderCache,
            RenderCoalescer<Integer, Article> renderCoalescer,
            CacheStatsRecorder statsRecorder,
            ArticleContentLoader contentLoader,
            AppProperties appProperties) {
        this.indexHolder = Objects.requireNonNull(indexHolder, "indexHolder");
        this.indexBuilder = Objects.requireNonNull(indexBuilder, "indexBuilder");
        this.renderCache = Objects.requireNonNull(renderCache, "renderCache");
        this.renderCoalescer = Objects.requireNonNull(renderCoalescer, "renderCoalescer");
        this.statsRecorder = Objects.requireNonNull(statsRecorder, "statsRecorder");
        this.contentLoader = Objects.requireNonNull(contentLoader, "contentLoader");
        this.articlesRoot = appProperties.getArticles().rootPath();
        this.defaultPageSize = appProperties.getArticles().getArticlesPerPage();
    }

    /**
     * Builds and publishes the first index. An unreadable articles root fails application startup.
     */
    @PostConstruct
    public void initializeIndex() {
        IndexBuildOutcome outcome = rebuildIndex();
        log.info("Initial article index ready: {} articles ({})", outcome.indexed(), outcome.status());
    }

    /**
     * Returns the article with its rendered content, from the cache when possible.
     *
     * @param id article id
     * @return rendered article
     * @throws ArticleNotFoundException if {@code id} is not indexed
     * @throws ArticleLoadException if the markdown cannot be read or rendered
     */
    public Article lookupArticle(int id) {
        ArticleMeta meta = indexHolder.current().get(id).orElseThrow(() -> new ArticleNotFoundException(id));

        Optional<Article> cached = renderCache.get(id);
        if (cached.isPresent()) {
            return cached.get();
        }
        return renderCoalescer.computeOnce(id, () -> renderCache.getUncounted(id).orElseGet(() -> loadAndCache(meta)));
    }

    /**
     * Returns the metadata for an indexed article without touching the render cache.
     *
     * @throws ArticleNotFoundException if {@code id} is not indexed
     */
    public ArticleMeta lookupMetadata(int id) {
        return indexHolder.current().get(id).orElseThrow(() -> new ArticleNotFoundException(id));
    }

    /**
     * Lists all articles, newest first.
     *
     * <p>Only when both {@code limit} and {@code page} are given is a single page returned.
     * Otherwise every article is returned, with {@code totalPages} computed from the configured
     * page size.</p>
     *
     * @param limit page size
     * @param page zero-based page
     * @return requested page, or the whole listing, with totals
     * @throws IllegalArgumentException if {@code limit <= 0} or {@code page < 0}
     */
    public ArticlePage listArticles(Integer limit, Integer page) {
        ArticleIndex index = indexHolder.current();
        if (limit == null || page == null) {
            return index.listAllUnpaged(defaultPageSize);
        }
        return index.listAll(limit, page);
    }

    /**
     * Lists articles carrying {@code tag}, newest first; an unknown tag yields an empty listing.
     * Paginated only when both {@code limit} and {@code page} are given.
     */
    public ArticlePage listByTag(String tag, Integer limit, Integer page) {
        ArticleIndex index = indexHolder.current();
        if (limit == null || page == null) {
            return index.listByTagUnpaged(tag, defaultPageSize);
        }
        return index.listByTag(tag, limit, page);
    }

    /**
     * Lists articles carrying {@code keyword}, newest first; an unknown keyword yields an empty
     * listing. Paginated only when both {@code limit} and {@code page} are given.
     */
    public ArticlePage listByKeyword(String keyword, Integer limit, Integer page) {
        ArticleIndex index = indexHolder.current();
        if (limit == null || page == null) {
            return index.listByKeywordUnpaged(keyword, defaultPageSize);
        }
        return index.listByKeyword(keyword, limit, page);
    }

    public int pageCount(Integer limit) {
        return indexHolder.current().pageCount(resolveLimit(limit));
    }

    public int tagPageCount(String tag, Integer limit) {
        return indexHolder.current().tagPageCount(tag, resolveLimit(limit));
    }

    public int keywordPageCount(String keyword, Integer limit) {
        return indexHolder.current().keywordPageCount(keyword, resolveLimit(limit));
    }

    public List<TagCount> listTags() {
        return indexHolder.current().tags();
    }

    /**
     * Re-reads and re-renders one article, replacing its cache entry.
     *
     * <p>The article's metadata is validated again with the rules the index build applies. When it
     * no longer validates the stale cache entry is dropped and the failure is reported. The
     * published index keeps its metadata until the next rebuild.</p>
     *
     * @param id article id
     * @return freshly rendered article
     * @throws ArticleNotFoundException if {@code id} is not indexed
     * @throws ArticleValidationException if the article directory no longer validates
     * @throws ArticleLoadException if the metadata or markdown cannot be read or rendered
     */
    public Article refreshArticle(int id) {
        if (!indexHolder.current().contains(id)) {
            throw new ArticleNotFoundException(id);
        }

        ArticleMeta freshMeta;
        try {
            freshMeta = indexBuilder.validateArticleDirectory(contentLoader.articleDirectory(id), id);
        } catch (ArticleValidationException invalid) {
            renderCache.invalidate(id);
            log.warn("Article {} failed validation on refresh ({}): {}", id, invalid.getReason(), invalid.getMessage());
            throw invalid;
        } catch (UncheckedIOException readFailure) {
            throw new ArticleLoadException("Failed to read metadata for article " + id, readFailure.getCause());
        }

        Article article = contentLoader.load(freshMeta);
        if (renderCache.putIf(id, article, () -> indexHolder.current().contains(id))) {
            log.info("Article {} refreshed in cache", id);
        } else {
            log.info("Article {} left the index during refresh, not cached", id);
        }
        return article;
    }

    /**
     * Empties the render cache. The index and the statistics are left unchanged.
     *
     * @return number of entries removed
     */
    public int clearCache() {
        int removed = renderCache.clear();
        log.info("Article cache cleared ({} entries removed)", removed);
        return removed;
    }

    /**
     * Rescans the articles root, publishes the new index, and drops cache entries for articles that
     * disappeared or whose metadata changed.
     *
     * @return indexed count and skipped directories
     * @throws IndexUnavailableException if the articles root cannot be read; the previous index stays live
     */
    public IndexBuildOutcome rebuildIndex() {
        rebuildLock.lock();
        try {
            IndexBuildResult result = indexBuilder.build(articlesRoot);
            ArticleIndex previous = indexHolder.publish(result.index());
            int invalidated = invalidateStaleEntries(previous, result.index());
            log.info("Published article index: {} indexed, {} skipped, {} cache entries invalidated",
                    result.outcome().indexed(), result.outcome().skipped().size(), invalidated);
            return result.outcome();
        } finally {
            rebuildLock.unlock();
        }
    }

    public CacheStatistics getStats() {
        return statsRecorder.snapshot();
    }

    /**
     * Zeroes the hit/miss counters. Cache contents are left unchanged.
     */
    public void resetStats() {
        statsRecorder.reset();
    }

    public int indexedCount() {
        return indexHolder.current().size();
    }

    public int cachedCount() {
        return renderCache.size();
    }

    public int cacheCapacity() {
        return renderCache.capacity();
    }

    public int rendersInFlight() {
        return renderCoalescer.inFlightCount();
    }

    private Article loadAndCache(ArticleMeta meta) {
        log.info("Article {} not cached, loading from filesystem", meta.id());
        Article article = contentLoader.load(meta);
        // cached only while the live index still holds the metadata this render was built from
        boolean cached = renderCache.putIfAbsent(
                meta.id(), article, () -> meta.equals(indexHolder.current().get(meta.id()).orElse(null)));
        if (!cached) {
            log.debug("Rendered article {} not cached, index or cache changed during load", meta.id());
        }
        return article;
    }

    private int invalidateStaleEntries(ArticleIndex previous, ArticleIndex next) {
        int invalidated = 0;
        for (Integer id : previous.ids()) {
            Optional<ArticleMeta> current = next.get(id);
            boolean stale = current.isEmpty() || !current.get().equals(previous.get(id).orElse(null));
            if (stale && renderCache.invalidate(id)) {
                invalidated++;
            }
        }
        return invalidated;
    }

    private int resolveLimit(Integer limit) {
        return limit == null ? defaultPageSize : limit;
    }
}
