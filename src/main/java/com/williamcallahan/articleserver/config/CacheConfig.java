package com.williamcallahan.articleserver.config;

import com.williamcallahan.articleserver.domain.Article;
import com.williamcallahan.articleserver.service.cache.ArticleRenderCache;
import com.williamcallahan.articleserver.service.cache.CacheStatsRecorder;
import com.williamcallahan.articleserver.service.cache.RenderCoalescer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the rendered-article cache and its miss-path coalescer.
 */
@Configuration
public class CacheConfig {
    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    /**
     * Creates cache configuration.
     */
    public CacheConfig() {}

    /**
     * Registers the LRU render cache sized from {@code app.cache.max-cached-articles}.
     *
     * @param appProperties application configuration
     * @param statsRecorder shared hit/miss recorder
     * @return render cache
     */
    @Bean
    public ArticleRenderCache articleRenderCache(AppProperties appProperties, CacheStatsRecorder statsRecorder) {
        int capacity = appProperties.getCache().getMaxCachedArticles();
        log.info("Article render cache capacity: {}", capacity);
        return new ArticleRenderCache(capacity, statsRecorder);
    }

    /**
     * Registers the per-article in-flight render registry.
     *
     * @return render coalescer keyed by article id
     */
    @Bean
    public RenderCoalescer<Integer, Article> articleRenderCoalescer() {
        return new RenderCoalescer<>();
    }
}
