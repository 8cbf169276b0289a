package com.williamcallahan.articleserver.web;

import com.williamcallahan.articleserver.service.ArticleService;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for reading articles and administering the article index and render cache.
 */
@RestController
@RequestMapping("/api/v1/articles")
public class ArticleController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(ArticleController.class);

    private final ArticleService articleService;

    public ArticleController(ArticleService articleService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.articleService = articleService;
    }

    /**
     * GET /api/v1/articles - Lists articles newest first
     */
    @GetMapping
    public ResponseEntity<ApiResponse> listArticles(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer page) {
        return createDataResponse(articleService.listArticles(limit, page));
    }

    /**
     * GET /api/v1/articles/pages - Number of pages at the given page size
     */
    @GetMapping("/pages")
    public ResponseEntity<ApiResponse> pageCount(@RequestParam(required = false) Integer limit) {
        return createDataResponse(Map.of("totalPages", articleService.pageCount(limit)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse> getArticle(@PathVariable int id) {
        return createDataResponse(articleService.lookupArticle(id));
    }

    @GetMapping("/tags")
    public ResponseEntity<ApiResponse> listTags() {
        return createDataResponse(articleService.listTags());
    }

    @GetMapping("/tags/{tag}")
    public ResponseEntity<ApiResponse> listByTag(
            @PathVariable String tag,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer page) {
        return createDataResponse(articleService.listByTag(tag, limit, page));
    }

    @GetMapping("/tags/{tag}/pages")
    public ResponseEntity<ApiResponse> tagPageCount(
            @PathVariable String tag,
            @RequestParam(required = false) Integer limit) {
        return createDataResponse(Map.of("totalPages", articleService.tagPageCount(tag, limit)));
    }

    @GetMapping("/keywords/{keyword}")
    public ResponseEntity<ApiResponse> listByKeyword(
            @PathVariable String keyword,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer page) {
        return createDataResponse(articleService.listByKeyword(keyword, limit, page));
    }

    @GetMapping("/keywords/{keyword}/pages")
    public ResponseEntity<ApiResponse> keywordPageCount(
            @PathVariable String keyword,
            @RequestParam(required = false) Integer limit) {
        return createDataResponse(Map.of("totalPages", articleService.keywordPageCount(keyword, limit)));
    }

    /**
     * POST /api/v1/articles/{id}/refresh - Re-reads and re-renders one article
     */
    @PostMapping("/{id}/refresh")
    public ResponseEntity<ApiResponse> refreshArticle(@PathVariable int id) {
        log.info("Refresh requested for article {}", id);
        return createDataResponse(articleService.refreshArticle(id));
    }

    /**
     * DELETE /api/v1/articles/cache - Empties the render cache
     */
    @DeleteMapping("/cache")
    public ResponseEntity<ApiResponse> clearCache() {
        int removed = articleService.clearCache();
        return createSuccessResponse(String.format("Article cache cleared (%d entries removed)", removed));
    }

    /**
     * POST /api/v1/articles/index/refresh - Rescans the articles directory
     */
    @PostMapping("/index/refresh")
    public ResponseEntity<ApiResponse> rebuildIndex() {
        log.info("Index rebuild requested");
        return createDataResponse(articleService.rebuildIndex());
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<ApiResponse> getCacheStats() {
        return createDataResponse(articleService.getStats());
    }

    @PostMapping("/cache/stats/reset")
    public ResponseEntity<ApiResponse> resetCacheStats() {
        articleService.resetStats();
        return createSuccessResponse("Article cache statistics reset");
    }
}
