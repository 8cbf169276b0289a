package com.williamcallahan.articleserver.web;

import com.williamcallahan.articleserver.service.ArticleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint reporting index and cache sizes.
 */
@RestController
public class HealthController {

    private final ArticleService articleService;

    public HealthController(ArticleService articleService) {
        this.articleService = articleService;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.healthy(
                articleService.indexedCount(),
                articleService.cachedCount(),
                articleService.cacheCapacity(),
                articleService.rendersInFlight()));
    }
}
