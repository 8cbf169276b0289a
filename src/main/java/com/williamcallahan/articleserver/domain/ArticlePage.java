package com.williamcallahan.articleserver.domain;

import java.util.List;

/**
 * One page of article summaries plus the paging totals needed to render navigation.
 *
 * @param items summaries on this page, empty when the page is past the end
 * @param page zero-based page index that was requested, 0 for an unpaginated listing
 * @param limit page size that was applied; for an unpaginated listing the configured page size
 * @param totalItems number of matching articles across all pages
 * @param totalPages {@code ceil(totalItems / limit)}
 */
public record ArticlePage(List<ArticleMeta> items, int page, int limit, int totalItems, int totalPages) {

    public ArticlePage {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
