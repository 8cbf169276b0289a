package com.williamcallahan.articleserver.service.index;

import static com.williamcallahan.articleserver.ArticleFixtures.meta;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.articleserver.domain.ArticleMeta;
import com.williamcallahan.articleserver.domain.ArticlePage;
import com.williamcallahan.articleserver.domain.TagCount;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies lookups, display ordering and pagination on {@link ArticleIndex}.
 */
class ArticleIndexTest {

    @Test
    void listAll_pagesNinetyFiveArticlesByTen() {
        ArticleIndex.Builder builder = ArticleIndex.builder();
        for (int id = 0; id < 95; id++) {
            builder.add(meta(id, 20240101));
        }
        ArticleIndex index = builder.build();

        assertEquals(10, index.pageCount(10));
        for (int page = 0; page <= 8; page++) {
            assertEquals(10, index.listAll(10, page).items().size(), "page " + page);
        }
        assertEquals(5, index.listAll(10, 9).items().size());
        ArticlePage pastEnd = index.listAll(10, 10);
        assertTrue(pastEnd.items().isEmpty());
        assertEquals(95, pastEnd.totalItems());
        assertEquals(10, pastEnd.totalPages());
    }

    @Test
    void listAllUnpaged_returnsEverythingWithTotalsAtPageSize() {
        ArticleIndex.Builder builder = ArticleIndex.builder();
        for (int id = 0; id < 25; id++) {
            builder.add(meta(id, 20240101));
        }
        ArticleIndex index = builder.build();

        ArticlePage all = index.listAllUnpaged(10);

        assertEquals(25, all.items().size());
        assertEquals(0, all.page());
        assertEquals(10, all.limit());
        assertEquals(3, all.totalPages());
        assertThrows(IllegalArgumentException.class, () -> index.listAllUnpaged(0));
    }

    @Test
    void unpagedTagAndKeywordListings_filterInDisplayOrder() {
        ArticleIndex index = ArticleIndex.builder()
                .add(meta(1, 20240101, List.of("java"), List.of("records")))
                .add(meta(2, 20240301, List.of("java"), List.of()))
                .add(meta(3, 20240201, List.of("rust"), List.of("records")))
                .build();

        assertEquals(List.of(2, 1), index.listByTagUnpaged("java", 1).items().stream().map(ArticleMeta::id).toList());
        assertEquals(2, index.listByTagUnpaged("java", 1).totalPages());
        assertEquals(List.of(3, 1),
                index.listByKeywordUnpaged("records", 10).items().stream().map(ArticleMeta::id).toList());
        assertTrue(index.listByKeywordUnpaged("unknown", 10).items().isEmpty());
        assertEquals(2, index.keywordPageCount("records", 1));
    }

    @Test
    void listAll_ordersByDateDescendingThenIdAscending() {
        ArticleIndex index = ArticleIndex.builder()
                .add(meta(3, 20230101))
                .add(meta(1, 20240101))
                .add(meta(2, 20240101))
                .add(meta(4, 20250101))
                .build();

        List<Integer> ids = index.listAll(10, 0).items().stream().map(ArticleMeta::id).toList();

        assertEquals(List.of(4, 1, 2, 3), ids);
    }

    @Test
    void listByTag_returnsOnlyTaggedArticlesInDisplayOrder() {
        ArticleIndex index = ArticleIndex.builder()
                .add(meta(1, 20240101, "java"))
                .add(meta(2, 20240301, "java", "jvm"))
                .add(meta(3, 20240201, "rust"))
                .build();

        ArticlePage page = index.listByTag("java", 10, 0);

        assertEquals(List.of(2, 1), page.items().stream().map(ArticleMeta::id).toList());
        assertEquals(1, index.tagPageCount("java", 10));
    }

    @Test
    void listByTag_returnsEmptyPageForUnknownTag() {
        ArticleIndex index = ArticleIndex.builder().add(meta(1, 20240101, "java")).build();

        ArticlePage page = index.listByTag("cobol", 10, 0);

        assertTrue(page.items().isEmpty());
        assertEquals(0, page.totalPages());
        assertEquals(0, index.tagPageCount("cobol", 10));
    }

    @Test
    void listByKeyword_matchesKeywordsOnly() {
        ArticleIndex index = ArticleIndex.builder()
                .add(meta(1, 20240101, List.of("java"), List.of("records")))
                .add(meta(2, 20240102, List.of("records"), List.of()))
                .build();

        ArticlePage page = index.listByKeyword("records", 10, 0);

        assertEquals(List.of(1), page.items().stream().map(ArticleMeta::id).toList());
        assertEquals(1, index.keywordPageCount("records", 10));
    }

    @Test
    void tags_countsArticlesPerTagInFirstSeenOrder() {
        ArticleIndex index = ArticleIndex.builder()
                .add(meta(1, 20240101, "java", "jvm"))
                .add(meta(2, 20240101, "java"))
                .build();

        assertEquals(List.of(new TagCount("java", 2), new TagCount("jvm", 1)), index.tags());
    }

    @Test
    void listAll_rejectsNonPositiveLimitAndNegativePage() {
        ArticleIndex index = ArticleIndex.builder().add(meta(1, 20240101)).build();

        assertThrows(IllegalArgumentException.class, () -> index.listAll(0, 0));
        assertThrows(IllegalArgumentException.class, () -> index.listAll(-5, 0));
        assertThrows(IllegalArgumentException.class, () -> index.listAll(10, -1));
        assertThrows(IllegalArgumentException.class, () -> index.pageCount(0));
    }

    @Test
    void pageCount_roundsUp() {
        assertEquals(0, ArticleIndex.pageCount(0, 10));
        assertEquals(1, ArticleIndex.pageCount(1, 10));
        assertEquals(1, ArticleIndex.pageCount(10, 10));
        assertEquals(2, ArticleIndex.pageCount(11, 10));
    }

    @Test
    void builder_rejectsDuplicateIds() {
        ArticleIndex.Builder builder = ArticleIndex.builder().add(meta(1, 20240101));

        assertThrows(IllegalStateException.class, () -> builder.add(meta(1, 20240202)));
    }

    @Test
    void empty_hasNoArticles() {
        ArticleIndex index = ArticleIndex.empty();

        assertEquals(0, index.size());
        assertTrue(index.get(0).isEmpty());
        assertEquals(0, index.pageCount(10));
    }
}
