package com.williamcallahan.articleserver.service.index;

import static com.williamcallahan.articleserver.ArticleFixtures.writeArticle;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.articleserver.ArticleFixtures;
import com.williamcallahan.articleserver.config.AppProperties;
import com.williamcallahan.articleserver.domain.index.IndexBuildOutcome;
import com.williamcallahan.articleserver.domain.index.IndexSkip;
import com.williamcallahan.articleserver.domain.index.SkipReason;
import com.williamcallahan.articleserver.service.IndexUnavailableException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies directory scanning, per-article validation and skip reporting in {@link ArticleIndexBuilder}.
 */
class ArticleIndexBuilderTest {

    private static final int DATE = 20240101;

    @TempDir
    Path articlesRoot;

    private ArticleIndexBuilder indexBuilder;

    @BeforeEach
    void setUp() {
        indexBuilder = new ArticleIndexBuilder(new ArticleMetadataReader(), new AppProperties());
    }

    @Test
    void build_indexesEveryValidDirectoryUnderItsOwnId() throws IOException {
        writeArticle(articlesRoot, 1, DATE, List.of("a"), List.of());
        writeArticle(articlesRoot, 2, DATE, List.of("b"), List.of());
        writeArticle(articlesRoot, 30, DATE, List.of("c"), List.of());

        IndexBuildResult result = indexBuilder.build(articlesRoot);

        ArticleIndex index = result.index();
        assertEquals(3, index.size());
        for (int id : List.of(1, 2, 30)) {
            assertEquals(id, index.get(id).orElseThrow().id());
        }
        assertEquals("success", result.outcome().status());
        assertTrue(result.outcome().skipped().isEmpty());
    }

    @Test
    void build_skipsIdMismatchAndKeepsTheOthers() throws IOException {
        writeArticle(articlesRoot, 5, DATE, List.of("a"), List.of());
        writeArticle(articlesRoot, "6", 5, DATE, List.of("a"), List.of());
        writeArticle(articlesRoot, 7, DATE, List.of("a"), List.of());

        IndexBuildResult result = indexBuilder.build(articlesRoot);

        assertEquals(List.of(5, 7), List.copyOf(result.index().ids()));
        IndexBuildOutcome outcome = result.outcome();
        assertEquals("partial-success", outcome.status());
        assertEquals(2, outcome.indexed());
        assertEquals(1, outcome.skipped().size());
        IndexSkip skip = outcome.skipped().get(0);
        assertEquals("6", skip.idOrPath());
        assertEquals(SkipReason.ID_MISMATCH, skip.reason());
    }

    @Test
    void build_reportsMissingMetadata() throws IOException {
        Files.createDirectories(articlesRoot.resolve("3"));

        IndexBuildOutcome outcome = indexBuilder.build(articlesRoot).outcome();

        assertEquals(SkipReason.MISSING_METADATA, outcome.skipped().get(0).reason());
    }

    @Test
    void build_reportsMissingContentFile() throws IOException {
        Path articleDir = writeArticle(articlesRoot, 4, DATE, List.of("a"), List.of());
        Files.delete(articleDir.resolve(ArticleFixtures.MARKDOWN_FILE));

        IndexBuildResult result = indexBuilder.build(articlesRoot);

        assertFalse(result.index().contains(4));
        assertEquals(SkipReason.CONTENT_MISSING, result.outcome().skipped().get(0).reason());
    }

    @Test
    void build_reportsInvalidFieldWithFieldName() throws IOException {
        Path articleDir = Files.createDirectories(articlesRoot.resolve("8"));
        ArticleFixtures.writeMetadata(articleDir, "[article]\nid = 8\n");

        IndexSkip skip = indexBuilder.build(articlesRoot).outcome().skipped().get(0);

        assertEquals(SkipReason.INVALID_FIELD, skip.reason());
        assertTrue(skip.details().contains("date"), skip.details());
    }

    @Test
    void build_skipsDirectoriesThatAreNotIds() throws IOException {
        writeArticle(articlesRoot, 1, DATE, List.of("a"), List.of());
        Files.createDirectories(articlesRoot.resolve("drafts"));
        Files.createDirectories(articlesRoot.resolve("007"));

        IndexBuildResult result = indexBuilder.build(articlesRoot);

        assertEquals(1, result.index().size());
        assertEquals(2, result.outcome().skipped().size());
        assertTrue(result.outcome().skipped().stream()
                .allMatch(skip -> skip.reason() == SkipReason.INVALID_DIRECTORY_NAME));
    }

    @Test
    void build_ignoresLooseFilesInRoot() throws IOException {
        writeArticle(articlesRoot, 1, DATE, List.of("a"), List.of());
        Files.writeString(articlesRoot.resolve("README.md"), "notes");

        IndexBuildResult result = indexBuilder.build(articlesRoot);

        assertEquals(1, result.index().size());
        assertEquals("success", result.outcome().status());
    }

    @Test
    void build_visitsDirectoriesInAscendingIdOrder() throws IOException {
        writeArticle(articlesRoot, 10, DATE, List.of("shared"), List.of());
        writeArticle(articlesRoot, 2, DATE, List.of("shared"), List.of());
        writeArticle(articlesRoot, 9, DATE, List.of("shared"), List.of());

        ArticleIndex index = indexBuilder.build(articlesRoot).index();

        assertEquals(List.of(2, 9, 10), List.copyOf(index.idsForTag("shared")));
    }

    @Test
    void build_failsWhenRootIsMissing() {
        assertThrows(IndexUnavailableException.class, () -> indexBuilder.build(articlesRoot.resolve("missing")));
    }

    @Test
    void parseDirectoryId_acceptsOnlyCanonicalNonNegativeIntegers() {
        assertEquals(OptionalInt.of(0), ArticleIndexBuilder.parseDirectoryId("0"));
        assertEquals(OptionalInt.of(42), ArticleIndexBuilder.parseDirectoryId("42"));
        assertTrue(ArticleIndexBuilder.parseDirectoryId("-1").isEmpty());
        assertTrue(ArticleIndexBuilder.parseDirectoryId("042").isEmpty());
        assertTrue(ArticleIndexBuilder.parseDirectoryId("+4").isEmpty());
        assertTrue(ArticleIndexBuilder.parseDirectoryId("abc").isEmpty());
        assertTrue(ArticleIndexBuilder.parseDirectoryId("99999999999").isEmpty());
    }
}
