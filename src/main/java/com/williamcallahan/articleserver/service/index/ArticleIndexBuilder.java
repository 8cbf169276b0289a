package com.williamcallahan.articleserver.service.index;

import com.williamcallahan.articleserver.config.AppProperties;
import com.williamcallahan.articleserver.domain.ArticleMeta;
import com.williamcallahan.articleserver.domain.index.IndexBuildOutcome;
import com.williamcallahan.articleserver.domain.index.IndexSkip;
import com.williamcallahan.articleserver.domain.index.SkipReason;
import com.williamcallahan.articleserver.service.ArticleValidationException;
import com.williamcallahan.articleserver.service.IndexUnavailableException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scans the articles root and builds a new {@link ArticleIndex} from its immediate subdirectories.
 *
 * <p>Each subdirectory is one article named by its id. A directory that fails validation is
 * recorded as an {@link IndexSkip} and the scan continues; only an unreadable root aborts the build.
 * The builder never touches the published snapshot.</p>
 */
@Service
public class ArticleIndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(ArticleIndexBuilder.class);
    private static final Pattern CANONICAL_ID = Pattern.compile("0|[1-9][0-9]*");

    private final ArticleMetadataReader metadataReader;
    private final String metadataFileName;

    /**
     * Creates a builder reading metadata files with the configured name.
     *
     * @param metadataReader TOML metadata decoder
     * @param appProperties application configuration
     */
    public ArticleIndexBuilder(ArticleMetadataReader metadataReader, AppProperties appProperties) {
        this.metadataReader = Objects.requireNonNull(metadataReader, "metadataReader");
        this.metadataFileName = appProperties.getArticles().getMetadataFile();
    }

    /**
     * Builds an index from every article directory under {@code root}.
     *
     * @param root articles root directory
     * @return built index and validation report
     * @throws IndexUnavailableException if {@code root} is missing or cannot be listed
     */
    public IndexBuildResult build(Path root) {
        Objects.requireNonNull(root, "root");
        Path normalizedRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(normalizedRoot)) {
            throw new IndexUnavailableException("Articles directory does not exist: " + normalizedRoot);
        }

        ArticleIndex.Builder index = ArticleIndex.builder();
        List<IndexSkip> skipped = new ArrayList<>();

        for (Path articleDir : listArticleDirectories(normalizedRoot)) {
            String dirName = articleDir.getFileName().toString();
            OptionalInt parsedId = parseDirectoryId(dirName);
            if (parsedId.isEmpty()) {
                skip(skipped, articleDir.toString(), SkipReason.INVALID_DIRECTORY_NAME,
                        "Directory name is not an article id: " + dirName);
                continue;
            }
            int articleId = parsedId.getAsInt();
            try {
                index.add(validateArticleDirectory(articleDir, articleId));
            } catch (ArticleValidationException invalid) {
                skip(skipped, dirName, invalid.getReason(), describe(invalid));
            } catch (UncheckedIOException readFailure) {
                skip(skipped, dirName, SkipReason.IO_ERROR, readFailure.getMessage());
            }
        }

        IndexBuildOutcome outcome = IndexBuildOutcome.of(index.size(), normalizedRoot.toString(), skipped);
        log.info("Built article index from {}: {} indexed, {} skipped",
                normalizedRoot, outcome.indexed(), outcome.skipped().size());
        return new IndexBuildResult(index.build(), outcome);
    }

    /**
     * Validates one article directory with the same rules the scan applies.
     *
     * @param articleDir the article's directory
     * @param expectedId id the directory name denotes
     * @return validated metadata
     * @throws ArticleValidationException when metadata is missing or invalid, the id does not match,
     *     or the content file is missing
     * @throws UncheckedIOException when the metadata file exists but cannot be read
     */
    public ArticleMeta validateArticleDirectory(Path articleDir, int expectedId) {
        ArticleMeta meta = metadataReader.read(articleDir.resolve(metadataFileName));
        if (meta.id() != expectedId) {
            throw new ArticleValidationException(SkipReason.ID_MISMATCH,
                    "Metadata declares id " + meta.id() + " but directory is " + expectedId);
        }
        Path contentFile = articleDir.resolve(meta.contentPath()).normalize();
        if (!Files.isRegularFile(contentFile)) {
            throw new ArticleValidationException(SkipReason.CONTENT_MISSING,
                    "Content file missing: " + contentFile);
        }
        return meta;
    }

    /**
     * Returns the article id a directory name denotes, empty when it is not a canonical
     * non-negative integer (no sign, no leading zeros).
     */
    static OptionalInt parseDirectoryId(String dirName) {
        if (dirName == null || !CANONICAL_ID.matcher(dirName).matches()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(dirName));
        } catch (NumberFormatException overflow) {
            return OptionalInt.empty();
        }
    }

    private List<Path> listArticleDirectories(Path root) {
        List<Path> directories = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root, Files::isDirectory)) {
            entries.forEach(directories::add);
        } catch (IOException | DirectoryIteratorException listFailure) {
            throw new IndexUnavailableException("Failed to read articles directory " + root, listFailure);
        }
        // numeric ids first in ascending order, then non-id names alphabetically
        directories.sort(Comparator
                .comparingLong((Path dir) -> sortKey(dir.getFileName().toString()))
                .thenComparing(dir -> dir.getFileName().toString()));
        return directories;
    }

    private static long sortKey(String dirName) {
        OptionalInt id = parseDirectoryId(dirName);
        return id.isPresent() ? id.getAsInt() : Long.MAX_VALUE;
    }

    private static void skip(List<IndexSkip> skipped, String idOrPath, SkipReason reason, String details) {
        log.warn("Skipping article {} ({}): {}", idOrPath, reason, details);
        skipped.add(new IndexSkip(idOrPath, reason, details));
    }

    private static String describe(ArticleValidationException invalid) {
        if (invalid.getField() == null) {
            return invalid.getMessage();
        }
        return "Invalid field '" + invalid.getField() + "': " + invalid.getMessage();
    }
}
