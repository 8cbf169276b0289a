package com.williamcallahan.articleserver.service.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.williamcallahan.articleserver.domain.ArticleMeta;
import com.williamcallahan.articleserver.domain.index.SkipReason;
import com.williamcallahan.articleserver.service.ArticleValidationException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Decodes an article's TOML metadata file into {@link ArticleMeta}.
 *
 * <p>Expects an {@code [article]} table. {@code markdown_path} names the markdown source and
 * {@code content_path} is accepted as an alias. {@code keywords} is optional.</p>
 */
@Component
public class ArticleMetadataReader {

    static final String ARTICLE_TABLE = "article";
    static final String FIELD_ID = "id";
    static final String FIELD_TITLE = "title";
    static final String FIELD_DESCRIPTION = "description";
    static final String FIELD_MARKDOWN_PATH = "markdown_path";
    static final String FIELD_CONTENT_PATH = "content_path";
    static final String FIELD_DATE = "date";
    static final String FIELD_TAGS = "tags";
    static final String FIELD_KEYWORDS = "keywords";
    static final String FIELD_METADATA = "metainfo";

    private static final int MIN_DATE = 10_000_000;
    private static final int MAX_DATE = 99_999_999;

    private final TomlMapper tomlMapper;

    public ArticleMetadataReader() {
        this.tomlMapper = new TomlMapper();
    }

    /**
     * Reads and decodes a metadata file.
     *
     * @param metadataFile path to the metadata file
     * @return decoded metadata
     * @throws ArticleValidationException {@link SkipReason#MISSING_METADATA} when the file is absent,
     *     {@link SkipReason#INVALID_FIELD} when it does not parse or a field is wrong
     * @throws UncheckedIOException when the file exists but cannot be read
     */
    public ArticleMeta read(Path metadataFile) {
        if (!Files.isRegularFile(metadataFile)) {
            throw new ArticleValidationException(
                    SkipReason.MISSING_METADATA, "Metadata file missing: " + metadataFile);
        }
        byte[] raw;
        try {
            raw = Files.readAllBytes(metadataFile);
        } catch (NoSuchFileException vanished) {
            throw new ArticleValidationException(
                    SkipReason.MISSING_METADATA, null, "Metadata file missing: " + metadataFile, vanished);
        } catch (IOException readFailure) {
            throw new UncheckedIOException("Failed to read " + metadataFile, readFailure);
        }
        return decode(raw);
    }

    /**
     * Decodes raw metadata bytes.
     *
     * @param raw TOML document bytes
     * @return decoded metadata
     * @throws ArticleValidationException when the document does not parse or a field is invalid
     */
    public ArticleMeta decode(byte[] raw) {
        JsonNode document;
        try {
            document = tomlMapper.readTree(raw);
        } catch (JsonProcessingException parseFailure) {
            throw new ArticleValidationException(
                    SkipReason.INVALID_FIELD, FIELD_METADATA,
                    "Metadata is not valid TOML: " + parseFailure.getOriginalMessage(), parseFailure);
        } catch (IOException readFailure) {
            throw new UncheckedIOException("Failed to decode metadata", readFailure);
        }

        JsonNode article = document == null ? null : document.get(ARTICLE_TABLE);
        if (article == null || !article.isObject()) {
            throw ArticleValidationException.invalidField(ARTICLE_TABLE, "Missing [article] table");
        }

        int id = requireInt(article, FIELD_ID);
        if (id < 0) {
            throw ArticleValidationException.invalidField(FIELD_ID, "'id' must be non-negative, got " + id);
        }
        int date = requireInt(article, FIELD_DATE);
        if (date < MIN_DATE || date > MAX_DATE) {
            throw ArticleValidationException.invalidField(FIELD_DATE, "'date' must be an 8-digit YYYYMMDD value, got " + date);
        }

        return new ArticleMeta(
                id,
                requireString(article, FIELD_TITLE),
                requireString(article, FIELD_DESCRIPTION),
                date,
                requireStringArray(article, FIELD_TAGS),
                optionalStringArray(article, FIELD_KEYWORDS),
                requireContentPath(article));
    }

    private String requireContentPath(JsonNode article) {
        String field = article.has(FIELD_MARKDOWN_PATH) || !article.has(FIELD_CONTENT_PATH)
                ? FIELD_MARKDOWN_PATH
                : FIELD_CONTENT_PATH;
        String contentPath = requireString(article, field);
        if (contentPath.isBlank()) {
            throw ArticleValidationException.invalidField(field, "'" + field + "' must not be blank");
        }
        Path relative = Path.of(contentPath).normalize();
        if (relative.isAbsolute() || relative.startsWith("..")) {
            throw ArticleValidationException.invalidField(
                    field, "'" + field + "' must stay inside the article directory: " + contentPath);
        }
        return contentPath;
    }

    private static int requireInt(JsonNode article, String field) {
        JsonNode value = article.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            throw ArticleValidationException.invalidField(field, "Missing or invalid '" + field + "'");
        }
        return value.intValue();
    }

    private static String requireString(JsonNode article, String field) {
        JsonNode value = article.get(field);
        if (value == null || !value.isTextual()) {
            throw ArticleValidationException.invalidField(field, "Missing or invalid '" + field + "'");
        }
        return value.textValue();
    }

    private static Set<String> requireStringArray(JsonNode article, String field) {
        if (!article.has(field)) {
            throw ArticleValidationException.invalidField(field, "Missing or invalid '" + field + "'");
        }
        return optionalStringArray(article, field);
    }

    private static Set<String> optionalStringArray(JsonNode article, String field) {
        JsonNode value = article.get(field);
        if (value == null) {
            return Set.of();
        }
        if (!value.isArray()) {
            throw ArticleValidationException.invalidField(field, "Missing or invalid '" + field + "'");
        }
        Set<String> values = new LinkedHashSet<>();
        for (JsonNode element : value) {
            if (!element.isTextual()) {
                throw ArticleValidationException.invalidField(field, "Invalid entry in '" + field + "'");
            }
            values.add(element.textValue());
        }
        return values;
    }
}
