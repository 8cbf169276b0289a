package com.williamcallahan.articleserver.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable metadata for one article as declared by its metadata file.
 *
 * <p>Tags and keywords keep their declaration order; duplicates are dropped.</p>
 *
 * @param id non-negative article id, equal to the article's directory name
 * @param title display title
 * @param description short summary shown in listings
 * @param date publication date encoded as {@code YYYYMMDD}
 * @param tags display tags in declaration order
 * @param keywords search keywords in declaration order
 * @param contentPath markdown source path relative to the article directory
 */
public record ArticleMeta(
        int id,
        String title,
        String description,
        int date,
        Set<String> tags,
        Set<String> keywords,
        @JsonIgnore String contentPath) {

    public ArticleMeta {
        if (id < 0) {
            throw new IllegalArgumentException("Article id must be non-negative, got: " + id);
        }
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(contentPath, "contentPath");
        tags = orderedCopy(tags);
        keywords = orderedCopy(keywords);
    }

    private static Set<String> orderedCopy(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
