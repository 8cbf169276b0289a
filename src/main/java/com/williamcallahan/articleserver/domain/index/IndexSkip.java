package com.williamcallahan.articleserver.domain.index;

import java.util.Objects;

/**
 * Captures one article directory excluded from an index build, with enough context to fix it.
 *
 * @param idOrPath article id when the directory name parsed, otherwise the directory path
 * @param reason skip category
 * @param details human-readable diagnostic
 */
public record IndexSkip(String idOrPath, SkipReason reason, String details) {

    public IndexSkip {
        if (idOrPath == null || idOrPath.isBlank()) {
            throw new IllegalArgumentException("Skipped id or path is required");
        }
        Objects.requireNonNull(reason, "Skip reason is required");
        Objects.requireNonNull(details, "Skip details are required");
    }
}
