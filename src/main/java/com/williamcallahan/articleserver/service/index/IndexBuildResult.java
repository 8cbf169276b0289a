package com.williamcallahan.articleserver.service.index;

import com.williamcallahan.articleserver.domain.index.IndexBuildOutcome;
import java.util.Objects;

/**
 * A freshly built, not yet published index together with its validation report.
 *
 * @param index built snapshot
 * @param outcome indexed count and skipped directories
 */
public record IndexBuildResult(ArticleIndex index, IndexBuildOutcome outcome) {

    public IndexBuildResult {
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(outcome, "outcome");
    }
}
