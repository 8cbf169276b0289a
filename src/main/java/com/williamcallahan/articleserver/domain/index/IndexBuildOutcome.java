package com.williamcallahan.articleserver.domain.index;

import java.util.List;
import java.util.Objects;

/**
 * Represents the outcome of an index build so operators can see which articles were left out.
 *
 * @param status status indicator ("success" or "partial-success")
 * @param indexed number of articles in the published index
 * @param root scanned articles directory
 * @param skipped article directories excluded from the index
 */
public record IndexBuildOutcome(String status, int indexed, String root, List<IndexSkip> skipped) {
    private static final String STATUS_SUCCESS = "success";
    private static final String STATUS_PARTIAL_SUCCESS = "partial-success";

    public IndexBuildOutcome {
        Objects.requireNonNull(status, "Status is required");
        if (indexed < 0) {
            throw new IllegalArgumentException("Indexed count must be non-negative");
        }
        if (root == null || root.isBlank()) {
            throw new IllegalArgumentException("Articles root is required");
        }
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    /**
     * Creates a build outcome, marking it partial when any directory was skipped.
     *
     * @param indexed number of indexed articles
     * @param root scanned articles directory
     * @param skipped excluded directories
     * @return build outcome
     */
    public static IndexBuildOutcome of(int indexed, String root, List<IndexSkip> skipped) {
        boolean hasSkips = skipped != null && !skipped.isEmpty();
        String status = hasSkips ? STATUS_PARTIAL_SUCCESS : STATUS_SUCCESS;
        return new IndexBuildOutcome(status, indexed, root, skipped);
    }
}
