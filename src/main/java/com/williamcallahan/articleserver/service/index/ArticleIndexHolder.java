package com.williamcallahan.articleserver.service.index;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Holds the live {@link ArticleIndex}. Readers take the current snapshot without locking;
 * publication replaces it in one atomic swap.
 */
@Component
public class ArticleIndexHolder {

    private final AtomicReference<ArticleIndex> current = new AtomicReference<>(ArticleIndex.empty());

    /**
     * Returns the snapshot that is live right now. Callers doing several lookups for one request
     * should hold on to the returned instance so they see a single consistent index.
     */
    public ArticleIndex current() {
        return current.get();
    }

    /**
     * Publishes a fully built snapshot.
     *
     * @param next snapshot to make live
     * @return the snapshot it replaced
     */
    public ArticleIndex publish(ArticleIndex next) {
        return current.getAndSet(Objects.requireNonNull(next, "next"));
    }
}
