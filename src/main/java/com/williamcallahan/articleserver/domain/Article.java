package com.williamcallahan.articleserver.domain;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import java.util.Objects;

/**
 * An article's metadata together with its rendered HTML body.
 *
 * <p>Only built on demand by the content loader; never stored in the index.</p>
 *
 * @param meta indexed metadata
 * @param content rendered HTML
 */
public record Article(@JsonUnwrapped ArticleMeta meta, String content) {

    public Article {
        Objects.requireNonNull(meta, "meta");
        Objects.requireNonNull(content, "content");
    }

    public int id() {
        return meta.id();
    }
}
