package com.williamcallahan.articleserver.domain;

/**
 * A tag and the number of indexed articles carrying it.
 */
public record TagCount(String tag, int articles) {
}
