package com.williamcallahan.articleserver.web;

/**
 * Response for the health endpoint.
 *
 * @param status always "healthy" while the server answers
 * @param indexedArticles articles in the live index
 * @param cachedArticles rendered articles currently cached
 * @param cacheCapacity maximum number of cached articles
 * @param rendersInFlight article renders currently running
 */
public record HealthResponse(
        String status, int indexedArticles, int cachedArticles, int cacheCapacity, int rendersInFlight) {

    public static HealthResponse healthy(int indexedArticles, int cachedArticles, int cacheCapacity, int rendersInFlight) {
        return new HealthResponse("healthy", indexedArticles, cachedArticles, cacheCapacity, rendersInFlight);
    }
}
