package com.williamcallahan.articleserver.web;

/**
 * Defines the shared contract for JSON API responses so controllers can return consistent payloads.
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse, ApiDataResponse {

    /**
     * Returns the status indicator for this response.
     *
     * @return response status for client handling
     */
    String status();
}
