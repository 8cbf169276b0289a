package com.williamcallahan.articleserver.web;

/**
 * Success payload wrapping a typed data body.
 *
 * @param status fixed status indicator ("success")
 * @param data response body
 * @param <T> body type
 */
public record ApiDataResponse<T>(String status, T data) implements ApiResponse {

    public static <T> ApiDataResponse<T> success(T data) {
        return new ApiDataResponse<>("success", data);
    }
}
