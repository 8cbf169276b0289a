package com.williamcallahan.articleserver.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Centralized utility for building the JSON envelopes every article endpoint returns.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds a standardized error response with status and message.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds a standardized error response with status, message, and exception details.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param exception The exception that occurred
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Builds a standardized success response with a simple message.
     *
     * @param message The success message
     * @return ResponseEntity with success details
     */
    public ResponseEntity<ApiResponse> buildSuccessResponse(String message) {
        return ResponseEntity.ok(ApiSuccessResponse.success(message));
    }

    /**
     * Builds a standardized success response carrying a data body.
     *
     * @param data response body
     * @return ResponseEntity wrapping {@code data}
     */
    public <T> ResponseEntity<ApiResponse> buildDataResponse(T data) {
        return ResponseEntity.ok(ApiDataResponse.success(data));
    }

    /**
     * Describes an exception for the {@code details} field of an error payload.
     *
     * @param exception exception to describe
     * @return exception type and message, or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        String message = exception.getMessage();
        String type = exception.getClass().getSimpleName();
        if (message == null || message.isBlank()) {
            return type;
        }
        Throwable cause = exception.getCause();
        if (cause != null && cause.getMessage() != null && !message.contains(cause.getMessage())) {
            return type + ": " + message + " (" + cause.getMessage() + ")";
        }
        return type + ": " + message;
    }
}
