package com.williamcallahan.articleserver.web;

import org.springframework.http.ResponseEntity;

/**
 * Base controller giving every article endpoint the same response envelope.
 */
public abstract class BaseController {

    protected final ExceptionResponseBuilder exceptionBuilder;

    /**
     * Creates a base controller wired to the shared exception response builder.
     */
    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Creates a standardized success response.
     *
     * @param message Success message
     * @return Success response
     */
    protected ResponseEntity<ApiResponse> createSuccessResponse(String message) {
        return exceptionBuilder.buildSuccessResponse(message);
    }

    /**
     * Creates a standardized success response carrying {@code data}.
     */
    protected <T> ResponseEntity<ApiResponse> createDataResponse(T data) {
        return exceptionBuilder.buildDataResponse(data);
    }
}
