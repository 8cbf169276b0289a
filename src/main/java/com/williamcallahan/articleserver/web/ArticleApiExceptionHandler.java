package com.williamcallahan.articleserver.web;

import com.williamcallahan.articleserver.service.ArticleLoadException;
import com.williamcallahan.articleserver.service.ArticleNotFoundException;
import com.williamcallahan.articleserver.service.ArticleValidationException;
import com.williamcallahan.articleserver.service.IndexUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps article service failures onto HTTP statuses and the shared error envelope.
 */
@RestControllerAdvice
public class ArticleApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ArticleApiExceptionHandler.class);

    private final ExceptionResponseBuilder exceptionBuilder;

    public ArticleApiExceptionHandler(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    @ExceptionHandler(ArticleNotFoundException.class)
    public ResponseEntity<ApiResponse> handleNotFound(ArticleNotFoundException notFound) {
        log.debug("Article {} requested but not indexed", notFound.getArticleId());
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, notFound.getMessage());
    }

    @ExceptionHandler(ArticleValidationException.class)
    public ResponseEntity<ApiResponse> handleValidation(ArticleValidationException invalid) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY,
                "Article failed validation: " + invalid.getReason(), invalid);
    }

    @ExceptionHandler(ArticleLoadException.class)
    public ResponseEntity<ApiResponse> handleLoadFailure(ArticleLoadException loadFailure) {
        log.error("Article load failed: {}", loadFailure.getMessage(), loadFailure);
        return exceptionBuilder.buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                "Failed to load article", loadFailure);
    }

    @ExceptionHandler(IndexUnavailableException.class)
    public ResponseEntity<ApiResponse> handleIndexUnavailable(IndexUnavailableException unavailable) {
        log.error("Article index rebuild failed, previous index stays live: {}", unavailable.getMessage());
        return exceptionBuilder.buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE,
                "Article index unavailable", unavailable);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse> handleBadRequest(IllegalArgumentException badRequest) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, badRequest.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse> handleTypeMismatch(MethodArgumentTypeMismatchException mismatch) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST,
                "Invalid value for '" + mismatch.getName() + "': " + mismatch.getValue());
    }
}
