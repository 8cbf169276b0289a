package com.williamcallahan.articleserver.service;

/**
 * Signals that an indexed article's content could not be read or rendered.
 */
public class ArticleLoadException extends RuntimeException {

    /**
     * Creates a load failure with a message and the original cause.
     *
     * @param message explanation of the failure
     * @param cause underlying I/O or rendering exception
     */
    public ArticleLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
