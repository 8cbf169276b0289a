package com.williamcallahan.articleserver.service;

/**
 * Signals a failure while rendering article markdown to HTML.
 */
public class MarkdownProcessingException extends IllegalStateException {

    /**
     * Creates a markdown processing exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public MarkdownProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
