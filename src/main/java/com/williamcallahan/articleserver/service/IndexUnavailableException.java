package com.williamcallahan.articleserver.service;

/**
 * Signals that the articles root directory itself could not be read, so no index can be built.
 *
 * <p>Fatal at startup. During an admin rebuild the previously published index stays live.</p>
 */
public class IndexUnavailableException extends RuntimeException {

    /**
     * Creates an exception with a human-readable message.
     *
     * @param message explanation of the failure
     */
    public IndexUnavailableException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and the original cause.
     *
     * @param message explanation of the failure
     * @param cause underlying I/O exception
     */
    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
