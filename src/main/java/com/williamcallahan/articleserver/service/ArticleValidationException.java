package com.williamcallahan.articleserver.service;

import com.williamcallahan.articleserver.domain.index.SkipReason;
import java.util.Objects;

/**
 * Signals that an article directory's metadata or content failed validation.
 *
 * <p>Index builds catch this per article and record it as a skip; refresh reports it to the caller.</p>
 */
public class ArticleValidationException extends RuntimeException {

    private final SkipReason reason;
    private final String field;

    /**
     * Creates a validation failure that is not tied to a single field.
     *
     * @param reason failure category
     * @param message explanation of the failure
     */
    public ArticleValidationException(SkipReason reason, String message) {
        this(reason, null, message, null);
    }

    /**
     * Creates a validation failure with the offending field and underlying cause.
     *
     * @param reason failure category
     * @param field metadata field name, or {@code null}
     * @param message explanation of the failure
     * @param cause underlying exception, or {@code null}
     */
    public ArticleValidationException(SkipReason reason, String field, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.field = field;
    }

    /**
     * Creates an {@link SkipReason#INVALID_FIELD} failure for the named field.
     *
     * @param field metadata field name
     * @param message explanation of the failure
     * @return validation exception
     */
    public static ArticleValidationException invalidField(String field, String message) {
        return new ArticleValidationException(SkipReason.INVALID_FIELD, field, message, null);
    }

    public SkipReason getReason() {
        return reason;
    }

    /**
     * Returns the offending metadata field for {@link SkipReason#INVALID_FIELD}, otherwise {@code null}.
     */
    public String getField() {
        return field;
    }
}
