package com.williamcallahan.articleserver.domain.index;

/**
 * Why an article directory was left out of an index build.
 */
public enum SkipReason {
    /** The directory has no metadata file. */
    MISSING_METADATA,
    /** A required metadata field is absent or has the wrong type, or the file does not parse. */
    INVALID_FIELD,
    /** The declared id differs from the directory name. */
    ID_MISMATCH,
    /** The declared content path does not resolve to a readable file. */
    CONTENT_MISSING,
    /** The directory name is not a non-negative integer id. */
    INVALID_DIRECTORY_NAME,
    /** The directory or its metadata could not be read. */
    IO_ERROR
}
