package com.taskhub.modules.upload;

/**
 * Coarse rejection category; the web layer maps it to a status code.
 */
public enum UploadErrorKind {
    /** A file rule was violated. Expected, never retried. */
    VALIDATION,
    /** A quota window is full. The caller may retry once the window slides. */
    RATE_LIMIT,
    /** Unexpected I/O failure. Partial writes have been rolled back. */
    STORAGE
}
