package com.taskhub.modules.upload.validation;

/**
 * Machine-readable reason for a rejected file. Every kind fails closed except
 * scanner I/O errors, which never produce a kind at all.
 */
public enum ValidationErrorKind {
    MISSING_FILENAME,
    EXTENSION,
    FILENAME,
    DANGEROUS_SIGNATURE,
    MIME_NOT_ALLOWED,
    MIME_MISMATCH,
    CONTENT_PATTERN,
    ENTROPY,
    PAYLOAD_TOO_SMALL,
    SIZE_CATEGORY,
    FILE_TOO_LARGE,
    UNREADABLE
}
