package com.taskhub.modules.upload.validation;

/**
 * One violated rule: its kind plus the message shown to the uploader.
 */
public record ValidationFailure(ValidationErrorKind kind, String message) {
}
