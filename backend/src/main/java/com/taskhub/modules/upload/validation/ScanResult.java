package com.taskhub.modules.upload.validation;

/**
 * Verdict of the content scanner. {@code kind} and {@code reason} are
 * {@code null} when the content is considered safe.
 */
public record ScanResult(boolean safe, ValidationErrorKind kind, String reason) {

    private static final ScanResult SAFE = new ScanResult(true, null, null);

    public static ScanResult safeResult() {
        return SAFE;
    }

    public static ScanResult rejected(ValidationErrorKind kind, String reason) {
        return new ScanResult(false, kind, reason);
    }
}
