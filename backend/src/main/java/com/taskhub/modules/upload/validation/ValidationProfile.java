package com.taskhub.modules.upload.validation;

/**
 * Selects which validation stages run.
 * <ul>
 * <li>{@link #STRICT}: caller-facing uploads: every stage.</li>
 * <li>{@link #RELAXED}: already-authenticated internal callers: skips the
 * MIME check and the content scanner. Executable signatures and size
 * ceilings are still enforced.</li>
 * </ul>
 */
public enum ValidationProfile {
    STRICT(true, true),
    RELAXED(false, false);

    private final boolean mimeCheck;
    private final boolean contentScan;

    ValidationProfile(boolean mimeCheck, boolean contentScan) {
        this.mimeCheck = mimeCheck;
        this.contentScan = contentScan;
    }

    public boolean runsMimeCheck() {
        return mimeCheck;
    }

    public boolean runsContentScan() {
        return contentScan;
    }
}
