package com.taskhub.modules.upload;

import java.time.Instant;

/**
 * Filesystem facts about a stored attachment.
 */
public record StoredFileInfo(long size, String mimeType, Instant createdAt, Instant modifiedAt) {
}
