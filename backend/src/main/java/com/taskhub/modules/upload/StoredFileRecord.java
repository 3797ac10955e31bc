package com.taskhub.modules.upload;

import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;

/**
 * Metadata of an accepted upload, handed to the caller for persistence.
 * Never mutated after creation.
 */
@Getter
@Builder
public class StoredFileRecord {
    /** Generated {@code <uuid>.<ext>} name on disk. */
    private final String storedFilename;
    private final String originalFilename;
    /** Absolute, normalized path of the stored file. */
    private final String filePath;
    /** Path relative to the storage root. */
    private final String storageKey;
    private final long fileSize;
    private final String mimeType;
    private final String sha256;
    private final long taskId;
    private final long uploadedBy;
    private final OffsetDateTime createdAt;
}
