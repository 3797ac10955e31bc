package com.taskhub.modules.upload;

import com.taskhub.modules.upload.validation.FileValidator;
import com.taskhub.modules.upload.validation.ValidationProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Upload pipeline entry point: rate limit, write, full validation, and
 * rollback when any late stage fails.
 * <p>
 * {@link ValidationProfile#RELAXED} is only for callers that are already
 * authenticated and trusted; request-facing code uses
 * {@link ValidationProfile#STRICT}.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttachmentUploadService {

    private final AttachmentFileStore fileStore;
    private final FileValidator fileValidator;

    /**
     * @return metadata of the accepted file, for the caller to persist
     * @throws UploadRejectedException with kind VALIDATION, RATE_LIMIT or STORAGE
     */
    public StoredFileRecord upload(UploadRequest request, ValidationProfile profile) {
        log.debug("Upload started: task={}, user={}, file={}, profile={}",
                request.taskId(), request.uploaderId(), request.originalFilename(), profile);

        StoredFileRecord record = fileStore.save(request, storedFile -> fileValidator.validate(
                storedFile, request.originalFilename(), request.declaredContentType(), profile));

        log.info("Upload accepted: task={}, user={}, storedAs={}, size={}",
                record.getTaskId(), record.getUploadedBy(), record.getStoredFilename(), record.getFileSize());
        return record;
    }

    /**
     * Remove a file that was accepted but could not be persisted by the
     * caller. Quota already consumed stays consumed.
     */
    public void discard(StoredFileRecord record) {
        try {
            fileStore.delete(record.getFilePath());
        } catch (RuntimeException e) {
            log.error("Failed to discard {}: {}", record.getFilePath(), e.getMessage());
        }
    }
}
