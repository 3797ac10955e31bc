package com.taskhub.modules.attachment;

import com.taskhub.exception.AttachmentAccessDeniedException;
import com.taskhub.exception.AttachmentNotFoundException;
import com.taskhub.model.entity.TaskAttachment;
import com.taskhub.modules.upload.AttachmentFileStore;
import com.taskhub.modules.upload.AttachmentUploadService;
import com.taskhub.modules.upload.StorageStats;
import com.taskhub.modules.upload.StoredFileRecord;
import com.taskhub.modules.upload.UploadRejectedException;
import com.taskhub.modules.upload.UploadRequest;
import com.taskhub.modules.upload.validation.ValidationProfile;
import com.taskhub.repository.TaskAttachmentRepository;
import com.taskhub.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task attachments: runs uploads through the admission pipeline and keeps
 * {@code task_attachments} rows in step with the files on disk.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskAttachmentService {

    private static final String ENTITY_TYPE = "TaskAttachment";

    private final AttachmentUploadService uploadService;
    private final AttachmentFileStore fileStore;
    private final TaskAttachmentRepository attachmentRepository;
    private final AuditService auditService;

    // ================================================================
    // Upload
    // ================================================================

    /**
     * Upload a client-supplied file with the strict profile.
     *
     * @throws UploadRejectedException when the file is not accepted
     */
    public TaskAttachment upload(long taskId, long userId, MultipartFile file) {
        try (InputStream content = file.getInputStream()) {
            UploadRequest request = new UploadRequest(content, file.getOriginalFilename(),
                    file.getContentType(), file.getSize(), taskId, userId);
            return store(request, ValidationProfile.STRICT);
        } catch (IOException e) {
            log.error("Could not open upload stream for task {}: {}", taskId, e.getMessage());
            throw UploadRejectedException.storage("Error reading upload stream", e);
        }
    }

    /**
     * Attach a file produced by an internal, already trusted source (imports,
     * generated exports). Runs the relaxed profile: executable headers,
     * filename and size rules still apply.
     */
    public TaskAttachment importTrusted(long taskId, long userId, Path source, String contentType) {
        try (InputStream content = Files.newInputStream(source)) {
            UploadRequest request = new UploadRequest(content, source.getFileName().toString(),
                    contentType, Files.size(source), taskId, userId);
            return store(request, ValidationProfile.RELAXED);
        } catch (IOException e) {
            log.error("Could not read import source {}: {}", source, e.getMessage());
            throw UploadRejectedException.storage("Error reading import source", e);
        }
    }

    private TaskAttachment store(UploadRequest request, ValidationProfile profile) {
        StoredFileRecord record;
        try {
            record = uploadService.upload(request, profile);
        } catch (UploadRejectedException e) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("taskId", request.taskId());
            metadata.put("filename", request.originalFilename());
            metadata.put("kind", e.getKind().name());
            metadata.put("reasons", e.getReasons());
            auditService.log(request.uploaderId(), "ATTACHMENT_REJECTED", ENTITY_TYPE, null, metadata);
            throw e;
        }

        TaskAttachment saved;
        try {
            saved = attachmentRepository.save(TaskAttachment.builder()
                    .taskId(record.getTaskId())
                    .filename(record.getStoredFilename())
                    .originalFilename(record.getOriginalFilename())
                    .filePath(record.getFilePath())
                    .fileSize(record.getFileSize())
                    .mimeType(record.getMimeType())
                    .sha256(record.getSha256())
                    .uploadedBy(record.getUploadedBy())
                    .createdAt(record.getCreatedAt())
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to persist attachment {} for task {}: {}",
                    record.getStoredFilename(), record.getTaskId(), e.getMessage());
            uploadService.discard(record);
            throw e;
        }

        auditService.log(record.getUploadedBy(), "ATTACHMENT_UPLOADED", ENTITY_TYPE,
                String.valueOf(saved.getId()), Map.of(
                        "taskId", record.getTaskId(),
                        "size", record.getFileSize(),
                        "mimeType", record.getMimeType(),
                        "sha256", record.getSha256()));
        return saved;
    }

    // ================================================================
    // Read
    // ================================================================

    public List<TaskAttachment> list(long taskId) {
        return attachmentRepository.findByTaskIdOrderByCreatedAtDesc(taskId);
    }

    /**
     * @throws AttachmentNotFoundException when the row or its file is missing
     */
    public AttachmentDownload open(long taskId, long attachmentId) {
        TaskAttachment attachment = find(taskId, attachmentId);
        Path path = fileStore.resolve(taskId, attachment.getFilename())
                .orElseThrow(() -> {
                    log.warn("Attachment {} has no file on disk: {}", attachmentId, attachment.getFilePath());
                    return new AttachmentNotFoundException("Attachment file not found: " + attachmentId);
                });
        return new AttachmentDownload(attachment, path);
    }

    // ================================================================
    // Delete / maintenance
    // ================================================================

    /**
     * Remove an attachment row and its file. Only the uploader may delete.
     */
    public void delete(long taskId, long attachmentId, long userId) {
        TaskAttachment attachment = find(taskId, attachmentId);
        if (attachment.getUploadedBy() == null || attachment.getUploadedBy() != userId) {
            throw new AttachmentAccessDeniedException("Only the uploader can delete attachment " + attachmentId);
        }

        attachmentRepository.delete(attachment);
        // A file left behind here is picked up by the orphan cleanup.
        if (!fileStore.delete(attachment.getFilePath())) {
            log.warn("Attachment {} deleted but file was already missing", attachmentId);
        }

        auditService.log(userId, "ATTACHMENT_DELETED", ENTITY_TYPE, String.valueOf(attachmentId),
                Map.of("taskId", taskId, "filename", attachment.getOriginalFilename()));
    }

    /**
     * Delete stored files that no attachment row references.
     *
     * @return number of files deleted
     */
    public int cleanupOrphans() {
        int deleted = fileStore.cleanupOrphans(new HashSet<>(attachmentRepository.findAllFilePaths()));
        if (deleted > 0) {
            auditService.log(null, "ATTACHMENT_ORPHANS_CLEANED", ENTITY_TYPE, null, Map.of("deleted", deleted));
        }
        return deleted;
    }

    public StorageStats stats() {
        return fileStore.stats();
    }

    private TaskAttachment find(long taskId, long attachmentId) {
        return attachmentRepository.findByIdAndTaskId(attachmentId, taskId)
                .orElseThrow(() -> new AttachmentNotFoundException("Attachment not found: " + attachmentId));
    }
}
