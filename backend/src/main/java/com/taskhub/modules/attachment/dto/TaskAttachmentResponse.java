package com.taskhub.modules.attachment.dto;

import com.taskhub.model.entity.TaskAttachment;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;

/**
 * Attachment metadata returned to clients. The on-disk path is never exposed.
 */
@Getter
@Builder
public class TaskAttachmentResponse {

    private Long id;
    private Long taskId;
    private String filename;
    private String originalFilename;
    private Long fileSize;
    private String mimeType;
    private String sha256;
    private Long uploadedBy;
    private OffsetDateTime createdAt;
    private String downloadUrl;

    public static TaskAttachmentResponse from(TaskAttachment attachment) {
        return TaskAttachmentResponse.builder()
                .id(attachment.getId())
                .taskId(attachment.getTaskId())
                .filename(attachment.getFilename())
                .originalFilename(attachment.getOriginalFilename())
                .fileSize(attachment.getFileSize())
                .mimeType(attachment.getMimeType())
                .sha256(attachment.getSha256())
                .uploadedBy(attachment.getUploadedBy())
                .createdAt(attachment.getCreatedAt())
                .downloadUrl("/tasks/" + attachment.getTaskId() + "/attachments/" + attachment.getId() + "/download")
                .build();
    }
}
