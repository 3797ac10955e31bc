package com.taskhub.modules.attachment;

import com.taskhub.model.entity.TaskAttachment;

import java.nio.file.Path;

/**
 * A persisted attachment together with its file on disk.
 */
public record AttachmentDownload(TaskAttachment attachment, Path path) {
}
