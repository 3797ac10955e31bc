package com.taskhub.modules.upload.validation;

import com.taskhub.config.UploadProperties;

import java.util.Set;

/**
 * Size-ceiling category derived from a MIME type.
 */
public enum FileCategory {
    IMAGE,
    VIDEO,
    AUDIO,
    ARCHIVE,
    DOCUMENT,
    OTHER;

    private static final Set<String> ARCHIVE_TYPES = Set.of(
            "application/zip", "application/x-rar-compressed", "application/x-7z-compressed");

    private static final Set<String> DOCUMENT_MARKERS = Set.of(
            "pdf", "document", "spreadsheet", "presentation");

    public static FileCategory of(String mimeType) {
        String mime = FileClassifier.normalizeMime(mimeType);
        if (mime == null) {
            return OTHER;
        }
        if (mime.startsWith("image/")) {
            return IMAGE;
        }
        if (mime.startsWith("video/")) {
            return VIDEO;
        }
        if (mime.startsWith("audio/")) {
            return AUDIO;
        }
        if (ARCHIVE_TYPES.contains(mime)) {
            return ARCHIVE;
        }
        if (DOCUMENT_MARKERS.stream().anyMatch(mime::contains)) {
            return DOCUMENT;
        }
        return OTHER;
    }

    public long ceiling(UploadProperties.SizeLimits limits) {
        return switch (this) {
            case IMAGE -> limits.getImage();
            case VIDEO -> limits.getVideo();
            case AUDIO -> limits.getAudio();
            case ARCHIVE -> limits.getArchive();
            case DOCUMENT -> limits.getDocument();
            case OTHER -> limits.getDefaultLimit();
        };
    }
}
