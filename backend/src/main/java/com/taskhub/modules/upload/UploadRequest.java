package com.taskhub.modules.upload;

import java.io.InputStream;

/**
 * One file to store.
 *
 * @param content             the upload stream; the caller closes it
 * @param originalFilename    name as sent by the client
 * @param declaredContentType content type as sent by the client, may be null
 * @param declaredSize        size as sent by the client, or a negative value
 *                            when unknown (streaming)
 * @param taskId              task the attachment belongs to
 * @param uploaderId          authenticated user
 */
public record UploadRequest(InputStream content,
        String originalFilename,
        String declaredContentType,
        long declaredSize,
        long taskId,
        long uploaderId) {

    public static final long UNKNOWN_SIZE = -1L;

    public boolean sizeKnown() {
        return declaredSize > 0;
    }
}
