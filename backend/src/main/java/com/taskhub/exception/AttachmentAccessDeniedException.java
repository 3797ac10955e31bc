package com.taskhub.exception;

/**
 * The caller is not allowed to modify the attachment.
 */
public class AttachmentAccessDeniedException extends RuntimeException {

    public AttachmentAccessDeniedException(String message) {
        super(message);
    }
}
