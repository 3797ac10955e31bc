package com.taskhub.exception;

/**
 * The requested attachment does not exist, or its file is gone from storage.
 */
public class AttachmentNotFoundException extends RuntimeException {

    public AttachmentNotFoundException(String message) {
        super(message);
    }
}
