package com.taskhub.service.storage;

/**
 * Thrown when the attachment file tree cannot be read or written.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
