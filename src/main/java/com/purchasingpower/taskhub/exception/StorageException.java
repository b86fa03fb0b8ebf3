package com.purchasingpower.taskhub.exception;

/**
 * Failure raised by a storage backend itself (I/O, validation, missing record).
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
