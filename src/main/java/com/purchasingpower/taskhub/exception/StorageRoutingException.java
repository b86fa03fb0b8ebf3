package com.purchasingpower.taskhub.exception;

/**
 * Base of the failures the federation layer reports to its callers.
 */
public abstract class StorageRoutingException extends RuntimeException {

    protected StorageRoutingException(String message) {
        super(message);
    }

    protected StorageRoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
