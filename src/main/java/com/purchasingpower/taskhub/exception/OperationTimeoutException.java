package com.purchasingpower.taskhub.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * A single backend call exceeded its deadline. The call is interrupted when this is raised.
 */
@Getter
public class OperationTimeoutException extends StorageRoutingException {

    private final String sourceId;
    private final Duration timeout;

    public OperationTimeoutException(String sourceId, String action, Duration timeout) {
        super(action + " on source '" + sourceId + "' timed out after " + timeout.toMillis() + "ms");
        this.sourceId = sourceId;
        this.timeout = timeout;
    }
}
