package com.purchasingpower.taskhub.exception;

import com.purchasingpower.taskhub.routing.OperationType;
import lombok.Getter;

/**
 * A backend call raised. Wraps the backend's own exception as the cause.
 */
@Getter
public class SourceOperationFailedException extends StorageRoutingException {

    private final String sourceId;
    private final OperationType operationType;

    public SourceOperationFailedException(String sourceId, OperationType operationType, Throwable cause) {
        super(operationType.name().toLowerCase() + " failed on source '" + sourceId + "': " + cause.getMessage(), cause);
        this.sourceId = sourceId;
        this.operationType = operationType;
    }
}
