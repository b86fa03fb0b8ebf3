package com.purchasingpower.taskhub.exception;

import com.purchasingpower.taskhub.routing.OperationType;
import lombok.Getter;

/**
 * No healthy source passed candidate selection.
 */
@Getter
public class NoAvailableSourceException extends StorageRoutingException {

    private final OperationType operationType;

    public NoAvailableSourceException(OperationType operationType) {
        super("No available data sources for " + operationType.name().toLowerCase() + " operation");
        this.operationType = operationType;
    }
}
