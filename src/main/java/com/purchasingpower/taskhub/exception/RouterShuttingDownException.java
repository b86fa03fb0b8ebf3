package com.purchasingpower.taskhub.exception;

public class RouterShuttingDownException extends StorageRoutingException {

    public RouterShuttingDownException() {
        super("DataSourceRouter is shutting down");
    }
}
