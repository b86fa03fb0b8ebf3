package com.purchasingpower.taskhub.routing;

public enum OperationType {
    READ,
    WRITE,
    DELETE;

    public boolean isMutation() {
        return this != READ;
    }
}
