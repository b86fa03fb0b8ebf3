package com.purchasingpower.taskhub.routing;

/**
 * Backend kinds a source can be configured with.
 */
public enum DataSourceType {
    MEMORY,
    FILESYSTEM,
    POSTGRESQL,   // declared, no backend yet
    MONGODB       // declared, no backend yet
}
