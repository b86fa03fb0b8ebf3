package com.purchasingpower.taskhub.routing;

import java.time.Instant;
import java.util.Set;

/**
 * Point-in-time snapshot of one pooled source.
 */
public record SourceStatus(
    String id,
    String name,
    DataSourceType type,
    boolean healthy,
    boolean readonly,
    int priority,
    int failureCount,
    Instant lastHealthCheck,
    Set<String> tags
) {
}
