package com.purchasingpower.taskhub.aggregation;

import lombok.Builder;

import java.time.Duration;

/**
 * @param conflictResolution strategy for full lists, {@link ConflictResolutionStrategy#LATEST} when unset
 * @param parallelQueries query all sources at once, {@code true} when unset
 * @param queryTimeout deadline of one source's whole fetch
 */
@Builder
public record AggregatorSettings(
    ConflictResolutionStrategy conflictResolution,
    Boolean parallelQueries,
    Duration queryTimeout
) {

    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);

    public AggregatorSettings {
        conflictResolution = conflictResolution == null ? ConflictResolutionStrategy.LATEST : conflictResolution;
        parallelQueries = parallelQueries == null ? Boolean.TRUE : parallelQueries;
        queryTimeout = queryTimeout == null || queryTimeout.isZero() ? DEFAULT_QUERY_TIMEOUT : queryTimeout;
    }

    public static AggregatorSettings defaults() {
        return new AggregatorSettings(null, null, null);
    }
}
