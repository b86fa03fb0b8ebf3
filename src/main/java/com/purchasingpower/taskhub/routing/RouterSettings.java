package com.purchasingpower.taskhub.routing;

import lombok.Builder;

import java.time.Duration;

/**
 * Router tuning.
 *
 * @param healthCheckInterval period of the health-check loop
 * @param maxFailures consecutive failed attempts before a source is marked unhealthy
 * @param operationTimeout deadline of a single backend attempt
 * @param enableFallback try further candidates after a failed attempt, {@code true} when unset
 * @param recoveryCheckDelay delay of the extra health check scheduled when a source turns unhealthy
 */
@Builder
public record RouterSettings(
    Duration healthCheckInterval,
    int maxFailures,
    Duration operationTimeout,
    Boolean enableFallback,
    Duration recoveryCheckDelay
) {

    public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_FAILURES = 3;
    public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_RECOVERY_CHECK_DELAY = Duration.ofSeconds(5);

    public RouterSettings {
        healthCheckInterval = healthCheckInterval == null ? DEFAULT_HEALTH_CHECK_INTERVAL : healthCheckInterval;
        maxFailures = maxFailures <= 0 ? DEFAULT_MAX_FAILURES : maxFailures;
        operationTimeout = operationTimeout == null ? DEFAULT_OPERATION_TIMEOUT : operationTimeout;
        enableFallback = enableFallback == null ? Boolean.TRUE : enableFallback;
        recoveryCheckDelay = recoveryCheckDelay == null ? DEFAULT_RECOVERY_CHECK_DELAY : recoveryCheckDelay;
    }

    public static RouterSettings defaults() {
        return new RouterSettings(null, 0, null, null, null);
    }
}
