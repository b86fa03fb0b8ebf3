package com.purchasingpower.taskhub.routing.impl;

import com.purchasingpower.taskhub.routing.SourceConfig;
import com.purchasingpower.taskhub.routing.SourceHandle;
import com.purchasingpower.taskhub.routing.SourceStatus;
import com.purchasingpower.taskhub.storage.StorageBackend;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Router bookkeeping for one pooled source. Mutated only by {@link DataSourceRouterImpl}.
 *
 * <p>Updates are not serialized across concurrent operations; two failures landing at
 * the same moment may both observe the threshold. Counts converge on the next success
 * or health check.
 */
final class PoolEntry {

    private final SourceConfig config;
    private final AtomicReference<StorageBackend> backend;
    private volatile boolean healthy;
    private volatile Instant lastHealthCheck;
    private final AtomicInteger failureCount;

    PoolEntry(SourceConfig config, StorageBackend backend, boolean healthy, int failureCount) {
        this.config = config;
        this.backend = new AtomicReference<>(backend);
        this.healthy = healthy;
        this.lastHealthCheck = Instant.now();
        this.failureCount = new AtomicInteger(failureCount);
    }

    SourceConfig config() {
        return config;
    }

    String id() {
        return config.id();
    }

    int priority() {
        return config.priority();
    }

    StorageBackend backend() {
        return backend.get();
    }

    /**
     * Install a rebuilt backend unless another rebuild got there first.
     *
     * @return true if {@code rebuilt} is now the entry's backend
     */
    boolean installBackend(StorageBackend rebuilt) {
        return backend.compareAndSet(null, rebuilt);
    }

    boolean healthy() {
        return healthy;
    }

    int failureCount() {
        return failureCount.get();
    }

    void recordSuccess() {
        failureCount.set(0);
    }

    int recordFailure() {
        return failureCount.incrementAndGet();
    }

    /**
     * Apply a health-check outcome.
     *
     * @return the health before this check
     */
    boolean recordHealthCheck(boolean nowHealthy) {
        boolean wasHealthy = healthy;
        healthy = nowHealthy;
        lastHealthCheck = Instant.now();
        if (nowHealthy && !wasHealthy) {
            failureCount.set(0);
        }
        return wasHealthy;
    }

    /**
     * Flip to unhealthy.
     *
     * @return true if this call made the transition
     */
    boolean markUnhealthy() {
        boolean wasHealthy = healthy;
        healthy = false;
        return wasHealthy;
    }

    SourceHandle handle() {
        return new SourceHandle(backend.get(), config.id(), config.name(), config.priority());
    }

    SourceStatus snapshot() {
        return new SourceStatus(
            config.id(),
            config.name(),
            config.type(),
            healthy,
            config.readonly(),
            config.priority(),
            failureCount.get(),
            lastHealthCheck,
            config.tags());
    }
}
