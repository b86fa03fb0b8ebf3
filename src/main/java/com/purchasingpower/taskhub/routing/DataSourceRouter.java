package com.purchasingpower.taskhub.routing;

import com.purchasingpower.taskhub.storage.StorageBackend;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Routes single-entity operations across the configured storage sources.
 *
 * <p>The router owns a pool of live backends, one entry per enabled source. It picks
 * candidates by health, project tag, write capability and priority; reads fall back
 * through candidates in priority order, writes and deletes go to the highest-priority
 * writable source and fall back only when it fails. Consecutive failures mark a source
 * unhealthy until a health check sees it recover.
 *
 * <p>All operations are asynchronous; failures are delivered through the returned future
 * as one of the {@link com.purchasingpower.taskhub.exception.StorageRoutingException}
 * subtypes.
 *
 * @since 1.0.0
 */
public interface DataSourceRouter {

    /**
     * Build and initialize every enabled source, then start the health-check loop.
     *
     * <p>Never fails because of a source: a source that cannot be built or initialized
     * joins the pool as unhealthy.
     */
    CompletableFuture<Void> initialize();

    /**
     * Execute an operation against the selected sources.
     *
     * @return the loaded list (possibly {@code null}) for READ, {@code null} for WRITE/DELETE
     */
    <T> CompletableFuture<T> routeOperation(DataOperation operation, OperationContext context);

    /**
     * Run one health-check pass over every pooled source now.
     */
    CompletableFuture<Void> checkHealth();

    /**
     * Snapshot of every pooled source; never a live view.
     */
    RouterStatus getStatus();

    /**
     * Healthy sources, highest priority first, for multi-source queries.
     */
    List<SourceHandle> healthySources();

    Optional<StorageBackend> getBackend(String sourceId);

    /**
     * Stop health checks, shut every backend down and clear the pool. Idempotent.
     */
    CompletableFuture<Void> shutdown();
}
