package com.purchasingpower.taskhub.routing.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.taskhub.concurrent.TimeLimitedExecutor;
import com.purchasingpower.taskhub.exception.NoAvailableSourceException;
import com.purchasingpower.taskhub.exception.OperationTimeoutException;
import com.purchasingpower.taskhub.exception.ReadExhaustedException;
import com.purchasingpower.taskhub.exception.RouterShuttingDownException;
import com.purchasingpower.taskhub.exception.SourceOperationFailedException;
import com.purchasingpower.taskhub.exception.StorageRoutingException;
import com.purchasingpower.taskhub.model.TaskList;
import com.purchasingpower.taskhub.routing.DataOperation;
import com.purchasingpower.taskhub.routing.DataSourceRouter;
import com.purchasingpower.taskhub.routing.OperationContext;
import com.purchasingpower.taskhub.routing.OperationType;
import com.purchasingpower.taskhub.routing.RouterSettings;
import com.purchasingpower.taskhub.routing.RouterStatus;
import com.purchasingpower.taskhub.routing.SourceConfig;
import com.purchasingpower.taskhub.routing.SourceHandle;
import com.purchasingpower.taskhub.routing.SourceStatus;
import com.purchasingpower.taskhub.storage.LoadOptions;
import com.purchasingpower.taskhub.storage.SaveOptions;
import com.purchasingpower.taskhub.storage.StorageBackend;
import com.purchasingpower.taskhub.storage.StorageBackendFactory;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Default {@link DataSourceRouter}.
 *
 * <p>Lifecycle:
 * <pre>
 * initialize() → pool populated (failed sources as unhealthy) → health loop running
 *              → routeOperation(...)* → shutdown() → pool cleared
 * </pre>
 *
 * <p>Per-source health:
 * <pre>
 * healthy ──failure──▶ failureCount+1 ──(count ≥ maxFailures)──▶ unhealthy + recovery check
 * unhealthy ──successful health check──▶ healthy, failureCount = 0
 * </pre>
 *
 * <p>The pool map is owned here and never handed out; {@link #getStatus()} returns copies.
 *
 * @since 1.0.0
 */
@Slf4j
public class DataSourceRouterImpl implements DataSourceRouter {

    private final List<SourceConfig> sources;
    private final RouterSettings settings;
    private final StorageBackendFactory backendFactory;
    private final TimeLimitedExecutor calls;

    private final Map<String, PoolEntry> pool = new ConcurrentHashMap<>();
    private final Set<ScheduledFuture<?>> recoveryChecks = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean initialized = new AtomicBoolean();
    private final AtomicBoolean shuttingDown = new AtomicBoolean();
    private volatile ScheduledFuture<?> healthCheckTask;

    public DataSourceRouterImpl(List<SourceConfig> sources,
                                RouterSettings settings,
                                StorageBackendFactory backendFactory,
                                TimeLimitedExecutor calls) {
        this.sources = sources.stream()
            .filter(SourceConfig::enabled)
            .sorted(Comparator.comparingInt(SourceConfig::priority).reversed())
            .collect(Collectors.toUnmodifiableList());
        this.settings = settings;
        this.backendFactory = backendFactory;
        this.calls = calls;

        log.info("DataSourceRouter created: sources={}, maxFailures={}, operationTimeout={}ms, fallback={}",
            this.sources.size(), settings.maxFailures(), settings.operationTimeout().toMillis(),
            settings.enableFallback());
    }

    // ================================================================
    // LIFECYCLE
    // ================================================================

    @PostConstruct
    public void start() {
        initialize().join();
    }

    @PreDestroy
    public void close() {
        shutdown().join();
    }

    @Override
    public CompletableFuture<Void> initialize() {
        if (shuttingDown.get()) {
            return CompletableFuture.failedFuture(new RouterShuttingDownException());
        }
        if (!initialized.compareAndSet(false, true)) {
            log.warn("DataSourceRouter already initialized");
            return CompletableFuture.completedFuture(null);
        }

        log.info("Initializing DataSourceRouter with {} sources", sources.size());

        CompletableFuture<?>[] initializations = sources.stream()
            .map(this::initializeSource)
            .toArray(CompletableFuture[]::new);

        return CompletableFuture.allOf(initializations).thenRun(() -> {
            startHealthChecks();
            RouterStatus status = getStatus();
            log.info("✅ DataSourceRouter initialized: healthy={}, total={}", status.healthy(), status.total());
        });
    }

    private CompletableFuture<Void> initializeSource(SourceConfig config) {
        return calls.call(() -> buildBackend(config))
            .thenCompose(backend -> runHealthCheck(config.id(), backend)
                .thenApply(healthy -> new PoolEntry(config, backend, healthy, 0)))
            .exceptionally(error -> {
                log.error("Failed to initialize data source {} ({}): {}",
                    config.id(), config.name(), describe(error));
                return new PoolEntry(config, null, false, settings.maxFailures());
            })
            .thenAccept(entry -> {
                pool.put(config.id(), entry);
                log.info("Data source {} ({}, {}) joined pool: healthy={}",
                    config.id(), config.name(), config.type(), entry.healthy());
            });
    }

    private StorageBackend buildBackend(SourceConfig config) {
        StorageBackend backend = backendFactory.create(config);
        backend.initialize();
        return backend;
    }

    private void startHealthChecks() {
        if (healthCheckTask != null || shuttingDown.get()) {
            return;
        }
        healthCheckTask = calls.scheduleAtFixedRate(() -> {
            if (!shuttingDown.get()) {
                checkHealth();
            }
        }, settings.healthCheckInterval());
        log.debug("Health check loop started: interval={}ms", settings.healthCheckInterval().toMillis());
    }

    @Override
    public CompletableFuture<Void> shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("DataSourceRouter shutting down");

        ScheduledFuture<?> loop = healthCheckTask;
        if (loop != null) {
            loop.cancel(false);
            healthCheckTask = null;
        }
        recoveryChecks.forEach(check -> check.cancel(false));
        recoveryChecks.clear();

        CompletableFuture<?>[] shutdowns = pooledEntries().stream()
            .filter(entry -> entry.backend() != null)
            .map(entry -> shutdownBackend(entry.id(), entry.backend()))
            .toArray(CompletableFuture[]::new);

        return CompletableFuture.allOf(shutdowns).thenRun(() -> {
            pool.clear();
            log.info("DataSourceRouter shutdown complete");
        });
    }

    private CompletableFuture<Void> shutdownBackend(String sourceId, StorageBackend backend) {
        return calls.call(sourceId, "shutdown", () -> {
                backend.shutdown();
                return null;
            }, settings.operationTimeout())
            .handle((ignored, error) -> {
                if (error != null) {
                    log.error("Backend shutdown failed for source {}: {}", sourceId, describe(error));
                } else {
                    log.debug("Backend shutdown complete for source {}", sourceId);
                }
                return null;
            });
    }

    // ================================================================
    // ROUTING
    // ================================================================

    @Override
    public <T> CompletableFuture<T> routeOperation(DataOperation operation, OperationContext context) {
        if (shuttingDown.get()) {
            return CompletableFuture.failedFuture(new RouterShuttingDownException());
        }
        try {
            validate(operation);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        OperationContext routing = context != null ? context : OperationContext.NONE;
        List<PoolEntry> candidates = selectSources(operation.type(), routing);
        if (candidates.isEmpty()) {
            return CompletableFuture.failedFuture(new NoAvailableSourceException(operation.type()));
        }

        log.debug("Routing {} of {} (list {}) to sources {}", operation.type(), operation.key(),
            routing.listId() != null ? routing.listId() : operation.key(),
            candidates.stream().map(PoolEntry::id).collect(Collectors.toList()));

        CompletableFuture<?> result = operation.type() == OperationType.READ
            ? executeRead(operation, candidates)
            : executeMutation(operation, candidates);

        @SuppressWarnings("unchecked")
        CompletableFuture<T> typed = (CompletableFuture<T>) result;
        return typed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private void validate(DataOperation operation) {
        if (operation == null || operation.type() == null) {
            throw new IllegalArgumentException("Operation type is required");
        }
        if (isBlank(operation.key())) {
            throw new IllegalArgumentException(operation.type().name().toLowerCase() + " operation requires a key");
        }
        if (operation.type() == OperationType.WRITE) {
            TaskList data = operation.data();
            Preconditions.checkArgument(data != null, "write operation requires data");
            if (SaveOptions.fromMap(operation.options()).validate()) {
                Preconditions.checkArgument(!isBlank(data.getId()),
                    "Invalid task list: missing or invalid id");
                Preconditions.checkArgument(!isBlank(data.getTitle()),
                    "Invalid task list: missing or invalid title");
                Preconditions.checkArgument(data.getItems() != null, "Invalid task list: items must be a list");
            }
        }
    }

    /**
     * Healthy entries, narrowed to the project's sources when any match, without read-only
     * entries for mutations, highest priority first.
     */
    private List<PoolEntry> selectSources(OperationType type, OperationContext context) {
        List<PoolEntry> candidates = pooledEntries().stream()
            .filter(PoolEntry::healthy)
            .filter(entry -> entry.backend() != null)
            .collect(Collectors.toList());

        if (context.projectTag() != null) {
            List<PoolEntry> tagged = candidates.stream()
                .filter(entry -> entry.config().hasTag(context.projectTag()))
                .collect(Collectors.toList());
            if (!tagged.isEmpty()) {
                candidates = tagged;
            }
        }

        if (type.isMutation() || context.requireWritable()) {
            candidates.removeIf(entry -> entry.config().readonly());
        }

        candidates.sort(Comparator.comparingInt(PoolEntry::priority).reversed());
        return candidates;
    }

    private CompletableFuture<TaskList> executeRead(DataOperation operation, List<PoolEntry> candidates) {
        return readFrom(operation, candidates, 0, new LinkedHashMap<>());
    }

    private CompletableFuture<TaskList> readFrom(DataOperation operation,
                                                 List<PoolEntry> candidates,
                                                 int index,
                                                 Map<String, Throwable> failures) {
        PoolEntry source = candidates.get(index);
        LoadOptions options = LoadOptions.fromMap(operation.options());
        StorageBackend backend = source.backend();

        return attempt(source, OperationType.READ, () -> backend.load(operation.key(), options))
            .handle((list, error) -> {
                if (error == null) {
                    return CompletableFuture.completedFuture(list);
                }
                Throwable cause = unwrap(error);
                failures.put(source.id(), cause);
                if (settings.enableFallback() && index + 1 < candidates.size()) {
                    log.warn("Read of {} failed on source {}, trying next: {}",
                        operation.key(), source.id(), cause.getMessage());
                    return readFrom(operation, candidates, index + 1, failures);
                }
                log.warn("Read of {} failed on source {}, no sources left to try: {}",
                    operation.key(), source.id(), cause.getMessage());
                return CompletableFuture.<TaskList>failedFuture(new ReadExhaustedException(operation.key(), failures));
            })
            .thenCompose(Function.identity());
    }

    /**
     * Write or delete on the primary; on failure walk the remaining writable candidates
     * in order. Surfaces the primary's own error when everything fails.
     */
    private CompletableFuture<Void> executeMutation(DataOperation operation, List<PoolEntry> candidates) {
        PoolEntry primary = candidates.get(0);

        return mutate(primary, operation)
            .handle((ignored, error) -> {
                if (error == null) {
                    return CompletableFuture.<Void>completedFuture(null);
                }
                Throwable primaryError = unwrap(error);
                log.error("{} of {} failed on primary source {}: {}",
                    operation.type(), operation.key(), primary.id(), primaryError.getMessage());

                if (!settings.enableFallback() || candidates.size() < 2) {
                    return CompletableFuture.<Void>failedFuture(primaryError);
                }
                log.info("Attempting {} of {} on fallback sources", operation.type(), operation.key());
                return mutateFallback(operation, candidates, 1, primaryError);
            })
            .thenCompose(Function.identity());
    }

    private CompletableFuture<Void> mutateFallback(DataOperation operation,
                                                   List<PoolEntry> candidates,
                                                   int index,
                                                   Throwable primaryError) {
        if (index >= candidates.size()) {
            return CompletableFuture.failedFuture(primaryError);
        }
        PoolEntry fallback = candidates.get(index);

        return mutate(fallback, operation)
            .handle((ignored, error) -> {
                if (error == null) {
                    log.info("{} of {} succeeded on fallback source {}",
                        operation.type(), operation.key(), fallback.id());
                    return CompletableFuture.<Void>completedFuture(null);
                }
                log.warn("{} of {} failed on fallback source {}: {}",
                    operation.type(), operation.key(), fallback.id(), unwrap(error).getMessage());
                return mutateFallback(operation, candidates, index + 1, primaryError);
            })
            .thenCompose(Function.identity());
    }

    private CompletableFuture<Void> mutate(PoolEntry source, DataOperation operation) {
        StorageBackend backend = source.backend();
        if (operation.type() == OperationType.WRITE) {
            SaveOptions options = SaveOptions.fromMap(operation.options());
            return attempt(source, OperationType.WRITE, () -> {
                backend.save(operation.key(), operation.data(), options);
                return null;
            });
        }
        return attempt(source, OperationType.DELETE, () -> {
            backend.delete(operation.key(), operation.permanent());
            return null;
        });
    }

    /**
     * One bounded call against one source, with failure accounting. Fails with either
     * {@link OperationTimeoutException} or {@link SourceOperationFailedException}.
     */
    private <T> CompletableFuture<T> attempt(PoolEntry source, OperationType type, Callable<T> call) {
        return calls.call(source.id(), type.name().toLowerCase(), call, settings.operationTimeout())
            .handle((value, error) -> {
                if (error == null) {
                    source.recordSuccess();
                    return CompletableFuture.completedFuture(value);
                }
                Throwable cause = unwrap(error);
                StorageRoutingException failure = cause instanceof OperationTimeoutException timeout
                    ? timeout
                    : new SourceOperationFailedException(source.id(), type, cause);
                handleOperationFailure(source);
                return CompletableFuture.<T>failedFuture(failure);
            })
            .thenCompose(Function.identity());
    }

    // ================================================================
    // HEALTH
    // ================================================================

    private void handleOperationFailure(PoolEntry source) {
        int failures = source.recordFailure();
        if (failures >= settings.maxFailures() && source.markUnhealthy()) {
            log.warn("⚠️  Data source {} marked unhealthy after {} consecutive failures", source.id(), failures);
            scheduleRecoveryCheck(source);
        }
    }

    private void scheduleRecoveryCheck(PoolEntry source) {
        if (shuttingDown.get()) {
            return;
        }
        recoveryChecks.removeIf(Future::isDone);
        recoveryChecks.add(calls.schedule(() -> checkSourceHealth(source), settings.recoveryCheckDelay()));
    }

    /** The periodic loop and any pending recovery rechecks. */
    List<ScheduledFuture<?>> scheduledHealthChecks() {
        List<ScheduledFuture<?>> scheduled = new ArrayList<>(recoveryChecks);
        ScheduledFuture<?> loop = healthCheckTask;
        if (loop != null) {
            scheduled.add(loop);
        }
        return scheduled;
    }

    @Override
    public CompletableFuture<Void> checkHealth() {
        CompletableFuture<?>[] checks = pooledEntries().stream()
            .map(this::checkSourceHealth)
            .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(checks);
    }

    private CompletableFuture<Void> checkSourceHealth(PoolEntry source) {
        if (shuttingDown.get()) {
            return CompletableFuture.completedFuture(null);
        }
        return ensureBackend(source)
            .thenCompose(backend -> runHealthCheck(source.id(), backend))
            .thenAccept(healthy -> {
                boolean wasHealthy = source.recordHealthCheck(healthy);
                if (healthy && !wasHealthy) {
                    log.info("✅ Data source {} recovered", source.id());
                } else if (!healthy && wasHealthy) {
                    log.warn("⚠️  Data source {} became unhealthy", source.id());
                }
            });
    }

    /**
     * The entry's backend, rebuilt when construction or initialization failed earlier.
     * Completes with {@code null} while the source still cannot be built.
     */
    private CompletableFuture<StorageBackend> ensureBackend(PoolEntry source) {
        StorageBackend current = source.backend();
        if (current != null) {
            return CompletableFuture.completedFuture(current);
        }
        return calls.call(() -> buildBackend(source.config()))
            .thenApply(backend -> {
                if (shuttingDown.get()) {
                    shutdownBackend(source.id(), backend);
                    return null;
                }
                if (!source.installBackend(backend)) {
                    log.debug("Data source {} was rebuilt concurrently, releasing the duplicate", source.id());
                    shutdownBackend(source.id(), backend);
                    return source.backend();
                }
                log.info("Data source {} backend initialized on retry", source.id());
                return backend;
            })
            .exceptionally(error -> {
                log.debug("Data source {} still cannot be initialized: {}", source.id(), describe(error));
                return null;
            });
    }

    /**
     * Health check with the operation deadline. Absent backends, exceptions and timeouts
     * all count as unhealthy.
     */
    private CompletableFuture<Boolean> runHealthCheck(String sourceId, StorageBackend backend) {
        if (backend == null) {
            return CompletableFuture.completedFuture(false);
        }
        return calls.call(sourceId, "health check", backend::healthCheck, settings.operationTimeout())
            .exceptionally(error -> {
                log.debug("Health check threw on source {}: {}", sourceId, describe(error));
                return false;
            });
    }

    // ================================================================
    // STATUS
    // ================================================================

    @Override
    public RouterStatus getStatus() {
        List<SourceStatus> snapshots = pooledEntries().stream()
            .map(PoolEntry::snapshot)
            .collect(Collectors.toList());
        int healthy = (int) snapshots.stream().filter(SourceStatus::healthy).count();
        return new RouterStatus(snapshots.size(), healthy, snapshots.size() - healthy, snapshots);
    }

    @Override
    public List<SourceHandle> healthySources() {
        return pooledEntries().stream()
            .filter(PoolEntry::healthy)
            .filter(entry -> entry.backend() != null)
            .map(PoolEntry::handle)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<StorageBackend> getBackend(String sourceId) {
        return Optional.ofNullable(pool.get(sourceId)).map(PoolEntry::backend);
    }

    /**
     * Pool entries in configured order (priority descending).
     */
    private List<PoolEntry> pooledEntries() {
        return sources.stream()
            .map(config -> pool.get(config.id()))
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
