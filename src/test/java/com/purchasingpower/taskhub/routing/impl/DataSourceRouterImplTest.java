package com.purchasingpower.taskhub.routing.impl;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.purchasingpower.taskhub.concurrent.TestExecutors;
import com.purchasingpower.taskhub.exception.NoAvailableSourceException;
import com.purchasingpower.taskhub.exception.OperationTimeoutException;
import com.purchasingpower.taskhub.exception.ReadExhaustedException;
import com.purchasingpower.taskhub.exception.RouterShuttingDownException;
import com.purchasingpower.taskhub.exception.SourceOperationFailedException;
import com.purchasingpower.taskhub.exception.StorageException;
import com.purchasingpower.taskhub.model.TaskList;
import com.purchasingpower.taskhub.routing.DataOperation;
import com.purchasingpower.taskhub.routing.DataSourceType;
import com.purchasingpower.taskhub.routing.OperationContext;
import com.purchasingpower.taskhub.routing.OperationType;
import com.purchasingpower.taskhub.routing.RouterSettings;
import com.purchasingpower.taskhub.routing.RouterStatus;
import com.purchasingpower.taskhub.routing.SourceConfig;
import com.purchasingpower.taskhub.routing.SourceHandle;
import com.purchasingpower.taskhub.routing.SourceStatus;
import com.purchasingpower.taskhub.storage.ScriptedBackend;
import com.purchasingpower.taskhub.storage.StorageBackend;
import com.purchasingpower.taskhub.storage.StorageBackendFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static com.purchasingpower.taskhub.storage.TaskLists.list;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DataSourceRouter")
class DataSourceRouterImplTest {

    private final Map<String, StorageBackend> backends = new HashMap<>();
    private final StorageBackendFactory factory = config -> {
        StorageBackend backend = backends.get(config.id());
        if (backend == null) {
            throw new StorageException("no backend scripted for " + config.id());
        }
        return backend;
    };

    private TestExecutors executors;
    private DataSourceRouterImpl router;

    @BeforeEach
    void setUp() {
        executors = new TestExecutors();
    }

    @AfterEach
    void tearDown() {
        if (router != null) {
            router.shutdown().join();
        }
        executors.close();
    }

    // ================================================================
    // READ
    // ================================================================

    @Test
    @DisplayName("Read is served by the highest-priority source without touching the others")
    void read_shouldUseHighestPrioritySourceOnly() {
        // Given
        ScriptedBackend high = register("high", new ScriptedBackend().with(list("x", "from high")));
        ScriptedBackend low = register("low", new ScriptedBackend().with(list("x", "from low")));
        start(settings().build(), source("low", 1), source("high", 10));

        // When
        TaskList result = router.<TaskList>routeOperation(DataOperation.read("x"), OperationContext.NONE).join();

        // Then
        assertThat(result.getTitle()).isEqualTo("from high");
        assertThat(high.loadCalls).hasValue(1);
        assertThat(low.loadCalls).hasValue(0);
    }

    @Test
    @DisplayName("A read that finds nothing is a successful attempt")
    void read_missingKey_shouldReturnNullAndResetFailures() {
        // Given
        ScriptedBackend only = register("only", new ScriptedBackend().failingLoadOf("bad"));
        start(settings().build(), source("only", 1));
        assertThatThrownBy(() -> router.routeOperation(DataOperation.read("bad"), OperationContext.NONE).join())
            .hasCauseInstanceOf(ReadExhaustedException.class);
        assertThat(failureCount("only")).isEqualTo(1);

        // When
        Object result = router.routeOperation(DataOperation.read("missing"), OperationContext.NONE).join();

        // Then
        assertThat(result).isNull();
        assertThat(failureCount("only")).isZero();
        assertThat(only.loadCalls).hasValue(2);
    }

    @Test
    @DisplayName("A failing read falls through to the next source")
    void read_primaryFails_shouldFallBack() {
        // Given
        register("primary", new ScriptedBackend().failing(true));
        register("secondary", new ScriptedBackend().with(list("x", "from secondary")));
        start(settings().build(), source("primary", 10), source("secondary", 5));

        // When
        TaskList result = router.<TaskList>routeOperation(DataOperation.read("x"), OperationContext.NONE).join();

        // Then
        assertThat(result.getTitle()).isEqualTo("from secondary");
        assertThat(failureCount("primary")).isEqualTo(1);
        assertThat(failureCount("secondary")).isZero();
    }

    @Test
    @DisplayName("Every read candidate failing surfaces one aggregate error")
    void read_allFail_shouldRaiseReadExhausted() {
        // Given
        register("a", new ScriptedBackend().failing(true));
        register("b", new ScriptedBackend().failing(true));
        start(settings().build(), source("a", 10), source("b", 5));

        // When / Then
        assertThatThrownBy(() -> router.routeOperation(DataOperation.read("x"), OperationContext.NONE).join())
            .isInstanceOf(CompletionException.class)
            .cause()
            .isInstanceOfSatisfying(ReadExhaustedException.class, e -> {
                assertThat(e.getFailedSources()).containsExactly("a", "b");
                assertThat(e.getSuppressed()).hasSize(2)
                    .allMatch(s -> s instanceof SourceOperationFailedException);
            });
    }

    @Test
    @DisplayName("With fallback disabled a read stops after the first failure")
    void read_fallbackDisabled_shouldStopAfterFirstFailure() {
        // Given
        register("a", new ScriptedBackend().failing(true));
        ScriptedBackend b = register("b", new ScriptedBackend().with(list("x", "from b")));
        start(settings().enableFallback(false).build(), source("a", 10), source("b", 5));

        // When / Then
        assertThatThrownBy(() -> router.routeOperation(DataOperation.read("x"), OperationContext.NONE).join())
            .cause()
            .isInstanceOfSatisfying(ReadExhaustedException.class,
                e -> assertThat(e.getFailedSources()).containsExactly("a"));
        assertThat(b.loadCalls).hasValue(0);
    }

    @Test
    @DisplayName("A read exceeding the deadline times out and its backend call is interrupted")
    void read_slowBackend_shouldTimeOutAndInterrupt() throws Exception {
        // Given
        ScriptedBackend slow = register("slow", new ScriptedBackend().latency(Duration.ofSeconds(10)));
        start(settings().operationTimeout(Duration.ofMillis(200)).build(), source("slow", 1));

        // When / Then
        assertThatThrownBy(() -> router.routeOperation(DataOperation.read("x"), OperationContext.NONE).join())
            .cause()
            .isInstanceOfSatisfying(ReadExhaustedException.class,
                e -> assertThat(e.getSuppressed()[0]).isInstanceOf(OperationTimeoutException.class));
        assertThat(slow.interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(failureCount("slow")).isEqualTo(1);
    }

    // ================================================================
    // WRITE / DELETE
    // ================================================================

    @Test
    @DisplayName("A failed primary write succeeds on the next writable source")
    void write_primaryFails_shouldFallBackAndCountOneFailure() {
        // Given
        register("primary", new ScriptedBackend().failing(true));
        ScriptedBackend secondary = register("secondary", new ScriptedBackend());
        start(settings().build(), source("primary", 10), source("secondary", 5));

        // When
        router.routeOperation(DataOperation.write(list("x", "new")), OperationContext.NONE).join();

        // Then
        assertThat(secondary.stored("x")).isNotNull();
        assertThat(failureCount("primary")).isEqualTo(1);
    }

    @Test
    @DisplayName("When every writable source fails the primary's error is surfaced")
    void write_allFail_shouldSurfacePrimaryError() {
        // Given
        register("primary", new ScriptedBackend().failing(true));
        register("secondary", new ScriptedBackend().failing(true));
        start(settings().build(), source("primary", 10), source("secondary", 5));

        // When / Then
        assertThatThrownBy(() -> router.routeOperation(DataOperation.write(list("x", "new")), OperationContext.NONE).join())
            .cause()
            .isInstanceOfSatisfying(SourceOperationFailedException.class, e -> {
                assertThat(e.getSourceId()).isEqualTo("primary");
                assertThat(e.getOperationType()).isEqualTo(OperationType.WRITE);
            });
    }

    @Test
    @DisplayName("Read-only sources never receive writes")
    void write_shouldSkipReadonlySources() {
        // Given
        ScriptedBackend archive = register("archive", new ScriptedBackend());
        ScriptedBackend main = register("main", new ScriptedBackend());
        start(settings().build(),
            source("archive", 100).toBuilder().readonly(true).build(),
            source("main", 1));

        // When
        router.routeOperation(DataOperation.write(list("x", "new")), OperationContext.NONE).join();

        // Then
        assertThat(archive.saveCalls).hasValue(0);
        assertThat(main.saveCalls).hasValue(1);
    }

    @Test
    @DisplayName("Only read-only sources left means no candidate for a write")
    void write_onlyReadonlySources_shouldRaiseNoAvailableSource() {
        // Given
        register("archive", new ScriptedBackend());
        start(settings().build(), source("archive", 100).toBuilder().readonly(true).build());

        // When / Then
        assertThatThrownBy(() -> router.routeOperation(DataOperation.write(list("x", "new")), OperationContext.NONE).join())
            .cause()
            .isInstanceOfSatisfying(NoAvailableSourceException.class,
                e -> assertThat(e.getOperationType()).isEqualTo(OperationType.WRITE));
    }

    @Test
    @DisplayName("Sources tagged with the project are preferred; no match means every source")
    void write_shouldPreferProjectTaggedSources() {
        // Given
        ScriptedBackend general = register("general", new ScriptedBackend());
        ScriptedBackend alpha = register("alpha", new ScriptedBackend());
        start(settings().build(),
            source("general", 10),
            source("alpha", 1).toBuilder().tag("alpha").build());

        // When
        router.routeOperation(DataOperation.write(list("a1", "alpha list")), OperationContext.forProject("alpha")).join();
        router.routeOperation(DataOperation.write(list("z1", "other list")), OperationContext.forProject("zeta")).join();

        // Then
        assertThat(alpha.stored("a1")).isNotNull();
        assertThat(general.stored("a1")).isNull();
        assertThat(general.stored("z1")).isNotNull();
    }

    @Test
    @DisplayName("A failed primary delete falls back like a write")
    void delete_primaryFails_shouldFallBack() {
        // Given
        register("primary", new ScriptedBackend().failing(true));
        ScriptedBackend secondary = register("secondary", new ScriptedBackend().with(list("x", "old")));
        start(settings().build(), source("primary", 10), source("secondary", 5));

        // When
        router.routeOperation(DataOperation.delete("x", true), OperationContext.NONE).join();

        // Then
        assertThat(secondary.stored("x")).isNull();
        assertThat(secondary.deleteCalls).hasValue(1);
    }

    @Test
    @DisplayName("Operations missing their key or data are rejected before any source is touched")
    void routeOperation_invalidOperation_shouldFailWithoutBackendCalls() {
        // Given
        ScriptedBackend only = register("only", new ScriptedBackend());
        start(settings().build(), source("only", 1));
        DataOperation writeWithoutData = DataOperation.builder().type(OperationType.WRITE).key("x").build();

        // When / Then
        assertThatThrownBy(() -> router.routeOperation(writeWithoutData, OperationContext.NONE).join())
            .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> router.routeOperation(DataOperation.read(" "), OperationContext.NONE).join())
            .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(only.saveCalls).hasValue(0);
        assertThat(only.loadCalls).hasValue(0);
        assertThat(failureCount("only")).isZero();
    }

    @Test
    @DisplayName("Only a read failure that is followed by another attempt is logged as trying next")
    void read_allFail_shouldLogTryingNextOnlyBeforeAnotherAttempt() {
        // Given
        register("high", new ScriptedBackend().failing(true));
        register("low", new ScriptedBackend().failing(true));
        start(settings().build(), source("low", 1), source("high", 10));

        // When
        List<String> messages = routerLog(() -> assertThatThrownBy(() ->
                router.routeOperation(DataOperation.read("x"), OperationContext.NONE).join())
            .hasCauseInstanceOf(ReadExhaustedException.class));

        // Then
        assertThat(messages)
            .filteredOn(message -> message.startsWith("Read of x failed"))
            .satisfiesExactly(
                first -> assertThat(first).contains("source high, trying next"),
                last -> assertThat(last).contains("source low, no sources left"));
    }

    @Test
    @DisplayName("The routing log line names the list from the operation context")
    void routeOperation_shouldLogContextListId() {
        // Given
        register("only", new ScriptedBackend().with(list("x", "X")));
        start(settings().build(), source("only", 1));

        // When
        List<String> messages = routerLog(() ->
            router.routeOperation(DataOperation.read("x"), OperationContext.builder().listId("list-42").build()).join());

        // Then
        assertThat(messages).anySatisfy(message -> assertThat(message).contains("Routing READ of x (list list-42)"));
    }

    @Test
    @DisplayName("A structurally invalid list is rejected up front and never counts against a source")
    void write_invalidList_shouldFailWithoutBackendCallsOrFailureCount() {
        // Given
        ScriptedBackend primary = register("primary", new ScriptedBackend());
        ScriptedBackend secondary = register("secondary", new ScriptedBackend());
        start(settings().maxFailures(1).build(), source("primary", 10), source("secondary", 1));
        TaskList untitled = list("x", " ");

        // When
        for (int attempt = 0; attempt < 3; attempt++) {
            assertThatThrownBy(() -> router.routeOperation(DataOperation.write(untitled), OperationContext.NONE).join())
                .hasCauseInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("title");
        }

        // Then
        assertThat(primary.saveCalls).hasValue(0);
        assertThat(secondary.saveCalls).hasValue(0);
        assertThat(failureCount("primary")).isZero();
        assertThat(router.getStatus().healthy()).isEqualTo(2);
    }

    @Test
    @DisplayName("Turning off validation lets a list without a title through to the backend")
    void write_validationDisabled_shouldStoreListWithoutTitle() {
        // Given
        ScriptedBackend only = register("only", new ScriptedBackend());
        start(settings().build(), source("only", 1));
        DataOperation unchecked = DataOperation.builder()
            .type(OperationType.WRITE)
            .key("x")
            .data(list("x", null))
            .options(Map.of("validate", false))
            .build();

        // When
        router.routeOperation(unchecked, OperationContext.NONE).join();

        // Then
        assertThat(only.stored("x")).isNotNull();
    }

    // ================================================================
    // HEALTH
    // ================================================================

    @Test
    @DisplayName("After maxFailures failed reads the sole source is excluded and the next read fails fast")
    void read_maxFailuresReached_shouldExcludeSource() {
        // Given
        ScriptedBackend only = register("only", new ScriptedBackend().failing(true));
        start(settings().maxFailures(3).build(), source("only", 1));

        // When
        for (int attempt = 0; attempt < 3; attempt++) {
            assertThatThrownBy(() -> router.routeOperation(DataOperation.read("x"), OperationContext.NONE).join())
                .hasCauseInstanceOf(ReadExhaustedException.class);
        }

        // Then
        assertThat(router.getStatus().source("only")).get()
            .extracting(SourceStatus::healthy)
            .isEqualTo(false);
        assertThatThrownBy(() -> router.routeOperation(DataOperation.read("x"), OperationContext.NONE).join())
            .hasCauseInstanceOf(NoAvailableSourceException.class);
        assertThat(only.loadCalls).hasValue(3);
    }

    @Test
    @DisplayName("A successful health check brings an unhealthy source back with a clean count")
    void checkHealth_afterFailures_shouldRestoreSource() {
        // Given
        ScriptedBackend only = register("only", new ScriptedBackend().failing(true));
        start(settings().maxFailures(2).build(), source("only", 1));
        for (int attempt = 0; attempt < 2; attempt++) {
            assertThatThrownBy(() -> router.routeOperation(DataOperation.read("x"), OperationContext.NONE).join())
                .hasCauseInstanceOf(ReadExhaustedException.class);
        }
        assertThat(router.healthySources()).isEmpty();

        // When
        only.failing(false);
        router.checkHealth().join();

        // Then
        SourceStatus status = router.getStatus().source("only").orElseThrow();
        assertThat(status.healthy()).isTrue();
        assertThat(status.failureCount()).isZero();
        assertThat(router.healthySources()).extracting(SourceHandle::id).containsExactly("only");
    }

    @Test
    @DisplayName("A health check reporting false takes the source out of rotation")
    void checkHealth_unhealthyBackend_shouldExcludeSource() {
        // Given
        ScriptedBackend flaky = register("flaky", new ScriptedBackend());
        register("steady", new ScriptedBackend());
        start(settings().build(), source("flaky", 10), source("steady", 1));

        // When
        flaky.healthy(false);
        router.checkHealth().join();

        // Then
        assertThat(router.healthySources()).extracting(SourceHandle::id).containsExactly("steady");
        assertThat(router.getStatus().unhealthy()).isEqualTo(1);
    }

    @Test
    @DisplayName("A source marked unhealthy is rechecked on its own after the recovery delay")
    void recoveryCheck_shouldRestoreSourceWithoutManualHealthCheck() throws Exception {
        // Given
        ScriptedBackend only = register("only", new ScriptedBackend().failing(true));
        start(settings().maxFailures(1).recoveryCheckDelay(Duration.ofMillis(300)).build(), source("only", 1));

        // When
        assertThatThrownBy(() -> router.routeOperation(DataOperation.read("x"), OperationContext.NONE).join())
            .hasCauseInstanceOf(ReadExhaustedException.class);
        assertThat(router.healthySources()).isEmpty();
        assertThat(router.scheduledHealthChecks()).hasSize(2);
        only.failing(false);

        // Then
        awaitUntil(() -> router.getStatus().source("only").orElseThrow().healthy());
        assertThat(failureCount("only")).isZero();
        assertThat(only.healthCheckCalls).hasValue(2);
        assertThat(router.healthySources()).extracting(SourceHandle::id).containsExactly("only");
    }

    @Test
    @DisplayName("The periodic health loop takes a source out of rotation and brings it back")
    void healthLoop_shouldTrackBackendHealthOverTime() throws Exception {
        // Given
        ScriptedBackend flaky = register("flaky", new ScriptedBackend());
        register("steady", new ScriptedBackend());
        start(settings().healthCheckInterval(Duration.ofMillis(100)).build(), source("flaky", 10), source("steady", 1));

        // When
        flaky.healthy(false);

        // Then
        awaitUntil(() -> router.getStatus().unhealthy() == 1);
        assertThat(router.healthySources()).extracting(SourceHandle::id).containsExactly("steady");

        // When
        flaky.healthy(true);

        // Then
        awaitUntil(() -> router.getStatus().healthy() == 2);
        assertThat(router.healthySources()).extracting(SourceHandle::id).containsExactly("flaky", "steady");
    }

    @Test
    @DisplayName("Shutdown cancels the health loop and pending recovery rechecks")
    void shutdown_shouldCancelScheduledHealthChecks() throws Exception {
        // Given
        ScriptedBackend only = register("only", new ScriptedBackend().failing(true));
        start(settings().maxFailures(1).healthCheckInterval(Duration.ofMillis(100)).build(), source("only", 1));
        assertThatThrownBy(() -> router.routeOperation(DataOperation.read("x"), OperationContext.NONE).join())
            .hasCauseInstanceOf(ReadExhaustedException.class);
        List<ScheduledFuture<?>> scheduled = router.scheduledHealthChecks();
        assertThat(scheduled).hasSize(2);

        // When
        router.shutdown().join();
        Thread.sleep(50);
        int checksAtShutdown = only.healthCheckCalls.get();
        Thread.sleep(400);

        // Then
        assertThat(scheduled).allMatch(Future::isCancelled);
        assertThat(router.scheduledHealthChecks()).isEmpty();
        assertThat(only.healthCheckCalls).hasValue(checksAtShutdown);
    }

    // ================================================================
    // LIFECYCLE
    // ================================================================

    @Test
    @DisplayName("A source that cannot be built joins the pool unhealthy at maxFailures")
    void initialize_brokenSource_shouldJoinUnhealthy() {
        // Given
        register("good", new ScriptedBackend());
        start(settings().maxFailures(3).build(), source("good", 1), source("broken", 10));

        // When
        RouterStatus status = router.getStatus();

        // Then
        assertThat(status.total()).isEqualTo(2);
        assertThat(status.healthy()).isEqualTo(1);
        SourceStatus broken = status.source("broken").orElseThrow();
        assertThat(broken.healthy()).isFalse();
        assertThat(broken.failureCount()).isEqualTo(3);
        assertThat(router.getBackend("broken")).isEmpty();
    }

    @Test
    @DisplayName("A source that failed to build is rebuilt by a later health check")
    void checkHealth_brokenSource_shouldRetryConstruction() {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        ScriptedBackend eventual = new ScriptedBackend();
        StorageBackendFactory flakyFactory = config -> {
            if (attempts.incrementAndGet() == 1) {
                throw new StorageException("not yet");
            }
            return eventual;
        };
        router = new DataSourceRouterImpl(List.of(source("late", 1)), settings().build(), flakyFactory, executors.calls());
        router.initialize().join();
        assertThat(router.healthySources()).isEmpty();

        // When
        router.checkHealth().join();

        // Then
        assertThat(router.healthySources()).extracting(SourceHandle::id).containsExactly("late");
        assertThat(router.getBackend("late")).containsSame(eventual);
    }

    @Test
    @DisplayName("Concurrent rebuilds of a broken source keep one backend and release the other")
    void checkHealth_concurrentRebuilds_shouldKeepOneBackend() throws Exception {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch bothBuilding = new CountDownLatch(2);
        List<ScriptedBackend> built = new CopyOnWriteArrayList<>();
        StorageBackendFactory racingFactory = config -> {
            if (attempts.incrementAndGet() == 1) {
                throw new StorageException("not yet");
            }
            bothBuilding.countDown();
            try {
                if (!bothBuilding.await(5, TimeUnit.SECONDS)) {
                    throw new StorageException("second rebuild never started");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StorageException("interrupted", e);
            }
            ScriptedBackend backend = new ScriptedBackend();
            built.add(backend);
            return backend;
        };
        router = new DataSourceRouterImpl(List.of(source("late", 1)), settings().build(), racingFactory, executors.calls());
        router.initialize().join();

        // When
        CompletableFuture.allOf(router.checkHealth(), router.checkHealth()).join();

        // Then
        assertThat(built).hasSize(2);
        StorageBackend kept = router.getBackend("late").orElseThrow();
        ScriptedBackend released = built.get(0) == kept ? built.get(1) : built.get(0);
        awaitUntil(() -> released.shutdownCalls.get() == 1);
        assertThat(built).contains((ScriptedBackend) kept);
        assertThat(((ScriptedBackend) kept).shutdownCalls).hasValue(0);
        assertThat(router.healthySources()).extracting(SourceHandle::id).containsExactly("late");
    }

    @Test
    @DisplayName("Disabled sources are not pooled")
    void initialize_disabledSource_shouldBeIgnored() {
        // Given
        register("on", new ScriptedBackend());
        register("off", new ScriptedBackend());

        // When
        start(settings().build(), source("on", 1), source("off", 10).toBuilder().enabled(false).build());

        // Then
        assertThat(router.getStatus().sources()).extracting(SourceStatus::id).containsExactly("on");
    }

    @Test
    @DisplayName("Status is a snapshot, not a live view")
    void getStatus_shouldReturnSnapshot() {
        // Given
        register("only", new ScriptedBackend().failing(true));
        start(settings().build(), source("only", 1));
        RouterStatus before = router.getStatus();

        // When
        assertThatThrownBy(() -> router.routeOperation(DataOperation.read("x"), OperationContext.NONE).join())
            .hasCauseInstanceOf(ReadExhaustedException.class);

        // Then
        assertThat(before.source("only").orElseThrow().failureCount()).isZero();
        assertThat(router.getStatus().source("only").orElseThrow().failureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("After shutdown new operations are refused and backends are shut down once")
    void shutdown_shouldRefuseNewOperationsAndReleaseBackends() {
        // Given
        ScriptedBackend only = register("only", new ScriptedBackend());
        start(settings().build(), source("only", 1));

        // When
        router.shutdown().join();
        router.shutdown().join();

        // Then
        assertThat(only.shutdownCalls).hasValue(1);
        assertThat(router.getStatus().total()).isZero();
        assertThatThrownBy(() -> router.routeOperation(DataOperation.read("x"), OperationContext.NONE).join())
            .hasCauseInstanceOf(RouterShuttingDownException.class);
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private ScriptedBackend register(String id, ScriptedBackend backend) {
        backends.put(id, backend);
        return backend;
    }

    private void start(RouterSettings settings, SourceConfig... sources) {
        router = new DataSourceRouterImpl(List.of(sources), settings, factory, executors.calls());
        router.initialize().join();
    }

    private int failureCount(String sourceId) {
        return router.getStatus().source(sourceId).orElseThrow().failureCount();
    }

    /** Messages the router logs at DEBUG and above while {@code action} runs. */
    private static List<String> routerLog(Runnable action) {
        Logger logger = (Logger) LoggerFactory.getLogger(DataSourceRouterImpl.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        Level previous = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        logger.addAppender(appender);
        try {
            action.run();
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(previous);
        }
        return appender.list.stream().map(ILoggingEvent::getFormattedMessage).collect(Collectors.toList());
    }

    private static void awaitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }

    private static SourceConfig source(String id, int priority) {
        return SourceConfig.builder()
            .id(id)
            .type(DataSourceType.MEMORY)
            .priority(priority)
            .enabled(true)
            .build();
    }

    private static RouterSettings.RouterSettingsBuilder settings() {
        return RouterSettings.builder()
            .healthCheckInterval(Duration.ofHours(1))
            .maxFailures(3)
            .operationTimeout(Duration.ofSeconds(5))
            .enableFallback(true)
            .recoveryCheckDelay(Duration.ofHours(1));
    }
}
