package com.purchasingpower.taskhub.aggregation.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.taskhub.aggregation.AggregatorSettings;
import com.purchasingpower.taskhub.aggregation.MultiSourceAggregator;
import com.purchasingpower.taskhub.aggregation.SearchQuery;
import com.purchasingpower.taskhub.aggregation.SearchResult;
import com.purchasingpower.taskhub.concurrent.TimeLimitedExecutor;
import com.purchasingpower.taskhub.model.TaskList;
import com.purchasingpower.taskhub.model.TaskListSummary;
import com.purchasingpower.taskhub.routing.SourceHandle;
import com.purchasingpower.taskhub.storage.ListOptions;
import com.purchasingpower.taskhub.storage.LoadOptions;
import com.purchasingpower.taskhub.storage.StorageBackend;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Default {@link MultiSourceAggregator}.
 *
 * <p>Pipeline per call:
 * <pre>
 * fetch (per source, bounded by queryTimeout) → tag with source → group by id
 *   → resolve → filter → sort → paginate
 * </pre>
 *
 * <p>Holds no state between calls.
 *
 * @since 1.0.0
 */
@Slf4j
public class MultiSourceAggregatorImpl implements MultiSourceAggregator {

    private final AggregatorSettings settings;
    private final TimeLimitedExecutor calls;

    public MultiSourceAggregatorImpl(AggregatorSettings settings, TimeLimitedExecutor calls) {
        this.settings = settings;
        this.calls = calls;

        log.info("MultiSourceAggregator created: conflictResolution={}, parallelQueries={}, queryTimeout={}ms",
            settings.conflictResolution().getValue(), settings.parallelQueries(), settings.queryTimeout().toMillis());
    }

    @Override
    public CompletableFuture<SearchResult<TaskList>> aggregateLists(List<SourceHandle> sources, SearchQuery query) {
        Preconditions.checkArgument(sources != null && !sources.isEmpty(), "At least one source is required");
        SearchQuery search = query != null ? query : SearchQuery.ALL;

        log.debug("Aggregating lists from {} sources", sources.size());

        return fetchAll(sources, source -> fetchLists(source, search)).thenApply(fetched -> {
            List<TaskList> resolved = ConflictResolver.deduplicate(fetched, TaskList::getId,
                copies -> ConflictResolver.resolve(copies, settings.conflictResolution()));
            log.debug("Deduplicated lists: fetched={}, unique={}", fetched.size(), resolved.size());

            List<TaskList> filtered = SearchPipeline.filterLists(resolved, search);
            List<TaskList> sorted = SearchPipeline.sortLists(filtered, search.sorting());
            SearchResult<TaskList> result = SearchPipeline.paginate(sorted, search.pagination());

            log.info("Aggregation complete: totalCount={}, returned={}, hasMore={}",
                result.totalCount(), result.items().size(), result.hasMore());
            return result;
        });
    }

    @Override
    public CompletableFuture<SearchResult<TaskListSummary>> aggregateSummaries(List<SourceHandle> sources,
                                                                               SearchQuery query) {
        Preconditions.checkArgument(sources != null && !sources.isEmpty(), "At least one source is required");
        SearchQuery search = query != null ? query : SearchQuery.ALL;

        log.debug("Aggregating summaries from {} sources", sources.size());

        return fetchAll(sources, source -> fetchSummaries(source, search)).thenApply(fetched -> {
            List<TaskListSummary> resolved = ConflictResolver.deduplicate(fetched, TaskListSummary::getId,
                ConflictResolver::byPriority);
            log.debug("Deduplicated summaries: fetched={}, unique={}", fetched.size(), resolved.size());

            List<TaskListSummary> filtered = SearchPipeline.filterSummaries(resolved, search);
            List<TaskListSummary> sorted = SearchPipeline.sortSummaries(filtered, search.sorting());
            SearchResult<TaskListSummary> result = SearchPipeline.paginate(sorted, search.pagination());

            log.info("Summary aggregation complete: totalCount={}, returned={}, hasMore={}",
                result.totalCount(), result.items().size(), result.hasMore());
            return result;
        });
    }

    // ================================================================
    // FETCH
    // ================================================================

    /**
     * Records from every source, in source order. Parallel mode starts all fetches at
     * once; sequential mode starts each fetch after the previous one settled.
     */
    private <T> CompletableFuture<List<SourceTagged<T>>> fetchAll(List<SourceHandle> sources,
                                                                 Function<SourceHandle, CompletableFuture<List<T>>> fetch) {
        if (settings.parallelQueries()) {
            List<CompletableFuture<List<SourceTagged<T>>>> fetches = sources.stream()
                .map(source -> isolate(source, fetch))
                .collect(Collectors.toList());
            return CompletableFuture.allOf(fetches.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> fetches.stream()
                    .flatMap(f -> f.join().stream())
                    .collect(Collectors.toList()));
        }

        CompletableFuture<List<SourceTagged<T>>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (SourceHandle source : sources) {
            chain = chain.thenCompose(collected -> isolate(source, fetch).thenApply(batch -> {
                collected.addAll(batch);
                return collected;
            }));
        }
        return chain;
    }

    /**
     * One source's records, tagged. Never fails: a failing source yields nothing.
     */
    private <T> CompletableFuture<List<SourceTagged<T>>> isolate(SourceHandle source,
                                                                Function<SourceHandle, CompletableFuture<List<T>>> fetch) {
        CompletableFuture<List<T>> records;
        try {
            records = fetch.apply(source);
        } catch (RuntimeException e) {
            records = CompletableFuture.failedFuture(e);
        }
        return records
            .thenApply(values -> tag(source, values))
            .exceptionally(error -> {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
                log.warn("Failed to query source {}: {}", source.id(), cause.getMessage());
                return List.of();
            });
    }

    private CompletableFuture<List<TaskList>> fetchLists(SourceHandle source, SearchQuery query) {
        return calls.call(source.id(), "list query", () -> loadAll(source, query), settings.queryTimeout());
    }

    /**
     * Summaries first, then each list by id. A list that fails to load is skipped.
     */
    private List<TaskList> loadAll(SourceHandle source, SearchQuery query) {
        StorageBackend backend = source.backend();
        List<TaskListSummary> summaries = backend.list(listOptions(query));
        LoadOptions loadOptions = new LoadOptions(query.includeArchived());

        List<TaskList> lists = new ArrayList<>();
        for (TaskListSummary summary : summaries == null ? List.<TaskListSummary>of() : summaries) {
            if (Thread.currentThread().isInterrupted()) {
                log.debug("List query on source {} interrupted after {} lists", source.id(), lists.size());
                break;
            }
            try {
                TaskList list = backend.load(summary.getId(), loadOptions);
                if (list != null) {
                    lists.add(list);
                }
            } catch (RuntimeException e) {
                log.warn("Failed to load list {} from source {}: {}", summary.getId(), source.id(), e.getMessage());
            }
        }
        return lists;
    }

    private CompletableFuture<List<TaskListSummary>> fetchSummaries(SourceHandle source, SearchQuery query) {
        return calls.call(source.id(), "summary query", () -> {
            List<TaskListSummary> summaries = source.backend().list(listOptions(query));
            return summaries == null ? List.<TaskListSummary>of() : summaries;
        }, settings.queryTimeout());
    }

    private static ListOptions listOptions(SearchQuery query) {
        return ListOptions.builder()
            .projectTag(query.projectTag())
            .includeArchived(query.includeArchived())
            .build();
    }

    private static <T> List<SourceTagged<T>> tag(SourceHandle source, List<T> records) {
        Instant fetchedAt = Instant.now();
        return records.stream()
            .filter(Objects::nonNull)
            .map(record -> new SourceTagged<>(record, source.id(), source.name(), source.priority(), fetchedAt))
            .collect(Collectors.toList());
    }
}
