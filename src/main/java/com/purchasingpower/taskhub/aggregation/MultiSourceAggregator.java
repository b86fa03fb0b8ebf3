package com.purchasingpower.taskhub.aggregation;

import com.purchasingpower.taskhub.model.TaskList;
import com.purchasingpower.taskhub.model.TaskListSummary;
import com.purchasingpower.taskhub.routing.SourceHandle;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Answers list and search queries across several sources at once.
 *
 * <p>Every call is a pipeline over the sources given at call time: fetch from each source,
 * group copies by list id, pick one copy per id, then filter, sort and paginate. A source
 * that fails or times out contributes nothing; the call itself still completes normally.
 *
 * @since 1.0.0
 */
public interface MultiSourceAggregator {

    /**
     * Full lists. Copies of the same list are resolved with the configured
     * {@link ConflictResolutionStrategy}.
     *
     * @throws IllegalArgumentException if {@code sources} is empty
     */
    CompletableFuture<SearchResult<TaskList>> aggregateLists(List<SourceHandle> sources, SearchQuery query);

    /**
     * Summaries. Copies of the same list always resolve to the highest-priority source.
     *
     * @throws IllegalArgumentException if {@code sources} is empty
     */
    CompletableFuture<SearchResult<TaskListSummary>> aggregateSummaries(List<SourceHandle> sources, SearchQuery query);
}
