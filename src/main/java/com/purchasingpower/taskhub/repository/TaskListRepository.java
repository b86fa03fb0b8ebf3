package com.purchasingpower.taskhub.repository;

import com.purchasingpower.taskhub.aggregation.SearchQuery;
import com.purchasingpower.taskhub.aggregation.SearchResult;
import com.purchasingpower.taskhub.model.TaskList;
import com.purchasingpower.taskhub.model.TaskListSummary;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Task list persistence across every configured storage source.
 *
 * <p>Single-list operations go through the router; searches fan out to every healthy
 * source through the aggregator.
 *
 * @since 1.0.0
 */
public interface TaskListRepository {

    /**
     * @return the list from the highest-priority source that has it, empty when none does
     */
    CompletableFuture<Optional<TaskList>> findById(String id, boolean includeArchived);

    default CompletableFuture<Optional<TaskList>> findById(String id) {
        return findById(id, false);
    }

    /**
     * Create or replace a list, preferring sources tagged with its project.
     */
    CompletableFuture<Void> save(TaskList list);

    /**
     * @param permanent {@code false} keeps a recoverable copy where the source supports it
     */
    CompletableFuture<Void> delete(String id, boolean permanent);

    CompletableFuture<SearchResult<TaskList>> search(SearchQuery query);

    CompletableFuture<SearchResult<TaskListSummary>> searchSummaries(SearchQuery query);
}
