package com.purchasingpower.taskhub.repository.impl;

import com.purchasingpower.taskhub.aggregation.MultiSourceAggregator;
import com.purchasingpower.taskhub.aggregation.SearchQuery;
import com.purchasingpower.taskhub.aggregation.SearchResult;
import com.purchasingpower.taskhub.exception.NoAvailableSourceException;
import com.purchasingpower.taskhub.model.TaskList;
import com.purchasingpower.taskhub.model.TaskListSummary;
import com.purchasingpower.taskhub.repository.TaskListRepository;
import com.purchasingpower.taskhub.routing.DataOperation;
import com.purchasingpower.taskhub.routing.DataSourceRouter;
import com.purchasingpower.taskhub.routing.OperationContext;
import com.purchasingpower.taskhub.routing.OperationType;
import com.purchasingpower.taskhub.routing.SourceHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * {@link TaskListRepository} over the {@link DataSourceRouter} and {@link MultiSourceAggregator}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FederatedTaskListRepository implements TaskListRepository {

    private final DataSourceRouter router;
    private final MultiSourceAggregator aggregator;

    @Override
    public CompletableFuture<Optional<TaskList>> findById(String id, boolean includeArchived) {
        DataOperation read = DataOperation.builder()
            .type(OperationType.READ)
            .key(id)
            .options(Map.of("includeArchived", includeArchived))
            .build();
        return router.<TaskList>routeOperation(read, OperationContext.builder().listId(id).build())
            .thenApply(Optional::ofNullable);
    }

    @Override
    public CompletableFuture<Void> save(TaskList list) {
        log.debug("Saving list {} (project {})", list.getId(), list.getProjectTag());
        OperationContext context = OperationContext.builder()
            .projectTag(list.getProjectTag())
            .listId(list.getId())
            .build();
        return router.routeOperation(DataOperation.write(list), context);
    }

    @Override
    public CompletableFuture<Void> delete(String id, boolean permanent) {
        log.debug("Deleting list {} (permanent={})", id, permanent);
        return router.routeOperation(DataOperation.delete(id, permanent), OperationContext.builder().listId(id).build());
    }

    @Override
    public CompletableFuture<SearchResult<TaskList>> search(SearchQuery query) {
        List<SourceHandle> sources = router.healthySources();
        if (sources.isEmpty()) {
            return CompletableFuture.failedFuture(new NoAvailableSourceException(OperationType.READ));
        }
        return aggregator.aggregateLists(sources, query);
    }

    @Override
    public CompletableFuture<SearchResult<TaskListSummary>> searchSummaries(SearchQuery query) {
        List<SourceHandle> sources = router.healthySources();
        if (sources.isEmpty()) {
            return CompletableFuture.failedFuture(new NoAvailableSourceException(OperationType.READ));
        }
        return aggregator.aggregateSummaries(sources, query);
    }
}
