package com.purchasingpower.taskhub.api;

import com.purchasingpower.taskhub.aggregation.ListStatusFilter;
import com.purchasingpower.taskhub.aggregation.PaginationOptions;
import com.purchasingpower.taskhub.aggregation.SearchQuery;
import com.purchasingpower.taskhub.aggregation.SearchResult;
import com.purchasingpower.taskhub.aggregation.SortDirection;
import com.purchasingpower.taskhub.aggregation.SortField;
import com.purchasingpower.taskhub.aggregation.SortOptions;
import com.purchasingpower.taskhub.model.TaskList;
import com.purchasingpower.taskhub.model.TaskListSummary;
import com.purchasingpower.taskhub.repository.TaskListRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Optional;

/**
 * REST controller for task lists.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/lists")
@RequiredArgsConstructor
public class TaskListController {

    private final TaskListRepository repository;

    /**
     * Summaries of every list across all healthy sources.
     *
     * GET /api/v1/lists?text=&projectTag=&status=&includeArchived=&sortField=&sortDirection=&offset=&limit=
     */
    @GetMapping
    public ResponseEntity<ApiResponse<SearchResult<TaskListSummary>>> listSummaries(
            @RequestParam(required = false) String text,
            @RequestParam(required = false) String projectTag,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "false") boolean includeArchived,
            @RequestParam(required = false) String sortField,
            @RequestParam(required = false) String sortDirection,
            @RequestParam(required = false) Integer offset,
            @RequestParam(required = false) Integer limit) {
        try {
            SearchQuery query = SearchQuery.builder()
                .text(text)
                .projectTag(projectTag)
                .status(ListStatusFilter.fromValue(status))
                .includeArchived(includeArchived)
                .sorting(sortField != null
                    ? new SortOptions(SortField.fromValue(sortField), SortDirection.fromValue(sortDirection))
                    : null)
                .pagination(offset != null || limit != null ? new PaginationOptions(offset, limit) : null)
                .build();

            SearchResult<TaskListSummary> result = repository.searchSummaries(query).join();
            return ResponseEntity.ok(ApiResponse.success(result));

        } catch (Exception e) {
            return ErrorResponses.from("List summaries", e);
        }
    }

    /**
     * Full lists matching a query.
     *
     * POST /api/v1/lists/search
     */
    @PostMapping("/search")
    public ResponseEntity<ApiResponse<SearchResult<TaskList>>> search(@RequestBody(required = false) SearchQuery query) {
        try {
            log.info("Search lists: text={}, projectTag={}", query != null ? query.text() : null,
                query != null ? query.projectTag() : null);

            SearchResult<TaskList> result = repository.search(query != null ? query : SearchQuery.ALL).join();
            return ResponseEntity.ok(ApiResponse.success(result));

        } catch (Exception e) {
            return ErrorResponses.from("Search", e);
        }
    }

    /**
     * GET /api/v1/lists/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<TaskList>> getList(@PathVariable String id,
                                                         @RequestParam(defaultValue = "false") boolean includeArchived) {
        try {
            Optional<TaskList> list = repository.findById(id, includeArchived).join();
            if (list.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.error("Task list not found: " + id));
            }
            return ResponseEntity.ok(ApiResponse.success(list.get()));

        } catch (Exception e) {
            return ErrorResponses.from("Load list " + id, e);
        }
    }

    /**
     * Create or replace a list. The path id wins over the body's id.
     *
     * PUT /api/v1/lists/{id}
     */
    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<TaskList>> saveList(@PathVariable String id, @RequestBody TaskList list) {
        try {
            Instant now = Instant.now();
            list.setId(id);
            if (list.getCreatedAt() == null) {
                list.setCreatedAt(now);
            }
            list.setUpdatedAt(now);

            repository.save(list).join();
            log.info("Saved list {} ({})", id, list.getTitle());
            return ResponseEntity.ok(ApiResponse.success(list));

        } catch (Exception e) {
            return ErrorResponses.from("Save list " + id, e);
        }
    }

    /**
     * DELETE /api/v1/lists/{id}?permanent=false
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteList(@PathVariable String id,
                                                        @RequestParam(defaultValue = "false") boolean permanent) {
        try {
            repository.delete(id, permanent).join();
            log.info("Deleted list {} (permanent={})", id, permanent);
            return ResponseEntity.ok(ApiResponse.success(null));

        } catch (Exception e) {
            return ErrorResponses.from("Delete list " + id, e);
        }
    }
}
