package com.purchasingpower.taskhub.aggregation;

import com.purchasingpower.taskhub.model.TaskPriority;
import com.purchasingpower.taskhub.model.TaskStatus;
import lombok.Builder;
import lombok.Singular;

import java.util.Set;

/**
 * Multi-source query: filters, ordering and pagination. Every part is optional.
 *
 * @param text case-insensitive substring of the title (or description, for full lists)
 * @param projectTag exact project tag
 * @param status derived list status
 * @param includeArchived also fetch archived lists
 * @param taskStatus keep lists with at least one task in one of these states
 * @param taskPriority keep lists with at least one task at one of these priorities
 * @param taskTags keep lists with at least one task carrying one of these tags
 * @param dateRange keep lists whose {@code updatedAt} falls in the range
 * @param sorting result order, fetch order when {@code null}
 * @param pagination result slice, everything when {@code null}
 */
@Builder(toBuilder = true)
public record SearchQuery(
    String text,
    String projectTag,
    ListStatusFilter status,
    boolean includeArchived,
    Set<TaskStatus> taskStatus,
    Set<TaskPriority> taskPriority,
    @Singular Set<String> taskTags,
    DateRange dateRange,
    SortOptions sorting,
    PaginationOptions pagination
) {

    public static final SearchQuery ALL = SearchQuery.builder().build();

    public SearchQuery {
        status = status == null ? ListStatusFilter.ALL : status;
        taskStatus = taskStatus == null ? Set.of() : Set.copyOf(taskStatus);
        taskPriority = taskPriority == null ? Set.of() : Set.copyOf(taskPriority);
        taskTags = taskTags == null ? Set.of() : Set.copyOf(taskTags);
    }
}
