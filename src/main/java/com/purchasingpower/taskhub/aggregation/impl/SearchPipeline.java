package com.purchasingpower.taskhub.aggregation.impl;

import com.purchasingpower.taskhub.aggregation.PaginationOptions;
import com.purchasingpower.taskhub.aggregation.SearchQuery;
import com.purchasingpower.taskhub.aggregation.SearchResult;
import com.purchasingpower.taskhub.aggregation.SortDirection;
import com.purchasingpower.taskhub.aggregation.SortField;
import com.purchasingpower.taskhub.aggregation.SortOptions;
import com.purchasingpower.taskhub.model.Task;
import com.purchasingpower.taskhub.model.TaskList;
import com.purchasingpower.taskhub.model.TaskListSummary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Filter, sort and paginate steps applied after resolution.
 */
final class SearchPipeline {

    private SearchPipeline() {
    }

    // ================================================================
    // FILTERS
    // ================================================================

    static List<TaskList> filterLists(List<TaskList> lists, SearchQuery query) {
        return lists.stream()
            .filter(list -> matchesText(query.text(), list.getTitle(), list.getDescription()))
            .filter(list -> query.projectTag() == null || query.projectTag().equals(projectTag(list)))
            .filter(list -> query.status().matches(list.isCompleted()))
            .filter(list -> query.taskStatus().isEmpty()
                || anyTask(list, task -> query.taskStatus().contains(task.getStatus())))
            .filter(list -> query.taskPriority().isEmpty()
                || anyTask(list, task -> query.taskPriority().contains(task.getPriority())))
            .filter(list -> query.taskTags().isEmpty()
                || anyTask(list, task -> task.getTags() != null
                    && task.getTags().stream().anyMatch(query.taskTags()::contains)))
            .filter(list -> query.dateRange() == null || query.dateRange().contains(list.getUpdatedAt()))
            .collect(Collectors.toList());
    }

    /**
     * Summaries carry no description and no tasks, so only text, tag and status apply.
     */
    static List<TaskListSummary> filterSummaries(List<TaskListSummary> summaries, SearchQuery query) {
        return summaries.stream()
            .filter(summary -> matchesText(query.text(), summary.getTitle(), null))
            .filter(summary -> query.projectTag() == null || query.projectTag().equals(summary.getProjectTag()))
            .filter(summary -> query.status().matches(summary.isCompleted()))
            .collect(Collectors.toList());
    }

    private static boolean matchesText(String text, String title, String description) {
        if (text == null || text.isEmpty()) {
            return true;
        }
        String needle = text.toLowerCase(Locale.ROOT);
        return contains(title, needle) || contains(description, needle);
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String projectTag(TaskList list) {
        String tag = list.getProjectTag();
        return tag == null || tag.isBlank() ? TaskList.DEFAULT_PROJECT_TAG : tag;
    }

    private static boolean anyTask(TaskList list, Predicate<Task> predicate) {
        return list.getItems() != null && list.getItems().stream().filter(Objects::nonNull).anyMatch(predicate);
    }

    // ================================================================
    // SORTING
    // ================================================================

    static List<TaskList> sortLists(List<TaskList> lists, SortOptions sorting) {
        return sort(lists, sorting, listComparator(sorting == null ? null : sorting.field()));
    }

    static List<TaskListSummary> sortSummaries(List<TaskListSummary> summaries, SortOptions sorting) {
        return sort(summaries, sorting, summaryComparator(sorting == null ? null : sorting.field()));
    }

    private static <T> List<T> sort(List<T> items, SortOptions sorting, Optional<Comparator<T>> comparator) {
        if (sorting == null || comparator.isEmpty()) {
            return items;
        }
        Comparator<T> order = sorting.direction() == SortDirection.DESC
            ? comparator.get().reversed()
            : comparator.get();
        List<T> sorted = new ArrayList<>(items);
        sorted.sort(order);
        return sorted;
    }

    private static Optional<Comparator<TaskList>> listComparator(SortField field) {
        if (field == null) {
            return Optional.empty();
        }
        return switch (field) {
            case TITLE -> Optional.of(Comparator.comparing(TaskList::getTitle, nullsFirst()));
            case CREATED_AT -> Optional.of(Comparator.comparing(TaskList::getCreatedAt, nullsFirst()));
            case UPDATED_AT -> Optional.of(Comparator.comparing(TaskList::getUpdatedAt, nullsFirst()));
            case COMPLETED_AT -> Optional.of(Comparator.comparing(
                (TaskList list) -> list.getCompletedAt() != null ? list.getCompletedAt() : Instant.EPOCH));
            case PRIORITY -> Optional.of(Comparator.comparingInt(TaskList::maxTaskPriority));
            case STATUS -> Optional.of(Comparator.comparingInt(TaskList::getProgress));
            case ESTIMATED_DURATION -> Optional.empty();
        };
    }

    private static Optional<Comparator<TaskListSummary>> summaryComparator(SortField field) {
        if (field == null) {
            return Optional.empty();
        }
        return switch (field) {
            case TITLE -> Optional.of(Comparator.comparing(TaskListSummary::getTitle, nullsFirst()));
            case UPDATED_AT -> Optional.of(Comparator.comparing(TaskListSummary::getLastUpdated, nullsFirst()));
            case STATUS -> Optional.of(Comparator.comparingInt(TaskListSummary::getProgress));
            default -> Optional.empty();
        };
    }

    private static <U extends Comparable<? super U>> Comparator<U> nullsFirst() {
        return Comparator.nullsFirst(Comparator.<U>naturalOrder());
    }

    // ================================================================
    // PAGINATION
    // ================================================================

    /**
     * Slice {@code [offset, offset + limit)} of {@code items} and build the result.
     * {@code totalCount} is the size of {@code items}.
     */
    static <T> SearchResult<T> paginate(List<T> items, PaginationOptions pagination) {
        int total = items.size();
        if (pagination == null) {
            return new SearchResult<>(items, total, false, null);
        }

        int offset = pagination.effectiveOffset();
        int limit = pagination.limit() == null ? total : Math.max(0, pagination.limit());
        int from = Math.min(offset, total);
        int to = from + Math.min(limit, total - from);

        List<T> page = items.subList(from, to);
        boolean hasMore = offset + page.size() < total;
        return new SearchResult<>(page, total, hasMore, new SearchResult.Page(offset, limit));
    }
}
