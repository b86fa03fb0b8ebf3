package com.purchasingpower.taskhub.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A task list: the logical entity persisted by every storage source.
 *
 * <p>The {@code id} is stable across sources. Two sources may hold divergent copies of
 * the same list; readers reconcile them at whole-record granularity.
 *
 * @see TaskListSummary
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskList {

    public static final String DEFAULT_PROJECT_TAG = "default";

    private String id;
    private String title;
    private String description;

    @Builder.Default
    private List<Task> items = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    @Builder.Default
    private String projectTag = DEFAULT_PROJECT_TAG;

    private boolean archived;

    private int totalItems;
    private int completedItems;

    /**
     * Completion percentage, 0-100. A list at 100 counts as completed.
     */
    private int progress;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @JsonIgnore
    public boolean isCompleted() {
        return progress >= 100;
    }

    /**
     * Highest task priority weight in this list, 0 when the list has no tasks.
     */
    public int maxTaskPriority() {
        if (items == null) {
            return 0;
        }
        return items.stream()
            .filter(task -> task.getPriority() != null)
            .mapToInt(task -> task.getPriority().getWeight())
            .max()
            .orElse(0);
    }
}
