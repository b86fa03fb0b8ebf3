package com.purchasingpower.taskhub.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Light-weight projection of a {@link TaskList}, as returned by a source's list call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskListSummary {

    private String id;
    private String title;
    private int progress;
    private int totalItems;
    private int completedItems;
    private Instant lastUpdated;
    private String projectTag;
    private boolean archived;

    public static TaskListSummary of(TaskList list) {
        String tag = list.getProjectTag() == null || list.getProjectTag().isBlank()
            ? TaskList.DEFAULT_PROJECT_TAG
            : list.getProjectTag();
        return TaskListSummary.builder()
            .id(list.getId())
            .title(list.getTitle())
            .progress(list.getProgress())
            .totalItems(list.getTotalItems())
            .completedItems(list.getCompletedItems())
            .lastUpdated(list.getUpdatedAt())
            .projectTag(tag)
            .archived(list.isArchived())
            .build();
    }

    @JsonIgnore
    public boolean isCompleted() {
        return progress >= 100;
    }
}
