package com.purchasingpower.taskhub.model;

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
 * A single task (child record) of a {@link TaskList}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    private String id;
    private String title;
    private String description;

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    @Builder.Default
    private TaskPriority priority = TaskPriority.MEDIUM;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    /**
     * Estimated duration in minutes.
     */
    private Integer estimatedDuration;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
