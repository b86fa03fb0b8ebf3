package com.purchasingpower.taskhub.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Task priority. The numeric weight is what gets persisted and compared.
 */
public enum TaskPriority {

    CRITICAL(5),
    HIGH(4),
    MEDIUM(3),
    LOW(2),
    MINIMAL(1);

    private final int weight;

    TaskPriority(int weight) {
        this.weight = weight;
    }

    @JsonValue
    public int getWeight() {
        return weight;
    }

    @JsonCreator
    public static TaskPriority fromWeight(int weight) {
        for (TaskPriority priority : values()) {
            if (priority.weight == weight) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown task priority: " + weight);
    }
}
