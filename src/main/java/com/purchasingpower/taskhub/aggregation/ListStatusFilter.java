package com.purchasingpower.taskhub.aggregation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Derived list status used by search filters. A list is completed at 100% progress.
 */
public enum ListStatusFilter {
    ACTIVE("active"),
    COMPLETED("completed"),
    ALL("all");

    private final String value;

    ListStatusFilter(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ListStatusFilter fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        for (ListStatusFilter status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown list status: " + value);
    }

    public boolean matches(boolean completed) {
        return switch (this) {
            case ACTIVE -> !completed;
            case COMPLETED -> completed;
            case ALL -> true;
        };
    }
}
