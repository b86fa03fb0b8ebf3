package com.purchasingpower.taskhub.aggregation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fields a search result can be ordered by. Not every field applies to every record
 * kind; ordering by an unsupported field leaves the result in fetch order.
 */
public enum SortField {
    TITLE("title"),
    CREATED_AT("createdAt"),
    UPDATED_AT("updatedAt"),
    COMPLETED_AT("completedAt"),
    /** Highest priority among the list's tasks. */
    PRIORITY("priority"),
    /** Progress, as a stand-in for status. */
    STATUS("status"),
    ESTIMATED_DURATION("estimatedDuration");

    private final String value;

    SortField(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @return the matching field, or {@code null} when {@code value} names none
     */
    @JsonCreator
    public static SortField fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (SortField field : values()) {
            if (field.value.equalsIgnoreCase(value.trim()) || field.name().equalsIgnoreCase(value.trim())) {
                return field;
            }
        }
        return null;
    }
}
