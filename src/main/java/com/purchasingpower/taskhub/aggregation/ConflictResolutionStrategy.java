package com.purchasingpower.taskhub.aggregation;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.extern.slf4j.Slf4j;

/**
 * How one copy is chosen when several sources hold the same list.
 */
@Slf4j
public enum ConflictResolutionStrategy {
    /** Most recent {@code updatedAt} wins; ties go to the first copy fetched. */
    LATEST("latest"),
    /** Copy from the highest-priority source wins. */
    PRIORITY("priority"),
    /** Resolved as {@link #PRIORITY}. */
    MANUAL("manual"),
    /** Resolved as {@link #LATEST}. */
    MERGE("merge");

    private final String value;

    ConflictResolutionStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * The strategy actually applied: {@link #LATEST} or {@link #PRIORITY}.
     */
    public ConflictResolutionStrategy effective() {
        return switch (this) {
            case LATEST, MERGE -> LATEST;
            case PRIORITY, MANUAL -> PRIORITY;
        };
    }

    /**
     * Parse a configured name. Blank means {@link #LATEST}; an unknown name falls back to
     * {@link #PRIORITY}.
     */
    public static ConflictResolutionStrategy parse(String value) {
        if (value == null || value.isBlank()) {
            return LATEST;
        }
        for (ConflictResolutionStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(value.trim())) {
                return strategy;
            }
        }
        log.warn("Unknown conflict resolution strategy '{}', using priority", value);
        return PRIORITY;
    }
}
