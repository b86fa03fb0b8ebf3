package com.purchasingpower.taskhub.aggregation;

import java.time.Instant;

/**
 * Inclusive range over a list's {@code updatedAt}. A {@code null} bound is open.
 */
public record DateRange(Instant start, Instant end) {

    public boolean contains(Instant instant) {
        if (instant == null) {
            return false;
        }
        if (start != null && instant.isBefore(start)) {
            return false;
        }
        return end == null || !instant.isAfter(end);
    }
}
