package com.purchasingpower.taskhub.aggregation;

/**
 * Slice of a sorted, filtered result.
 *
 * @param offset records to skip, 0 when {@code null}
 * @param limit maximum records to return, everything after {@code offset} when {@code null}
 */
public record PaginationOptions(Integer offset, Integer limit) {

    public static PaginationOptions of(int offset, int limit) {
        return new PaginationOptions(offset, limit);
    }

    public int effectiveOffset() {
        return offset == null ? 0 : Math.max(0, offset);
    }
}
