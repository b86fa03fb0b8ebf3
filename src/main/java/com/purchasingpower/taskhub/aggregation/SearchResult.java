package com.purchasingpower.taskhub.aggregation;

import java.util.List;

/**
 * One page of an aggregated query.
 *
 * @param items records in the requested slice
 * @param totalCount records matching the filters, before pagination
 * @param hasMore whether records remain after this slice
 * @param pagination echo of the applied slice, {@code null} when the query had none
 */
public record SearchResult<T>(List<T> items, int totalCount, boolean hasMore, Page pagination) {

    public SearchResult {
        items = List.copyOf(items);
    }

    /**
     * Applied slice. {@code limit} is the total count when the caller gave none.
     */
    public record Page(int offset, int limit) {
    }
}
