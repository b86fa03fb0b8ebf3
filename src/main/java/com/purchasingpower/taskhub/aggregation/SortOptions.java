package com.purchasingpower.taskhub.aggregation;

/**
 * @param field field to order by; {@code null} keeps fetch order
 * @param direction descending when {@code null}
 */
public record SortOptions(SortField field, SortDirection direction) {

    public SortOptions {
        direction = direction == null ? SortDirection.DESC : direction;
    }

    public static SortOptions ascending(SortField field) {
        return new SortOptions(field, SortDirection.ASC);
    }

    public static SortOptions descending(SortField field) {
        return new SortOptions(field, SortDirection.DESC);
    }
}
