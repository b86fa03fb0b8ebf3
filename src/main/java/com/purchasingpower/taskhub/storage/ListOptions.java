package com.purchasingpower.taskhub.storage;

import lombok.Builder;

/**
 * Options for {@link StorageBackend#list}.
 *
 * @param projectTag only lists with this tag, {@code null} for all
 * @param includeArchived include archived lists
 * @param offset records to skip, {@code null} for none
 * @param limit maximum records, {@code null} for no limit
 */
@Builder
public record ListOptions(String projectTag, boolean includeArchived, Integer offset, Integer limit) {

    public static final ListOptions ALL = new ListOptions(null, false, null, null);
}
