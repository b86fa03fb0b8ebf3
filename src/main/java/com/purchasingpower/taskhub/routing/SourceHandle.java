package com.purchasingpower.taskhub.routing;

import com.purchasingpower.taskhub.storage.StorageBackend;

/**
 * A live source as handed to the aggregator.
 */
public record SourceHandle(StorageBackend backend, String id, String name, int priority) {
}
