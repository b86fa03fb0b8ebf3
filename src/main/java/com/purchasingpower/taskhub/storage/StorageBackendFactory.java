package com.purchasingpower.taskhub.storage;

import com.purchasingpower.taskhub.routing.SourceConfig;

/**
 * Builds the backend for a configured source.
 *
 * <p>Construction only; the router calls {@link StorageBackend#initialize()} afterwards.
 */
@FunctionalInterface
public interface StorageBackendFactory {

    StorageBackend create(SourceConfig config);
}
