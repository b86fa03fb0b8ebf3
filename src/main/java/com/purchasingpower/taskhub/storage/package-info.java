/**
 * Storage backend contract consumed by the federation layer.
 *
 * <p>Every configured source is a {@link com.purchasingpower.taskhub.storage.StorageBackend}.
 * The router and the aggregator only ever talk to this interface; concrete backends live
 * in {@code storage.impl} and are built by a
 * {@link com.purchasingpower.taskhub.storage.StorageBackendFactory}.
 *
 * @since 1.0.0
 */
package com.purchasingpower.taskhub.storage;
