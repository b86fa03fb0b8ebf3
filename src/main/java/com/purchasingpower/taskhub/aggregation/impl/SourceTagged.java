package com.purchasingpower.taskhub.aggregation.impl;

import java.time.Instant;

/**
 * A fetched record and where it came from. Lives only between fetch and resolution.
 */
record SourceTagged<T>(T value, String sourceId, String sourceName, int priority, Instant fetchedAt) {
}
