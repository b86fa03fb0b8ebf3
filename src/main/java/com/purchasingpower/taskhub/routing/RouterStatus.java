package com.purchasingpower.taskhub.routing;

import java.util.List;
import java.util.Optional;

/**
 * Point-in-time snapshot of the router's pool, ordered by priority.
 */
public record RouterStatus(int total, int healthy, int unhealthy, List<SourceStatus> sources) {

    public RouterStatus {
        sources = List.copyOf(sources);
    }

    public Optional<SourceStatus> source(String id) {
        return sources.stream().filter(s -> s.id().equals(id)).findFirst();
    }
}
