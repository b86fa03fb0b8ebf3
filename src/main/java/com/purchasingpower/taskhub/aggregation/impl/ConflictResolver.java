package com.purchasingpower.taskhub.aggregation.impl;

import com.purchasingpower.taskhub.aggregation.ConflictResolutionStrategy;
import com.purchasingpower.taskhub.model.TaskList;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Groups fetched copies by list id and keeps one copy per id.
 */
@Slf4j
final class ConflictResolver {

    private ConflictResolver() {
    }

    /**
     * One record per id, in order of first appearance. Source metadata is dropped.
     */
    static <T> List<T> deduplicate(List<SourceTagged<T>> fetched,
                                   Function<T, String> idOf,
                                   Function<List<SourceTagged<T>>, SourceTagged<T>> resolve) {
        Map<String, List<SourceTagged<T>>> groups = new LinkedHashMap<>();
        for (SourceTagged<T> copy : fetched) {
            groups.computeIfAbsent(idOf.apply(copy.value()), id -> new ArrayList<>()).add(copy);
        }

        List<T> resolved = new ArrayList<>(groups.size());
        groups.forEach((id, copies) -> {
            if (copies.size() == 1) {
                resolved.add(copies.get(0).value());
            } else {
                log.debug("Conflict detected for list {}: {} copies", id, copies.size());
                resolved.add(resolve.apply(copies).value());
            }
        });
        return resolved;
    }

    static SourceTagged<TaskList> resolve(List<SourceTagged<TaskList>> copies, ConflictResolutionStrategy strategy) {
        ConflictResolutionStrategy applied = strategy.effective();
        if (applied != strategy) {
            log.warn("{} conflict resolution not implemented for list {}, using {}",
                strategy.getValue(), copies.get(0).value().getId(), applied.getValue());
        }
        SourceTagged<TaskList> winner = applied == ConflictResolutionStrategy.LATEST
            ? byLatest(copies)
            : byPriority(copies);
        log.debug("Resolved list {} by {}: source={}", winner.value().getId(), applied.getValue(), winner.sourceId());
        return winner;
    }

    /**
     * Most recently updated copy; the first one wins a tie. A missing timestamp counts as the epoch.
     */
    static SourceTagged<TaskList> byLatest(List<SourceTagged<TaskList>> copies) {
        SourceTagged<TaskList> winner = copies.get(0);
        for (SourceTagged<TaskList> copy : copies) {
            if (updatedAt(copy).isAfter(updatedAt(winner))) {
                winner = copy;
            }
        }
        return winner;
    }

    /**
     * Copy from the highest-priority source; the first one wins a tie.
     */
    static <T> SourceTagged<T> byPriority(List<SourceTagged<T>> copies) {
        SourceTagged<T> winner = copies.get(0);
        for (SourceTagged<T> copy : copies) {
            if (copy.priority() > winner.priority()) {
                winner = copy;
            }
        }
        return winner;
    }

    private static Instant updatedAt(SourceTagged<TaskList> copy) {
        Instant updatedAt = copy.value().getUpdatedAt();
        return updatedAt != null ? updatedAt : Instant.EPOCH;
    }
}
