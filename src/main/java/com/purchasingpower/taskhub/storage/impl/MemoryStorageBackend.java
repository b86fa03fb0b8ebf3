package com.purchasingpower.taskhub.storage.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.taskhub.exception.StorageException;
import com.purchasingpower.taskhub.model.TaskList;
import com.purchasingpower.taskhub.model.TaskListSummary;
import com.purchasingpower.taskhub.storage.ListOptions;
import com.purchasingpower.taskhub.storage.LoadOptions;
import com.purchasingpower.taskhub.storage.SaveOptions;
import com.purchasingpower.taskhub.storage.StorageBackend;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Process-local backend for development and tests.
 *
 * <p>Lists are copied on the way in and on the way out, so callers never share state
 * with the store.
 */
@Slf4j
public class MemoryStorageBackend implements StorageBackend {

    static final int MAX_BACKUPS_PER_LIST = 3;

    private final ObjectMapper mapper = TaskListJson.newMapper();
    private final Map<String, TaskList> data = new ConcurrentHashMap<>();
    private final Map<String, Deque<TaskList>> backups = new ConcurrentHashMap<>();
    private volatile boolean initialized;

    @Override
    public void initialize() {
        if (initialized) {
            return;
        }
        data.clear();
        backups.clear();
        initialized = true;
        log.info("Memory storage backend initialized");
    }

    @Override
    public boolean healthCheck() {
        return initialized;
    }

    @Override
    public TaskList load(String key, LoadOptions options) {
        ensureInitialized();
        TaskList stored = data.get(key);
        if (stored == null) {
            return null;
        }
        if (stored.isArchived() && !options.includeArchived()) {
            log.debug("List {} is archived, not returned", key);
            return null;
        }
        return TaskListJson.copy(mapper, stored);
    }

    @Override
    public void save(String key, TaskList list, SaveOptions options) {
        ensureInitialized();
        if (options.validate()) {
            TaskListJson.validate(list);
        }

        TaskList copy = TaskListJson.copy(mapper, list);
        TaskList previous = data.put(key, copy);
        if (options.backup() && previous != null) {
            keepBackup(key, previous);
        }
        log.debug("Saved list {} ({}) to memory", key, list.getTitle());
    }

    @Override
    public void delete(String key, boolean permanent) {
        ensureInitialized();
        TaskList removed = data.remove(key);
        if (removed == null) {
            throw new StorageException("Task list not found: " + key);
        }
        if (!permanent) {
            keepBackup(key, removed);
        }
        log.info("Deleted list {} from memory (permanent={})", key, permanent);
    }

    @Override
    public List<TaskListSummary> list(ListOptions options) {
        ensureInitialized();
        Stream<TaskListSummary> summaries = data.values().stream()
            .filter(list -> options.includeArchived() || !list.isArchived())
            .map(TaskListSummary::of)
            .filter(summary -> options.projectTag() == null || options.projectTag().equals(summary.getProjectTag()))
            .sorted(Comparator.comparing(TaskListSummary::getLastUpdated,
                    Comparator.nullsLast(Comparator.reverseOrder()))
                .thenComparing(TaskListSummary::getId));

        if (options.offset() != null && options.offset() > 0) {
            summaries = summaries.skip(options.offset());
        }
        if (options.limit() != null && options.limit() > 0) {
            summaries = summaries.limit(options.limit());
        }
        return summaries.collect(Collectors.toList());
    }

    @Override
    public void shutdown() {
        data.clear();
        backups.clear();
        initialized = false;
        log.info("Memory storage backend shut down");
    }

    /**
     * Backups held for {@code key}, newest first. Never part of {@link #list}.
     */
    List<TaskList> backupsOf(String key) {
        Deque<TaskList> kept = backups.get(key);
        if (kept == null) {
            return List.of();
        }
        synchronized (kept) {
            return List.copyOf(kept);
        }
    }

    private void keepBackup(String key, TaskList previous) {
        Deque<TaskList> kept = backups.computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (kept) {
            kept.addFirst(previous);
            while (kept.size() > MAX_BACKUPS_PER_LIST) {
                kept.removeLast();
            }
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new StorageException("Storage backend not initialized");
        }
    }
}
