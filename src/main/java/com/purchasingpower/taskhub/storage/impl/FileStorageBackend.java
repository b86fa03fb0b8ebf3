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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stores each list as one JSON document.
 *
 * <p>Layout:
 * <pre>
 * &lt;dataDirectory&gt;/
 *   lists/&lt;id&gt;.json                  current version
 *   backups/&lt;id&gt;_deleted_&lt;ms&gt;.json     copy kept by a non-permanent delete
 * </pre>
 *
 * <p>Writes go to a temp file first and are moved into place, so a reader never sees a
 * half-written document.
 *
 * @since 1.0.0
 */
@Slf4j
public class FileStorageBackend implements StorageBackend {

    public static final int DEFAULT_BACKUP_RETENTION_DAYS = 7;

    private static final String JSON = ".json";
    private static final String HEALTH_MARKER = ".health-check";

    private final ObjectMapper mapper = TaskListJson.newMapper();
    private final Path dataDirectory;
    private final Path listsDirectory;
    private final Path backupsDirectory;
    private final int backupRetentionDays;
    private volatile boolean initialized;

    public FileStorageBackend(Path dataDirectory, int backupRetentionDays) {
        this.dataDirectory = dataDirectory;
        this.listsDirectory = dataDirectory.resolve("lists");
        this.backupsDirectory = dataDirectory.resolve("backups");
        this.backupRetentionDays = backupRetentionDays;
    }

    @Override
    public void initialize() {
        if (initialized) {
            return;
        }
        log.info("Initializing file storage backend: dataDirectory={}", dataDirectory.toAbsolutePath());
        try {
            Files.createDirectories(listsDirectory);
            Files.createDirectories(backupsDirectory);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories under " + dataDirectory, e);
        }
        purgeExpiredBackups();
        initialized = true;
        log.info("File storage backend initialized");
    }

    @Override
    public boolean healthCheck() {
        if (!initialized) {
            return false;
        }
        Path marker = dataDirectory.resolve(HEALTH_MARKER);
        try {
            Files.writeString(marker, "ok");
            Files.delete(marker);
            return true;
        } catch (IOException e) {
            log.error("File storage health check failed for {}: {}", dataDirectory, e.getMessage());
            return false;
        }
    }

    @Override
    public TaskList load(String key, LoadOptions options) {
        ensureInitialized();
        Path file = fileOf(key);
        if (!Files.exists(file)) {
            return null;
        }
        TaskList list = read(file);
        if (list.isArchived() && !options.includeArchived()) {
            log.debug("List {} is archived, not returned", key);
            return null;
        }
        return list;
    }

    @Override
    public void save(String key, TaskList list, SaveOptions options) {
        ensureInitialized();
        if (options.validate()) {
            TaskListJson.validate(list);
        }

        Path file = fileOf(key);
        Path temp = file.resolveSibling(key + JSON + ".tmp");
        Path setAside = file.resolveSibling(key + JSON + ".backup");

        try {
            if (options.backup() && Files.exists(file)) {
                Files.copy(file, setAside, StandardCopyOption.REPLACE_EXISTING);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), list);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            Files.deleteIfExists(setAside);
            log.debug("Saved list {} ({}) to {}", key, list.getTitle(), file);
        } catch (IOException e) {
            StorageException failure = new StorageException("Failed to save task list " + key, e);
            rollback(file, temp, setAside, failure);
            throw failure;
        }
    }

    private void rollback(Path file, Path temp, Path setAside, StorageException failure) {
        try {
            if (Files.exists(setAside)) {
                Files.move(setAside, file, StandardCopyOption.REPLACE_EXISTING);
                log.debug("Restored previous version of {}", file.getFileName());
            }
            Files.deleteIfExists(temp);
        } catch (IOException rollbackError) {
            log.error("Rollback after failed save of {} also failed: {}", file.getFileName(), rollbackError.getMessage());
            failure.addSuppressed(rollbackError);
        }
    }

    @Override
    public void delete(String key, boolean permanent) {
        ensureInitialized();
        Path file = fileOf(key);
        if (!Files.exists(file)) {
            throw new StorageException("Task list not found: " + key);
        }
        try {
            if (!permanent) {
                Path backup = backupsDirectory.resolve(key + "_deleted_" + System.currentTimeMillis() + JSON);
                Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
                log.debug("Kept deleted list {} as {}", key, backup.getFileName());
            }
            Files.delete(file);
            log.info("Deleted list {} from file storage (permanent={})", key, permanent);
        } catch (IOException e) {
            throw new StorageException("Failed to delete task list " + key, e);
        }
    }

    @Override
    public List<TaskListSummary> list(ListOptions options) {
        ensureInitialized();
        List<Path> files;
        try (Stream<Path> entries = Files.list(listsDirectory)) {
            files = entries
                .filter(path -> path.getFileName().toString().endsWith(JSON))
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Failed to list " + listsDirectory, e);
        }

        List<TaskListSummary> summaries = new ArrayList<>(files.size());
        for (Path file : files) {
            if (Thread.currentThread().isInterrupted()) {
                throw new StorageException("Listing of " + listsDirectory + " interrupted");
            }
            try {
                TaskList list = read(file);
                if (options.includeArchived() || !list.isArchived()) {
                    summaries.add(TaskListSummary.of(list));
                }
            } catch (StorageException e) {
                log.warn("Skipping unreadable list file {}: {}", file.getFileName(), e.getMessage());
            }
        }

        Stream<TaskListSummary> result = summaries.stream()
            .filter(summary -> options.projectTag() == null || options.projectTag().equals(summary.getProjectTag()))
            .sorted(Comparator.comparing(TaskListSummary::getLastUpdated,
                Comparator.nullsLast(Comparator.reverseOrder())));
        if (options.offset() != null && options.offset() > 0) {
            result = result.skip(options.offset());
        }
        if (options.limit() != null && options.limit() > 0) {
            result = result.limit(options.limit());
        }
        return result.collect(Collectors.toList());
    }

    @Override
    public void shutdown() {
        initialized = false;
        log.info("File storage backend shut down: {}", dataDirectory);
    }

    /**
     * Remove backups older than the retention period. Failures are logged; they never
     * block initialization.
     */
    private void purgeExpiredBackups() {
        Instant cutoff = Instant.now().minus(Duration.ofDays(backupRetentionDays));
        try (Stream<Path> entries = Files.list(backupsDirectory)) {
            for (Path backup : entries.collect(Collectors.toList())) {
                if (Files.getLastModifiedTime(backup).toInstant().isBefore(cutoff)) {
                    Files.delete(backup);
                    log.debug("Removed expired backup {}", backup.getFileName());
                }
            }
        } catch (IOException e) {
            log.warn("Failed to purge expired backups in {}: {}", backupsDirectory, e.getMessage());
        }
    }

    private TaskList read(Path file) {
        try {
            return mapper.readValue(file.toFile(), TaskList.class);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + file.getFileName(), e);
        }
    }

    private Path fileOf(String key) {
        if (key == null || key.isBlank() || key.contains("/") || key.contains("\\") || key.contains("..")) {
            throw new StorageException("Invalid list key: " + key);
        }
        return listsDirectory.resolve(key + JSON);
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new StorageException("Storage backend not initialized");
        }
    }
}
