package com.purchasingpower.taskhub.storage.impl;

import com.google.common.base.Strings;
import com.purchasingpower.taskhub.exception.StorageException;
import com.purchasingpower.taskhub.routing.SourceConfig;
import com.purchasingpower.taskhub.storage.StorageBackend;
import com.purchasingpower.taskhub.storage.StorageBackendFactory;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * Builds the bundled backends from a source's type and options.
 *
 * <p>Options read:
 * <ul>
 *   <li>{@code dataDirectory} (FILESYSTEM, required)</li>
 *   <li>{@code backupRetentionDays} (FILESYSTEM, default 7)</li>
 * </ul>
 */
@Slf4j
public class DefaultStorageBackendFactory implements StorageBackendFactory {

    public static final String DATA_DIRECTORY = "dataDirectory";
    public static final String BACKUP_RETENTION_DAYS = "backupRetentionDays";

    @Override
    public StorageBackend create(SourceConfig config) {
        log.debug("Creating {} backend for source {}", config.type(), config.id());
        return switch (config.type()) {
            case MEMORY -> new MemoryStorageBackend();
            case FILESYSTEM -> fileBackend(config);
            case POSTGRESQL, MONGODB -> throw new StorageException(
                "No backend available for source type " + config.type() + " (source " + config.id() + ")");
        };
    }

    private StorageBackend fileBackend(SourceConfig config) {
        String directory = config.option(DATA_DIRECTORY);
        if (Strings.isNullOrEmpty(directory)) {
            throw new StorageException("Source " + config.id() + " requires option " + DATA_DIRECTORY);
        }
        return new FileStorageBackend(Path.of(directory), retentionDays(config));
    }

    private static int retentionDays(SourceConfig config) {
        String value = config.option(BACKUP_RETENTION_DAYS);
        if (Strings.isNullOrEmpty(value)) {
            return FileStorageBackend.DEFAULT_BACKUP_RETENTION_DAYS;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new StorageException("Source " + config.id() + ": " + BACKUP_RETENTION_DAYS
                + " must be a number, got '" + value + "'", e);
        }
    }
}
