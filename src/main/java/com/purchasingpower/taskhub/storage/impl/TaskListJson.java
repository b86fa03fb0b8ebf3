package com.purchasingpower.taskhub.storage.impl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.purchasingpower.taskhub.exception.StorageException;
import com.purchasingpower.taskhub.model.TaskList;

import java.io.IOException;

/**
 * JSON mapping shared by the bundled backends.
 */
final class TaskListJson {

    private TaskListJson() {
    }

    static ObjectMapper newMapper() {
        return new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Deep copy through a JSON round trip, so the copy shares no mutable state.
     */
    static TaskList copy(ObjectMapper mapper, TaskList list) {
        try {
            return mapper.readValue(mapper.writeValueAsBytes(list), TaskList.class);
        } catch (IOException e) {
            throw new StorageException("Failed to copy task list " + list.getId(), e);
        }
    }

    /**
     * Structural checks applied before a list is stored.
     */
    static void validate(TaskList list) {
        if (list.getId() == null || list.getId().isBlank()) {
            throw new StorageException("Invalid task list: missing or invalid id");
        }
        if (list.getTitle() == null || list.getTitle().isBlank()) {
            throw new StorageException("Invalid task list: missing or invalid title");
        }
        if (list.getItems() == null) {
            throw new StorageException("Invalid task list: items must be a list");
        }
    }
}
