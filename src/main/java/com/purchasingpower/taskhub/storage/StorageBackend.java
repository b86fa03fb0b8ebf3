package com.purchasingpower.taskhub.storage;

import com.purchasingpower.taskhub.model.TaskList;
import com.purchasingpower.taskhub.model.TaskListSummary;

import java.util.List;

/**
 * Contract every storage source implements.
 *
 * <p>Calls are blocking. Callers run them on the storage executor and bound them with a
 * deadline; a call that overruns its deadline is interrupted, so implementations that
 * loop over many records should check {@link Thread#isInterrupted()} between records.
 *
 * <p>Implementations signal their own failures with
 * {@link com.purchasingpower.taskhub.exception.StorageException}.
 *
 * @since 1.0.0
 */
public interface StorageBackend {

    /**
     * Prepare resources (directories, connections). Called once before first use.
     */
    default void initialize() {
    }

    /**
     * Report whether the backend can currently serve requests.
     *
     * <p>Must not throw. Callers still treat a thrown exception as "unhealthy".
     */
    boolean healthCheck();

    /**
     * Load a task list.
     *
     * @param key list id
     * @param options load options, never null
     * @return the list, or {@code null} when this source does not hold it
     */
    TaskList load(String key, LoadOptions options);

    /**
     * Create or replace a task list.
     */
    void save(String key, TaskList list, SaveOptions options);

    /**
     * Delete a task list.
     *
     * @param permanent {@code false} keeps a recoverable copy where the backend supports it
     */
    void delete(String key, boolean permanent);

    /**
     * List summaries of the stored task lists.
     */
    List<TaskListSummary> list(ListOptions options);

    /**
     * Release resources. Best-effort; called once during router teardown.
     */
    default void shutdown() {
    }
}
