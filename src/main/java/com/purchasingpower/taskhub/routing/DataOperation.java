package com.purchasingpower.taskhub.routing;

import com.purchasingpower.taskhub.model.TaskList;
import lombok.Builder;

import java.util.Map;

/**
 * A single-entity request submitted to the {@link DataSourceRouter}.
 *
 * @param type read, write or delete
 * @param key list id
 * @param data list to write, WRITE only
 * @param permanent skip the recoverable copy on DELETE
 * @param options generic options ({@code includeArchived}, {@code backup}, {@code validate})
 */
@Builder
public record DataOperation(
    OperationType type,
    String key,
    TaskList data,
    boolean permanent,
    Map<String, Object> options
) {

    public DataOperation {
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static DataOperation read(String key) {
        return DataOperation.builder().type(OperationType.READ).key(key).build();
    }

    public static DataOperation write(TaskList list) {
        return DataOperation.builder().type(OperationType.WRITE).key(list.getId()).data(list).build();
    }

    public static DataOperation delete(String key, boolean permanent) {
        return DataOperation.builder().type(OperationType.DELETE).key(key).permanent(permanent).build();
    }
}
