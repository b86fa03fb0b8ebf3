package com.purchasingpower.taskhub.storage;

import java.util.Map;

/**
 * Options for {@link StorageBackend#load}.
 */
public record LoadOptions(boolean includeArchived) {

    public static final LoadOptions DEFAULT = new LoadOptions(false);

    public static LoadOptions fromMap(Map<String, Object> options) {
        if (options == null || options.isEmpty()) {
            return DEFAULT;
        }
        return new LoadOptions(Boolean.TRUE.equals(options.get("includeArchived")));
    }
}
