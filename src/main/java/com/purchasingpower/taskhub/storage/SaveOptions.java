package com.purchasingpower.taskhub.storage;

import java.util.Map;

/**
 * Options for {@link StorageBackend#save}.
 *
 * @param backup keep a copy of the previous version before overwriting
 * @param validate reject structurally invalid lists before writing
 */
public record SaveOptions(boolean backup, boolean validate) {

    public static final SaveOptions DEFAULT = new SaveOptions(false, true);

    public static SaveOptions fromMap(Map<String, Object> options) {
        if (options == null || options.isEmpty()) {
            return DEFAULT;
        }
        Object validate = options.get("validate");
        return new SaveOptions(
            Boolean.TRUE.equals(options.get("backup")),
            validate == null || Boolean.TRUE.equals(validate));
    }
}
