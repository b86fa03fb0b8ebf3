package com.purchasingpower.taskhub.configuration;

import com.purchasingpower.taskhub.routing.DataSourceType;
import com.purchasingpower.taskhub.routing.SourceConfig;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One entry of {@code app.storage.sources}.
 */
@Data
public class SourceProperties {

    @NotBlank(message = "Source id is required")
    private String id;

    private String name;

    @NotNull(message = "Source type is required")
    private DataSourceType type;

    @Min(0)
    private int priority = 0;

    private boolean readonly = false;

    private boolean enabled = true;

    private Set<String> tags = new LinkedHashSet<>();

    /**
     * Backend-specific options, e.g. {@code dataDirectory} for filesystem sources.
     */
    private Map<String, String> config = new HashMap<>();

    public SourceConfig toSourceConfig() {
        return SourceConfig.builder()
            .id(id)
            .name(name)
            .type(type)
            .priority(priority)
            .readonly(readonly)
            .enabled(enabled)
            .tags(tags)
            .config(config)
            .build();
    }
}
