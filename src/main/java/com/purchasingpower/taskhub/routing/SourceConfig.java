package com.purchasingpower.taskhub.routing;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Singular;

import java.util.Map;
import java.util.Set;

/**
 * Immutable description of one configured storage source.
 *
 * @param id unique source id
 * @param name display name for logs and status
 * @param type backend kind
 * @param priority higher is preferred for reads, writes and conflict resolution
 * @param readonly never selected for writes or deletes
 * @param enabled disabled sources are not pooled at all
 * @param tags project tags this source prefers to serve
 * @param config backend-specific settings (e.g. {@code dataDirectory})
 */
@Builder(toBuilder = true)
public record SourceConfig(
    String id,
    String name,
    DataSourceType type,
    int priority,
    boolean readonly,
    boolean enabled,
    @Singular Set<String> tags,
    @Singular("option") Map<String, String> config
) {

    public SourceConfig {
        Preconditions.checkArgument(id != null && !id.isBlank(), "Source id is required");
        Preconditions.checkNotNull(type, "Source type is required for %s", id);
        name = name == null || name.isBlank() ? id : name;
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        config = config == null ? Map.of() : Map.copyOf(config);
    }

    public boolean hasTag(String tag) {
        return tag != null && tags.contains(tag);
    }

    public String option(String key) {
        return config.get(key);
    }
}
