package com.purchasingpower.taskhub.configuration;

import com.purchasingpower.taskhub.routing.DataSourceType;
import com.purchasingpower.taskhub.routing.SourceConfig;
import com.purchasingpower.taskhub.storage.impl.DefaultStorageBackendFactory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Storage federation settings, bound from {@code app.storage}.
 *
 * <p>Environment variables override entries through Spring's relaxed binding, e.g.
 * {@code APP_STORAGE_ROUTER_MAXFAILURES=5}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {

    public static final String DEFAULT_SOURCE_ID = "default-file";
    public static final String DEFAULT_DATA_DIRECTORY = "./data";

    @Valid
    private List<SourceProperties> sources = new ArrayList<>();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RouterProperties router = new RouterProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private AggregatorProperties aggregator = new AggregatorProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ExecutorProperties executor = new ExecutorProperties();

    /**
     * Configured sources, or the single default filesystem source when none are configured.
     *
     * @throws IllegalStateException if two sources share an id
     */
    public List<SourceConfig> toSourceConfigs() {
        if (sources == null || sources.isEmpty()) {
            return List.of(defaultSource());
        }

        Set<String> seen = new HashSet<>();
        List<String> duplicates = sources.stream()
            .map(SourceProperties::getId)
            .filter(id -> !seen.add(id))
            .distinct()
            .collect(Collectors.toList());
        if (!duplicates.isEmpty()) {
            throw new IllegalStateException("Duplicate data source ids: " + duplicates);
        }

        return sources.stream()
            .map(SourceProperties::toSourceConfig)
            .collect(Collectors.toList());
    }

    static SourceConfig defaultSource() {
        return SourceConfig.builder()
            .id(DEFAULT_SOURCE_ID)
            .name("Default File Storage")
            .type(DataSourceType.FILESYSTEM)
            .priority(100)
            .enabled(true)
            .option(DefaultStorageBackendFactory.DATA_DIRECTORY, DEFAULT_DATA_DIRECTORY)
            .build();
    }
}
