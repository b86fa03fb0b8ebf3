package com.purchasingpower.taskhub.configuration;

import com.purchasingpower.taskhub.aggregation.AggregatorSettings;
import com.purchasingpower.taskhub.aggregation.ConflictResolutionStrategy;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class AggregatorProperties {

    /**
     * latest, priority, manual or merge. Anything else resolves by priority.
     */
    private String conflictResolution = ConflictResolutionStrategy.LATEST.getValue();

    private boolean parallelQueries = true;

    @NotNull
    private Duration queryTimeout = AggregatorSettings.DEFAULT_QUERY_TIMEOUT;

    public AggregatorSettings toSettings() {
        return AggregatorSettings.builder()
            .conflictResolution(ConflictResolutionStrategy.parse(conflictResolution))
            .parallelQueries(parallelQueries)
            .queryTimeout(queryTimeout)
            .build();
    }
}
