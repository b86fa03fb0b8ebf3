package com.purchasingpower.taskhub.configuration;

import com.purchasingpower.taskhub.routing.RouterSettings;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class RouterProperties {

    @NotNull
    private Duration healthCheckInterval = RouterSettings.DEFAULT_HEALTH_CHECK_INTERVAL;

    @Min(1)
    private int maxFailures = RouterSettings.DEFAULT_MAX_FAILURES;

    @NotNull
    private Duration operationTimeout = RouterSettings.DEFAULT_OPERATION_TIMEOUT;

    private boolean enableFallback = true;

    @NotNull
    private Duration recoveryCheckDelay = RouterSettings.DEFAULT_RECOVERY_CHECK_DELAY;

    public RouterSettings toSettings() {
        return RouterSettings.builder()
            .healthCheckInterval(healthCheckInterval)
            .maxFailures(maxFailures)
            .operationTimeout(operationTimeout)
            .enableFallback(enableFallback)
            .recoveryCheckDelay(recoveryCheckDelay)
            .build();
    }
}
