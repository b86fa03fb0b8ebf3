package com.purchasingpower.taskhub.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Thread pools for backend calls and timers.
 */
@Data
public class ExecutorProperties {

    @Min(1)
    private int corePoolSize = 8;

    @Min(1)
    private int maxPoolSize = 32;

    @Min(0)
    private int queueCapacity = 500;

    @Min(1)
    private int schedulerPoolSize = 2;
}
