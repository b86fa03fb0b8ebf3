package com.purchasingpower.taskhub.configuration;

import com.purchasingpower.taskhub.aggregation.MultiSourceAggregator;
import com.purchasingpower.taskhub.aggregation.impl.MultiSourceAggregatorImpl;
import com.purchasingpower.taskhub.concurrent.TimeLimitedExecutor;
import com.purchasingpower.taskhub.routing.DataSourceRouter;
import com.purchasingpower.taskhub.routing.impl.DataSourceRouterImpl;
import com.purchasingpower.taskhub.storage.StorageBackendFactory;
import com.purchasingpower.taskhub.storage.impl.DefaultStorageBackendFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Wires the storage federation: backend factory, router and aggregator.
 *
 * <p>The router initializes its sources when the bean is created and shuts them down
 * when the context closes.
 */
@Slf4j
@Configuration
public class StorageConfiguration {

    @Bean
    public StorageBackendFactory storageBackendFactory() {
        return new DefaultStorageBackendFactory();
    }

    @Bean
    public TimeLimitedExecutor timeLimitedExecutor(@Qualifier("storageExecutor") ThreadPoolTaskExecutor executor,
                                                   @Qualifier("storageScheduler") ThreadPoolTaskScheduler scheduler) {
        return new TimeLimitedExecutor(executor, scheduler);
    }

    @Bean
    public DataSourceRouter dataSourceRouter(StorageProperties properties,
                                             StorageBackendFactory backendFactory,
                                             TimeLimitedExecutor timeLimitedExecutor) {
        return new DataSourceRouterImpl(
            properties.toSourceConfigs(),
            properties.getRouter().toSettings(),
            backendFactory,
            timeLimitedExecutor);
    }

    @Bean
    public MultiSourceAggregator multiSourceAggregator(StorageProperties properties,
                                                       TimeLimitedExecutor timeLimitedExecutor) {
        return new MultiSourceAggregatorImpl(properties.getAggregator().toSettings(), timeLimitedExecutor);
    }
}
