package com.jiracdc.core.engine;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs one background thread per in-flight operation.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService operationExecutor(SyncProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getOperationThreads()),
                new CustomizableThreadFactory("jiracdc-op-"));
    }

    /**
     * Runs the tasks of a wave concurrently.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService taskExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("jiracdc-task-"));
    }
}
