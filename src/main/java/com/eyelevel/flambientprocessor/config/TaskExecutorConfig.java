package com.eyelevel.flambientprocessor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the bounded worker pool that moves files to and from the signed transfer URLs.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Pool size follows {@code app.processing.imagen.transfer-concurrency}. Callers apply results in
     * submission order, so the pool only bounds how many transfers are in flight.
     *
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("transferTaskExecutor")
    public AsyncTaskExecutor transferTaskExecutor(FlambientProcessingConfig config) {
        int concurrency = Math.max(1, config.getImagen().getTransferConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setThreadNamePrefix("transfer-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
