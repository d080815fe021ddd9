package com.deepansh.mq.config;

import com.deepansh.mq.batch.WorkerPoolFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for batch runs.
 *
 * A batch asks for exactly W workers, so core and max size are both W and the queue
 * is unbounded: every row is submitted up front and waits for a free worker.
 * Pools live for one run and are shut down by the dispatcher.
 */
@Configuration
public class AsyncConfig {

    @Bean
    public WorkerPoolFactory batchWorkerPoolFactory() {
        return workers -> {
            ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
            executor.setCorePoolSize(workers);
            executor.setMaxPoolSize(workers);
            executor.setQueueCapacity(Integer.MAX_VALUE);
            executor.setThreadNamePrefix("mq-batch-");
            executor.setWaitForTasksToCompleteOnShutdown(false);
            executor.initialize();
            return executor;
        };
    }
}
