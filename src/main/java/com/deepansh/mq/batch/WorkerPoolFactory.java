package com.deepansh.mq.batch;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Creates a fixed-size pool for one batch run. The caller shuts it down. */
@FunctionalInterface
public interface WorkerPoolFactory {

    ThreadPoolTaskExecutor create(int workers);
}
