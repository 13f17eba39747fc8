package org.tarik.resilience.retry;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.tarik.resilience.ResilienceConfig;

import java.util.concurrent.ScheduledThreadPoolExecutor;

final class SharedDelayScheduler {
    static final DelayScheduler INSTANCE = DelayScheduler.using(createExecutor());

    private SharedDelayScheduler() {
    }

    private static ScheduledThreadPoolExecutor createExecutor() {
        var threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("retry-scheduler-%d")
                .setDaemon(true)
                .build();
        var executor = new ScheduledThreadPoolExecutor(ResilienceConfig.getSchedulerThreads(), threadFactory);
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
