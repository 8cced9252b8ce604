package com.example.dodge.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scheduler for the delayed level advance that follows the first finisher of a level.
 * Tasks are one-shot and never cancelled; a task whose room is gone simply does nothing.
 */
@Configuration
public class LevelTimerConfig {

    @Value("${scheduler.level-advance.core-pool-size:1}")
    private int corePoolSize;

    @Bean(name = "levelAdvanceScheduler", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor levelAdvanceScheduler() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "level-advance-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        return new ScheduledThreadPoolExecutor(corePoolSize, tf, new ThreadPoolExecutor.AbortPolicy());
    }
}
