package com.kopo.letterrush.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for work that runs outside request handling.
 *
 * <ul>
 *   <li>{@code roundClockScheduler}: one daemon thread driving the round timer sweep.</li>
 *   <li>{@code validationExecutor}: bounded pool that judges completed rounds, so the request
 *       or tick that completed a round never waits for the external judge.</li>
 * </ul>
 */
@Configuration
public class SchedulerConfig {

    private static final int VALIDATION_QUEUE_CAPACITY = 1000;

    @Value("${game.validation.threads:2}")
    private int validationThreads;

    @Bean(name = "roundClockScheduler")
    public ScheduledThreadPoolExecutor roundClockScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, namedDaemonFactory("round-clock-"));
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Bean(name = "validationExecutor")
    public ExecutorService validationExecutor() {
        int threads = Math.max(1, validationThreads);
        return new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(VALIDATION_QUEUE_CAPACITY),
                namedDaemonFactory("validation-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private static ThreadFactory namedDaemonFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
    }
}
