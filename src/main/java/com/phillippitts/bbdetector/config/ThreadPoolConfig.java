package com.phillippitts.bbdetector.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Scheduler for background timers: sync reconnect backoff and the periodic summary log.
 *
 * <p>One thread is enough; every task is short and non-blocking. The capture/detect loop
 * owns its own thread and is not scheduled here.
 *
 * <p>MDC propagation: copies Log4j2 ThreadContext from the scheduling thread so a retry
 * scheduled from a transport callback keeps its {@code profile} key.
 */
@Configuration
public class ThreadPoolConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolConfig.class);

    @Bean(name = "syncScheduler")
    public ThreadPoolTaskScheduler syncScheduler() {
        ThreadPoolTaskScheduler scheduler = new ContextPropagatingTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("sync-scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> LOG.error("Scheduled task failed", t));
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Wraps a task so it runs with the ThreadContext captured at submission, restoring the
     * worker's own context afterwards.
     */
    static Runnable withCurrentContext(Runnable task) {
        Map<String, String> contextMap = ThreadContext.getImmutableContext();
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                if (contextMap != null && !contextMap.isEmpty()) {
                    ThreadContext.putAll(contextMap);
                }
                task.run();
            } finally {
                ThreadContext.clearAll();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }

    /** Propagates MDC into one-shot and periodic tasks. */
    static class ContextPropagatingTaskScheduler extends ThreadPoolTaskScheduler {

        @Override
        public void execute(Runnable task) {
            super.execute(withCurrentContext(task));
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
            return super.schedule(withCurrentContext(task), startTime);
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
            return super.scheduleAtFixedRate(withCurrentContext(task), startTime, period);
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
            return super.scheduleAtFixedRate(withCurrentContext(task), period);
        }

        @Override
        public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
            return super.scheduleWithFixedDelay(withCurrentContext(task), startTime, delay);
        }

        @Override
        public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
            return super.scheduleWithFixedDelay(withCurrentContext(task), delay);
        }
    }
}
