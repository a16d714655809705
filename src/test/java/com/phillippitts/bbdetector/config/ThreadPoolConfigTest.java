package com.phillippitts.bbdetector.config;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private ThreadPoolTaskScheduler scheduler;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    @Test
    void usesSingleNamedThread() throws InterruptedException {
        scheduler = new ThreadPoolConfig().syncScheduler();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();

        scheduler.schedule(() -> {
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        }, Instant.now());

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(threadName.get()).startsWith("sync-scheduler-");
        assertThat(scheduler.getPoolSize()).isLessThanOrEqualTo(1);
    }

    @Test
    void propagatesProfileContextToScheduledTask() throws InterruptedException {
        scheduler = new ThreadPoolConfig().syncScheduler();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        ThreadContext.put("profile", "hunter");

        scheduler.schedule(() -> {
            seen.set(ThreadContext.get("profile"));
            latch.countDown();
        }, Instant.now());

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("hunter");
    }

    @Test
    void propagatesProfileContextToPeriodicTask() throws InterruptedException {
        scheduler = new ThreadPoolConfig().syncScheduler();
        CountDownLatch latch = new CountDownLatch(2);
        AtomicReference<String> seen = new AtomicReference<>();
        ThreadContext.put("profile", "hunter");

        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> {
            seen.set(ThreadContext.get("profile"));
            latch.countDown();
        }, Duration.ofMillis(10));

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        future.cancel(false);
        assertThat(seen.get()).isEqualTo("hunter");
    }

    @Test
    void contextDoesNotLeakIntoLaterTasks() throws InterruptedException {
        scheduler = new ThreadPoolConfig().syncScheduler();
        CountDownLatch first = new CountDownLatch(1);
        ThreadContext.put("profile", "hunter");
        scheduler.schedule(first::countDown, Instant.now());
        assertThat(first.await(2, TimeUnit.SECONDS)).isTrue();

        ThreadContext.clearAll();
        CountDownLatch second = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>("unset");
        scheduler.schedule(() -> {
            seen.set(ThreadContext.get("profile"));
            second.countDown();
        }, Instant.now());

        assertThat(second.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isNull();
    }

    @Test
    void failingTaskDoesNotKillScheduler() throws InterruptedException {
        scheduler = new ThreadPoolConfig().syncScheduler();
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.schedule(() -> {
            throw new IllegalStateException("boom");
        }, Instant.now());
        scheduler.schedule(latch::countDown, Instant.now());

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
    }
}
