package com.coderag.watch;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

class ExecutorDebounceSchedulerTest {

    @Test
    void shouldNotRunCancelledTask() throws Exception {
        AtomicBoolean cancelledRan = new AtomicBoolean();
        CountDownLatch later = new CountDownLatch(1);
        try (ExecutorDebounceScheduler scheduler = new ExecutorDebounceScheduler()) {
            scheduler.schedule(() -> cancelledRan.set(true), Duration.ofMillis(50)).cancel();
            scheduler.schedule(later::countDown, Duration.ofMillis(300));

            assertTrue(later.await(5, TimeUnit.SECONDS));
            assertFalse(cancelledRan.get());
        }
    }

    @Test
    void shouldLetRunningFlushFinishOnClose() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        AtomicBoolean finished = new AtomicBoolean();
        ExecutorDebounceScheduler scheduler = new ExecutorDebounceScheduler(Duration.ofSeconds(5));
        scheduler.schedule(() -> {
            started.countDown();
            try {
                Thread.sleep(300);
                finished.set(true);
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        }, Duration.ZERO);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        scheduler.close();

        assertTrue(finished.get());
        assertFalse(interrupted.get());
    }

    @Test
    void shouldDropDelayedTasksOnClose() throws Exception {
        AtomicBoolean ran = new AtomicBoolean();
        ExecutorDebounceScheduler scheduler = new ExecutorDebounceScheduler(Duration.ofSeconds(5));
        scheduler.schedule(() -> ran.set(true), Duration.ofMillis(200));

        scheduler.close();
        Thread.sleep(400);

        assertFalse(ran.get());
    }
}
