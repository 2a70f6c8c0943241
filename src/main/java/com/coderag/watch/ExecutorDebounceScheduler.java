package com.coderag.watch;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single daemon thread running debounce flushes. Closing lets a flush that already started finish, up to
 * {@code shutdownTimeout}; flushes still waiting on their delay are dropped.
 */
public class ExecutorDebounceScheduler implements DebounceScheduler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutorDebounceScheduler.class);

    static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final Duration shutdownTimeout;
    private final ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
        Thread thread = new Thread(runnable, "watch-debounce");
        thread.setDaemon(true);
        return thread;
    });

    public ExecutorDebounceScheduler() {
        this(DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public ExecutorDebounceScheduler(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("watch.scheduler.shutdown_timeout timeoutMs={}", shutdownTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
