package com.coderag.watch;

import java.time.Duration;

public interface DebounceScheduler {
    ScheduledTask schedule(Runnable task, Duration delay);

    interface ScheduledTask {
        void cancel();
    }
}
