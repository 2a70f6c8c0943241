package com.coderag.watch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.coderag.ingest.FileIndexResult;
import com.coderag.ingest.FileIndexStatus;
import com.coderag.ingest.IndexingSettings;
import com.coderag.ingest.SingleFileIndexer;

class WatchCoordinatorTest {

    @TempDir
    Path tempDir;

    private Path alpha;
    private Path beta;
    private RecordingIndexer indexer;
    private FakeEventSource events;
    private ManualScheduler scheduler;
    private WatchCoordinator coordinator;

    @BeforeEach
    void setUp() throws Exception {
        alpha = Files.createDirectories(tempDir.resolve("alpha")).toAbsolutePath().normalize();
        beta = Files.createDirectories(tempDir.resolve("beta")).toAbsolutePath().normalize();
        indexer = new RecordingIndexer();
        events = new FakeEventSource();
        scheduler = new ManualScheduler();
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        coordinator = new WatchCoordinator(indexer, events, scheduler, clock, Duration.ofMillis(2000),
                IndexingSettings.defaults());
    }

    @Test
    void shouldCoalesceBurstIntoSingleIndexCall() {
        coordinator.startWatch(alpha);
        Path file = alpha.resolve("app.py");

        for (int i = 0; i < 5; i++) {
            events.emit(alpha, new FileEvent(FileEventKind.MODIFIED, file, false));
        }

        assertEquals(1, coordinator.pendingCount());
        assertEquals(5, scheduler.scheduled);
        assertEquals(4, scheduler.cancelled);
        assertEquals(Duration.ofMillis(2000), scheduler.lastDelay);

        scheduler.runArmed();

        assertEquals(List.of(file), indexer.indexed);
        assertEquals(0, coordinator.pendingCount());
    }

    @Test
    void shouldRemoveDeletedFilesWithoutDebounce() {
        coordinator.startWatch(alpha);
        Path file = alpha.resolve("app.py");
        events.emit(alpha, new FileEvent(FileEventKind.MODIFIED, file, false));

        events.emit(alpha, new FileEvent(FileEventKind.DELETED, file, false));

        assertEquals(List.of(file), indexer.removed);
        assertEquals(0, coordinator.pendingCount());
        scheduler.runArmed();
        assertTrue(indexer.indexed.isEmpty());
    }

    @Test
    void shouldFlushPendingFilesOfEveryProjectTogether() {
        coordinator.startWatch(alpha);
        coordinator.startWatch(beta);
        Path first = alpha.resolve("a.py");
        Path second = beta.resolve("b.py");

        events.emit(alpha, new FileEvent(FileEventKind.CREATED, first, false));
        events.emit(beta, new FileEvent(FileEventKind.MODIFIED, second, false));
        scheduler.runArmed();

        assertEquals(List.of(first, second), indexer.indexed);
        assertEquals(List.of(alpha, beta), indexer.roots);
    }

    @Test
    void shouldKeepFlushingAfterOneFileFails() {
        coordinator.startWatch(alpha);
        Path broken = alpha.resolve("broken.py");
        Path fine = alpha.resolve("fine.py");
        indexer.failOn = broken;

        events.emit(alpha, new FileEvent(FileEventKind.MODIFIED, broken, false));
        events.emit(alpha, new FileEvent(FileEventKind.MODIFIED, fine, false));
        scheduler.runArmed();

        assertEquals(List.of(broken, fine), indexer.indexed);
    }

    @Test
    void shouldDropDirectoryAndIgnoredEvents() {
        coordinator.startWatch(alpha);

        events.emit(alpha, new FileEvent(FileEventKind.CREATED, alpha.resolve("pkg"), true));
        events.emit(alpha, new FileEvent(FileEventKind.MODIFIED, alpha.resolve("node_modules/x/index.js"), false));
        events.emit(alpha, new FileEvent(FileEventKind.MODIFIED, alpha.resolve(".git/index"), false));
        events.emit(alpha, new FileEvent(FileEventKind.MODIFIED, alpha.resolve("logo.png"), false));
        events.emit(alpha, new FileEvent(FileEventKind.DELETED, alpha.resolve("dist/bundle.js"), false));

        assertEquals(0, coordinator.pendingCount());
        assertEquals(0, scheduler.scheduled);
        assertTrue(indexer.removed.isEmpty());
    }

    @Test
    void shouldCancelArmedTaskWhenLastProjectStops() {
        coordinator.startWatch(alpha);
        coordinator.startWatch(beta);
        events.emit(alpha, new FileEvent(FileEventKind.MODIFIED, alpha.resolve("a.py"), false));
        events.emit(beta, new FileEvent(FileEventKind.MODIFIED, beta.resolve("b.py"), false));

        coordinator.stopWatch(alpha);
        assertEquals(1, coordinator.pendingCount());
        assertTrue(events.closed.contains(alpha));
        int cancelledBefore = scheduler.cancelled;

        coordinator.stopWatch(beta);

        assertEquals(0, coordinator.pendingCount());
        assertEquals(cancelledBefore + 1, scheduler.cancelled);
        assertNull(scheduler.armed);
        assertTrue(coordinator.listWatched().isEmpty());
    }

    @Test
    void shouldIgnoreEventsForUnwatchedProject() {
        coordinator.startWatch(alpha);
        FileEventListener listener = events.listeners.get(alpha);
        coordinator.stopWatch(alpha);

        listener.onEvent(new FileEvent(FileEventKind.MODIFIED, alpha.resolve("a.py"), false));

        assertEquals(0, coordinator.pendingCount());
    }

    @Test
    void shouldReportStartAndStopOutcomes() throws Exception {
        Path plainFile = Files.writeString(tempDir.resolve("file.txt"), "x");

        assertEquals(WatchResult.Status.STARTED, coordinator.startWatch(alpha).status());
        assertEquals(WatchResult.Status.ALREADY_WATCHING, coordinator.startWatch(alpha).status());
        assertEquals(WatchResult.Status.NOT_A_DIRECTORY, coordinator.startWatch(plainFile).status());
        assertEquals(WatchResult.Status.NOT_A_DIRECTORY, coordinator.startWatch(tempDir.resolve("missing")).status());
        assertEquals(List.of(alpha), coordinator.listWatched());

        assertEquals(WatchResult.Status.STOPPED, coordinator.stopWatch(alpha).status());
        assertEquals(WatchResult.Status.NOT_WATCHING, coordinator.stopWatch(alpha).status());
    }

    @Test
    void shouldReportFailedSubscription() {
        events.failure = new IOException("too many watches");

        WatchResult result = coordinator.startWatch(alpha);

        assertEquals(WatchResult.Status.FAILED, result.status());
        assertEquals("too many watches", result.message());
        assertFalse(coordinator.listWatched().contains(alpha));
    }

    @Test
    void shouldCloseEverySubscriptionOnClose() {
        coordinator.startWatch(alpha);
        coordinator.startWatch(beta);

        coordinator.close();

        assertEquals(List.of(alpha, beta), events.closed);
        assertTrue(coordinator.listWatched().isEmpty());
    }

    @Test
    void shouldKeepOneArmedTaskWhenEventArrivesDuringFlush() {
        StartedTaskScheduler racing = new StartedTaskScheduler();
        WatchCoordinator watcher = new WatchCoordinator(indexer, events, racing,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC), Duration.ofMillis(2000),
                IndexingSettings.defaults());
        watcher.startWatch(alpha);
        Path first = alpha.resolve("a.py");
        Path second = alpha.resolve("c.py");
        events.emit(alpha, new FileEvent(FileEventKind.MODIFIED, first, false));

        racing.startThenRun(racing.tasks.get(0),
                () -> events.emit(alpha, new FileEvent(FileEventKind.MODIFIED, second, false)));
        indexer.indexed.clear();

        events.emit(alpha, new FileEvent(FileEventKind.MODIFIED, second, false));
        assertEquals(1, racing.liveTasks());
        events.emit(alpha, new FileEvent(FileEventKind.MODIFIED, second, false));
        assertEquals(1, racing.liveTasks());

        racing.runLive();

        assertEquals(List.of(second), indexer.indexed);
    }

    private static final class RecordingIndexer implements SingleFileIndexer {
        final List<Path> indexed = new ArrayList<>();
        final List<Path> roots = new ArrayList<>();
        final List<Path> removed = new ArrayList<>();
        Path failOn;

        @Override
        public FileIndexResult indexFile(Path root, Path file) {
            indexed.add(file);
            roots.add(root);
            if (file.equals(failOn)) {
                throw new IllegalStateException("boom");
            }
            return new FileIndexResult(FileIndexStatus.SUCCESS, file.toString(), 1, null);
        }

        @Override
        public int removeFile(Path root, Path file) {
            removed.add(file);
            return 1;
        }
    }

    private static final class FakeEventSource implements FileEventSource {
        final Map<Path, FileEventListener> listeners = new HashMap<>();
        final List<Path> closed = new ArrayList<>();
        IOException failure;

        @Override
        public Subscription subscribe(Path root, FileEventListener listener) throws IOException {
            if (failure != null) {
                throw failure;
            }
            listeners.put(root, listener);
            return () -> closed.add(root);
        }

        void emit(Path root, FileEvent event) {
            listeners.get(root).onEvent(event);
        }
    }

    private static final class ManualScheduler implements DebounceScheduler {
        Runnable armed;
        Duration lastDelay;
        int scheduled;
        int cancelled;

        @Override
        public ScheduledTask schedule(Runnable task, Duration delay) {
            scheduled++;
            armed = task;
            lastDelay = delay;
            return () -> {
                cancelled++;
                if (armed == task) {
                    armed = null;
                }
            };
        }

        void runArmed() {
            Runnable task = armed;
            armed = null;
            if (task != null) {
                task.run();
            }
        }
    }

    /**
     * Scheduler whose cancel has no effect once a task has started, like {@code Future.cancel(false)}.
     */
    private static final class StartedTaskScheduler implements DebounceScheduler {
        final List<FakeTask> tasks = new ArrayList<>();

        @Override
        public ScheduledTask schedule(Runnable task, Duration delay) {
            FakeTask scheduled = new FakeTask(task);
            tasks.add(scheduled);
            return () -> {
                if (!scheduled.started) {
                    scheduled.cancelled = true;
                }
            };
        }

        void startThenRun(FakeTask task, Runnable whileStarting) {
            task.started = true;
            whileStarting.run();
            task.body.run();
        }

        long liveTasks() {
            return tasks.stream().filter(task -> !task.started && !task.cancelled).count();
        }

        void runLive() {
            for (FakeTask task : new ArrayList<>(tasks)) {
                if (!task.started && !task.cancelled) {
                    task.started = true;
                    task.body.run();
                }
            }
        }
    }

    private static final class FakeTask {
        final Runnable body;
        boolean started;
        boolean cancelled;

        FakeTask(Runnable body) {
            this.body = body;
        }
    }
}
