package com.coderag.watch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderag.ingest.FileIndexResult;
import com.coderag.ingest.FileIndexStatus;
import com.coderag.ingest.IgnoreRules;
import com.coderag.ingest.IndexingSettings;
import com.coderag.ingest.ProjectScanner;
import com.coderag.ingest.SingleFileIndexer;

/**
 * Coalesces file events of every watched project into one pending queue drained by one debounce task.
 * Create and modify events are re-indexed after the debounce delay has passed without new events; delete
 * events remove the file's records immediately.
 */
public class WatchCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WatchCoordinator.class);

    public static final Duration DEFAULT_DEBOUNCE = Duration.ofSeconds(2);

    private final SingleFileIndexer indexer;
    private final FileEventSource eventSource;
    private final DebounceScheduler scheduler;
    private final Clock clock;
    private final Duration debounceDelay;
    private final IndexingSettings settings;

    private final Object lock = new Object();
    private final Map<Path, WatchedProject> watched = new HashMap<>();
    private final Map<Path, PendingWrite> pending = new LinkedHashMap<>();
    private DebounceScheduler.ScheduledTask armed;
    private long armedGeneration;

    public WatchCoordinator(
            SingleFileIndexer indexer,
            FileEventSource eventSource,
            DebounceScheduler scheduler,
            Clock clock,
            Duration debounceDelay,
            IndexingSettings settings) {
        this.indexer = indexer;
        this.eventSource = eventSource;
        this.scheduler = scheduler;
        this.clock = clock;
        this.debounceDelay = debounceDelay;
        this.settings = settings;
    }

    public WatchResult startWatch(Path root) {
        Path project = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(project)) {
            return WatchResult.of(WatchResult.Status.NOT_A_DIRECTORY, project);
        }
        synchronized (lock) {
            if (watched.containsKey(project)) {
                return WatchResult.of(WatchResult.Status.ALREADY_WATCHING, project);
            }
        }

        IgnoreRules rules = IgnoreRules.forProject(project, settings);
        Subscription subscription;
        try {
            subscription = eventSource.subscribe(project, event -> onEvent(project, event));
        } catch (IOException | RuntimeException e) {
            log.error("watch.start.failed path={} reason={}", project, e.getMessage(), e);
            return new WatchResult(WatchResult.Status.FAILED, project, e.getMessage());
        }

        synchronized (lock) {
            if (watched.putIfAbsent(project, new WatchedProject(subscription, rules)) != null) {
                subscription.close();
                return WatchResult.of(WatchResult.Status.ALREADY_WATCHING, project);
            }
        }
        log.info("watch.started path={} debounceMs={}", project, debounceDelay.toMillis());
        return WatchResult.of(WatchResult.Status.STARTED, project);
    }

    public WatchResult stopWatch(Path root) {
        Path project = root.toAbsolutePath().normalize();
        WatchedProject removed;
        synchronized (lock) {
            removed = watched.remove(project);
            if (removed == null) {
                return WatchResult.of(WatchResult.Status.NOT_WATCHING, project);
            }
            pending.values().removeIf(write -> write.projectRoot().equals(project));
            if (watched.isEmpty()) {
                cancelArmedTask();
            }
        }
        removed.subscription().close();
        log.info("watch.stopped path={}", project);
        return WatchResult.of(WatchResult.Status.STOPPED, project);
    }

    public List<Path> listWatched() {
        synchronized (lock) {
            List<Path> projects = new ArrayList<>(watched.keySet());
            projects.sort(Comparator.naturalOrder());
            return projects;
        }
    }

    public void stopAll() {
        for (Path project : listWatched()) {
            stopWatch(project);
        }
    }

    @Override
    public void close() {
        stopAll();
    }

    int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    void onEvent(Path project, FileEvent event) {
        if (event.directory()) {
            return;
        }
        Path file = event.path().toAbsolutePath().normalize();
        if (!file.startsWith(project) || file.equals(project)) {
            return;
        }
        IgnoreRules rules;
        synchronized (lock) {
            WatchedProject watchedProject = watched.get(project);
            if (watchedProject == null) {
                return;
            }
            rules = watchedProject.rules();
        }
        if (rules.isIgnored(ProjectScanner.relativePath(project, file), IgnoreRules.UNKNOWN_SIZE)) {
            return;
        }

        if (event.kind() == FileEventKind.DELETED) {
            synchronized (lock) {
                pending.remove(file);
            }
            removeNow(project, file);
            return;
        }

        synchronized (lock) {
            pending.put(file, new PendingWrite(clock.instant(), project));
            cancelArmedTask();
            long generation = ++armedGeneration;
            armed = scheduler.schedule(() -> flush(generation), debounceDelay);
        }
    }

    /**
     * Drains the pending queue. A flush that started before a newer event was scheduled leaves that newer
     * task armed.
     */
    void flush(long generation) {
        Map<Path, PendingWrite> drained;
        synchronized (lock) {
            drained = new LinkedHashMap<>(pending);
            pending.clear();
            if (generation == armedGeneration) {
                armed = null;
            }
        }
        if (drained.isEmpty()) {
            return;
        }
        log.debug("watch.flush.start files={}", drained.size());
        for (Map.Entry<Path, PendingWrite> entry : drained.entrySet()) {
            Path file = entry.getKey();
            try {
                FileIndexResult result = indexer.indexFile(entry.getValue().projectRoot(), file);
                if (result.status() == FileIndexStatus.SUCCESS) {
                    log.info("watch.file.indexed path={} chunks={}", file, result.chunksIndexed());
                } else if (result.status().isIgnorable()) {
                    log.debug("watch.file.skipped path={} status={}", file, result.status());
                } else {
                    log.warn("watch.file.failed path={} status={} reason={}", file, result.status(), result.message());
                }
            } catch (RuntimeException e) {
                log.error("watch.file.error path={} reason={}", file, e.getMessage(), e);
            }
        }
    }

    private void removeNow(Path project, Path file) {
        try {
            int removed = indexer.removeFile(project, file);
            log.info("watch.file.deleted path={} records={}", file, removed);
        } catch (IOException | RuntimeException e) {
            log.error("watch.file.delete_failed path={} reason={}", file, e.getMessage(), e);
        }
    }

    private void cancelArmedTask() {
        if (armed != null) {
            armed.cancel();
            armed = null;
        }
    }

    record PendingWrite(Instant timestamp, Path projectRoot) {
    }

    private record WatchedProject(Subscription subscription, IgnoreRules rules) {
    }
}
