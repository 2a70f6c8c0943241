package com.coderag.watch;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderag.ingest.IgnoreRules;

/**
 * {@link WatchService} backed event source. Each subscription registers every directory below the root,
 * including directories created later, and delivers events from its own daemon thread.
 */
public class NioFileEventSource implements FileEventSource {
    private static final Logger log = LoggerFactory.getLogger(NioFileEventSource.class);

    private final Predicate<String> skipDirectory;

    public NioFileEventSource() {
        this(IgnoreRules.DEFAULT_IGNORED_DIRECTORIES);
    }

    public NioFileEventSource(Set<String> skippedDirectoryNames) {
        this.skipDirectory = Set.copyOf(skippedDirectoryNames)::contains;
    }

    @Override
    public Subscription subscribe(Path root, FileEventListener listener) throws IOException {
        WatchService watchService = root.getFileSystem().newWatchService();
        Worker worker = new Worker(root, watchService, listener);
        try {
            worker.registerTree(root);
        } catch (IOException e) {
            watchService.close();
            throw e;
        }
        Thread thread = new Thread(worker, "watch-" + root.getFileName());
        thread.setDaemon(true);
        thread.start();
        return () -> {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("watch.source.close_failed path={} reason={}", root, e.toString());
            }
            thread.interrupt();
        };
    }

    private final class Worker implements Runnable {
        private final Path root;
        private final WatchService watchService;
        private final FileEventListener listener;
        private final Map<WatchKey, Path> directories = new ConcurrentHashMap<>();

        private Worker(Path root, WatchService watchService, FileEventListener listener) {
            this.root = root;
            this.watchService = watchService;
            this.listener = listener;
        }

        @Override
        public void run() {
            while (!Thread.currentThread().isInterrupted()) {
                WatchKey key;
                try {
                    key = watchService.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (ClosedWatchServiceException e) {
                    return;
                }
                Path directory = directories.get(key);
                if (directory != null) {
                    for (WatchEvent<?> event : key.pollEvents()) {
                        handle(directory, event);
                    }
                }
                if (!key.reset()) {
                    directories.remove(key);
                }
            }
        }

        private void handle(Path directory, WatchEvent<?> event) {
            if (event.kind() == OVERFLOW) {
                log.warn("watch.source.overflow path={}", directory);
                return;
            }
            Path child = directory.resolve((Path) event.context());
            try {
                if (event.kind() == ENTRY_CREATE) {
                    if (Files.isDirectory(child)) {
                        deliver(new FileEvent(FileEventKind.CREATED, child, true));
                        if (!skipDirectory.test(child.getFileName().toString())) {
                            registerTree(child);
                            announceExisting(child);
                        }
                    } else {
                        deliver(new FileEvent(FileEventKind.CREATED, child, false));
                    }
                } else if (event.kind() == ENTRY_MODIFY) {
                    deliver(new FileEvent(FileEventKind.MODIFIED, child, Files.isDirectory(child)));
                } else if (event.kind() == ENTRY_DELETE) {
                    deliver(new FileEvent(FileEventKind.DELETED, child, directories.containsValue(child)));
                }
            } catch (IOException e) {
                log.warn("watch.source.register_failed path={} reason={}", child, e.toString());
            }
        }

        private void deliver(FileEvent event) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("watch.listener.failed root={} path={} reason={}", root, event.path(), e.getMessage(), e);
            }
        }

        private void registerTree(Path start) throws IOException {
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                    if (!dir.equals(start) && skipDirectory.test(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                    directories.put(key, dir);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("watch.source.unreadable path={} reason={}", file, exc.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        }

        // Files written into a new directory before it was registered produce no events of their own.
        private void announceExisting(Path directory) throws IOException {
            Files.walkFileTree(directory, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(directory) && skipDirectory.test(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        deliver(new FileEvent(FileEventKind.CREATED, file, false));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    return FileVisitResult.CONTINUE;
                }
            });
        }
    }
}
