package com.mendwatch.core.watch;

import com.mendwatch.core.security.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Watches the project tree and delivers debounced batches of changed files.
 * <p>
 * Every non-excluded directory is registered with a {@link WatchService}; directories created
 * later are registered as they appear. Events are collected until no new event arrives for the
 * debounce window, then the batch is handed to the {@link Listener} on the watcher thread.
 */
public class ProjectWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProjectWatcher.class);

    /** Receives changed files. Called on the watcher thread. */
    @FunctionalInterface
    public interface Listener {
        void onFilesChanged(Set<Path> files);
    }

    private final PathGuard pathGuard;
    private final Duration debounce;
    private final Listener listener;
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
    private WatchService watchService;
    private Thread thread;
    private volatile boolean running;

    public ProjectWatcher(PathGuard pathGuard, Duration debounce, Listener listener) {
        this.pathGuard = pathGuard;
        this.debounce = debounce;
        this.listener = listener;
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        registerTree(pathGuard.projectRoot());
        running = true;
        thread = new Thread(this::run, "mendwatch-watcher");
        thread.setDaemon(true);
        thread.start();
        log.info("Watching {} ({} directories)", pathGuard.projectRoot(), keys.size());
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public synchronized void close() {
        running = false;
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Failed to close watch service: {}", e.getMessage());
            }
        }
        if (thread != null) {
            thread.interrupt();
        }
        keys.clear();
    }

    private void run() {
        var pending = new LinkedHashSet<Path>();
        try {
            while (running) {
                WatchKey key = pending.isEmpty()
                        ? watchService.take()
                        : watchService.poll(debounce.toMillis(), TimeUnit.MILLISECONDS);
                if (key == null) {
                    flush(pending);
                    continue;
                }
                collect(key, pending);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            log.debug("Watch service closed");
        } finally {
            running = false;
        }
    }

    private void collect(WatchKey key, Set<Path> pending) {
        Path dir = keys.get(key);
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == StandardWatchEventKinds.OVERFLOW || dir == null) {
                log.warn("Watch events overflowed; some changes may be missed");
                continue;
            }
            Path changed = dir.resolve((Path) event.context());
            if (Files.isDirectory(changed)) {
                if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE) {
                    try {
                        registerTree(changed);
                    } catch (IOException e) {
                        log.warn("Failed to watch new directory {}: {}", changed, e.getMessage());
                    }
                }
                continue;
            }
            if (event.kind() != StandardWatchEventKinds.ENTRY_DELETE && pathGuard.isAllowed(changed)) {
                pending.add(changed);
            }
        }
        if (!key.reset()) {
            keys.remove(key);
        }
    }

    private void flush(Set<Path> pending) {
        if (pending.isEmpty()) {
            return;
        }
        Set<Path> batch = Set.copyOf(pending);
        pending.clear();
        log.debug("Delivering {} changed file(s)", batch.size());
        try {
            listener.onFilesChanged(batch);
        } catch (RuntimeException e) {
            log.error("Change listener failed: {}", e.getMessage(), e);
        }
    }

    private void registerTree(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(pathGuard.projectRoot()) && !pathGuard.isAllowed(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                WatchKey key = dir.register(watchService,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_DELETE);
                keys.put(key, dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
