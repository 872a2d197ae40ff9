package com.mendwatch.core.engine;

import com.mendwatch.core.detect.Detector;
import com.mendwatch.core.events.EventBus;
import com.mendwatch.core.events.MendwatchEvent;
import com.mendwatch.core.loop.EventLoop;
import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.model.Task;
import com.mendwatch.core.security.PathGuard;
import com.mendwatch.core.tasks.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for file-change notifications.
 * <p>
 * Each batch of changed paths becomes one detection cycle on the {@link EventLoop}: the paths
 * are filtered through the {@link PathGuard}, handed to the {@link Detector}, and new errors
 * are recorded and queued for fixing by the {@link ErrorIntake}. Every changed file also gets a
 * (deduplicated) linting task.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private final AtomicInteger cycleCounter = new AtomicInteger();

    private final PathGuard pathGuard;
    private final Detector detector;
    private final ErrorIntake intake;
    private final TaskQueue taskQueue;
    private final EventLoop eventLoop;
    private final EventBus eventBus;

    public Orchestrator(PathGuard pathGuard, Detector detector, ErrorIntake intake,
                        TaskQueue taskQueue, EventLoop eventLoop, EventBus eventBus) {
        this.pathGuard = pathGuard;
        this.detector = detector;
        this.intake = intake;
        this.taskQueue = taskQueue;
        this.eventLoop = eventLoop;
        this.eventBus = eventBus;
    }

    /**
     * Schedules a detection cycle for {@code paths}. Safe to call from any thread.
     *
     * @return completes with the newly recorded errors
     */
    public CompletableFuture<List<DetectedError>> onFilesChanged(Collection<Path> paths) {
        List<Path> batch = List.copyOf(paths);
        return eventLoop.submit(() -> handleChanges(batch));
    }

    /**
     * Runs detection over every project file without queuing linting tasks.
     */
    public CompletableFuture<List<DetectedError>> scanProject() {
        return eventLoop.submit(() -> detect(pathGuard.walkProjectFiles(), false));
    }

    /** Queues a full project scan task for the worker. */
    public CompletableFuture<Task> requestProjectScan() {
        return eventLoop.submit(() -> taskQueue.createProjectScanTask(pathGuard.projectRoot().toString()));
    }

    List<DetectedError> handleChanges(List<Path> paths) {
        return detect(paths, true);
    }

    private List<DetectedError> detect(List<Path> paths, boolean queueLinting) {
        String cycleId = generateCycleId();
        var files = new LinkedHashSet<Path>();
        for (Path path : paths) {
            Path resolved = pathGuard.projectRoot().resolve(path).normalize();
            if (Files.isRegularFile(resolved) && pathGuard.isAllowed(resolved)) {
                files.add(resolved);
            }
        }
        if (files.isEmpty()) {
            log.debug("Cycle {}: no eligible files in {} change(s)", cycleId, paths.size());
            return List.of();
        }
        log.info("Cycle {}: scanning {} file(s)", cycleId, files.size());

        List<DetectedError> detected;
        try {
            detected = detector.scan(List.copyOf(files));
        } catch (RuntimeException e) {
            log.error("Cycle {}: detector failed: {}", cycleId, e.getMessage(), e);
            return List.of();
        }
        List<DetectedError> recorded = intake.ingest(detected);

        if (queueLinting) {
            for (Path file : files) {
                taskQueue.createLintingTask(pathGuard.projectRoot().relativize(file).toString());
            }
        }
        eventBus.publish(MendwatchEvent.of("scan.completed", cycleId, Map.of(
                "files", files.size(),
                "detected", detected.size(),
                "recorded", recorded.size())));
        return recorded;
    }

    /**
     * Generates a cycle id in the format CYCLE-NNNN.
     */
    String generateCycleId() {
        return String.format("CYCLE-%04d", cycleCounter.incrementAndGet());
    }
}
