package com.mendwatch.core.tasks;

import com.mendwatch.core.metrics.MendwatchMetrics;
import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.model.Task;
import com.mendwatch.core.model.TaskPriority;
import com.mendwatch.core.model.TaskStatus;
import com.mendwatch.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered list of remediation tasks.
 * <p>
 * All mutations go through one queue-wide lock. Tasks are immutable records; a status change
 * replaces the stored record, so snapshots handed to callers never change underneath them.
 * <p>
 * Kinds flagged by {@link TaskType#isDeduplicated()} never have two active tasks for the same
 * file: creating one while another is pending or in progress returns the existing task.
 * <p>
 * At most {@code retainFinished} completed or failed tasks are kept; older ones are dropped
 * first. Pending and in-progress tasks are never dropped.
 */
public class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    public static final Duration DEFAULT_STALE_AFTER = Duration.ofMinutes(5);
    public static final int DEFAULT_RETAIN_FINISHED = 1000;

    private static final Comparator<Task> BY_PRIORITY =
            Comparator.comparing(Task::priority).reversed().thenComparing(Task::createdAt);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Task> tasks = new ArrayList<>();
    private final AtomicInteger counter = new AtomicInteger();
    private final Clock clock;
    private final Duration staleAfter;
    private final int retainFinished;
    private final MendwatchMetrics metrics;

    public TaskQueue(MendwatchMetrics metrics) {
        this(metrics, Clock.systemUTC(), DEFAULT_STALE_AFTER);
    }

    public TaskQueue(MendwatchMetrics metrics, Clock clock, Duration staleAfter) {
        this(metrics, clock, staleAfter, DEFAULT_RETAIN_FINISHED);
    }

    public TaskQueue(MendwatchMetrics metrics, Clock clock, Duration staleAfter, int retainFinished) {
        if (retainFinished < 0) {
            throw new IllegalArgumentException("retainFinished must not be negative: " + retainFinished);
        }
        this.metrics = metrics;
        this.clock = clock;
        this.staleAfter = staleAfter;
        this.retainFinished = retainFinished;
    }

    /**
     * Queues a fix for one detected error. Never deduplicated: every error gets its own task.
     *
     * @param error   the error to fix (nullable when the failure has no stored error)
     * @param file    file containing the error
     * @param line    line of the error
     * @param context description handed to the fix handler
     */
    public Task createErrorFixTask(DetectedError error, String file, int line, String context) {
        TaskPriority priority = error != null ? TaskPriority.forSeverity(error.severity()) : TaskPriority.MEDIUM;
        String errorId = error != null ? error.id() : null;
        Task task = insert(TaskType.FIX_ERROR, priority, file, line, errorId, context);
        log.info("Created error fix task {} for {}:{}", task.id(), file, line);
        return task;
    }

    /** Queues a lint of {@code file}, or returns the active lint task for it. */
    public Task createLintingTask(String file) {
        return insert(TaskType.LINTING, TaskPriority.LOW, file, 0, null, "lint " + file);
    }

    public Task createTestExecutionTask(String testFile) {
        Task task = insert(TaskType.RUN_TESTS, TaskPriority.MEDIUM, testFile, 0, null, "run tests in " + testFile);
        log.info("Created test execution task {} for {}", task.id(), testFile);
        return task;
    }

    /** Queues a full scan of {@code root}, or returns the active scan for it. */
    public Task createProjectScanTask(String root) {
        return insert(TaskType.PROJECT_SCAN, TaskPriority.LOW, root, 0, null, "scan " + root);
    }

    /** Pending tasks in insertion order. */
    public List<Task> getPendingTasks() {
        lock.lock();
        try {
            return tasks.stream().filter(t -> t.status() == TaskStatus.PENDING).toList();
        } finally {
            lock.unlock();
        }
    }

    public List<Task> listTasks() {
        lock.lock();
        try {
            return List.copyOf(tasks);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Task> getTask(String taskId) {
        lock.lock();
        try {
            return Optional.ofNullable(findById(taskId)).map(tasks::get);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically picks the highest-priority pending task and marks it in progress.
     */
    public Optional<Task> claimNextPending() {
        lock.lock();
        try {
            Optional<Task> next = tasks.stream()
                    .filter(t -> t.status() == TaskStatus.PENDING)
                    .min(BY_PRIORITY);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            Task claimed = next.get().withStatus(TaskStatus.IN_PROGRESS, clock.instant());
            tasks.set(tasks.indexOf(next.get()), claimed);
            return Optional.of(claimed);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves a task to {@code status}. Re-applying the current status refreshes {@code updatedAt}.
     *
     * @return false if the task is unknown or already terminal with a different status
     */
    public boolean updateTaskStatus(String taskId, TaskStatus status) {
        lock.lock();
        try {
            Integer index = findById(taskId);
            if (index == null) {
                log.warn("Cannot update unknown task {}", taskId);
                return false;
            }
            Task task = tasks.get(index);
            if (task.status().isTerminal() && task.status() != status) {
                log.warn("Task {} is already {}, ignoring update to {}", taskId, task.status(), status);
                return false;
            }
            tasks.set(index, task.withStatus(status, clock.instant()));
            log.info("Updated task {} ({}) status to {}", taskId, task.type(), status);
            if (status.isTerminal()) {
                pruneFinished();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fails every in-progress task whose last update is older than the staleness window.
     *
     * @return the tasks that were failed
     */
    public List<Task> cleanupStaleTasks() {
        lock.lock();
        try {
            Instant now = clock.instant();
            var failed = new ArrayList<Task>();
            for (int i = 0; i < tasks.size(); i++) {
                Task task = tasks.get(i);
                if (task.status() != TaskStatus.IN_PROGRESS) {
                    continue;
                }
                if (Duration.between(task.updatedAt(), now).compareTo(staleAfter) > 0) {
                    Task stale = task.withStatus(TaskStatus.FAILED, now);
                    tasks.set(i, stale);
                    failed.add(stale);
                    log.warn("Marked stale task as failed: {} ({})", task.id(), task.type());
                }
            }
            if (!failed.isEmpty()) {
                metrics.recordStaleTasks(failed.size());
                pruneFinished();
            }
            return failed;
        } finally {
            lock.unlock();
        }
    }

    public Duration staleAfter() {
        return staleAfter;
    }

    private Task insert(TaskType type, TaskPriority priority, String file, int line,
                        String errorId, String context) {
        lock.lock();
        try {
            if (type.isDeduplicated()) {
                for (Task existing : tasks) {
                    if (existing.type() == type && existing.isActive() && Objects.equals(existing.file(), file)) {
                        log.debug("Reusing active {} task {} for {}", type, existing.id(), file);
                        return existing;
                    }
                }
            }
            Instant now = clock.instant();
            Task task = new Task(nextId(), type, priority, TaskStatus.PENDING, file, line,
                    errorId, context, now, now);
            tasks.add(task);
            metrics.recordTaskCreated(type);
            if (type.isDeduplicated()) {
                log.info("Created {} task {} for {}", type, task.id(), file);
            }
            return task;
        } finally {
            lock.unlock();
        }
    }

    /** Drops the oldest finished tasks beyond the retention limit. Caller holds the lock. */
    private void pruneFinished() {
        long finished = tasks.stream().filter(t -> t.status().isTerminal()).count();
        if (finished <= retainFinished) {
            return;
        }
        long excess = finished - retainFinished;
        var it = tasks.iterator();
        while (excess > 0 && it.hasNext()) {
            if (it.next().status().isTerminal()) {
                it.remove();
                excess--;
            }
        }
        log.debug("Pruned finished tasks, {} task(s) remain", tasks.size());
    }

    private Integer findById(String taskId) {
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i).id().equals(taskId)) {
                return i;
            }
        }
        return null;
    }

    private String nextId() {
        return String.format("TASK-%04d", counter.incrementAndGet());
    }
}
