package com.mendwatch.core.remediation;

import com.mendwatch.core.agent.AgentMonitor;
import com.mendwatch.core.config.MendwatchProperties;
import com.mendwatch.core.events.EventBus;
import com.mendwatch.core.events.MendwatchEvent;
import com.mendwatch.core.logging.MdcContext;
import com.mendwatch.core.loop.EventLoop;
import com.mendwatch.core.metrics.MendwatchMetrics;
import com.mendwatch.core.model.Task;
import com.mendwatch.core.model.TaskStatus;
import com.mendwatch.core.model.TaskType;
import com.mendwatch.core.tasks.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Drains the {@link TaskQueue} on the {@link EventLoop}.
 * <p>
 * Each claimed task is dispatched to the {@link TaskHandler} registered for its type and then
 * marked COMPLETED or FAILED. Failures go to the {@link RemediationRegistry}. Outcomes are
 * recorded as Micrometer metrics, published on the {@link EventBus} and logged as activities of
 * the worker's agent in the {@link AgentMonitor}.
 */
public class TaskWorker {

    private static final Logger log = LoggerFactory.getLogger(TaskWorker.class);

    private final TaskQueue taskQueue;
    private final Map<TaskType, TaskHandler> handlers;
    private final RemediationRegistry remediations;
    private final AgentMonitor agentMonitor;
    private final MendwatchMetrics metrics;
    private final EventBus eventBus;
    private final EventLoop eventLoop;
    private final MendwatchProperties.Tasks settings;
    private final String project;
    private final List<ScheduledFuture<?>> schedules = new ArrayList<>();

    public TaskWorker(TaskQueue taskQueue, Map<TaskType, TaskHandler> handlers, RemediationRegistry remediations,
                      AgentMonitor agentMonitor, MendwatchMetrics metrics, EventBus eventBus,
                      EventLoop eventLoop, MendwatchProperties.Tasks settings, String project) {
        this.taskQueue = taskQueue;
        this.handlers = new EnumMap<>(TaskType.class);
        this.handlers.putAll(handlers);
        this.remediations = remediations;
        this.agentMonitor = agentMonitor;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.eventLoop = eventLoop;
        this.settings = settings;
        this.project = project;
    }

    /**
     * Starts the worker agent and schedules the drain and the staleness sweep on the loop.
     */
    public synchronized void start() {
        if (!schedules.isEmpty()) {
            return;
        }
        agentMonitor.startAgent(settings.getWorkerAgentId());
        schedules.add(eventLoop.scheduleAtFixedRate("task-drain", this::drain,
                settings.getPollInterval(), settings.getPollInterval()));
        schedules.add(eventLoop.scheduleAtFixedRate("stale-task-sweep", this::sweepStaleTasks,
                settings.getSweepInterval(), settings.getSweepInterval()));
        log.info("Task worker started as agent {}", settings.getWorkerAgentId());
    }

    public synchronized void stop() {
        schedules.forEach(s -> s.cancel(false));
        schedules.clear();
        agentMonitor.stopAgent(settings.getWorkerAgentId());
    }

    /**
     * Runs pending tasks, highest priority first, until none are left. Tasks queued by
     * remediations during the drain are picked up in the same pass.
     *
     * @return the number of tasks executed
     */
    public int drain() {
        int executed = 0;
        Optional<Task> next;
        while ((next = taskQueue.claimNextPending()).isPresent()) {
            execute(next.get());
            executed++;
        }
        return executed;
    }

    /** Fails in-progress tasks that exceeded the staleness window. */
    public List<Task> sweepStaleTasks() {
        List<Task> stale = taskQueue.cleanupStaleTasks();
        for (Task task : stale) {
            eventBus.publish(MendwatchEvent.of("task.stale", task.id(), Map.of("type", task.type().name())));
        }
        return stale;
    }

    void execute(Task task) {
        MdcContext.setTask(task.id(), task.type().name());
        long start = System.currentTimeMillis();
        try {
            Result<String> result = run(task);
            TaskStatus outcome = result.isOk() ? TaskStatus.COMPLETED : TaskStatus.FAILED;
            taskQueue.updateTaskStatus(task.id(), outcome);
            metrics.recordTaskExecution(task.type(), outcome, System.currentTimeMillis() - start);

            String details = result.isOk() ? result.value() : result.kind() + ": " + result.message();
            agentMonitor.logActivity(settings.getWorkerAgentId(), task.type().name().toLowerCase(),
                    outcome.name().toLowerCase(), task.id() + " " + details, project);
            var payload = new HashMap<String, Object>();
            payload.put("type", task.type().name());
            payload.put("details", String.valueOf(details));
            if (task.errorId() != null) {
                payload.put("errorId", task.errorId());
            }

            if (result.isOk()) {
                log.info("Task {} completed: {}", task.id(), details);
            } else {
                log.warn("Task {} failed: {}", task.id(), details);
                remediations.handle(task, result);
            }
            eventBus.publish(MendwatchEvent.of(
                    outcome == TaskStatus.COMPLETED ? "task.completed" : "task.failed", task.id(), payload));
        } finally {
            MdcContext.clearTask();
        }
    }

    private Result<String> run(Task task) {
        TaskHandler handler = handlers.get(task.type());
        if (handler == null) {
            return Result.failure(ErrorKind.VALIDATION, "No handler for " + task.type());
        }
        try {
            return handler.handle(task);
        } catch (RuntimeException e) {
            log.error("Handler for task {} threw: {}", task.id(), e.getMessage(), e);
            return Result.failure(ErrorKind.EXECUTION, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
