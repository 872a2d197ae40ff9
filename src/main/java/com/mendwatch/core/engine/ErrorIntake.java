package com.mendwatch.core.engine;

import com.mendwatch.core.errors.ErrorStore;
import com.mendwatch.core.events.EventBus;
import com.mendwatch.core.events.MendwatchEvent;
import com.mendwatch.core.metrics.MendwatchMetrics;
import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.model.Task;
import com.mendwatch.core.tasks.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Feeds detector output into the {@link ErrorStore} and queues one fix task per newly
 * recorded error. Duplicates of unresolved errors are dropped.
 */
public class ErrorIntake {

    private static final Logger log = LoggerFactory.getLogger(ErrorIntake.class);

    private final ErrorStore errorStore;
    private final TaskQueue taskQueue;
    private final EventBus eventBus;
    private final MendwatchMetrics metrics;
    private final int maxRetries;

    public ErrorIntake(ErrorStore errorStore, TaskQueue taskQueue, EventBus eventBus,
                       MendwatchMetrics metrics, int maxRetries) {
        this.errorStore = errorStore;
        this.taskQueue = taskQueue;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxRetries = maxRetries;
    }

    /**
     * @return the errors that were new and now have a fix task
     */
    public List<DetectedError> ingest(List<DetectedError> detected) {
        var accepted = new ArrayList<DetectedError>();
        for (DetectedError candidate : detected) {
            DetectedError error = candidate.maxRetries() == maxRetries ? candidate : candidate.withMaxRetries(maxRetries);
            if (!errorStore.add(error)) {
                metrics.recordDuplicateError();
                continue;
            }
            metrics.recordErrorDetected(error.errorType());
            Task task = taskQueue.createErrorFixTask(error, error.filePath(), error.lineNumber(), error.message());
            eventBus.publish(MendwatchEvent.of("error.detected", error.filePath(), Map.of(
                    "errorId", error.id(),
                    "type", error.errorType(),
                    "line", error.lineNumber(),
                    "taskId", task.id())));
            accepted.add(error);
        }
        if (!accepted.isEmpty()) {
            log.info("Recorded {} new error(s) out of {} detected", accepted.size(), detected.size());
        }
        return accepted;
    }

    public int maxRetries() {
        return maxRetries;
    }
}
