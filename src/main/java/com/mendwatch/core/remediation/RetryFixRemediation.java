package com.mendwatch.core.remediation;

import com.mendwatch.core.engine.ErrorIntake;
import com.mendwatch.core.errors.ErrorStore;
import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.model.ErrorSeverity;
import com.mendwatch.core.model.Task;
import com.mendwatch.core.tasks.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Counts a failed fix attempt and queues another FIX_ERROR task while the error still has
 * retries left; once they are used up the error is marked FAILED.
 * <p>
 * A failed task that does not point at an error (a test run, a lint) is recorded as a
 * {@value #TASK_FAILURE} error at line 0 of the task's file. The store keeps at most one
 * unresolved such error per file, which bounds the follow-up work.
 */
public class RetryFixRemediation implements Remediation {

    private static final Logger log = LoggerFactory.getLogger(RetryFixRemediation.class);

    public static final String TASK_FAILURE = "TaskFailure";

    private final ErrorStore errorStore;
    private final TaskQueue taskQueue;
    private final ErrorIntake intake;

    public RetryFixRemediation(ErrorStore errorStore, TaskQueue taskQueue, ErrorIntake intake) {
        this.errorStore = errorStore;
        this.taskQueue = taskQueue;
        this.intake = intake;
    }

    @Override
    public void apply(Task task, Result<?> failure) {
        if (task.errorId() == null) {
            intake.ingest(List.of(DetectedError.of(TASK_FAILURE, failure.message(), task.file(), 0, ErrorSeverity.MEDIUM)));
            return;
        }
        int attempts = errorStore.incrementFixAttempts(task.errorId());
        Optional<DetectedError> error = errorStore.get(task.errorId());
        if (attempts < 0 || error.isEmpty()) {
            log.warn("Error {} for task {} is gone, not retrying", task.errorId(), task.id());
            return;
        }
        if (attempts < error.get().maxRetries()) {
            Task retry = taskQueue.createErrorFixTask(error.get(), task.file(), task.line(), failure.message());
            log.info("Retrying error {} as task {} (attempt {}/{})", task.errorId(), retry.id(),
                    attempts + 1, error.get().maxRetries());
        } else {
            errorStore.markFailed(task.errorId());
            log.warn("Giving up on error {} after {} attempt(s)", task.errorId(), attempts);
        }
    }
}
