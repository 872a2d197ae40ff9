package com.mendwatch.core.remediation;

import com.mendwatch.core.engine.ErrorIntake;
import com.mendwatch.core.errors.ErrorStore;
import com.mendwatch.core.events.EventBus;
import com.mendwatch.core.metrics.MendwatchMetrics;
import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.model.ErrorSeverity;
import com.mendwatch.core.model.ErrorStatus;
import com.mendwatch.core.model.Task;
import com.mendwatch.core.model.TaskStatus;
import com.mendwatch.core.model.TaskType;
import com.mendwatch.core.tasks.TaskQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetryFixRemediationTest {

    private ErrorStore errorStore;
    private TaskQueue taskQueue;
    private ErrorIntake intake;
    private RetryFixRemediation remediation;

    @BeforeEach
    void setUp() {
        var metrics = new MendwatchMetrics(new SimpleMeterRegistry());
        errorStore = new ErrorStore();
        taskQueue = new TaskQueue(metrics);
        intake = new ErrorIntake(errorStore, taskQueue, new EventBus(), metrics, 2);
        remediation = new RetryFixRemediation(errorStore, taskQueue, intake);
    }

    private Task claimFixTask() {
        Task task = taskQueue.claimNextPending().orElseThrow();
        taskQueue.updateTaskStatus(task.id(), TaskStatus.FAILED);
        return task;
    }

    private List<Task> pendingFixTasks() {
        return taskQueue.getPendingTasks().stream().filter(t -> t.type() == TaskType.FIX_ERROR).toList();
    }

    @Test
    @DisplayName("queues another fix while retries remain, then gives up")
    void retriesUntilBudgetIsUsed() {
        DetectedError error = intake.ingest(List.of(
                DetectedError.of("Style", "ws", "app.py", 2, ErrorSeverity.LOW))).get(0);
        Result<String> failure = Result.failure(ErrorKind.EXECUTION, "write failed");

        remediation.apply(claimFixTask(), failure);

        assertEquals(1, errorStore.get(error.id()).orElseThrow().fixAttempts());
        List<Task> retries = pendingFixTasks();
        assertEquals(1, retries.size());
        assertEquals(error.id(), retries.get(0).errorId());
        assertEquals(2, retries.get(0).line());

        remediation.apply(claimFixTask(), failure);

        DetectedError stored = errorStore.get(error.id()).orElseThrow();
        assertEquals(2, stored.fixAttempts());
        assertEquals(ErrorStatus.FAILED, stored.status());
        assertTrue(pendingFixTasks().isEmpty());
    }

    @Test
    @DisplayName("a failed task without an error is recorded once as a TaskFailure")
    void taskFailureRecordedOnce() {
        Task run = taskQueue.createTestExecutionTask("tests/run.sh");
        Result<String> failure = Result.failure(ErrorKind.EXECUTION, "exit code 1");

        remediation.apply(run, failure);
        remediation.apply(run, failure);

        List<DetectedError> failures = errorStore.list().stream()
                .filter(e -> RetryFixRemediation.TASK_FAILURE.equals(e.errorType()))
                .toList();
        assertEquals(1, failures.size());
        assertEquals("tests/run.sh", failures.get(0).filePath());
        assertEquals(0, failures.get(0).lineNumber());
        assertEquals("exit code 1", failures.get(0).message());
        assertEquals(1, pendingFixTasks().size());
    }

    @Test
    @DisplayName("an error that no longer exists is not retried")
    void unknownError() {
        DetectedError ghost = DetectedError.of("Style", "ws", "gone.py", 1, ErrorSeverity.LOW);
        Task task = taskQueue.createErrorFixTask(ghost, "gone.py", 1, "ws");
        taskQueue.claimNextPending();

        remediation.apply(task, Result.failure(ErrorKind.EXECUTION, "boom"));

        assertTrue(pendingFixTasks().isEmpty());
        assertTrue(errorStore.list().isEmpty());
    }
}
