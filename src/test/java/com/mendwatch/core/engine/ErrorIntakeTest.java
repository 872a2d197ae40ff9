package com.mendwatch.core.engine;

import com.mendwatch.core.errors.ErrorStore;
import com.mendwatch.core.events.EventBus;
import com.mendwatch.core.events.MendwatchEvent;
import com.mendwatch.core.metrics.MendwatchMetrics;
import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.model.ErrorSeverity;
import com.mendwatch.core.model.Task;
import com.mendwatch.core.model.TaskPriority;
import com.mendwatch.core.model.TaskType;
import com.mendwatch.core.tasks.TaskQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorIntakeTest {

    private SimpleMeterRegistry registry;
    private ErrorStore errorStore;
    private TaskQueue taskQueue;
    private List<MendwatchEvent> detected;
    private ErrorIntake intake;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        var metrics = new MendwatchMetrics(registry);
        var eventBus = new EventBus();
        detected = new ArrayList<>();
        eventBus.subscribe("error.detected", detected::add);
        errorStore = new ErrorStore();
        taskQueue = new TaskQueue(metrics);
        intake = new ErrorIntake(errorStore, taskQueue, eventBus, metrics, 5);
    }

    @Test
    @DisplayName("records new errors with the configured retry budget and queues a fix for each")
    void recordsAndQueues() {
        var error = DetectedError.of("SyntaxError", "invalid syntax", "app.py", 3, ErrorSeverity.HIGH);

        List<DetectedError> accepted = intake.ingest(List.of(error));

        assertEquals(1, accepted.size());
        assertEquals(5, errorStore.get(error.id()).orElseThrow().maxRetries());
        Task task = taskQueue.getPendingTasks().get(0);
        assertEquals(TaskType.FIX_ERROR, task.type());
        assertEquals(TaskPriority.HIGH, task.priority());
        assertEquals(error.id(), task.errorId());
        assertEquals(1, detected.size());
        assertEquals(task.id(), detected.get(0).payload().get("taskId"));
    }

    @Test
    @DisplayName("duplicates of unresolved errors are dropped and counted")
    void dropsDuplicates() {
        intake.ingest(List.of(DetectedError.of("Style", "ws", "app.py", 1, ErrorSeverity.LOW)));

        List<DetectedError> accepted = intake.ingest(List.of(
                DetectedError.of("Style", "ws", "app.py", 1, ErrorSeverity.LOW),
                DetectedError.of("Style", "ws", "app.py", 2, ErrorSeverity.LOW)));

        assertEquals(1, accepted.size());
        assertEquals(2, accepted.get(0).lineNumber());
        assertEquals(2, taskQueue.listTasks().size());
        assertEquals(1.0, registry.find("mendwatch.errors.duplicates").counter().count());
    }

    @Test
    @DisplayName("an error at the same place is recorded again once the first is fixed")
    void reDetectedAfterFix() {
        var first = intake.ingest(List.of(DetectedError.of("Style", "ws", "app.py", 1, ErrorSeverity.LOW))).get(0);
        errorStore.markResolved(first.id(), null);

        assertEquals(1, intake.ingest(List.of(DetectedError.of("Style", "ws", "app.py", 1, ErrorSeverity.LOW))).size());
    }
}
