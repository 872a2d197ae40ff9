package com.mendwatch.core.remediation;

import com.mendwatch.core.errors.ErrorStore;
import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.model.ErrorSeverity;
import com.mendwatch.core.model.ErrorStatus;
import com.mendwatch.core.model.Task;
import com.mendwatch.core.model.TaskPriority;
import com.mendwatch.core.model.TaskStatus;
import com.mendwatch.core.model.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class GiveUpRemediationTest {

    @Test
    @DisplayName("marks the task's error failed and allows a later retry")
    void marksFailed() {
        var store = new ErrorStore();
        DetectedError error = DetectedError.of("SyntaxError", "bad", "x.py", 1, ErrorSeverity.HIGH);
        store.add(error);
        Instant now = Instant.now();
        var task = new Task("TASK-0001", TaskType.FIX_ERROR, TaskPriority.HIGH, TaskStatus.FAILED,
                "x.py", 1, error.id(), "fix", now, now);

        new GiveUpRemediation(store).apply(task, Result.failure(ErrorKind.UNRECOVERABLE, "no strategy"));

        assertEquals(ErrorStatus.FAILED, store.get(error.id()).orElseThrow().status());
        assertTrue(store.retry(error.id()));
        assertEquals(ErrorStatus.PENDING, store.get(error.id()).orElseThrow().status());
    }

    @Test
    @DisplayName("tasks without an error are only logged")
    void noError() {
        var store = new ErrorStore();
        Instant now = Instant.now();
        var task = new Task("TASK-0002", TaskType.LINTING, TaskPriority.LOW, TaskStatus.FAILED,
                "x.py", 0, null, "lint", now, now);

        assertDoesNotThrow(() -> new GiveUpRemediation(store).apply(task, Result.failure(ErrorKind.VALIDATION, "bad path")));
        assertTrue(store.list().isEmpty());
    }
}
