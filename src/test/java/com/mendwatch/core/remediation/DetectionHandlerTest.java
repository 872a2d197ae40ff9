package com.mendwatch.core.remediation;

import com.mendwatch.core.detect.PatternDetector;
import com.mendwatch.core.engine.ErrorIntake;
import com.mendwatch.core.errors.ErrorStore;
import com.mendwatch.core.events.EventBus;
import com.mendwatch.core.metrics.MendwatchMetrics;
import com.mendwatch.core.model.Task;
import com.mendwatch.core.security.PathGuard;
import com.mendwatch.core.security.SecurityContext;
import com.mendwatch.core.tasks.TaskQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DetectionHandlerTest {

    @TempDir
    Path tempDir;

    private Path root;
    private ErrorStore errorStore;
    private TaskQueue taskQueue;
    private DetectionHandler handler;

    @BeforeEach
    void setUp() throws Exception {
        var guard = new PathGuard(SecurityContext.create(tempDir.resolve("project"), List.of("read", "write")));
        root = guard.projectRoot();
        var metrics = new MendwatchMetrics(new SimpleMeterRegistry());
        errorStore = new ErrorStore();
        taskQueue = new TaskQueue(metrics);
        var intake = new ErrorIntake(errorStore, taskQueue, new EventBus(), metrics, 3);
        handler = new DetectionHandler(guard, new PatternDetector(guard), intake);

        Files.writeString(root.resolve("a.py"), "x = 1  \n");
        Files.writeString(root.resolve("b.py"), "TypeError: unsupported operand\n");
    }

    @Test
    @DisplayName("a linting task scans only its file")
    void lintOneFile() {
        Task lint = taskQueue.createLintingTask("a.py");

        Result<String> result = handler.handle(lint);

        assertTrue(result.isOk());
        assertEquals("Scanned 1 file(s): 1 finding(s), 1 new", result.value());
        assertEquals(1, errorStore.list().size());
        assertEquals("a.py", errorStore.list().get(0).filePath());
    }

    @Test
    @DisplayName("a project scan covers every file and skips known errors")
    void projectScan() {
        Task scan = taskQueue.createProjectScanTask(root.toString());

        assertEquals("Scanned 2 file(s): 2 finding(s), 2 new", handler.handle(scan).value());
        assertEquals("Scanned 2 file(s): 2 finding(s), 0 new", handler.handle(scan).value());
        assertEquals(2, errorStore.list().size());
    }

    @Test
    @DisplayName("linting a path outside the project fails validation")
    void outsidePath() {
        Task lint = taskQueue.createLintingTask("../elsewhere.py");

        Result<String> result = handler.handle(lint);

        assertEquals(ErrorKind.VALIDATION, result.kind());
        assertTrue(errorStore.list().isEmpty());
    }

    @Test
    @DisplayName("a project scan of a vanished root is a transient failure, not an empty scan")
    void vanishedRoot() throws Exception {
        Task scan = taskQueue.createProjectScanTask(root.toString());
        Files.delete(root.resolve("a.py"));
        Files.delete(root.resolve("b.py"));
        Files.delete(root);

        Result<String> result = handler.handle(scan);

        assertEquals(ErrorKind.TRANSIENT, result.kind());
        assertTrue(result.message().startsWith("Cannot list project files"));
    }
}
