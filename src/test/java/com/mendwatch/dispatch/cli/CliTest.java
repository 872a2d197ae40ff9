package com.mendwatch.dispatch.cli;

import com.mendwatch.core.engine.Orchestrator;
import com.mendwatch.core.errors.ErrorStore;
import com.mendwatch.core.events.EventBus;
import com.mendwatch.core.events.MendwatchEvent;
import com.mendwatch.core.health.HealthCheckService;
import com.mendwatch.core.health.HealthStatus;
import com.mendwatch.core.loop.EventLoop;
import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.model.ErrorContext;
import com.mendwatch.core.model.ErrorReport;
import com.mendwatch.core.model.ErrorSeverity;
import com.mendwatch.core.model.ErrorStatus;
import com.mendwatch.core.remediation.TaskWorker;
import com.mendwatch.core.report.ReportAnalyzer;
import com.mendwatch.core.report.ReportCodec;
import com.mendwatch.core.report.ReportWriter;
import com.mendwatch.core.security.PathGuard;
import com.mendwatch.core.watch.ProjectWatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Mendwatch CLI command structure.
 * These tests exercise picocli directly without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path tempDir;

    private PathGuard pathGuard;
    private Orchestrator orchestrator;
    private TaskWorker taskWorker;
    private EventLoop eventLoop;
    private ErrorStore errorStore;
    private HealthCheckService healthCheckService;
    private ReportWriter reportWriter;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        pathGuard = mock(PathGuard.class);
        when(pathGuard.projectRoot()).thenReturn(tempDir);
        orchestrator = mock(Orchestrator.class);
        taskWorker = mock(TaskWorker.class);
        eventLoop = new EventLoop("cli-test-loop");
        errorStore = new ErrorStore();
        healthCheckService = mock(HealthCheckService.class);
        reportWriter = new ReportWriter(tempDir.resolve("reports"), new ReportCodec());
        eventBus = new EventBus();
    }

    @AfterEach
    void tearDown() {
        eventLoop.close();
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ScanCommand.class) {
                    return (K) new ScanCommand(pathGuard, orchestrator, taskWorker, eventLoop, errorStore);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                if (cls == ReportsCommand.class) {
                    return (K) new ReportsCommand(reportWriter, new ReportAnalyzer());
                }
                if (cls == WatchCommand.class) {
                    return (K) new WatchCommand(mock(ProjectWatcher.class), orchestrator, taskWorker,
                            eventBus, errorStore);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new MendwatchCommand(), factory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // -- Help output ----------------------------------------------------------

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String sub : List.of("scan", "watch", "health", "reports", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Mendwatch 0.1.0"));
        }

        @Test
        @DisplayName("unknown subcommand fails")
        void unknownSubcommand() {
            assertNotEquals(0, execute("explode").exitCode());
        }
    }

    // -- scan -----------------------------------------------------------------

    @Nested
    @DisplayName("scan")
    class ScanTests {

        @Test
        @DisplayName("a clean project exits 0")
        void cleanProject() {
            when(orchestrator.scanProject()).thenReturn(CompletableFuture.completedFuture(List.of()));

            CliResult result = execute("scan");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No errors found"));
            verify(taskWorker, never()).drain();
        }

        @Test
        @DisplayName("unresolved errors exit 1 and are listed")
        void unresolvedErrors() {
            var error = DetectedError.of("SyntaxError", "invalid syntax", "app.py", 2, ErrorSeverity.HIGH);
            errorStore.add(error);
            when(orchestrator.scanProject()).thenReturn(CompletableFuture.completedFuture(List.of(error)));

            CliResult result = execute("scan");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("app.py:2"));
            assertTrue(result.output().contains("1 error(s) found"));
        }

        @Test
        @DisplayName("--fix drains the queue on the event loop")
        void fixDrains() {
            var error = DetectedError.of("Style", "Trailing whitespace", "app.py", 1, ErrorSeverity.LOW);
            errorStore.add(error);
            when(orchestrator.scanProject()).thenReturn(CompletableFuture.completedFuture(List.of(error)));
            when(taskWorker.drain()).thenAnswer(inv -> {
                errorStore.markResolved(error.id(), null);
                return 1;
            });

            CliResult result = execute("scan", "--fix");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Executed 1 task(s)"));
            assertEquals(ErrorStatus.FIXED, errorStore.get(error.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("a failing scan exits 2")
        void scanFailure() {
            when(orchestrator.scanProject())
                    .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk gone")));

            CliResult result = execute("scan");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("disk gone"));
        }
    }

    // -- health ---------------------------------------------------------------

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("all components UP exits 0")
        void allUp() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("project", HealthStatus.Status.UP, "Project root readable", Map.of()),
                    new HealthStatus("event-loop", HealthStatus.Status.UP, "Event loop responsive", Map.of())));

            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("all systems operational"));
        }

        @Test
        @DisplayName("a degraded component exits 1")
        void degraded() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("agents", HealthStatus.Status.DEGRADED, "1 of 1 agent(s) in error", Map.of())));

            CliResult result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("1 of 1 agent(s) in error"));
        }
    }

    // -- watch ----------------------------------------------------------------

    @Nested
    @DisplayName("watch")
    class WatchTests {

        @BeforeEach
        void publishOnScanRequest() {
            when(orchestrator.requestProjectScan()).thenAnswer(invocation -> {
                eventBus.publish(MendwatchEvent.of("task.completed", "TASK-0001", Map.of("type", "LINTING")));
                eventBus.publish(MendwatchEvent.of("error.detected", "app.py", Map.of("line", 3)));
                return CompletableFuture.completedFuture(null);
            });
        }

        @Test
        @DisplayName("--events prints only the selected categories")
        void filtersEventCategories() {
            CliResult result = execute("watch", "--duration", "1", "--events", "task");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[task.completed]"));
            assertFalse(result.output().contains("[error.detected]"));
            assertEquals(0, eventBus.subscriberCount());
        }

        @Test
        @DisplayName("without --events every event is printed")
        void printsAllEvents() {
            CliResult result = execute("watch", "-d", "1");

            assertTrue(result.output().contains("[task.completed]"));
            assertTrue(result.output().contains("[error.detected]"));
            verify(taskWorker).start();
            verify(taskWorker).stop();
        }

        @Test
        @DisplayName("--quiet prints no events")
        void quiet() {
            CliResult result = execute("watch", "-d", "1", "--quiet");

            assertFalse(result.output().contains("[task.completed]"));
        }
    }

    // -- reports --------------------------------------------------------------

    @Nested
    @DisplayName("reports")
    class ReportsTests {

        @Test
        @DisplayName("no reports prints the report directory")
        void noReports() {
            CliResult result = execute("reports");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No reports in"));
        }

        @Test
        @DisplayName("lists reports with aggregate statistics")
        void listsReports() throws Exception {
            var error = DetectedError.of("NameError", "name 'x' is not defined", "lib.py", 9, ErrorSeverity.MEDIUM)
                    .withStatus(ErrorStatus.FAILED, Instant.now());
            reportWriter.write(ErrorReport.forError(error, ErrorContext.empty()));

            CliResult result = execute("reports", "--limit", "5");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("lib.py:9"));
            assertTrue(result.output().contains("Reports: 1, fixed: 0, failed: 1"));
        }
    }
}
