package com.mendwatch.dispatch.cli;

import com.mendwatch.core.engine.Orchestrator;
import com.mendwatch.core.errors.ErrorStore;
import com.mendwatch.core.loop.EventLoop;
import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.remediation.TaskWorker;
import com.mendwatch.core.security.PathGuard;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * CLI command: mendwatch scan [--fix]
 * <p>
 * Runs one detection pass over the project and optionally drains the resulting fix tasks.
 * Exits with 1 when unresolved errors remain.
 */
@Command(name = "scan", mixinStandardHelpOptions = true, description = "Scan the project for errors")
@Component
public class ScanCommand implements Callable<Integer> {

    @Option(names = {"--fix", "-f"}, description = "Run the queued fix tasks after scanning")
    private boolean fix;

    private final PathGuard pathGuard;
    private final Orchestrator orchestrator;
    private final TaskWorker taskWorker;
    private final EventLoop eventLoop;
    private final ErrorStore errorStore;

    public ScanCommand(PathGuard pathGuard, Orchestrator orchestrator, TaskWorker taskWorker,
                       EventLoop eventLoop, ErrorStore errorStore) {
        this.pathGuard = pathGuard;
        this.orchestrator = orchestrator;
        this.taskWorker = taskWorker;
        this.eventLoop = eventLoop;
        this.errorStore = errorStore;
    }

    @Override
    public Integer call() throws InterruptedException {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Scanning " + pathGuard.projectRoot());
        try {
            List<DetectedError> found = orchestrator.scanProject().get();
            if (found.isEmpty()) {
                ConsoleOutput.success("No errors found");
            } else {
                ConsoleOutput.warn(found.size() + " error(s) found");
                found.forEach(ConsoleOutput::detectedError);
            }
            if (fix && !found.isEmpty()) {
                int executed = eventLoop.submit(taskWorker::drain).get();
                ConsoleOutput.info("Executed " + executed + " task(s)");
            }
        } catch (ExecutionException e) {
            ConsoleOutput.error("Scan failed: " + e.getCause().getMessage());
            return 2;
        }
        var stats = errorStore.stats();
        ConsoleOutput.stats(stats);
        return stats.unresolved() == 0 ? 0 : 1;
    }
}
