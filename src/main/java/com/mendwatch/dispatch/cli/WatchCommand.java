package com.mendwatch.dispatch.cli;

import com.mendwatch.core.engine.Orchestrator;
import com.mendwatch.core.errors.ErrorStore;
import com.mendwatch.core.events.EventBus;
import com.mendwatch.core.remediation.TaskWorker;
import com.mendwatch.core.watch.ProjectWatcher;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: mendwatch watch
 * <p>
 * Watches the project, remediates errors as they appear and prints engine events until
 * interrupted or until {@code --duration} elapses.
 */
@Command(name = "watch", mixinStandardHelpOptions = true, description = "Watch the project and fix errors continuously")
@Component
public class WatchCommand implements Runnable {

    @Option(names = {"--duration", "-d"}, description = "Stop after this many seconds; 0 runs until interrupted (default: ${DEFAULT-VALUE})",
            defaultValue = "0")
    private long durationSeconds;

    @Option(names = {"--quiet", "-q"}, description = "Do not print events")
    private boolean quiet;

    @Option(names = {"--events", "-e"}, split = ",", paramLabel = "CATEGORY",
            description = "Only print events in these categories: agent, error, scan, task (default: all)")
    private List<String> categories = new ArrayList<>();

    private final ProjectWatcher watcher;
    private final Orchestrator orchestrator;
    private final TaskWorker taskWorker;
    private final EventBus eventBus;
    private final ErrorStore errorStore;

    public WatchCommand(ProjectWatcher watcher, Orchestrator orchestrator, TaskWorker taskWorker,
                        EventBus eventBus, ErrorStore errorStore) {
        this.watcher = watcher;
        this.orchestrator = orchestrator;
        this.taskWorker = taskWorker;
        this.eventBus = eventBus;
        this.errorStore = errorStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        EventBus.Subscription subscription = subscribe();
        var stop = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(stop::countDown, "mendwatch-shutdown"));
        try {
            taskWorker.start();
            watcher.start();
            orchestrator.requestProjectScan();
            ConsoleOutput.info("Watching for changes" + (durationSeconds > 0 ? " for " + durationSeconds + "s" : "; Ctrl+C to stop"));
            if (durationSeconds > 0) {
                stop.await(durationSeconds, TimeUnit.SECONDS);
            } else {
                stop.await();
            }
        } catch (IOException e) {
            ConsoleOutput.error("Cannot watch project: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            watcher.close();
            taskWorker.stop();
            subscription.unsubscribe();
        }
        ConsoleOutput.stats(errorStore.stats());
    }

    private EventBus.Subscription subscribe() {
        if (quiet) {
            return () -> { };
        }
        if (categories.isEmpty()) {
            return eventBus.subscribeAll(ConsoleOutput::event);
        }
        return eventBus.subscribeCategories(categories, ConsoleOutput::event);
    }
}
