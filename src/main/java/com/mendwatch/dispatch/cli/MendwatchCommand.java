package com.mendwatch.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Mendwatch.
 * Routes to subcommands: scan, watch, health, reports.
 */
@Command(
        name = "mendwatch",
        mixinStandardHelpOptions = true,
        version = "Mendwatch 0.1.0",
        description = "Detects errors in a project and remediates them under a file-access guard",
        subcommands = {
                ScanCommand.class,
                WatchCommand.class,
                HealthCommand.class,
                ReportsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MendwatchCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
