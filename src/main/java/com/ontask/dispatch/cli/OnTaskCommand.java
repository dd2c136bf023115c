package com.ontask.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for OnTask.
 * Routes to subcommands: tasks, top, set, done.
 */
@Command(
        name = "ontask",
        mixinStandardHelpOptions = true,
        version = "OnTask 0.1.0",
        description = "Finds checkbox tasks across markdown notes, page by page, and picks the top task",
        subcommands = {
                TasksCommand.class,
                TopCommand.class,
                SetCommand.class,
                DoneCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class OnTaskCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
