package com.ontask.dispatch.cli;

import com.ontask.core.update.TaskStatusService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: ontask done &lt;document&gt;:&lt;line&gt; [--undo]
 */
@Command(name = "done", mixinStandardHelpOptions = true, description = "Mark a task completed")
@Component
public class DoneCommand implements Runnable {

    @Parameters(index = "0", description = "Task location, e.g. Journal/2024-01-15.md:12")
    private String location;

    @Option(names = {"--undo"}, description = "Re-open the task instead")
    private boolean undo;

    private final TaskStatusService statusService;

    public DoneCommand(TaskStatusService statusService) {
        this.statusService = statusService;
    }

    @Override
    public void run() {
        TaskLocation target;
        try {
            target = TaskLocation.parse(location);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        char status = undo ? TaskStatusService.OPEN : TaskStatusService.COMPLETED;
        SetCommand.apply(target, () -> statusService.setStatus(target.documentId(), target.lineNumber(), status));
    }
}
