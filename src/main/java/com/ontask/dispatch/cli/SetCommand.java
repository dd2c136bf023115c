package com.ontask.dispatch.cli;

import com.ontask.core.model.TaskLine;
import com.ontask.core.store.DocumentStoreException;
import com.ontask.core.update.TaskStatusService;
import com.ontask.core.update.TaskUpdateException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.function.Supplier;

/**
 * CLI command: ontask set &lt;document&gt;:&lt;line&gt; &lt;symbol&gt;
 * <p>
 * Rewrites the status symbol of one task line in place. {@code .} stands for the
 * plain to-do box {@code [ ]}.
 */
@Command(name = "set", mixinStandardHelpOptions = true, description = "Change the status of a task")
@Component
public class SetCommand implements Runnable {

    @Parameters(index = "0", description = "Task location, e.g. Journal/2024-01-15.md:12")
    private String location;

    @Parameters(index = "1", description = "New status symbol, e.g. x, /, !, . for to-do")
    private String symbol;

    private final TaskStatusService statusService;

    public SetCommand(TaskStatusService statusService) {
        this.statusService = statusService;
    }

    @Override
    public void run() {
        TaskLocation target;
        char status;
        try {
            target = TaskLocation.parse(location);
            status = toStatus(symbol);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        apply(target, () -> statusService.setStatus(target.documentId(), target.lineNumber(), status));
    }

    static char toStatus(String symbol) {
        if (".".equals(symbol) || " ".equals(symbol)) {
            return TaskStatusService.OPEN;
        }
        if (symbol == null || symbol.length() != 1) {
            throw new IllegalArgumentException("Status must be a single character, got '" + symbol + "'");
        }
        return symbol.charAt(0);
    }

    /** Runs an update and reports the outcome; shared with {@link DoneCommand}. */
    static void apply(TaskLocation target, Supplier<TaskLine> update) {
        try {
            TaskLine updated = update.get();
            ConsoleOutput.success(target + " " + updated.rawLine());
        } catch (TaskUpdateException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
        } catch (DocumentStoreException e) {
            ConsoleOutput.error("Cannot update " + target + ": " + e.getMessage());
        }
    }
}
