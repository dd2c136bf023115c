package com.ontask.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ontask.core.engine.FeedRequest;
import com.ontask.core.engine.TaskFeedService;
import com.ontask.core.model.ScanScope;
import com.ontask.core.model.TaskFeed;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.HashMap;
import java.util.Map;

/**
 * CLI command: ontask top [--today] [--json]
 * <p>
 * Loads every page, then prints the top task.
 */
@Command(name = "top", mixinStandardHelpOptions = true, description = "Show the current top task")
@Component
public class TopCommand implements Runnable {

    @Option(names = {"--today"}, description = "Only documents dated today")
    private boolean today;

    @Option(names = {"--json"}, description = "Print the top task as JSON")
    private boolean json;

    private final TaskFeedService feedService;
    private final ObjectMapper objectMapper;

    public TopCommand(TaskFeedService feedService, ObjectMapper objectMapper) {
        this.feedService = feedService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        FeedRequest request = feedService.defaultRequest();
        if (today) {
            request = request.withScope(ScanScope.today());
        }
        feedService.refresh(request);
        TaskFeed feed = feedService.loadAll();

        if (json) {
            Map<String, Object> body = new HashMap<>();
            body.put("topTask", feed.topTask());
            body.put("scanned", feed.size());
            TasksCommand.printJson(objectMapper, body);
            return;
        }

        ConsoleOutput.printBanner();
        feed.top().ifPresentOrElse(
                ConsoleOutput::topTask,
                () -> ConsoleOutput.info("No top task among " + feed.size() + " tasks"));
    }
}
