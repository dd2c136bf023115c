package com.ontask.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ontask.core.engine.FeedRequest;
import com.ontask.core.engine.TaskFeedService;
import com.ontask.core.model.RankedTask;
import com.ontask.core.model.ScanScope;
import com.ontask.core.model.TaskFeed;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI command: ontask tasks [--limit N] [--pages P] [--today] [--status s]... [--json]
 * <p>
 * Loads one or more pages of tasks and prints them grouped by document, marking the top task.
 */
@Command(name = "tasks", mixinStandardHelpOptions = true, description = "List tasks page by page")
@Component
public class TasksCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Tasks per page (default: configured load-more limit)")
    private Integer limit;

    @Option(names = {"--pages", "-p"}, description = "Number of pages to load (default: ${DEFAULT-VALUE})",
            defaultValue = "1")
    private int pages;

    @Option(names = {"--today"}, description = "Only documents dated today")
    private boolean today;

    @Option(names = {"--status", "-s"}, description = "Only these status symbols (repeatable), e.g. -s / -s !")
    private List<String> statuses;

    @Option(names = {"--json"}, description = "Print the feed as JSON")
    private boolean json;

    private final TaskFeedService feedService;
    private final ObjectMapper objectMapper;

    public TasksCommand(TaskFeedService feedService, ObjectMapper objectMapper) {
        this.feedService = feedService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        if (pages < 1) {
            ConsoleOutput.error("--pages must be at least 1");
            return;
        }
        if (limit != null && limit < 0) {
            ConsoleOutput.error("--limit must not be negative");
            return;
        }

        TaskFeed feed = feedService.refresh(buildRequest(feedService.defaultRequest()));
        for (int page = 1; page < pages && feed.hasMore(); page++) {
            feed = feedService.loadMore();
        }

        if (json) {
            printJson(objectMapper, feed);
            return;
        }

        ConsoleOutput.printBanner();
        if (feed.tasks().isEmpty()) {
            ConsoleOutput.info("No tasks found");
            return;
        }

        String lastDocument = null;
        for (RankedTask task : feed.tasks()) {
            if (!task.task().documentId().equals(lastDocument)) {
                lastDocument = task.task().documentId();
                System.out.println();
                ConsoleOutput.document(lastDocument);
            }
            ConsoleOutput.task(task);
        }

        System.out.println();
        feed.top().ifPresentOrElse(ConsoleOutput::topTask, () -> ConsoleOutput.info("No top task"));
        ConsoleOutput.info(feed.size() + " task" + (feed.size() != 1 ? "s" : "") + " loaded"
                + (feed.hasMore() ? ", more available (use --pages)" : ", no more tasks"));
    }

    FeedRequest buildRequest(FeedRequest defaults) {
        FeedRequest request = defaults;
        if (limit != null) {
            request = request.withPageSize(limit);
        }
        if (today) {
            request = request.withScope(ScanScope.today());
        }
        if (statuses != null && !statuses.isEmpty()) {
            Map<String, Boolean> only = new LinkedHashMap<>();
            for (String s : statuses) {
                only.put(s, true);
            }
            request = request.withStatusFilters(only);
        }
        return request;
    }

    static void printJson(ObjectMapper objectMapper, Object value) {
        try {
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Failed to write JSON: " + e.getOriginalMessage());
        }
    }
}
