package com.ontask.core.update;

import com.ontask.core.filter.CheckboxLine;
import com.ontask.core.metrics.OnTaskMetrics;
import com.ontask.core.model.TaskLine;
import com.ontask.core.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Writes a new status symbol into a task line of a document.
 * <p>
 * The document is re-read on every update. Only the character between the brackets
 * changes; indentation, text, the other lines and their line endings are written back
 * as they were. Updates addressed by a previously scanned {@link TaskLine} are rejected
 * when the line has changed since the scan.
 */
@Service
public class TaskStatusService {

    private static final Logger log = LoggerFactory.getLogger(TaskStatusService.class);

    public static final char COMPLETED = 'x';
    public static final char OPEN = ' ';

    private final DocumentStore store;
    private final OnTaskMetrics metrics;

    public TaskStatusService(DocumentStore store, OnTaskMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * Sets the status of whatever task line currently sits at {@code lineNumber}.
     *
     * @return the task line as written
     * @throws TaskUpdateException if the line does not exist or is not a task line
     * @throws IllegalArgumentException if {@code status} cannot appear in a checkbox
     */
    public TaskLine setStatus(String documentId, int lineNumber, char status) {
        return update(documentId, lineNumber, status, null);
    }

    /**
     * Sets the status of a previously scanned task, provided its line is unchanged.
     *
     * @throws TaskUpdateException if the line moved, changed or disappeared since the scan
     */
    public TaskLine setStatus(TaskLine task, char status) {
        return update(task.documentId(), task.lineNumber(), status, task.rawLine());
    }

    /** Marks the task completed, or re-opens it if it already is. */
    public TaskLine toggle(String documentId, int lineNumber) {
        String[] lines = store.readDocument(documentId).split("\n", -1);
        char current = currentStatus(documentId, lineNumber, lines);
        return setStatus(documentId, lineNumber, CheckboxLine.isCompleted(current) ? OPEN : COMPLETED);
    }

    private TaskLine update(String documentId, int lineNumber, char status, String expectedLine) {
        validateStatus(status);
        String content = store.readDocument(documentId);
        String[] lines = content.split("\n", -1);
        char current = currentStatus(documentId, lineNumber, lines);

        String line = lines[lineNumber - 1];
        if (expectedLine != null && !line.strip().equals(expectedLine)) {
            metrics.recordStatusUpdate("stale");
            throw new TaskUpdateException(documentId, lineNumber,
                    "Line " + lineNumber + " of " + documentId + " changed since it was scanned");
        }

        if (current == status) {
            log.debug("{}:{} already has status '{}'", documentId, lineNumber, status);
            metrics.recordStatusUpdate("unchanged");
            return new TaskLine(documentId, lineNumber, line.strip(), status);
        }

        Optional<String> rewritten = CheckboxLine.withStatus(line, status);
        lines[lineNumber - 1] = rewritten.orElseThrow();
        store.writeDocument(documentId, String.join("\n", lines));

        log.info("Status of {}:{} changed '{}' -> '{}'", documentId, lineNumber, current, status);
        metrics.recordStatusUpdate("updated");
        return new TaskLine(documentId, lineNumber, lines[lineNumber - 1].strip(), status);
    }

    private char currentStatus(String documentId, int lineNumber, String[] lines) {
        if (lineNumber < 1 || lineNumber > lines.length) {
            metrics.recordStatusUpdate("rejected");
            throw new TaskUpdateException(documentId, lineNumber,
                    "Line " + lineNumber + " is outside " + documentId + " (" + lines.length + " lines)");
        }
        return CheckboxLine.parse(lines[lineNumber - 1])
                .map(CheckboxLine::status)
                .orElseThrow(() -> {
                    metrics.recordStatusUpdate("rejected");
                    return new TaskUpdateException(documentId, lineNumber,
                            "Line " + lineNumber + " of " + documentId + " is not a task line");
                });
    }

    private static void validateStatus(char status) {
        if (status == ']' || status == '[' || (Character.isWhitespace(status) && status != OPEN)
                || Character.isISOControl(status)) {
            throw new IllegalArgumentException("Not a usable status symbol: '" + status + "'");
        }
    }
}
