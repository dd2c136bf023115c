package com.ontask.core.scan;

import com.ontask.core.filter.StatusFilter;
import com.ontask.core.filter.StatusFilterCompiler;
import com.ontask.core.metrics.OnTaskMetrics;
import com.ontask.core.model.ScanBatch;
import com.ontask.core.model.ScanCursor;
import com.ontask.core.model.TaskLine;
import com.ontask.core.source.DocumentAggregator;
import com.ontask.core.store.InMemoryDocumentStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for the cursor-driven {@link TaskScanner#scan} step.
 */
class TaskScannerTest {

    private static final StatusFilter ALL_TODO_AND_DONE =
            new StatusFilterCompiler().compile(Map.of(".", true, "x", true, "/", true, "!", true));

    private InMemoryDocumentStore store;
    private SimpleMeterRegistry registry;
    private TaskScanner scanner;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        registry = new SimpleMeterRegistry();
        scanner = new TaskScanner(mock(DocumentAggregator.class), store, new OnTaskMetrics(registry));
    }

    private static String tasks(String prefix, int count) {
        var sb = new StringBuilder("# " + prefix + "\n");
        for (int i = 1; i <= count; i++) {
            sb.append("- [ ] ").append(prefix).append(" task ").append(i).append('\n');
        }
        return sb.toString();
    }

    private ScanBatch scan(List<String> docs, ScanCursor cursor, int target) {
        return scanner.scan(docs, cursor, target, ALL_TODO_AND_DONE, "scan-test");
    }

    private List<TaskLine> drain(List<String> docs, int pageSize) {
        var all = new ArrayList<TaskLine>();
        ScanCursor cursor = ScanCursor.START;
        for (int guard = 0; guard < 1000; guard++) {
            ScanBatch batch = scan(docs, cursor, pageSize);
            assertTrue(batch.size() <= pageSize, "batch exceeds target");
            all.addAll(batch.tasks());
            cursor = batch.cursor();
            if (!batch.hasMore()) {
                return all;
            }
        }
        throw new AssertionError("scan did not terminate");
    }

    // ── Pagination scenarios ─────────────────────────────────────────

    @Nested
    @DisplayName("pagination")
    class PaginationTests {

        @Test
        @DisplayName("3 then 10 over two 5-match documents -> 3 (more), then 7 (done)")
        void loadMoreAcrossDocuments() {
            store.put("doc1.md", tasks("one", 5)).put("doc2.md", tasks("two", 5));
            var docs = List.of("doc1.md", "doc2.md");

            ScanBatch first = scan(docs, ScanCursor.START, 3);
            assertEquals(3, first.size());
            assertTrue(first.hasMore());
            assertEquals(new ScanCursor(0, 3), first.cursor());
            assertEquals(List.of("- [ ] one task 1", "- [ ] one task 2", "- [ ] one task 3"),
                    first.tasks().stream().map(TaskLine::rawLine).toList());

            ScanBatch second = scan(docs, first.cursor(), 10);
            assertEquals(7, second.size());
            assertFalse(second.hasMore());
            assertEquals("- [ ] one task 4", second.tasks().get(0).rawLine());
            assertEquals("- [ ] one task 5", second.tasks().get(1).rawLine());
            assertEquals("doc2.md", second.tasks().get(2).documentId());
            assertEquals("- [ ] two task 5", second.tasks().get(6).rawLine());
            assertEquals(new ScanCursor(2, 0), second.cursor());
        }

        @Test
        @DisplayName("any page size yields the same sequence as one unbounded call")
        void pagingIsExhaustiveAndOrdered() {
            store.put("a.md", tasks("a", 4))
                 .put("b.md", "nothing here\n")
                 .put("c.md", tasks("c", 1))
                 .put("d.md", tasks("d", 6));
            var docs = List.of("a.md", "b.md", "c.md", "d.md");

            List<TaskLine> reference = scan(docs, ScanCursor.START, Integer.MAX_VALUE).tasks();
            assertEquals(11, reference.size());
            for (int pageSize : new int[]{1, 2, 3, 4, 5, 7, 11, 12}) {
                assertEquals(reference, drain(docs, pageSize), "page size " + pageSize);
            }
        }

        @Test
        @DisplayName("filling the target on a document's last match keeps the cursor on that document")
        void exactFitStaysOnDocument() {
            store.put("a.md", tasks("a", 2)).put("b.md", tasks("b", 2));
            var docs = List.of("a.md", "b.md");

            ScanBatch first = scan(docs, ScanCursor.START, 2);
            assertEquals(new ScanCursor(0, 2), first.cursor());
            assertTrue(first.hasMore());

            ScanBatch second = scan(docs, first.cursor(), 2);
            assertEquals(List.of("b.md", "b.md"), second.tasks().stream().map(TaskLine::documentId).toList());
            assertEquals(new ScanCursor(1, 2), second.cursor());
            assertTrue(second.hasMore(), "still positioned inside the last document");

            ScanBatch third = scan(docs, second.cursor(), 2);
            assertTrue(third.tasks().isEmpty());
            assertFalse(third.hasMore());
        }

        @Test
        @DisplayName("a zero target returns nothing and leaves the cursor in place")
        void zeroTarget() {
            store.put("a.md", tasks("a", 2));
            ScanBatch batch = scan(List.of("a.md"), ScanCursor.START, 0);
            assertTrue(batch.tasks().isEmpty());
            assertTrue(batch.hasMore());
            assertEquals(ScanCursor.START, batch.cursor());
            assertEquals(0, store.readCount());
        }

        @Test
        @DisplayName("a negative target is rejected")
        void negativeTarget() {
            assertThrows(IllegalArgumentException.class, () -> scan(List.of(), ScanCursor.START, -1));
        }

        @Test
        @DisplayName("an empty document list is immediately exhausted")
        void emptyDocumentList() {
            ScanBatch batch = scan(List.of(), ScanCursor.START, 5);
            assertTrue(batch.tasks().isEmpty());
            assertFalse(batch.hasMore());
        }

        @Test
        @DisplayName("documents are read lazily, only as far as the page needs")
        void readsLazily() {
            store.put("a.md", tasks("a", 5)).put("b.md", tasks("b", 5)).put("c.md", tasks("c", 5));
            scan(List.of("a.md", "b.md", "c.md"), ScanCursor.START, 4);
            assertEquals(1, store.readCount());
        }
    }

    // ── Matching ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("matching")
    class MatchingTests {

        @Test
        @DisplayName("records 1-based line numbers and trimmed text")
        void lineNumbersAndTrimming() {
            store.put("a.md", "# Title\n\n  - [/] indented   \nplain\n- [x] done");
            ScanBatch batch = scan(List.of("a.md"), ScanCursor.START, 10);

            assertEquals(2, batch.size());
            TaskLine first = batch.tasks().get(0);
            assertEquals(3, first.lineNumber());
            assertEquals("- [/] indented", first.rawLine());
            assertEquals('/', first.statusSymbol());
            assertEquals("indented", first.text());
            assertEquals(5, batch.tasks().get(1).lineNumber());
        }

        @Test
        @DisplayName("excluded statuses and malformed lines are skipped")
        void filterAppliesToStatus() {
            store.put("a.md", "- [ ] todo\n- [x] done\n- [?] question\n- [] broken\n");
            var filter = new StatusFilterCompiler().compile(Map.of(" ", true, "x", true));

            ScanBatch batch = scanner.scan(List.of("a.md"), ScanCursor.START, 10, filter, "scan-test");
            assertEquals(List.of(' ', 'x'), batch.tasks().stream().map(TaskLine::statusSymbol).toList());
        }

        @Test
        @DisplayName("Windows line endings keep line numbers and strip the carriage return")
        void crlfContent() {
            store.put("a.md", "intro\r\n- [!] urgent\r\n");
            TaskLine task = scan(List.of("a.md"), ScanCursor.START, 10).tasks().get(0);
            assertEquals(2, task.lineNumber());
            assertEquals("- [!] urgent", task.rawLine());
        }

        @Test
        @DisplayName("a filter that matches nothing exhausts the scan without reading")
        void emptyFilterReadsNothing() {
            store.put("a.md", tasks("a", 3));
            ScanBatch batch = scanner.scan(List.of("a.md"), ScanCursor.START, 10, StatusFilter.none(), "scan-test");
            assertTrue(batch.tasks().isEmpty());
            assertFalse(batch.hasMore());
            assertEquals(0, store.readCount());
        }

        @Test
        @DisplayName("a document that shrank below the cursor offset is passed over")
        void shrunkDocument() {
            store.put("a.md", tasks("a", 1)).put("b.md", tasks("b", 1));
            ScanBatch batch = scan(List.of("a.md", "b.md"), new ScanCursor(0, 4), 5);
            assertEquals(List.of("b.md"), batch.tasks().stream().map(TaskLine::documentId).toList());
            assertFalse(batch.hasMore());
        }
    }

    // ── Fault tolerance ──────────────────────────────────────────────

    @Nested
    @DisplayName("fault tolerance")
    class FaultToleranceTests {

        @Test
        @DisplayName("an unreadable middle document is skipped, the others still match")
        void skipsUnreadableDocument() {
            store.put("1.md", tasks("one", 2)).put("2.md", tasks("two", 2)).put("3.md", tasks("three", 2))
                 .failReading("2.md");

            ScanBatch batch = assertDoesNotThrow(() -> scan(List.of("1.md", "2.md", "3.md"), ScanCursor.START, 100));
            assertEquals(List.of("1.md", "1.md", "3.md", "3.md"),
                    batch.tasks().stream().map(TaskLine::documentId).toList());
            assertFalse(batch.hasMore());

            var failures = registry.find("ontask.scan.read.failures").tag("reason", "read_error").counter();
            assertNotNull(failures);
            assertEquals(1.0, failures.count());
        }

        @Test
        @DisplayName("a document deleted after listing is skipped")
        void skipsMissingDocument() {
            store.put("1.md", tasks("one", 1));
            ScanBatch batch = scan(List.of("gone.md", "1.md"), ScanCursor.START, 10);
            assertEquals(1, batch.size());
            assertEquals(1.0, registry.find("ontask.scan.read.failures").tag("reason", "not_found").counter().count());
        }

        @Test
        @DisplayName("a failing resume document resets the offset for the next one")
        void failureResetsOffset() {
            store.put("1.md", tasks("one", 3)).put("2.md", tasks("two", 3));
            store.failReading("1.md");
            ScanBatch batch = scan(List.of("1.md", "2.md"), new ScanCursor(0, 2), 10);
            assertEquals(3, batch.size(), "second document starts from its first match");
        }
    }

    @Test
    @DisplayName("records batch size and duration metrics")
    void recordsMetrics() {
        store.put("a.md", tasks("a", 3));
        scan(List.of("a.md"), ScanCursor.START, 2);

        var size = registry.find("ontask.scan.batch.size").summary();
        assertNotNull(size);
        assertEquals(2.0, size.totalAmount());
        assertNotNull(registry.find("ontask.scan.batch.duration").timer());
    }
}
