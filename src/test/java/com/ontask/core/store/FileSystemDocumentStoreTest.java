package com.ontask.core.store;

import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link FileSystemDocumentStore} over a {@code @TempDir} vault.
 */
class FileSystemDocumentStoreTest {

    @TempDir
    Path vault;

    FileSystemDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemDocumentStore(vault, ".md");
    }

    @Test
    @DisplayName("lists markdown documents with slash-separated relative ids")
    void listsMarkdownDocuments() throws IOException {
        Files.createDirectories(vault.resolve("Journal/2024"));
        Files.writeString(vault.resolve("Journal/2024/2024-01-15.md"), "- [ ] a");
        Files.writeString(vault.resolve("inbox.md"), "");
        Files.writeString(vault.resolve("image.png"), "");

        var documents = store.listDocuments();
        assertEquals(2, documents.size());
        assertTrue(documents.contains("Journal/2024/2024-01-15.md"));
        assertTrue(documents.contains("inbox.md"));
    }

    @Test
    @DisplayName("ignores editor and trash directories")
    void ignoresToolDirectories() throws IOException {
        Files.createDirectories(vault.resolve(".obsidian"));
        Files.createDirectories(vault.resolve(".trash"));
        Files.writeString(vault.resolve(".obsidian/workspace.md"), "");
        Files.writeString(vault.resolve(".trash/old.md"), "- [ ] gone");
        Files.writeString(vault.resolve("note.md"), "");

        assertEquals(java.util.List.of("note.md"), store.listDocuments());
    }

    @Test
    @DisplayName("listing a missing root fails with DocumentStoreException")
    void missingRootFails() {
        var missing = new FileSystemDocumentStore(vault.resolve("nope"), ".md");
        assertThrows(DocumentStoreException.class, missing::listDocuments);
    }

    @Test
    @DisplayName("a link cycle or broken link is skipped and the rest of the vault still lists")
    void badPathsDoNotAbortListing() throws IOException {
        Files.createDirectories(vault.resolve("Work"));
        Files.writeString(vault.resolve("Work/plan.md"), "- [ ] a");
        Files.writeString(vault.resolve("inbox.md"), "");
        try {
            Files.createSymbolicLink(vault.resolve("Work/loop"), vault);
            Files.createSymbolicLink(vault.resolve("dangling.md"), vault.resolve("gone.md"));
        } catch (UnsupportedOperationException | IOException e) {
            Assumptions.abort("symbolic links not supported: " + e.getMessage());
        }

        var documents = assertDoesNotThrow(store::listDocuments);
        assertEquals(Set.of("Work/plan.md", "inbox.md"), Set.copyOf(documents));
    }

    @Test
    @DisplayName("a path that fails mid-walk is skipped instead of failing the listing")
    void failedVisitContinues() {
        var collector = store.new DocumentCollector();

        var result = collector.visitFileFailed(vault.resolve("Locked"),
                new AccessDeniedException(vault.resolve("Locked").toString()));
        var postResult = collector.postVisitDirectory(vault.resolve("Gone"),
                new NoSuchFileException(vault.resolve("Gone").toString()));

        assertEquals(FileVisitResult.CONTINUE, result);
        assertEquals(FileVisitResult.CONTINUE, postResult);
        assertEquals(2, collector.skipped);
        assertTrue(collector.documents.isEmpty());
    }

    @Test
    @DisplayName("reads content and distinguishes documents from folders")
    void readsContent() throws IOException {
        Files.createDirectories(vault.resolve("Work"));
        Files.writeString(vault.resolve("Work/plan.md"), "- [/] ship it\n");

        assertEquals("- [/] ship it\n", store.readDocument("Work/plan.md"));
        assertTrue(store.exists("Work"));
        assertFalse(store.isDocument("Work"));
        assertTrue(store.isDocument("Work/plan.md"));
        assertFalse(store.exists("Play"));
    }

    @Test
    @DisplayName("reading a missing document throws DocumentNotFoundException")
    void readMissingDocument() {
        var e = assertThrows(DocumentNotFoundException.class, () -> store.readDocument("missing.md"));
        assertEquals("missing.md", e.getDocumentId());
    }

    @Test
    @DisplayName("ids escaping the root are treated as not found")
    void rejectsPathTraversal() {
        assertThrows(DocumentNotFoundException.class, () -> store.readDocument("../outside.md"));
    }

    @Test
    @DisplayName("writes replace an existing document's content as UTF-8")
    void writesDocument() throws IOException {
        Files.createDirectories(vault.resolve("Work"));
        Files.writeString(vault.resolve("Work/plan.md"), "- [ ] café\n");

        store.writeDocument("Work/plan.md", "- [x] café\n");

        assertEquals("- [x] café\n", Files.readString(vault.resolve("Work/plan.md")));
    }

    @Test
    @DisplayName("writes never create documents or escape the root")
    void writeRejectsUnknownDocuments() throws IOException {
        Files.createDirectories(vault.resolve("Work"));

        assertThrows(DocumentNotFoundException.class, () -> store.writeDocument("new.md", "x"));
        assertThrows(DocumentNotFoundException.class, () -> store.writeDocument("Work", "x"));
        assertThrows(DocumentNotFoundException.class, () -> store.writeDocument("../outside.md", "x"));
        assertFalse(Files.exists(vault.resolve("new.md")));
    }

    @Test
    @DisplayName("recency is the file's last-modified time")
    void recencyIsLastModified() throws IOException {
        Path note = Files.writeString(vault.resolve("note.md"), "");
        Instant modified = Instant.parse("2024-03-01T10:15:30Z");
        Files.setLastModifiedTime(note, FileTime.from(modified));

        assertEquals(modified, store.getRecency("note.md"));
        assertThrows(DocumentNotFoundException.class, () -> store.getRecency("other.md"));
    }

    @Test
    @DisplayName("fileName strips directory prefixes")
    void fileNameStripsDirectories() {
        assertEquals("2024-01-15.md", DocumentStore.fileName("Journal/2024/2024-01-15.md"));
        assertEquals("inbox.md", DocumentStore.fileName("inbox.md"));
    }
}
