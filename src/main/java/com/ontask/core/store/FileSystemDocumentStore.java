package com.ontask.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * {@link DocumentStore} over a directory of markdown notes.
 * <p>
 * Tool and editor directories (e.g. {@code .git}, {@code .obsidian}, {@code .trash})
 * are excluded from listings. Symbolic links are followed; a folder or file that cannot
 * be visited (unreadable, deleted mid-walk, a link cycle) is logged and left out while
 * the rest of the vault is still listed.
 */
public class FileSystemDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentStore.class);

    /** Directories to skip during the walk. */
    private static final Set<String> IGNORE_DIRS = Set.of(
            ".git", ".obsidian", ".trash", "node_modules", ".idea", ".vscode"
    );

    private final Path root;
    private final String extension;

    public FileSystemDocumentStore(Path root, String extension) {
        this.root = root.toAbsolutePath().normalize();
        this.extension = extension == null ? "" : extension;
    }

    @Override
    public List<String> listDocuments() {
        if (!Files.isDirectory(root)) {
            throw new DocumentStoreException(null, "Document root is not a directory: " + root);
        }
        var collector = new DocumentCollector();
        try {
            Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE, collector);
        } catch (IOException e) {
            throw new DocumentStoreException(null, "Failed to list documents under " + root, e);
        }
        log.debug("Listed {} documents under {} ({} paths skipped)",
                collector.documents.size(), root, collector.skipped);
        return collector.documents;
    }

    @Override
    public boolean exists(String id) {
        return id != null && Files.exists(resolve(id));
    }

    @Override
    public boolean isDocument(String id) {
        return id != null && Files.isRegularFile(resolve(id));
    }

    @Override
    public String readDocument(String id) {
        Path path = resolve(id);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new DocumentNotFoundException(id, e);
        } catch (IOException e) {
            throw new DocumentReadException(id, "Failed to read " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void writeDocument(String id, String content) {
        Path path = resolve(id);
        if (!Files.isRegularFile(path)) {
            throw new DocumentNotFoundException(id);
        }
        try {
            Files.writeString(path, content, StandardCharsets.UTF_8);
            log.debug("Wrote {} chars to {}", content.length(), id);
        } catch (IOException e) {
            throw new DocumentWriteException(id, "Failed to write " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Instant getRecency(String id) {
        Path path = resolve(id);
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (NoSuchFileException e) {
            throw new DocumentNotFoundException(id, e);
        } catch (IOException e) {
            throw new DocumentReadException(id, "Failed to stat " + id + ": " + e.getMessage(), e);
        }
    }

    private Path resolve(String id) {
        Path path = root.resolve(id).normalize();
        if (!path.startsWith(root)) {
            throw new DocumentNotFoundException(id);
        }
        return path;
    }

    private String toId(Path path) {
        return StreamSupport.stream(root.relativize(path).spliterator(), false)
                .map(Path::toString)
                .collect(Collectors.joining("/"));
    }

    /**
     * Collects matching regular files; never aborts the walk on a single bad path.
     */
    class DocumentCollector extends SimpleFileVisitor<Path> {

        final List<String> documents = new ArrayList<>();
        int skipped;

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(root) && IGNORE_DIRS.contains(String.valueOf(dir.getFileName()))) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && file.getFileName().toString().endsWith(extension)) {
                documents.add(toId(file));
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException e) {
            skipped++;
            log.warn("Skipping {} while listing documents: {}", file, e.toString());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException e) {
            if (e != null) {
                skipped++;
                log.warn("Listing of {} ended early: {}", dir, e.toString());
            }
            return FileVisitResult.CONTINUE;
        }
    }
}
