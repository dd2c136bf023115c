package com.ontask.core.source;

import com.ontask.core.model.ScanScope;
import com.ontask.core.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Documents belonging to named streams. A stream points at a folder (every document under it)
 * or at a single document.
 */
public class StreamsOrigin implements DocumentOrigin {

    private static final Logger log = LoggerFactory.getLogger(StreamsOrigin.class);

    /**
     * A tagged collection of notes.
     *
     * @param name   display name of the stream
     * @param folder folder or document id the stream covers; blank disables the stream
     */
    public record Stream(String name, String folder) {}

    private final DocumentStore store;
    private final List<Stream> streams;

    public StreamsOrigin(DocumentStore store, List<Stream> streams) {
        this.store = store;
        this.streams = streams == null ? List.of() : List.copyOf(streams);
    }

    @Override
    public String name() {
        return "streams";
    }

    @Override
    public boolean isAvailable() {
        return streams.stream().anyMatch(s -> s.folder() != null && !s.folder().isBlank());
    }

    @Override
    public List<String> listCandidateDocuments(ScanScope scope, List<String> vaultDocuments) {
        var result = new ArrayList<String>();
        for (Stream stream : streams) {
            if (stream.folder() == null || stream.folder().isBlank()) {
                continue;
            }
            String folder = FolderOrigin.normalizeFolder(stream.folder());
            if (!store.exists(folder)) {
                log.debug("Stream '{}' points at missing path {}", stream.name(), folder);
                continue;
            }
            if (store.isDocument(folder)) {
                result.add(folder);
                continue;
            }
            String prefix = folder + "/";
            for (String id : vaultDocuments) {
                if (id.startsWith(prefix)) {
                    result.add(id);
                }
            }
        }
        log.debug("Streams contributed {} documents from {} streams", result.size(), streams.size());
        return result;
    }
}
