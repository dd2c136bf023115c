package com.ontask.core.source;

import com.ontask.core.model.ScanScope;
import com.ontask.core.store.DocumentStore;

import java.util.List;

/**
 * Every document under one designated folder, optionally excluding nested folders.
 */
public class FolderOrigin implements DocumentOrigin {

    private final DocumentStore store;
    private final String folder;
    private final boolean includeSubfolders;

    public FolderOrigin(DocumentStore store, String folder, boolean includeSubfolders) {
        this.store = store;
        this.folder = folder == null ? "" : normalizeFolder(folder);
        this.includeSubfolders = includeSubfolders;
    }

    @Override
    public String name() {
        return "folder";
    }

    @Override
    public boolean isAvailable() {
        return !folder.isEmpty();
    }

    @Override
    public List<String> listCandidateDocuments(ScanScope scope, List<String> vaultDocuments) {
        if (!store.exists(folder)) {
            return List.of();
        }
        String prefix = folder + "/";
        return vaultDocuments.stream()
                .filter(id -> id.startsWith(prefix))
                .filter(id -> includeSubfolders || id.indexOf('/', prefix.length()) < 0)
                .toList();
    }

    /** Strips surrounding whitespace and leading/trailing slashes. */
    static String normalizeFolder(String folder) {
        String f = folder.strip();
        while (f.startsWith("/")) f = f.substring(1);
        while (f.endsWith("/")) f = f.substring(0, f.length() - 1);
        return f;
    }
}
