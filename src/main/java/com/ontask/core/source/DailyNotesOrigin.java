package com.ontask.core.source;

import com.ontask.core.model.ScanScope;
import com.ontask.core.store.DocumentStore;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Documents whose filename carries a date, as daily notes do
 * ({@code 2024-01-15.md}, {@code 01-15-2024.md}, {@code 20240115.md}).
 */
public class DailyNotesOrigin implements DocumentOrigin {

    private static final List<Pattern> DATE_NAME_PATTERNS = List.of(
            Pattern.compile("\\d{4}-\\d{2}-\\d{2}"),
            Pattern.compile("\\d{2}-\\d{2}-\\d{4}"),
            Pattern.compile("\\d{8}")
    );

    private final boolean enabled;

    public DailyNotesOrigin(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public String name() {
        return "daily-notes";
    }

    @Override
    public boolean isAvailable() {
        return enabled;
    }

    @Override
    public List<String> listCandidateDocuments(ScanScope scope, List<String> vaultDocuments) {
        return vaultDocuments.stream()
                .filter(DailyNotesOrigin::isDateNamed)
                .toList();
    }

    static boolean isDateNamed(String id) {
        String fileName = DocumentStore.fileName(id).toLowerCase(Locale.ROOT);
        for (Pattern p : DATE_NAME_PATTERNS) {
            if (p.matcher(fileName).find()) return true;
        }
        return false;
    }
}
