package com.ontask.core.source;

import com.ontask.core.store.DocumentStore;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a document belongs to the current period (today), either because
 * its name or path contains today's date or, optionally, because it was modified today.
 */
public class PeriodMatcher {

    private static final List<DateTimeFormatter> FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("yyyyMMdd"),
            DateTimeFormatter.ofPattern("MM-dd-yyyy"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("dd-MM-yyyy"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy"),
            DateTimeFormatter.ofPattern("MMddyyyy"),
            DateTimeFormatter.ofPattern("ddMMyyyy")
    );

    private final Clock clock;

    public PeriodMatcher(Clock clock) {
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /** {@code true} if the document's filename or full path contains today's date. */
    public boolean matchesIdentifier(String id) {
        LocalDate today = today();
        String fileName = DocumentStore.fileName(id).toLowerCase(Locale.ROOT);
        String path = id.toLowerCase(Locale.ROOT);
        for (DateTimeFormatter format : FORMATS) {
            String stamp = today.format(format);
            if (fileName.contains(stamp) || path.contains(stamp)) {
                return true;
            }
        }
        return false;
    }

    /** {@code true} if the instant falls on today in the clock's zone. */
    public boolean matchesRecency(Instant modified) {
        return modified != null && LocalDate.ofInstant(modified, clock.getZone()).equals(today());
    }
}
