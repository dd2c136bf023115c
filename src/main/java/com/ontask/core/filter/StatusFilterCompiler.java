package com.ontask.core.filter;

import com.ontask.core.model.StatusConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a {@code symbol -> included} map into a {@link StatusFilter}.
 * <p>
 * A symbol is included when it is present with a value other than {@code false}.
 * Absent symbols are excluded. Keys that are not exactly one character can never
 * match a checkbox token and are ignored. Including {@code '.'} also includes
 * {@code ' '}, the plain to-do box; the reverse does not hold.
 */
@Component
public class StatusFilterCompiler {

    private static final Logger log = LoggerFactory.getLogger(StatusFilterCompiler.class);

    static final char TODO_DOT = '.';
    static final char TODO_SPACE = ' ';

    public StatusFilter compile(Map<String, Boolean> filterSet) {
        if (filterSet == null || filterSet.isEmpty()) {
            log.debug("Empty status filter set, nothing will match");
            return StatusFilter.none();
        }

        Set<Character> allowed = new HashSet<>();
        for (var entry : filterSet.entrySet()) {
            String symbol = entry.getKey();
            if (symbol == null || symbol.length() != 1) {
                log.debug("Ignoring status key '{}': not a single character", symbol);
                continue;
            }
            if (!Boolean.FALSE.equals(entry.getValue())) {
                allowed.add(symbol.charAt(0));
            }
        }

        if (allowed.contains(TODO_DOT)) {
            allowed.add(TODO_SPACE);
        }

        if (allowed.isEmpty()) {
            return StatusFilter.none();
        }
        var filter = new StatusFilter(allowed);
        log.debug("Compiled {}", filter);
        return filter;
    }

    /** Builds the filter set from status configurations ({@code symbol -> filtered}). */
    public static Map<String, Boolean> filterSetOf(List<StatusConfig> statuses) {
        var filterSet = new LinkedHashMap<String, Boolean>();
        if (statuses != null) {
            for (StatusConfig status : statuses) {
                filterSet.put(status.symbol(), status.filtered());
            }
        }
        return filterSet;
    }
}
