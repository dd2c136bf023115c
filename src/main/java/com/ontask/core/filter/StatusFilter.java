package com.ontask.core.filter;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Compiled inclusion predicate over status symbols. Closed world: anything not
 * explicitly allowed is rejected.
 */
public final class StatusFilter implements Predicate<Character> {

    private static final StatusFilter NONE = new StatusFilter(Set.of());

    private final Set<Character> allowed;

    StatusFilter(Set<Character> allowed) {
        this.allowed = Collections.unmodifiableSet(new TreeSet<>(allowed));
    }

    /** A filter that matches nothing. */
    public static StatusFilter none() {
        return NONE;
    }

    public boolean includes(char symbol) {
        return allowed.contains(symbol);
    }

    @Override
    public boolean test(Character symbol) {
        return symbol != null && includes(symbol);
    }

    /** {@code true} when no symbol can ever match. */
    public boolean matchesNothing() {
        return allowed.isEmpty();
    }

    public Set<Character> allowedSymbols() {
        return allowed;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("StatusFilter[");
        for (char c : allowed) {
            sb.append('\'').append(c).append('\'');
        }
        return sb.append(']').toString();
    }
}
