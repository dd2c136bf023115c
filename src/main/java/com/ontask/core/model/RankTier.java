package com.ontask.core.model;

import java.io.Serializable;

/**
 * Associates one status symbol with a precedence for top-task selection.
 * Lower priority values win.
 */
public record RankTier(
    char statusSymbol,
    int priority
) implements Serializable {
}
