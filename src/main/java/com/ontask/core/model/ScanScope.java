package com.ontask.core.model;

import java.io.Serializable;

/**
 * Restrictions applied when building the ordered document list of a scan session.
 *
 * @param onlyCurrentPeriod keep only documents dated today
 */
public record ScanScope(boolean onlyCurrentPeriod) implements Serializable {

    public static ScanScope all() {
        return new ScanScope(false);
    }

    public static ScanScope today() {
        return new ScanScope(true);
    }
}
