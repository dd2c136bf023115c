package com.ontask.core.scan;

/**
 * Thrown when a scan session is used out of order: fetching before {@code initialize},
 * after {@code reset}, or while another call on the same session is still running.
 * This is a caller bug, not a data error.
 */
public class ScanSessionStateException extends IllegalStateException {
    public ScanSessionStateException(String message) {
        super(message);
    }
}
