package com.flinkcursor.gateway;

import java.util.Locale;

/**
 * Status of an operation as reported by the gateway status probe.
 *
 * <p>{@link #UNKNOWN} is never reported by the gateway; cursors return it
 * before any statement has been submitted.
 */
public enum OperationStatus {
    INITIALIZED,
    PENDING,
    RUNNING,
    FINISHED,
    CANCELED,
    CLOSED,
    ERROR,
    TIMEOUT,
    UNKNOWN;

    /**
     * Returns true if the operation will not change status any more.
     *
     * @return true for finished, canceled, closed, error and timeout
     */
    public boolean isTerminal() {
        switch (this) {
            case FINISHED:
            case CANCELED:
            case CLOSED:
            case ERROR:
            case TIMEOUT:
                return true;
            default:
                return false;
        }
    }

    /**
     * Parses a status as spelled by the gateway, ignoring case.
     *
     * @param value the status text
     * @return the status
     * @throws IllegalArgumentException if the text names no status
     */
    public static OperationStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
