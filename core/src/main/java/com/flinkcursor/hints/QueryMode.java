package com.flinkcursor.hints;

import java.util.Locale;

/**
 * Execution regime requested for a statement.
 *
 * <p>The value is written verbatim into the session's
 * {@code execution.runtime-mode} setting before the statement is submitted.
 */
public enum QueryMode {

    /** One-shot execution over bounded input */
    BATCH("batch"),

    /** Continuous execution; the operation must be released after the final fetch */
    STREAMING("streaming");

    private final String value;

    QueryMode(String value) {
        this.value = value;
    }

    /**
     * Returns the runtime-mode setting value for this mode.
     *
     * @return "batch" or "streaming"
     */
    public String getValue() {
        return value;
    }

    /**
     * Resolves a runtime-mode value, ignoring case.
     *
     * @param value the setting value
     * @return the matching mode
     * @throws IllegalArgumentException if the value names no mode
     */
    public static QueryMode fromValue(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (QueryMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown query mode: " + value);
    }
}
