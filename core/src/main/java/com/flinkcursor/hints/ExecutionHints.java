package com.flinkcursor.hints;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-statement execution directives.
 *
 * <p>Hints are derived once from the statement text when it is submitted and
 * never change afterwards. Every field is optional:
 * <ul>
 *   <li>{@code mode} - the execution regime, unset means batch</li>
 *   <li>{@code fetchMax} - stop buffering once this many rows were fetched</li>
 *   <li>{@code fetchTimeoutMs} - stop fetching pages once this much time has
 *       passed since submission</li>
 *   <li>{@code testQuery} - the statement is a self-test probe whose
 *       streaming result collapses to a single row</li>
 * </ul>
 *
 * @see ExecutionHintsParser
 */
public final class ExecutionHints {

    private static final ExecutionHints NONE = new ExecutionHints(null, null, null, false);

    private final QueryMode mode;
    private final Integer fetchMax;
    private final Long fetchTimeoutMs;
    private final boolean testQuery;

    /**
     * Creates execution hints.
     *
     * @param mode the execution mode, or null if unset
     * @param fetchMax the maximum number of rows to buffer, or null
     * @param fetchTimeoutMs the fetch timeout in milliseconds, or null
     * @param testQuery whether the statement is a test query
     * @throws IllegalArgumentException if a limit is negative
     */
    public ExecutionHints(QueryMode mode, Integer fetchMax, Long fetchTimeoutMs, boolean testQuery) {
        if (fetchMax != null && fetchMax < 0) {
            throw new IllegalArgumentException("fetchMax must be non-negative");
        }
        if (fetchTimeoutMs != null && fetchTimeoutMs < 0) {
            throw new IllegalArgumentException("fetchTimeoutMs must be non-negative");
        }
        this.mode = mode;
        this.fetchMax = fetchMax;
        this.fetchTimeoutMs = fetchTimeoutMs;
        this.testQuery = testQuery;
    }

    /**
     * Returns hints with every field unset.
     *
     * @return the empty hints
     */
    public static ExecutionHints none() {
        return NONE;
    }

    public Optional<QueryMode> getMode() {
        return Optional.ofNullable(mode);
    }

    public Optional<Integer> getFetchMax() {
        return Optional.ofNullable(fetchMax);
    }

    public Optional<Long> getFetchTimeoutMs() {
        return Optional.ofNullable(fetchTimeoutMs);
    }

    public boolean isTestQuery() {
        return testQuery;
    }

    /**
     * Returns the mode to set on the session before submission.
     *
     * @return the hinted mode, or {@link QueryMode#BATCH} when unset
     */
    public QueryMode runtimeMode() {
        return mode != null ? mode : QueryMode.BATCH;
    }

    /**
     * Returns true if the statement runs in streaming mode.
     *
     * @return true for an explicit streaming hint
     */
    public boolean isStreaming() {
        return mode == QueryMode.STREAMING;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionHints)) return false;
        ExecutionHints that = (ExecutionHints) o;
        return testQuery == that.testQuery
            && mode == that.mode
            && Objects.equals(fetchMax, that.fetchMax)
            && Objects.equals(fetchTimeoutMs, that.fetchTimeoutMs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, fetchMax, fetchTimeoutMs, testQuery);
    }

    @Override
    public String toString() {
        return String.format("ExecutionHints[mode=%s, fetchMax=%s, fetchTimeoutMs=%s, testQuery=%s]",
            mode, fetchMax, fetchTimeoutMs, testQuery);
    }
}
