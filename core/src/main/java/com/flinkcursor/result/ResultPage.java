package com.flinkcursor.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one page of statement output.
 *
 * <p>A page holds the ordered column names, the ordered rows, the URI of the
 * next page and whether the stream has ended. Each fetch produces a new page
 * that supersedes the previous one.
 */
public final class ResultPage {

    private final List<String> columnNames;
    private final List<Row> rows;
    private final String nextResultUri;
    private final boolean endOfStream;

    /**
     * Creates a result page.
     *
     * @param columnNames the column names in order
     * @param rows the rows in order
     * @param nextResultUri the continuation token, or null if there is none
     * @param endOfStream whether no further pages exist
     */
    public ResultPage(List<String> columnNames, List<Row> rows, String nextResultUri, boolean endOfStream) {
        this.columnNames = Collections.unmodifiableList(
            new ArrayList<>(Objects.requireNonNull(columnNames, "columnNames must not be null")));
        this.rows = Collections.unmodifiableList(
            new ArrayList<>(Objects.requireNonNull(rows, "rows must not be null")));
        this.nextResultUri = nextResultUri;
        this.endOfStream = endOfStream;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public List<Row> getRows() {
        return rows;
    }

    /**
     * Returns the continuation token identifying the next page.
     *
     * @return the next result URI, empty at end of stream
     */
    public Optional<String> getNextResultUri() {
        return Optional.ofNullable(nextResultUri);
    }

    public boolean isEndOfStream() {
        return endOfStream;
    }

    @Override
    public String toString() {
        return String.format("ResultPage[columns=%s, rows=%d, next=%s, eos=%s]",
            columnNames, rows.size(), nextResultUri, endOfStream);
    }
}
