package com.flinkcursor.runtime;

import com.flinkcursor.exception.NoResultException;
import com.flinkcursor.exception.StatementExecutionException;
import com.flinkcursor.gateway.GatewayClient;
import com.flinkcursor.gateway.Operation;
import com.flinkcursor.gateway.OperationStatus;
import com.flinkcursor.gateway.SqlGatewaySession;
import com.flinkcursor.hints.ExecutionHints;
import com.flinkcursor.hints.ExecutionHintsParser;
import com.flinkcursor.result.ColumnDescription;
import com.flinkcursor.result.ResultPage;
import com.flinkcursor.result.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Blocking, pull-based cursor over statements executed on the SQL gateway.
 *
 * <p>The gateway executes statements asynchronously and serves their output
 * page by page. This cursor hides that behind a synchronous interface:
 * <ol>
 *   <li>{@link #execute} switches the session's runtime mode, submits the
 *       statement and waits until the gateway reports a terminal status</li>
 *   <li>{@link #fetchAll} and {@link #fetchOne} pull result pages into a row
 *       buffer and hand rows to the caller</li>
 * </ol>
 *
 * <p>How much {@link #fetchAll} reads is governed by the statement's
 * {@link ExecutionHints}: it stops at end of stream, once {@code fetch_max}
 * rows are buffered, or once {@code fetch_timeout_ms} has passed since
 * submission, whichever comes first. Streaming operations are released
 * after the final fetch; batch operations are left open.
 *
 * <p>A cursor serves one statement at a time and is reused across
 * statements. It is not thread-safe.
 *
 * <p>Example usage:
 * <pre>
 *   FlinkCursor cursor = handler.cursor();
 *   cursor.execute("SELECT id, name FROM users WHERE name = {}", List.of("alice"));
 *   List&lt;Row&gt; rows = cursor.fetchAll();
 * </pre>
 *
 * @see FlinkHandler
 */
public class FlinkCursor {

    private static final Logger logger = LoggerFactory.getLogger(FlinkCursor.class);

    /** Row returned for a streaming test query that produced no rows */
    static final Row EMPTY_TEST_QUERY_ROW = Row.of(0, false, false);

    private final GatewayClient client;
    private final SqlGatewaySession session;
    private final Poller poller;
    private final Clock clock;

    private Operation lastOperation;
    private Operation submittedOperation;
    private final Deque<Row> resultBuffer = new ArrayDeque<>();
    private int bufferedResultsCounter;
    private ResultPage lastResult;
    private ExecutionHints lastQueryHints = ExecutionHints.none();
    private long lastQueryStartTime;

    /**
     * Creates a cursor bound to a session.
     *
     * @param client the gateway client
     * @param session the session statements run on
     * @param poller the poller driving status and page waits
     * @param clock the clock measuring fetch timeouts
     */
    public FlinkCursor(GatewayClient client, SqlGatewaySession session, Poller poller, Clock clock) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.poller = Objects.requireNonNull(poller, "poller must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        logger.info("Creating new cursor for session {}", session);
    }

    /**
     * Creates a cursor measuring timeouts on the system clock.
     *
     * @param client the gateway client
     * @param session the session statements run on
     * @param poller the poller driving status and page waits
     */
    public FlinkCursor(GatewayClient client, SqlGatewaySession session, Poller poller) {
        this(client, session, poller, Clock.systemUTC());
    }

    /**
     * Executes a statement without bindings.
     *
     * @param sql the statement
     * @throws StatementExecutionException if the statement ends in error
     */
    public void execute(String sql) {
        execute(sql, null);
    }

    /**
     * Executes a statement and waits for the gateway to finish it.
     *
     * <p>Before submission the session's runtime mode is set from the
     * statement's hints ({@code batch} unless the hints ask for
     * {@code streaming}). The setting stays in effect on the session for
     * later statements.
     *
     * <p>The completion wait has no deadline.
     *
     * @param sql the statement, with {@code {}} placeholders for bindings
     * @param bindings the binding values, or null
     * @throws StatementExecutionException if the statement ends in error
     * @throws IllegalArgumentException if the bindings or hints are invalid
     */
    public void execute(String sql, List<?> bindings) {
        Objects.requireNonNull(sql, "sql must not be null");
        logger.debug("Preparing statement \"{}\"", sql);
        if (bindings != null) {
            sql = BindingRenderer.substitute(sql, bindings);
        }

        if (lastOperation != null || lastResult != null || !resultBuffer.isEmpty()) {
            logger.debug("Discarding unfinished result of operation {}", lastOperation);
            clean();
        }

        logger.info("Executing statement \"{}\"", sql);

        lastQueryHints = ExecutionHintsParser.parse(sql);
        session.applyRuntimeMode(client, lastQueryHints.runtimeMode());
        lastQueryStartTime = clock.millis();

        Operation operation = client.executeStatement(session, sql);
        lastOperation = operation;
        submittedOperation = operation;

        OperationStatus status = waitTillFinished(operation);
        logger.info("Statement executed. Status {}, operation handle: {}",
            status, operation.getOperationHandle());
        if (status == OperationStatus.ERROR) {
            throw new StatementExecutionException(status, sql);
        }
    }

    /**
     * Fetches all remaining rows of the current statement and ends its cycle.
     *
     * <p>Pages are read until end of stream, until {@code fetch_max} rows are
     * buffered or until {@code fetch_timeout_ms} has passed since submission.
     * For a streaming test query the result collapses to its last row.
     *
     * @return the rows in order
     * @throws NoResultException if the gateway produced no result page
     * @throws IllegalStateException if no statement is active
     */
    public List<Row> fetchAll() {
        if (lastResult == null) {
            bufferResults();
        }

        poller.repeatUntil(this::retrievalComplete, this::bufferResults);

        List<Row> result = new ArrayList<>(resultBuffer);
        logger.info("Fetched {} rows from gateway", result.size());

        if (lastQueryHints.isTestQuery()) {
            result = handleTestQuery(result);
        }
        logger.debug("Returning rows from cursor: {}", result);

        try {
            closeStreamingOperation();
        } finally {
            clean();
        }
        return result;
    }

    /**
     * Fetches the next row of the current statement.
     *
     * <p>Reads at most one page per call. When no row is left the cursor
     * state is reset and an empty result is returned.
     *
     * @return the next row, or empty when the result is exhausted
     */
    public Optional<Row> fetchOne() {
        if (resultBuffer.isEmpty() && lastOperation != null
                && (lastResult == null || !lastResult.isEndOfStream())) {
            bufferResults();
        }

        if (!resultBuffer.isEmpty()) {
            return Optional.of(resultBuffer.pollFirst());
        }

        clean();
        return Optional.empty();
    }

    /**
     * Returns the columns of the current result.
     *
     * <p>Fetches the first page if none was fetched yet; its rows stay
     * buffered for the next fetch.
     *
     * @return the column descriptions in order
     * @throws NoResultException if the gateway produced no result page
     */
    public List<ColumnDescription> getDescription() {
        if (lastResult == null) {
            bufferResults();
        }

        List<ColumnDescription> description = new ArrayList<>();
        for (String columnName : lastResult.getColumnNames()) {
            description.add(new ColumnDescription(columnName));
        }
        return Collections.unmodifiableList(description);
    }

    /**
     * Returns the status of the most recently submitted operation.
     *
     * <p>Issues a fresh status probe.
     *
     * @return {@link OperationStatus#UNKNOWN} if nothing was submitted yet
     */
    public OperationStatus getStatus() {
        if (submittedOperation != null) {
            return submittedOperation.getStatus();
        }
        return OperationStatus.UNKNOWN;
    }

    /**
     * Does nothing. The running operation and the buffered rows are left
     * untouched.
     */
    public void cancel() {
    }

    /**
     * Does nothing. The running operation and the buffered rows are left
     * untouched.
     */
    public void close() {
    }

    public ExecutionHints getLastQueryHints() {
        return lastQueryHints;
    }

    /**
     * Returns the number of rows buffered since the last reset.
     *
     * @return the buffered row count
     */
    public int getBufferedRowCount() {
        return bufferedResultsCounter;
    }

    /**
     * Returns true while a statement's result is being retrieved.
     *
     * @return true if an operation is live
     */
    public boolean hasLiveOperation() {
        return lastOperation != null;
    }

    public SqlGatewaySession getSession() {
        return session;
    }

    private OperationStatus waitTillFinished(Operation operation) {
        return poller.pollUntil(operation::getStatus, OperationStatus::isTerminal);
    }

    private void bufferResults() {
        if (lastOperation == null) {
            throw new IllegalStateException("No statement is active; call execute() first");
        }

        String nextPage = lastResult != null ? lastResult.getNextResultUri().orElse(null) : null;
        ResultPage result = lastOperation.getResult(nextPage);
        if (result == null) {
            throw new NoResultException("No result after fetch for " + lastOperation);
        }

        for (Row row : result.getRows()) {
            if (bufferedFetchMax()) {
                logger.info("Reached fetch max of {} rows", lastQueryHints.getFetchMax().orElse(0));
                break;
            }
            bufferedResultsCounter++;
            resultBuffer.addLast(row);
        }
        logger.debug("Buffered {} rows", result.getRows().size());
        lastResult = result;
    }

    private boolean retrievalComplete() {
        return lastResult.isEndOfStream() || bufferedFetchMax() || exceededTimeout();
    }

    private boolean bufferedFetchMax() {
        Optional<Integer> fetchMax = lastQueryHints.getFetchMax();
        return fetchMax.isPresent() && bufferedResultsCounter >= fetchMax.get();
    }

    private boolean exceededTimeout() {
        Optional<Long> timeoutMs = lastQueryHints.getFetchTimeoutMs();
        return timeoutMs.isPresent() && clock.millis() - lastQueryStartTime > timeoutMs.get();
    }

    private List<Row> handleTestQuery(List<Row> result) {
        if (lastQueryHints.isStreaming()) {
            if (!result.isEmpty()) {
                return List.of(result.get(result.size() - 1));
            }
            return List.of(EMPTY_TEST_QUERY_ROW);
        }
        return result;
    }

    private void closeStreamingOperation() {
        if (lastQueryHints.isStreaming() && lastOperation != null) {
            OperationStatus status = lastOperation.close();
            logger.info("Closed streaming operation {}, status {}", lastOperation.getOperationHandle(), status);
        }
    }

    private void clean() {
        resultBuffer.clear();
        lastResult = null;
        lastOperation = null;
        bufferedResultsCounter = 0;
    }
}
