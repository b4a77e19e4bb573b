package com.flinkcursor.exception;

import com.flinkcursor.gateway.OperationStatus;

/**
 * Exception thrown when a submitted statement finishes in the
 * {@link OperationStatus#ERROR} state.
 *
 * <p>The gateway status probe does not say why an operation failed, so this
 * exception carries only the terminal status and the statement text. Syntax
 * errors, runtime errors and resource errors are indistinguishable here.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       cursor.execute("SELECT * FROM missing_table");
 *   } catch (StatementExecutionException e) {
 *       System.err.println("Failed SQL: " + e.getFailedSQL());
 *   }
 * </pre>
 */
public class StatementExecutionException extends SqlGatewayException {

    private final OperationStatus status;
    private final String failedSQL;

    /**
     * Creates a statement execution exception.
     *
     * @param status the terminal operation status
     * @param sql the statement that failed
     */
    public StatementExecutionException(OperationStatus status, String sql) {
        super("Statement execution failed with status " + status);
        this.status = status;
        this.failedSQL = sql;
    }

    /**
     * Returns the terminal status observed for the operation.
     *
     * @return the terminal status
     */
    public OperationStatus getStatus() {
        return status;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    @Override
    protected void appendContext(StringBuilder sb) {
        sb.append("Status: ").append(status).append("\n");
        if (failedSQL != null) {
            sb.append("Failed SQL:\n").append(failedSQL).append("\n");
        }
    }
}
