package com.flinkcursor.exception;

/**
 * Base class for failures raised while talking to the SQL gateway.
 *
 * <p>All gateway failures are unchecked and propagate synchronously to the
 * caller of the cursor operation that triggered them. Nothing in this library
 * retries a failed request; the only repeated call is the status probe while
 * waiting for a statement to finish.
 *
 * @see GatewayRequestException
 * @see StatementExecutionException
 * @see NoResultException
 */
public class SqlGatewayException extends RuntimeException {

    /**
     * Creates a gateway exception.
     *
     * @param message the error message
     */
    public SqlGatewayException(String message) {
        super(message);
    }

    /**
     * Creates a gateway exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public SqlGatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName()).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        appendContext(sb);

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }

    /**
     * Appends subclass-specific context lines to the technical message.
     *
     * @param sb the message under construction
     */
    protected void appendContext(StringBuilder sb) {
    }
}
