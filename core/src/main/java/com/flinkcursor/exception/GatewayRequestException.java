package com.flinkcursor.exception;

/**
 * Exception thrown when a request to the SQL gateway fails.
 *
 * <p>Raised for non-2xx responses, for bodies that cannot be decoded, and
 * for transport failures (connection refused, I/O errors, interruption).
 * Transport failures carry no HTTP status; {@link #getStatusCode()} then
 * returns {@link #NO_STATUS}.
 */
public class GatewayRequestException extends SqlGatewayException {

    /** Status code reported when no HTTP response was received */
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String responseBody;

    /**
     * Creates an exception for an unsuccessful HTTP response.
     *
     * @param message the error message
     * @param statusCode the HTTP status code
     * @param responseBody the raw response body, may be null
     */
    public GatewayRequestException(String message, int statusCode, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * Creates an exception for a request that never produced a response.
     *
     * @param message the error message
     * @param cause the transport failure
     */
    public GatewayRequestException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
        this.responseBody = null;
    }

    /**
     * Returns the HTTP status code of the failed response.
     *
     * @return the status code, or {@link #NO_STATUS}
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns the raw body of the failed response.
     *
     * @return the response body, or null if none was received
     */
    public String getResponseBody() {
        return responseBody;
    }

    @Override
    protected void appendContext(StringBuilder sb) {
        if (statusCode != NO_STATUS) {
            sb.append("HTTP Status: ").append(statusCode).append("\n");
        }
        if (responseBody != null) {
            sb.append("Response Body:\n").append(responseBody).append("\n");
        }
    }
}
