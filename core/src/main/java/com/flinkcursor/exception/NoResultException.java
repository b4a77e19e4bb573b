package com.flinkcursor.exception;

/**
 * Exception thrown when the gateway reported a finished statement but no
 * result page could be obtained for it.
 *
 * <p>This indicates a gateway contract violation and is never retried.
 */
public class NoResultException extends SqlGatewayException {

    /**
     * Creates a no-result exception.
     *
     * @param message the error message
     */
    public NoResultException(String message) {
        super(message);
    }
}
