package com.flinkcursor.gateway;

import com.flinkcursor.result.ResultPage;

/**
 * Client for the SQL gateway's session and operation endpoints.
 *
 * <p>Every method performs exactly one request and throws
 * {@link com.flinkcursor.exception.GatewayRequestException} when the gateway
 * rejects it. No method retries.
 *
 * @see HttpGatewayClient
 */
public interface GatewayClient {

    /**
     * Opens a new session.
     *
     * @param sessionName the session name
     * @return the opened session
     */
    SqlGatewaySession openSession(String sessionName);

    /**
     * Submits a statement on a session.
     *
     * @param session the session
     * @param sql the statement text
     * @return the handle of the created operation
     */
    String submitStatement(SqlGatewaySession session, String sql);

    OperationStatus getOperationStatus(SqlGatewaySession session, String operationHandle);

    /**
     * Fetches a result page.
     *
     * @param session the session
     * @param operationHandle the operation
     * @param nextResultUri the continuation token, or null for the first page
     * @return the page
     */
    ResultPage fetchResult(SqlGatewaySession session, String operationHandle, String nextResultUri);

    OperationStatus closeOperation(SqlGatewaySession session, String operationHandle);

    OperationStatus cancelOperation(SqlGatewaySession session, String operationHandle);

    /**
     * Submits a statement and wraps the returned handle.
     *
     * @param session the session
     * @param sql the statement text
     * @return the operation
     */
    default Operation executeStatement(SqlGatewaySession session, String sql) {
        return new Operation(this, session, submitStatement(session, sql));
    }
}
