package com.flinkcursor.gateway;

import com.flinkcursor.result.ResultPage;

import java.util.Objects;

/**
 * Handle to one statement submitted on the gateway.
 *
 * <p>Status is polled, never pushed: each {@link #getStatus()} call issues a
 * fresh probe.
 */
public class Operation {

    private final GatewayClient client;
    private final SqlGatewaySession session;
    private final String operationHandle;

    public Operation(GatewayClient client, SqlGatewaySession session, String operationHandle) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.operationHandle = Objects.requireNonNull(operationHandle, "operationHandle must not be null");
    }

    public String getOperationHandle() {
        return operationHandle;
    }

    public SqlGatewaySession getSession() {
        return session;
    }

    /**
     * Probes the current status of the operation.
     *
     * @return the status
     */
    public OperationStatus getStatus() {
        return client.getOperationStatus(session, operationHandle);
    }

    /**
     * Fetches a page of the operation's result.
     *
     * @param nextResultUri the continuation token of the previous page, or
     *                      null for the first page
     * @return the page
     */
    public ResultPage getResult(String nextResultUri) {
        return client.fetchResult(session, operationHandle, nextResultUri);
    }

    /**
     * Releases the operation and its resources on the gateway.
     *
     * @return the status reported after closing
     */
    public OperationStatus close() {
        return client.closeOperation(session, operationHandle);
    }

    /**
     * Cancels the operation on the gateway.
     *
     * @return the status reported after cancelling
     */
    public OperationStatus cancel() {
        return client.cancelOperation(session, operationHandle);
    }

    @Override
    public String toString() {
        return "Operation[" + operationHandle + "]";
    }
}
