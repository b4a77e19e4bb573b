package com.flinkcursor.gateway;

import com.flinkcursor.hints.QueryMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * A session opened on the SQL gateway.
 *
 * <p>Besides its handle, a session carries the runtime execution mode it
 * was last switched to. The mode is session-scoped configuration on the
 * gateway: it is set before each statement is submitted and stays in effect
 * for every later statement on the same session until it is set again.
 * Callers sharing a session must therefore serialize their statements.
 */
public class SqlGatewaySession {

    private static final Logger logger = LoggerFactory.getLogger(SqlGatewaySession.class);

    /** Gateway setting holding the runtime execution mode */
    public static final String RUNTIME_MODE_KEY = "execution.runtime-mode";

    private final String sessionName;
    private final String sessionHandle;
    private QueryMode runtimeMode;

    /**
     * Creates a session reference.
     *
     * @param sessionName the name the session was opened under
     * @param sessionHandle the handle assigned by the gateway
     */
    public SqlGatewaySession(String sessionName, String sessionHandle) {
        this.sessionName = Objects.requireNonNull(sessionName, "sessionName must not be null");
        this.sessionHandle = Objects.requireNonNull(sessionHandle, "sessionHandle must not be null");
    }

    public String getSessionName() {
        return sessionName;
    }

    public String getSessionHandle() {
        return sessionHandle;
    }

    /**
     * Returns the path of this session's REST resource.
     *
     * @return the path, e.g. {@code /v1/sessions/<handle>}
     */
    public String endpointPath() {
        return "/v1/sessions/" + sessionHandle;
    }

    /**
     * Returns the runtime mode this session was last switched to.
     *
     * @return the mode, empty if it was never set through this session
     */
    public Optional<QueryMode> getRuntimeMode() {
        return Optional.ofNullable(runtimeMode);
    }

    /**
     * Switches the session's runtime execution mode.
     *
     * <p>The setting statement is submitted without waiting for it to
     * complete; the gateway applies session statements in order.
     *
     * @param client the gateway client
     * @param mode the mode to set
     * @return the operation of the setting statement
     */
    public Operation applyRuntimeMode(GatewayClient client, QueryMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        logger.info("Setting '{}' to '{}'", RUNTIME_MODE_KEY, mode.getValue());
        Operation operation = client.executeStatement(this, runtimeModeStatement(mode));
        this.runtimeMode = mode;
        return operation;
    }

    /**
     * Returns the statement that switches the runtime mode.
     *
     * @param mode the mode
     * @return the SET statement
     */
    public static String runtimeModeStatement(QueryMode mode) {
        return "SET '" + RUNTIME_MODE_KEY + "' = '" + mode.getValue() + "'";
    }

    @Override
    public String toString() {
        return String.format("SqlGatewaySession[name=%s, handle=%s, mode=%s]",
            sessionName, sessionHandle, runtimeMode != null ? runtimeMode.getValue() : "unset");
    }
}
