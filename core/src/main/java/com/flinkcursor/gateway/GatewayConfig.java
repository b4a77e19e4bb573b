package com.flinkcursor.gateway;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for a SQL gateway.
 *
 * <p>Example usage:
 * <pre>
 *   GatewayConfig config = GatewayConfig.of("localhost", 8083)
 *       .withSessionName("analytics")
 *       .withRequestTimeout(Duration.ofSeconds(60));
 * </pre>
 *
 * <p>Settings can also be read from system properties with
 * {@link #fromSystemProperties()}:
 * <ul>
 *   <li>{@code flinkcursor.gateway.host} (default {@value #DEFAULT_HOST})</li>
 *   <li>{@code flinkcursor.gateway.port} (default {@value #DEFAULT_PORT})</li>
 *   <li>{@code flinkcursor.gateway.sessionName} (default {@value #DEFAULT_SESSION_NAME})</li>
 * </ul>
 */
public class GatewayConfig {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 8083;
    public static final String DEFAULT_SESSION_NAME = "flinkcursor";

    /** Default time allowed to establish a connection */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    /** Default time allowed for a single request */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    static final String PROP_HOST = "flinkcursor.gateway.host";
    static final String PROP_PORT = "flinkcursor.gateway.port";
    static final String PROP_SESSION_NAME = "flinkcursor.gateway.sessionName";

    private final String host;
    private final int port;
    private String sessionName = DEFAULT_SESSION_NAME;
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

    private GatewayConfig(String host, int port) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
        this.port = port;
    }

    /**
     * Creates a configuration for the given gateway endpoint.
     *
     * @param host the gateway host
     * @param port the gateway REST port
     * @return the configuration
     */
    public static GatewayConfig of(String host, int port) {
        return new GatewayConfig(host, port);
    }

    /**
     * Creates a configuration from system properties, falling back to the
     * defaults for unset or invalid values.
     *
     * @return the configuration
     */
    public static GatewayConfig fromSystemProperties() {
        String host = System.getProperty(PROP_HOST, DEFAULT_HOST);
        int port = DEFAULT_PORT;
        String portValue = System.getProperty(PROP_PORT);
        if (portValue != null) {
            try {
                int parsed = Integer.parseInt(portValue.trim());
                if (parsed > 0 && parsed <= 65535) {
                    port = parsed;
                }
            } catch (NumberFormatException e) {
                // Ignore, use default
            }
        }
        return of(host, port).withSessionName(System.getProperty(PROP_SESSION_NAME, DEFAULT_SESSION_NAME));
    }

    /**
     * Sets the name under which sessions are opened.
     *
     * @param name the session name
     * @return this configuration
     */
    public GatewayConfig withSessionName(String name) {
        this.sessionName = Objects.requireNonNull(name, "sessionName must not be null");
        return this;
    }

    /**
     * Sets the connect timeout.
     *
     * @param timeout the timeout
     * @return this configuration
     */
    public GatewayConfig withConnectTimeout(Duration timeout) {
        this.connectTimeout = requirePositive(timeout, "connectTimeout");
        return this;
    }

    /**
     * Sets the per-request timeout.
     *
     * @param timeout the timeout
     * @return this configuration
     */
    public GatewayConfig withRequestTimeout(Duration timeout) {
        this.requestTimeout = requirePositive(timeout, "requestTimeout");
        return this;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getSessionName() {
        return sessionName;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Returns the base URL of the gateway REST API.
     *
     * @return the URL, e.g. {@code http://localhost:8083}
     */
    public String gatewayUrl() {
        return "http://" + host + ":" + port;
    }

    private static Duration requirePositive(Duration timeout, String name) {
        Objects.requireNonNull(timeout, name + " must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return timeout;
    }

    @Override
    public String toString() {
        return String.format("GatewayConfig[url=%s, session=%s]", gatewayUrl(), sessionName);
    }
}
