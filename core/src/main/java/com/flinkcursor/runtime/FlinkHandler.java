package com.flinkcursor.runtime;

import com.flinkcursor.gateway.GatewayClient;
import com.flinkcursor.gateway.GatewayConfig;
import com.flinkcursor.gateway.HttpGatewayClient;
import com.flinkcursor.gateway.SqlGatewaySession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Binds one gateway session and hands out cursors for it.
 *
 * <p>The handler owns the scheduler that drives every cursor's polling.
 * Closing the handler stops it; cursors created by a closed handler fail on
 * their next wait.
 *
 * <p>Example usage:
 * <pre>
 *   try (FlinkHandler handler = FlinkHandler.connect(GatewayConfig.of("localhost", 8083))) {
 *       FlinkCursor cursor = handler.cursor();
 *       cursor.execute("SELECT 1");
 *       List&lt;Row&gt; rows = cursor.fetchAll();
 *   }
 * </pre>
 */
public class FlinkHandler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FlinkHandler.class);

    private final GatewayClient client;
    private final SqlGatewaySession session;
    private final ScheduledExecutorService scheduler;
    private final Poller poller;
    private final Clock clock;

    /**
     * Creates a handler with the configured fetch interval.
     *
     * @param client the gateway client
     * @param session the session cursors run on
     */
    public FlinkHandler(GatewayClient client, SqlGatewaySession session) {
        this(client, session, PollingConfig.configuredFetchIntervalMs(), Clock.systemUTC());
    }

    /**
     * Creates a handler.
     *
     * @param client the gateway client
     * @param session the session cursors run on
     * @param fetchIntervalMs the wait between status probes and page fetches
     * @param clock the clock measuring fetch timeouts
     */
    public FlinkHandler(GatewayClient client, SqlGatewaySession session, long fetchIntervalMs, Clock clock) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "flinkcursor-poller");
            t.setDaemon(true);
            return t;
        });
        this.poller = new Poller(scheduler, PollingConfig.normalizeFetchInterval(fetchIntervalMs));
    }

    /**
     * Opens a session on the configured gateway and binds a handler to it.
     *
     * @param config the gateway configuration
     * @return the handler
     * @throws com.flinkcursor.exception.GatewayRequestException if the session cannot be opened
     */
    public static FlinkHandler connect(GatewayConfig config) {
        GatewayClient client = new HttpGatewayClient(config);
        SqlGatewaySession session = client.openSession(config.getSessionName());
        return new FlinkHandler(client, session);
    }

    /**
     * Creates a new cursor on this handler's session.
     *
     * @return the cursor
     */
    public FlinkCursor cursor() {
        return new FlinkCursor(client, session, poller, clock);
    }

    public SqlGatewaySession getSession() {
        return session;
    }

    /**
     * Stops the polling scheduler.
     */
    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Handler for session {} closed", session.getSessionHandle());
    }
}
