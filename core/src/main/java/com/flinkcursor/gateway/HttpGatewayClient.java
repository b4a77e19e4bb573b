package com.flinkcursor.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flinkcursor.exception.GatewayRequestException;
import com.flinkcursor.result.ResultPage;
import com.flinkcursor.result.ResultPageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * {@link GatewayClient} speaking the SQL gateway v1 REST API over HTTP.
 *
 * <p>Endpoints used:
 * <ul>
 *   <li>{@code POST /v1/sessions} - open a session</li>
 *   <li>{@code POST /v1/sessions/{s}/statements} - submit a statement</li>
 *   <li>{@code GET /v1/sessions/{s}/operations/{o}/status} - probe status</li>
 *   <li>{@code GET /v1/sessions/{s}/operations/{o}/result/0} - first result page;
 *       later pages follow the {@code nextResultUri} of the previous one</li>
 *   <li>{@code DELETE /v1/sessions/{s}/operations/{o}/close} - release an operation</li>
 *   <li>{@code POST /v1/sessions/{s}/operations/{o}/cancel} - cancel an operation</li>
 * </ul>
 *
 * <p>Any non-2xx response fails with {@link GatewayRequestException}.
 */
public class HttpGatewayClient implements GatewayClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpGatewayClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final GatewayConfig config;
    private final HttpClient client;

    /**
     * Creates a client for the configured gateway.
     *
     * @param config the gateway configuration
     */
    public HttpGatewayClient(GatewayConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.getConnectTimeout()).build());
    }

    /**
     * Creates a client using the given HTTP client.
     *
     * @param config the gateway configuration
     * @param client the HTTP client
     */
    public HttpGatewayClient(GatewayConfig config, HttpClient client) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    public SqlGatewaySession openSession(String sessionName) {
        String body = MAPPER.createObjectNode().put("sessionName", sessionName).toString();
        JsonNode response = send(post("/v1/sessions", body), "open session");

        String handle = response.path("sessionHandle").asText(null);
        if (handle == null || handle.isBlank()) {
            throw new GatewayRequestException("No sessionHandle in open session response", 200, response.toString());
        }

        logger.info("Opened gateway session '{}' with handle {}", sessionName, handle);
        return new SqlGatewaySession(sessionName, handle);
    }

    @Override
    public String submitStatement(SqlGatewaySession session, String sql) {
        String body = MAPPER.createObjectNode().put("statement", sql).toString();
        JsonNode response = send(post(session.endpointPath() + "/statements", body), "submit statement");

        String handle = response.path("operationHandle").asText(null);
        if (handle == null || handle.isBlank()) {
            throw new GatewayRequestException("No operationHandle in submit response", 200, response.toString());
        }
        return handle;
    }

    @Override
    public OperationStatus getOperationStatus(SqlGatewaySession session, String operationHandle) {
        JsonNode response = send(get(operationPath(session, operationHandle) + "/status"), "status");
        return parseStatus(response);
    }

    @Override
    public ResultPage fetchResult(SqlGatewaySession session, String operationHandle, String nextResultUri) {
        String path = nextResultUri != null
            ? nextResultUri
            : operationPath(session, operationHandle) + "/result/0";
        HttpResponse<String> response = exchange(get(path), "fetch result");
        ResultPage page = ResultPageDecoder.decode(response.body());
        logger.debug("Fetched {} for operation {}", page, operationHandle);
        return page;
    }

    @Override
    public OperationStatus closeOperation(SqlGatewaySession session, String operationHandle) {
        HttpRequest request = newRequest(operationPath(session, operationHandle) + "/close").DELETE().build();
        return parseStatus(send(request, "close operation"));
    }

    @Override
    public OperationStatus cancelOperation(SqlGatewaySession session, String operationHandle) {
        return parseStatus(send(post(operationPath(session, operationHandle) + "/cancel", "{}"), "cancel operation"));
    }

    public GatewayConfig getConfig() {
        return config;
    }

    private static String operationPath(SqlGatewaySession session, String operationHandle) {
        return session.endpointPath() + "/operations/" + operationHandle;
    }

    private HttpRequest.Builder newRequest(String pathOrUri) {
        URI uri = pathOrUri.startsWith("http://") || pathOrUri.startsWith("https://")
            ? URI.create(pathOrUri)
            : URI.create(config.gatewayUrl() + pathOrUri);
        return HttpRequest.newBuilder()
            .uri(uri)
            .timeout(config.getRequestTimeout())
            .header("Accept", "application/json");
    }

    private HttpRequest get(String path) {
        return newRequest(path).GET().build();
    }

    private HttpRequest post(String path, String jsonBody) {
        return newRequest(path)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
            .build();
    }

    private JsonNode send(HttpRequest request, String action) {
        HttpResponse<String> response = exchange(request, action);
        try {
            return MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new GatewayRequestException(
                "Malformed " + action + " response: " + e.getOriginalMessage(), e);
        }
    }

    private HttpResponse<String> exchange(HttpRequest request, String action) {
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new GatewayRequestException(
                "SQL gateway " + action + " request to " + request.uri() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayRequestException("Interrupted during SQL gateway " + action + " request", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new GatewayRequestException(
                "SQL gateway error on " + action + ": HTTP " + response.statusCode(),
                response.statusCode(), response.body());
        }
        return response;
    }

    private static OperationStatus parseStatus(JsonNode response) {
        String status = response.path("status").asText(null);
        try {
            return OperationStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new GatewayRequestException("Unrecognized operation status: " + status, 200, response.toString());
        }
    }
}
