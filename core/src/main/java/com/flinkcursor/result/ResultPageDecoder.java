package com.flinkcursor.result;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flinkcursor.exception.GatewayRequestException;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes a gateway result response into a {@link ResultPage}.
 *
 * <p>Expected response shape:
 * <pre>
 * {
 *   "resultType": "PAYLOAD" | "EOS" | "NOT_READY",
 *   "nextResultUri": "/v1/sessions/.../result/1",
 *   "results": {
 *     "columns": [ {"name": "id", "logicalType": {...}}, ... ],
 *     "data": [ {"kind": "INSERT", "fields": [1, "a"]}, ... ]
 *   }
 * }
 * </pre>
 *
 * <p>Record fields are matched to columns by position. Shape mismatches are
 * not validated: a record with fewer fields than columns yields nulls for the
 * missing positions, extra fields are dropped.
 */
public final class ResultPageDecoder {

    /** Result type marking the last page of a result */
    public static final String END_OF_STREAM = "EOS";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ResultPageDecoder() {} // Utility class

    /**
     * Decodes a raw JSON response body.
     *
     * @param body the response body
     * @return the decoded page
     * @throws GatewayRequestException if the body is not a result response
     */
    public static ResultPage decode(String body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GatewayRequestException("Malformed result response: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new GatewayRequestException("Result response is not a JSON object", 200, body);
        }
        return decode(root);
    }

    /**
     * Decodes a parsed JSON response.
     *
     * @param data the response tree
     * @return the decoded page
     * @throws GatewayRequestException if the response has no results object
     */
    public static ResultPage decode(JsonNode data) {
        JsonNode results = data.path("results");
        if (!results.isObject()) {
            throw new GatewayRequestException("Result response has no 'results' object", 200, data.toString());
        }

        List<String> columnNames = new ArrayList<>();
        for (JsonNode column : results.path("columns")) {
            columnNames.add(column.path("name").asText());
        }

        boolean endOfStream = END_OF_STREAM.equals(data.path("resultType").asText());
        String nextResultUri = null;
        if (!endOfStream) {
            JsonNode next = data.path("nextResultUri");
            if (next.isTextual()) {
                nextResultUri = next.asText();
            }
        }

        List<Row> rows = new ArrayList<>();
        for (JsonNode record : results.path("data")) {
            JsonNode fields = record.path("fields");
            List<Object> values = new ArrayList<>(columnNames.size());
            for (int idx = 0; idx < columnNames.size(); idx++) {
                values.add(toValue(fields.path(idx)));
            }
            rows.add(new Row(values));
        }

        return new ResultPage(columnNames, rows, nextResultUri, endOfStream);
    }

    private static Object toValue(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        return MAPPER.convertValue(node, Object.class);
    }
}
