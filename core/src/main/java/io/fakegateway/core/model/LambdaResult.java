package io.fakegateway.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Proxy-integration result: produced by a worker, or synthesized locally for routing misses and
 * invocation failures.
 *
 * @param statusCode        HTTP status to write
 * @param headers           single-valued headers, applied first
 * @param multiValueHeaders multi-valued headers applied after {@code headers}; may be {@code null}
 * @param body              response body text
 * @param isBase64Encoded   binary flag; a {@code true} value is answered with 400
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LambdaResult(
        @JsonProperty("statusCode") int statusCode,
        @JsonProperty("headers") Map<String, String> headers,
        @JsonProperty("multiValueHeaders") Map<String, List<String>> multiValueHeaders,
        @JsonProperty("body") String body,
        @JsonProperty("isBase64Encoded") boolean isBase64Encoded) {

    /** Body of the routing-miss and binary-body responses. */
    public static final String FORBIDDEN_BODY = "{\"message\":\"Forbidden\"}";

    public LambdaResult {
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
        if (multiValueHeaders != null) {
            multiValueHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(multiValueHeaders));
        }
        body = body != null ? body : "";
    }

    /** A plain text result with single-valued headers. */
    public static LambdaResult of(int statusCode, Map<String, String> headers, String body) {
        return new LambdaResult(statusCode, headers, null, body, false);
    }

    /** The 403 answer for a path no function is registered for. */
    public static LambdaResult forbidden() {
        return new LambdaResult(403, Map.of(), Map.of(), FORBIDDEN_BODY, false);
    }

    /**
     * Converts a worker result that already passed {@link ResultShape}. Header values that are not
     * strings are rendered as text; a scalar multi-value entry becomes a one-element list.
     *
     * @param node a shape-valid result node
     * @return the typed result
     * @throws IllegalArgumentException if the node fails the shape check
     */
    public static LambdaResult fromJson(JsonNode node) {
        ResultShape.violation(node).ifPresent(violation -> {
            throw new IllegalArgumentException("Invalid result: " + violation);
        });

        Map<String, String> headers = new LinkedHashMap<>();
        node.get("headers").fields().forEachRemaining(field -> headers.put(field.getKey(), field.getValue().asText()));

        Map<String, List<String>> multiValueHeaders = null;
        JsonNode multi = node.get("multiValueHeaders");
        if (multi != null && multi.isObject()) {
            Map<String, List<String>> collected = new LinkedHashMap<>();
            multi.fields().forEachRemaining(field -> {
                List<String> values = new ArrayList<>();
                if (field.getValue().isArray()) {
                    field.getValue().forEach(value -> values.add(value.asText()));
                } else {
                    values.add(field.getValue().asText());
                }
                collected.put(field.getKey(), List.copyOf(values));
            });
            multiValueHeaders = collected;
        }

        return new LambdaResult(
                node.get("statusCode").asInt(),
                headers,
                multiValueHeaders,
                node.get("body").asText(),
                node.get("isBase64Encoded").asBoolean());
    }
}
