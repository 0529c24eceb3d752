package io.fakegateway.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Proxy-integration request event handed to a function: one per HTTP request, immutable once
 * built.
 *
 * <p>
 * {@code pathParameters} and {@code stageVariables} are always empty and
 * {@code isBase64Encoded} is always {@code false} on ingestion. Use
 * {@link #withRequestContext(JsonNode)} to attach a request context; it returns a copy.
 *
 * @param resource                        always {@value #PROXY_RESOURCE}
 * @param path                            raw request path
 * @param httpMethod                      request method
 * @param headers                         first occurrence of each header
 * @param multiValueHeaders               every occurrence of each header, in order
 * @param queryStringParameters           first occurrence of each query parameter
 * @param multiValueQueryStringParameters every occurrence of each query parameter
 * @param pathParameters                  always empty
 * @param stageVariables                  always empty
 * @param requestContext                  supplied by a request-context hook, or an empty object
 * @param body                            the request body as text
 * @param isBase64Encoded                 always {@code false}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LambdaEvent(
        @JsonProperty("resource") String resource,
        @JsonProperty("path") String path,
        @JsonProperty("httpMethod") String httpMethod,
        @JsonProperty("headers") Map<String, String> headers,
        @JsonProperty("multiValueHeaders") Map<String, List<String>> multiValueHeaders,
        @JsonProperty("queryStringParameters") Map<String, String> queryStringParameters,
        @JsonProperty("multiValueQueryStringParameters") Map<String, List<String>> multiValueQueryStringParameters,
        @JsonProperty("pathParameters") Map<String, String> pathParameters,
        @JsonProperty("stageVariables") Map<String, String> stageVariables,
        @JsonProperty("requestContext") JsonNode requestContext,
        @JsonProperty("body") String body,
        @JsonProperty("isBase64Encoded") boolean isBase64Encoded) {

    public static final String PROXY_RESOURCE = "/{proxy+}";

    public LambdaEvent {
        headers = copy(headers);
        multiValueHeaders = copy(multiValueHeaders);
        queryStringParameters = copy(queryStringParameters);
        multiValueQueryStringParameters = copy(multiValueQueryStringParameters);
        pathParameters = copy(pathParameters);
        stageVariables = copy(stageVariables);
        requestContext = requestContext != null ? requestContext.deepCopy() : JsonNodeFactory.instance.objectNode();
        body = body != null ? body : "";
    }

    /**
     * Builds an event from raw request data.
     *
     * @param httpMethod  request method
     * @param path        raw request path
     * @param rawHeaders  header pairs in arrival order, duplicates included
     * @param rawQuery    query pairs in arrival order, duplicates included
     * @param body        the fully buffered body
     * @return a new event with an empty request context
     */
    public static LambdaEvent fromRequest(
            String httpMethod,
            String path,
            List<Map.Entry<String, String>> rawHeaders,
            List<Map.Entry<String, String>> rawQuery,
            String body) {
        return new LambdaEvent(
                PROXY_RESOURCE,
                path != null && !path.isEmpty() ? path : "/",
                httpMethod != null ? httpMethod : "GET",
                MultiValues.firstValues(rawHeaders),
                MultiValues.allValues(rawHeaders),
                MultiValues.firstValues(rawQuery),
                MultiValues.allValues(rawQuery),
                Map.of(),
                Map.of(),
                null,
                body,
                false);
    }

    /** Returns a copy of this event carrying the given request context. */
    public LambdaEvent withRequestContext(JsonNode context) {
        return new LambdaEvent(
                resource,
                path,
                httpMethod,
                headers,
                multiValueHeaders,
                queryStringParameters,
                multiValueQueryStringParameters,
                pathParameters,
                stageVariables,
                context,
                body,
                isBase64Encoded);
    }

    /**
     * The path without any query string, as used for routing.
     *
     * @return the path component of {@link #path()}
     */
    public String pathname() {
        int query = path.indexOf('?');
        return query >= 0 ? path.substring(0, query) : path;
    }

    @Override
    public JsonNode requestContext() {
        return requestContext.deepCopy();
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
