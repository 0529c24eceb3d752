package io.fakegateway.standalone.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;

/**
 * Builds the {@code {"message": ...}} bodies the gateway writes for errors it produces itself:
 *
 * <pre>{@code
 * {
 *   "message" : "unexpected host header"
 * }
 * }</pre>
 *
 * <p>
 * Thread-safe.
 */
final class ErrorBodies {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String EXPECTED_LOCALHOST = "expected request from localhost";
    static final String UNEXPECTED_HOST = "unexpected host header";

    private ErrorBodies() {
        // utility class
    }

    /** Pretty-printed {@code {"message": message}}. */
    static String message(String message) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("message", message);
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
