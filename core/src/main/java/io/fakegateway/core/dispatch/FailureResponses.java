package io.fakegateway.core.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fakegateway.core.error.WorkerCrashException;
import io.fakegateway.core.model.LambdaResult;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Translates a failed invocation into the 500 result written to the client:
 *
 * <pre>{@code
 * {
 *   "message" : "Internal Server Error",
 *   "stack" : [ "java.lang.IllegalStateException: boom", "\tat ..." ]
 * }
 * }</pre>
 *
 * <p>
 * The body embeds worker stack text. That is acceptable only because every caller of the local
 * gateway is trusted.
 */
public final class FailureResponses {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FailureResponses() {
        // utility class
    }

    /**
     * Builds the 500 result for a failure.
     *
     * @param failure the invocation failure, possibly wrapped in {@link CompletionException}
     * @return the synthesized result
     */
    public static LambdaResult from(Throwable failure) {
        Throwable cause = unwrap(failure);
        List<String> stack = cause instanceof WorkerCrashException crash ? crash.stackLines() : List.of();
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return LambdaResult.of(500, Map.of(), body(message, stack));
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String body(String message, List<String> stack) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("message", message);
        stack.forEach(node.putArray("stack")::add);
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
