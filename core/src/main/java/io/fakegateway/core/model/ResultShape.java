package io.fakegateway.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Shape contract a worker-produced result must satisfy before it is trusted: field presence and
 * primitive types only.
 *
 * <ul>
 *   <li>{@code isBase64Encoded} boolean
 *   <li>{@code statusCode} number
 *   <li>{@code headers} object
 *   <li>{@code multiValueHeaders} absent, null, or object
 *   <li>{@code body} string
 * </ul>
 */
public final class ResultShape {

    private ResultShape() {
        // utility class
    }

    /**
     * Checks a candidate result.
     *
     * @param candidate the decoded {@code result} field of a worker message
     * @return the first violation found, or empty if the shape is valid
     */
    public static Optional<String> violation(JsonNode candidate) {
        if (candidate == null || !candidate.isObject()) {
            return Optional.of("result is not an object");
        }
        if (!candidate.path("isBase64Encoded").isBoolean()) {
            return Optional.of("isBase64Encoded must be a boolean");
        }
        if (!candidate.path("statusCode").isNumber()) {
            return Optional.of("statusCode must be a number");
        }
        if (!candidate.path("headers").isObject()) {
            return Optional.of("headers must be an object");
        }
        JsonNode multiValueHeaders = candidate.get("multiValueHeaders");
        if (multiValueHeaders != null && !multiValueHeaders.isNull() && !multiValueHeaders.isObject()) {
            return Optional.of("multiValueHeaders must be an object");
        }
        if (!candidate.path("body").isTextual()) {
            return Optional.of("body must be a string");
        }
        return Optional.empty();
    }

    /** Returns {@code true} if {@link #violation(JsonNode)} finds nothing. */
    public static boolean isValid(JsonNode candidate) {
        return violation(candidate).isEmpty();
    }
}
