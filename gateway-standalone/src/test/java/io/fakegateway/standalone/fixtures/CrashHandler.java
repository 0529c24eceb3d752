package io.fakegateway.standalone.fixtures;

import com.fasterxml.jackson.databind.JsonNode;

/** Always throws. */
public class CrashHandler {

    public Object handler(JsonNode event) {
        throw new IllegalStateException("boom");
    }
}
