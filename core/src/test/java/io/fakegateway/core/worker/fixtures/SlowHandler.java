package io.fakegateway.core.worker.fixtures;

import com.fasterxml.jackson.databind.JsonNode;

/** Sleeps far longer than any test runs. */
public class SlowHandler {

    public Object handler(JsonNode event) throws InterruptedException {
        Thread.sleep(600_000);
        return null;
    }
}
