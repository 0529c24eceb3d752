package io.fakegateway.core.ipc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outbound message: the single event a worker process is asked to handle.
 *
 * @param id          correlation id the result must echo
 * @param eventObject the serialized {@link io.fakegateway.core.model.LambdaEvent}
 */
public record EventMessage(String id, JsonNode eventObject) {}
