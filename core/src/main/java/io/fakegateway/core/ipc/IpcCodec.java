package io.fakegateway.core.ipc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fakegateway.core.error.IpcProtocolException;
import io.fakegateway.core.model.LambdaEvent;
import io.fakegateway.core.model.LambdaResult;
import io.fakegateway.core.model.ResultShape;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Encodes and validates the two IPC messages exchanged with a worker process. Each message is one
 * JSON object on one line:
 *
 * <pre>{@code
 * {"type":"event","id":"...","eventObject":{...}}                     gateway -> worker
 * {"type":"result","id":"...","result":{...},"memoryUsedBytes":1234}  worker -> gateway
 * }</pre>
 *
 * <p>
 * Decoding is strict. Anything that deviates from the contract raises
 * {@link IpcProtocolException}; nothing is coerced or defaulted.
 *
 * <p>
 * Thread-safe.
 */
public final class IpcCodec {

    public static final String TYPE_EVENT = "event";
    public static final String TYPE_RESULT = "result";

    private final ObjectMapper mapper;

    public IpcCodec() {
        this(new ObjectMapper());
    }

    public IpcCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Serializes the event message for {@code id}. */
    public String encodeEvent(String id, LambdaEvent event) {
        ObjectNode message = mapper.createObjectNode();
        message.put("type", TYPE_EVENT);
        message.put("id", id);
        message.set("eventObject", mapper.valueToTree(event));
        return write(message);
    }

    /** Serializes the result message a worker sends back. */
    public String encodeResult(String id, JsonNode result, long memoryUsedBytes) {
        ObjectNode message = mapper.createObjectNode();
        message.put("type", TYPE_RESULT);
        message.put("id", id);
        message.set("result", result);
        message.put("memoryUsedBytes", memoryUsedBytes);
        return write(message);
    }

    /**
     * Decodes and validates a result message.
     *
     * @param line       one line read from the channel
     * @param expectedId the correlation id the invocation was started with
     * @return the validated message
     * @throws IpcProtocolException if the line violates the contract in any way
     */
    public ResultMessage decodeResult(String line, String expectedId) {
        JsonNode message = parseObject(line, expectedId);

        String type = message.path("type").asText(null);
        if (!TYPE_RESULT.equals(type)) {
            throw new IpcProtocolException("Incorrect type field from worker: " + type, expectedId);
        }

        JsonNode id = message.get("id");
        if (id == null || !id.isTextual()) {
            throw new IpcProtocolException("Missing id from worker: " + id, expectedId);
        }
        if (!id.asText().equals(expectedId)) {
            throw new IpcProtocolException("Unknown response id from worker: " + id.asText(), expectedId);
        }

        JsonNode result = message.get("result");
        Optional<String> violation = ResultShape.violation(result);
        if (violation.isPresent()) {
            throw new IpcProtocolException(
                    "Malformed result from worker (" + violation.get() + "): " + result, expectedId);
        }

        JsonNode memory = message.get("memoryUsedBytes");
        if (memory == null || !memory.isNumber()) {
            throw new IpcProtocolException("memoryUsedBytes must be a number: " + memory, expectedId);
        }

        return new ResultMessage(expectedId, LambdaResult.fromJson(result), memory.asLong());
    }

    /**
     * Decodes an event message. Used by the worker runtime.
     *
     * @param line one line read from the channel
     * @return the event message
     * @throws IpcProtocolException if the line is not an event message
     */
    public EventMessage decodeEvent(String line) {
        JsonNode message = parseObject(line, null);
        String type = message.path("type").asText(null);
        if (!TYPE_EVENT.equals(type)) {
            throw new IpcProtocolException("Incorrect type field from gateway: " + type, null);
        }
        JsonNode id = message.get("id");
        if (id == null || !id.isTextual()) {
            throw new IpcProtocolException("Missing id from gateway: " + id, null);
        }
        JsonNode eventObject = message.get("eventObject");
        if (eventObject == null || !eventObject.isObject()) {
            throw new IpcProtocolException("Missing eventObject from gateway", id.asText());
        }
        return new EventMessage(id.asText(), eventObject);
    }

    private JsonNode parseObject(String line, String correlationId) {
        if (line == null) {
            throw new IpcProtocolException("Channel closed before a message arrived", correlationId);
        }
        JsonNode message;
        try {
            message = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new IpcProtocolException("Message is not valid JSON: " + e.getOriginalMessage(), e, correlationId);
        }
        if (message == null || !message.isObject()) {
            throw new IpcProtocolException("Bad data type from worker: expected an object", correlationId);
        }
        return message;
    }

    private String write(JsonNode message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
