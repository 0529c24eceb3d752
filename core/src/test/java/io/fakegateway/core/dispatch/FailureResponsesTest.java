package io.fakegateway.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fakegateway.core.error.IpcProtocolException;
import io.fakegateway.core.error.WorkerCrashException;
import io.fakegateway.core.model.LambdaResult;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link FailureResponses}. */
class FailureResponsesTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("crash becomes 500 with message and stderr lines")
    void crashResponse() throws Exception {
        WorkerCrashException crash = new WorkerCrashException(
                "Internal Server Error", "id-1", "java.lang.IllegalStateException: boom\n\tat Foo.bar", 1);

        LambdaResult result = FailureResponses.from(new CompletionException(crash));
        JsonNode body = MAPPER.readTree(result.body());

        assertThat(result.statusCode()).isEqualTo(500);
        assertThat(body.get("message").asText()).isEqualTo("Internal Server Error");
        assertThat(body.get("stack").get(0).asText()).isEqualTo("java.lang.IllegalStateException: boom");
        assertThat(body.get("stack").get(1).asText()).isEqualTo("\tat Foo.bar");
        assertThat(result.body()).contains("\n");
    }

    @Test
    void protocolViolationHasNoStack() throws Exception {
        LambdaResult result = FailureResponses.from(new IpcProtocolException("Unknown response id", "id-1"));
        JsonNode body = MAPPER.readTree(result.body());

        assertThat(result.statusCode()).isEqualTo(500);
        assertThat(body.get("message").asText()).isEqualTo("Unknown response id");
        assertThat(body.has("stack")).isFalse();
    }

    @Test
    void messagelessFailureUsesClassName() throws Exception {
        JsonNode body = MAPPER.readTree(FailureResponses.from(new IllegalStateException()).body());

        assertThat(body.get("message").asText()).isEqualTo("java.lang.IllegalStateException");
    }
}
