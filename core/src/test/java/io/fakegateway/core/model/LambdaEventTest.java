package io.fakegateway.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link LambdaEvent}. */
class LambdaEventTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static LambdaEvent sample() {
        return LambdaEvent.fromRequest(
                "POST",
                "/orders",
                List.of(Map.entry("X", "a"), Map.entry("X", "b")),
                List.of(Map.entry("page", "1"), Map.entry("page", "2")),
                "{\"qty\":1}");
    }

    @Test
    @DisplayName("fromRequest fills proxy-integration defaults")
    void proxyIntegrationDefaults() {
        LambdaEvent event = sample();

        assertThat(event.resource()).isEqualTo("/{proxy+}");
        assertThat(event.httpMethod()).isEqualTo("POST");
        assertThat(event.pathParameters()).isEmpty();
        assertThat(event.stageVariables()).isEmpty();
        assertThat(event.requestContext().isObject()).isTrue();
        assertThat(event.requestContext().isEmpty()).isTrue();
        assertThat(event.isBase64Encoded()).isFalse();
    }

    @Test
    @DisplayName("headers and query keep both the first-wins and all-values views")
    void headerAndQueryViews() {
        LambdaEvent event = sample();

        assertThat(event.headers()).containsExactly(Map.entry("X", "a"));
        assertThat(event.multiValueHeaders().get("X")).containsExactly("a", "b");
        assertThat(event.queryStringParameters()).containsExactly(Map.entry("page", "1"));
        assertThat(event.multiValueQueryStringParameters().get("page")).containsExactly("1", "2");
    }

    @Test
    @DisplayName("withRequestContext returns a copy and leaves the original untouched")
    void withRequestContextCopies() {
        LambdaEvent original = sample();
        ObjectNode context = MAPPER.createObjectNode().put("user", "alice");

        LambdaEvent enriched = original.withRequestContext(context);
        context.put("user", "mallory");

        assertThat(enriched.requestContext().get("user").asText()).isEqualTo("alice");
        assertThat(original.requestContext().isEmpty()).isTrue();
        assertThat(enriched.body()).isEqualTo(original.body());
    }

    @Test
    @DisplayName("serializes with API Gateway field names")
    void serializedFieldNames() {
        JsonNode json = MAPPER.valueToTree(sample());

        assertThat(json.get("isBase64Encoded").asBoolean()).isFalse();
        assertThat(json.get("httpMethod").asText()).isEqualTo("POST");
        assertThat(json.get("multiValueQueryStringParameters").get("page")).hasSize(2);
    }

    @Test
    void roundTripsThroughJson() throws Exception {
        LambdaEvent event = sample();

        LambdaEvent decoded = MAPPER.treeToValue(MAPPER.valueToTree(event), LambdaEvent.class);

        assertThat(decoded).isEqualTo(event);
    }

    @Test
    void pathnameStripsQueryString() {
        LambdaEvent event = LambdaEvent.fromRequest("GET", "/a/b?x=1", List.of(), List.of(), null);

        assertThat(event.pathname()).isEqualTo("/a/b");
        assertThat(event.body()).isEmpty();
    }
}
