package io.fakegateway.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fakegateway.core.model.LambdaResult;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link PendingRequests}. */
class PendingRequestsTest {

    private final PendingRequests pending = new PendingRequests();

    @Test
    @DisplayName("resolve completes the sink and removes the entry")
    void resolveCompletesAndRemoves() {
        CompletableFuture<LambdaResult> sink = pending.open("a");
        LambdaResult result = LambdaResult.of(200, Map.of(), "ok");

        assertThat(pending.contains("a")).isTrue();
        pending.resolve("a", result);

        assertThat(sink).isCompletedWithValue(result);
        assertThat(pending.contains("a")).isFalse();
        assertThat(pending.size()).isZero();
    }

    @Test
    @DisplayName("second resolution of the same id is an invariant violation")
    void secondResolutionFails() {
        pending.open("a");
        pending.resolve("a", LambdaResult.forbidden());

        assertThatThrownBy(() -> pending.resolve("a", LambdaResult.forbidden()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Response without request: a");
    }

    @Test
    void unknownIdFails() {
        assertThatThrownBy(() -> pending.resolve("never-opened", LambdaResult.forbidden()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void duplicateOpenFails() {
        pending.open("a");

        assertThatThrownBy(() -> pending.open("a"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate");
    }
}
