package io.fakegateway.core.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link PathRouter} and {@link RoutePattern}. */
class PathRouterTest {

    record Route(String path, String name) implements RoutedFunction {}

    // ── Exact routes ──

    @Test
    @DisplayName("exact route matches only its own path")
    void exactRouteMatchesOnlyItself() {
        Route hello = new Route("/hello", "hello");
        Route users = new Route("/users", "users");

        assertThat(PathRouter.match(List.of(hello, users), "/hello")).containsSame(hello);
        assertThat(PathRouter.match(List.of(hello, users), "/users")).containsSame(users);
        assertThat(PathRouter.match(List.of(hello, users), "/hello/")).isEmpty();
        assertThat(PathRouter.match(List.of(hello, users), "/hellos")).isEmpty();
    }

    @Test
    @DisplayName("no registered route → empty, not an error")
    void noMatchIsEmpty() {
        assertThat(PathRouter.match(List.of(new Route("/hello", "hello")), "/nope")).isEmpty();
        assertThat(PathRouter.match(List.<Route>of(), "/")).isEmpty();
    }

    // ── Proxy routes ──

    @Test
    @DisplayName("proxy route never matches its bare prefix")
    void proxyRouteRejectsBarePrefix() {
        Route api = new Route("/api/{proxy+}", "api");

        assertThat(PathRouter.match(List.of(api), "/api/")).isEmpty();
        assertThat(PathRouter.match(List.of(api), "/api")).isEmpty();
    }

    @Test
    @DisplayName("proxy route matches any non-empty suffix")
    void proxyRouteMatchesSuffixes() {
        Route api = new Route("/api/{proxy+}", "api");

        assertThat(PathRouter.match(List.of(api), "/api/x")).containsSame(api);
        assertThat(PathRouter.match(List.of(api), "/api/users/42/orders")).containsSame(api);
    }

    @Test
    @DisplayName("marker name does not matter, only the greedy suffix")
    void anyGreedyMarkerName() {
        RoutePattern pattern = RoutePattern.parse("/files/{key+}");

        assertThat(pattern.proxy()).isTrue();
        assertThat(pattern.prefix()).isEqualTo("/files/");
        assertThat(pattern.matches("/files/a.txt")).isTrue();
    }

    @Test
    @DisplayName("non-greedy braces are literal")
    void nonGreedyBracesAreLiteral() {
        RoutePattern pattern = RoutePattern.parse("/users/{id}");

        assertThat(pattern.proxy()).isFalse();
        assertThat(pattern.matches("/users/42")).isFalse();
        assertThat(pattern.matches("/users/{id}")).isTrue();
    }

    // ── Ordering ──

    @Test
    @DisplayName("first registration wins when several match")
    void firstRegistrationWins() {
        Route catchAll = new Route("/{proxy+}", "catch-all");
        Route hello = new Route("/hello", "hello");

        assertThat(PathRouter.match(List.of(catchAll, hello), "/hello")).containsSame(catchAll);
        assertThat(PathRouter.match(List.of(hello, catchAll), "/hello")).containsSame(hello);
        assertThat(PathRouter.match(List.of(hello, catchAll), "/other")).containsSame(catchAll);
    }

    @Test
    void nullPatternRejected() {
        assertThatThrownBy(() -> RoutePattern.parse(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void greedySuffixWithoutBraceRejected() {
        assertThatThrownBy(() -> RoutePattern.parse("/broken+}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("/broken+}");
    }
}
