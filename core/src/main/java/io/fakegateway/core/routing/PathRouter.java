package io.fakegateway.core.routing;

import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a request path to the function registered for it. Registrations are scanned in order and
 * the first match wins, so an earlier proxy route shadows a later exact route under its prefix.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class PathRouter {

    private static final Logger LOG = LoggerFactory.getLogger(PathRouter.class);

    private PathRouter() {}

    /**
     * Finds the function serving {@code pathname}.
     *
     * @param functions registered functions, in registration order
     * @param pathname  the request path without query string
     * @param <T>       the registration type
     * @return the first matching function, or empty when nothing is registered for the path
     */
    public static <T extends RoutedFunction> Optional<T> match(List<T> functions, String pathname) {
        for (T function : functions) {
            if (RoutePattern.parse(function.path()).matches(pathname)) {
                LOG.debug("Path '{}' matched route '{}'", pathname, function.path());
                return Optional.of(function);
            }
        }
        LOG.debug("Path '{}' matched no route", pathname);
        return Optional.empty();
    }
}
