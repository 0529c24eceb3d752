package io.fakegateway.standalone.server;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;

/**
 * Guards a gateway that is meant to be reachable from the local machine only.
 *
 * <ul>
 *   <li>Without CORS, a request carrying a {@code Referer} must come from a {@code localhost} page.
 *   <li>A {@code Host} header must name {@code localhost}, on any port. This defeats DNS
 *       rebinding, where a foreign page reaches the gateway through a hostname that resolves to
 *       the loopback address.
 * </ul>
 *
 * <p>
 * Rejections happen before any function is routed or spawned.
 */
public final class SecurityChecks {

    private static final String LOCALHOST = "localhost";

    private SecurityChecks() {
        // utility class
    }

    /**
     * Checks the request origin headers.
     *
     * @param referer     the {@code Referer} header, or {@code null}
     * @param host        the {@code Host} header, or {@code null}
     * @param corsEnabled whether cross-origin callers are allowed
     * @return the rejection message, or empty if the request may proceed
     */
    public static Optional<String> reject(String referer, String host, boolean corsEnabled) {
        if (!corsEnabled && referer != null && !LOCALHOST.equals(refererHostname(referer))) {
            return Optional.of(ErrorBodies.EXPECTED_LOCALHOST);
        }
        if (host != null && !LOCALHOST.equals(hostname(host))) {
            return Optional.of(ErrorBodies.UNEXPECTED_HOST);
        }
        return Optional.empty();
    }

    /** The part of a {@code Host} header before the first {@code ':'}. */
    static String hostname(String host) {
        int colon = host.indexOf(':');
        return colon >= 0 ? host.substring(0, colon) : host;
    }

    private static String refererHostname(String referer) {
        try {
            return new URI(referer).getHost();
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
