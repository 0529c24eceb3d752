package io.fakegateway.core.routing;

/**
 * A parsed path pattern: either an exact literal, or a proxy pattern whose last segment is a
 * greedy {@code {name+}} marker.
 *
 * <p>
 * A proxy pattern matches any path that starts with its literal prefix (everything before the
 * last {@code '{'}) and is strictly longer than it: the wildcard must consume at least one
 * character. So {@code /api/{proxy+}} matches {@code /api/x} but neither {@code /api/} nor
 * {@code /api}.
 *
 * @param pattern the pattern as registered
 * @param proxy   whether the pattern ends in a greedy marker
 * @param prefix  the literal part that must match exactly; the whole pattern when not a proxy
 */
public record RoutePattern(String pattern, boolean proxy, String prefix) {

    /** Suffix identifying a greedy proxy marker such as {@code {proxy+}}. */
    static final String GREEDY_SUFFIX = "+}";

    /**
     * Parses a registration pattern.
     *
     * @param pattern the registered path
     * @return the parsed pattern
     * @throws IllegalArgumentException if {@code pattern} is null, or a proxy marker has no
     *                                  opening brace
     */
    public static RoutePattern parse(String pattern) {
        if (pattern == null) {
            throw new IllegalArgumentException("Route pattern must not be null");
        }
        if (!pattern.endsWith(GREEDY_SUFFIX)) {
            return new RoutePattern(pattern, false, pattern);
        }
        int braceStart = pattern.lastIndexOf('{');
        if (braceStart < 0) {
            throw new IllegalArgumentException("Proxy pattern without opening brace: " + pattern);
        }
        return new RoutePattern(pattern, true, pattern.substring(0, braceStart));
    }

    /**
     * Tests a request path (no query string) against this pattern.
     *
     * @param pathname the request path
     * @return {@code true} if the path is served by this pattern
     */
    public boolean matches(String pathname) {
        if (pathname == null) {
            return false;
        }
        if (!proxy) {
            return pathname.equals(pattern);
        }
        return pathname.startsWith(prefix) && !pathname.equals(prefix);
    }
}
