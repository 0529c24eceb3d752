package io.fakegateway.standalone.server;

import io.javalin.http.Context;

/** Permissive CORS headers written on every response when CORS is enabled. */
final class CorsHeaders {

    static final String ALLOW_METHODS = "POST, GET, PUT, DELETE, OPTIONS, XMODIFY";
    static final String ALLOW_HEADERS =
            "X-Requested-With, X-HTTP-Method-Override, Content-Type, Accept, Authorization";
    static final String MAX_AGE = "86400";

    private CorsHeaders() {
        // utility class
    }

    /** Echoes the request {@code Origin}, or allows any origin when there is none. */
    static void apply(Context ctx) {
        String origin = ctx.header("Origin");
        ctx.header("Access-Control-Allow-Origin", origin != null ? origin : "*");
        ctx.header("Access-Control-Allow-Methods", ALLOW_METHODS);
        ctx.header("Access-Control-Allow-Credentials", "true");
        ctx.header("Access-Control-Max-Age", MAX_AGE);
        ctx.header("Access-Control-Allow-Headers", ALLOW_HEADERS);
    }
}
