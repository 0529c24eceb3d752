package io.fakegateway.standalone.server;

import io.fakegateway.core.model.LambdaResult;
import io.javalin.http.Context;
import jakarta.servlet.http.HttpServletResponse;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a {@link LambdaResult} to the client.
 *
 * <p>
 * Single-valued headers are applied first and multi-valued headers second, so a name present
 * in both ends up with the multi-valued list. Binary bodies are not supported: a result flagged
 * {@code isBase64Encoded} keeps its headers, but its status and body are replaced with 400 and
 * {@value LambdaResult#FORBIDDEN_BODY}.
 */
public final class ResponseWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseWriter.class);

    private ResponseWriter() {
        // utility class
    }

    /**
     * Populates the Javalin context with the result.
     *
     * @param ctx    the Javalin context
     * @param result the function or gateway result
     */
    public static void write(Context ctx, LambdaResult result) {
        result.headers().forEach(ctx::header);
        Map<String, List<String>> multiValueHeaders = result.multiValueHeaders();
        if (multiValueHeaders != null) {
            HttpServletResponse response = ctx.res();
            multiValueHeaders.forEach((name, values) -> {
                response.setHeader(name, null);
                values.forEach(value -> response.addHeader(name, value));
            });
        }

        if (result.isBase64Encoded()) {
            LOG.warn("Binary response bodies are not supported: {} {}", ctx.method(), ctx.path());
            ctx.status(400);
            ctx.result(LambdaResult.FORBIDDEN_BODY);
            return;
        }
        ctx.status(result.statusCode());
        ctx.result(result.body());
    }
}
