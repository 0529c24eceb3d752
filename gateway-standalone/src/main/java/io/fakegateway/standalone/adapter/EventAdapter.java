package io.fakegateway.standalone.adapter;

import io.fakegateway.core.model.LambdaEvent;
import io.fakegateway.core.model.MultiValues;
import io.javalin.http.Context;
import jakarta.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link LambdaEvent} for a Javalin request.
 *
 * <p>
 * Header names keep the case the client sent. Every occurrence of a repeated header or query
 * parameter is kept for the multi-valued views; the single-valued views keep the first. The body
 * is read in full.
 */
public final class EventAdapter {

    /**
     * Converts the request.
     *
     * @param ctx the Javalin context
     * @return the event, with an empty request context
     */
    public LambdaEvent toEvent(Context ctx) {
        return LambdaEvent.fromRequest(
                ctx.method().name(),
                ctx.path(),
                headerPairs(ctx.req()),
                MultiValues.pairs(ctx.queryParamMap()),
                ctx.body());
    }

    /** Header pairs grouped by name, in the order the servlet container reports them. */
    static List<Map.Entry<String, String>> headerPairs(HttpServletRequest request) {
        List<Map.Entry<String, String>> pairs = new ArrayList<>();
        Enumeration<String> headerNames = request.getHeaderNames();
        if (headerNames == null) {
            return pairs;
        }
        while (headerNames.hasMoreElements()) {
            String name = headerNames.nextElement();
            Enumeration<String> values = request.getHeaders(name);
            if (values != null) {
                while (values.hasMoreElements()) {
                    pairs.add(Map.entry(name, values.nextElement()));
                }
            }
        }
        return pairs;
    }
}
