package io.fakegateway.standalone.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fakegateway.core.dispatch.Dispatcher;
import io.fakegateway.core.model.LambdaEvent;
import io.fakegateway.core.model.LambdaResult;
import io.fakegateway.standalone.adapter.EventAdapter;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.javalin.http.HandlerType;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves every request the gateway receives, on every path and method.
 *
 * <p>
 * Per request, in order:
 * <ol>
 *   <li>CORS headers, when enabled; {@code OPTIONS} is answered right away with an empty 200</li>
 *   <li>{@link SecurityChecks}; a rejection is answered with 403 and nothing is spawned</li>
 *   <li>build the event from the fully buffered request ({@link EventAdapter})</li>
 *   <li>run the {@link RequestContextProvider}, if any, and attach its value</li>
 *   <li>hand the event to the {@link Dispatcher} and release the request thread</li>
 *   <li>write the result ({@link ResponseWriter})</li>
 * </ol>
 *
 * <p>
 * Thread-safe: all per-request state is local to {@link #handle(Context)}.
 */
public final class GatewayHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(GatewayHandler.class);

    private final Dispatcher dispatcher;
    private final EventAdapter adapter;
    private final boolean enableCors;
    private final RequestContextProvider requestContextProvider;
    private final ObjectMapper mapper;

    /**
     * @param dispatcher             routes events to functions
     * @param adapter                builds events from Javalin requests
     * @param enableCors             write CORS headers and skip the Referer check
     * @param requestContextProvider optional request-context hook, may be {@code null}
     * @param mapper                 converts request-context values to JSON
     */
    public GatewayHandler(
            Dispatcher dispatcher,
            EventAdapter adapter,
            boolean enableCors,
            RequestContextProvider requestContextProvider,
            ObjectMapper mapper) {
        this.dispatcher = dispatcher;
        this.adapter = adapter;
        this.enableCors = enableCors;
        this.requestContextProvider = requestContextProvider;
        this.mapper = mapper;
    }

    @Override
    public void handle(Context ctx) {
        if (enableCors) {
            CorsHeaders.apply(ctx);
            if (ctx.method() == HandlerType.OPTIONS) {
                ctx.status(200);
                return;
            }
        }

        Optional<String> rejection = SecurityChecks.reject(ctx.header("Referer"), ctx.header("Host"), enableCors);
        if (rejection.isPresent()) {
            LOG.warn("Rejected {} {}: {}", ctx.method(), ctx.path(), rejection.get());
            ctx.status(403);
            ctx.contentType("application/json");
            ctx.result(ErrorBodies.message(rejection.get()));
            return;
        }

        LambdaEvent event = adapter.toEvent(ctx);
        CompletableFuture<LambdaResult> response = withRequestContext(event)
                .handle((enriched, failure) -> failure == null
                        ? dispatcher.dispatch(enriched)
                        : CompletableFuture.completedFuture(contextFailure(event, failure)))
                .thenCompose(Function.identity());
        ctx.future(() -> response.thenAccept(result -> ResponseWriter.write(ctx, result)));
    }

    private CompletableFuture<LambdaEvent> withRequestContext(LambdaEvent event) {
        if (requestContextProvider == null) {
            return CompletableFuture.completedFuture(event);
        }
        CompletionStage<?> stage;
        try {
            stage = requestContextProvider.populate(event);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Request context provider returned no stage"));
        }
        return stage.toCompletableFuture().thenApply(value -> event.withRequestContext(mapper.valueToTree(value)));
    }

    private static LambdaResult contextFailure(LambdaEvent event, Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        LOG.error("Request context provider failed for {} {}", event.httpMethod(), event.path(), cause);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return LambdaResult.of(500, Map.of(), ErrorBodies.message(message));
    }
}
