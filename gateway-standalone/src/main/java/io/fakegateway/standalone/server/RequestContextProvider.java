package io.fakegateway.standalone.server;

import io.fakegateway.core.model.LambdaEvent;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Hook that supplies the {@code requestContext} of each event, standing in for the authorizer and
 * identity data a real gateway would attach.
 *
 * <p>
 * The returned value is converted to JSON with Jackson. A failed stage, or an exception thrown
 * by {@link #populate(LambdaEvent)}, fails the request with 500.
 */
@FunctionalInterface
public interface RequestContextProvider {

    /**
     * Computes the request context for an event.
     *
     * @param event the event as built from the HTTP request, with an empty request context
     * @return a stage completing with the context value
     */
    CompletionStage<?> populate(LambdaEvent event);

    /** Adapts a synchronous function into a provider whose stages are already complete. */
    static RequestContextProvider immediate(Function<LambdaEvent, ?> function) {
        return event -> CompletableFuture.completedFuture(function.apply(event));
    }
}
