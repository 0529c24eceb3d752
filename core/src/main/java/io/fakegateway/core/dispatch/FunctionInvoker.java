package io.fakegateway.core.dispatch;

import io.fakegateway.core.model.LambdaEvent;
import io.fakegateway.core.model.LambdaResult;
import io.fakegateway.core.routing.RoutedFunction;
import java.util.concurrent.CompletableFuture;

/** A routed function the {@link Dispatcher} can hand events to. */
public interface FunctionInvoker extends RoutedFunction {

    /**
     * Runs one invocation.
     *
     * @param id    correlation id of the request
     * @param event the request event
     * @return completes once, with the result or with the failure that prevented one
     */
    CompletableFuture<LambdaResult> invoke(String id, LambdaEvent event);
}
