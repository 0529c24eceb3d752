package io.fakegateway.core.dispatch;

import io.fakegateway.core.model.LambdaEvent;
import io.fakegateway.core.model.LambdaResult;
import io.fakegateway.core.routing.PathRouter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Correlates HTTP requests with function invocations.
 *
 * <p>
 * {@link #dispatch(LambdaEvent)} assigns a fresh correlation id, records a pending entry,
 * routes the event and forwards it to the matched function. Whatever the invocation produces
 * (result, crash, spawn failure or protocol violation) is converted into exactly one
 * {@link LambdaResult} that resolves and removes the pending entry. Paths without a function are
 * answered with 403 without spawning anything.
 *
 * <p>
 * Thread-safe.
 */
public final class Dispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    private final List<? extends FunctionInvoker> functions;
    private final PendingRequests pending = new PendingRequests();

    /**
     * @param functions registered functions, in registration order
     */
    public Dispatcher(List<? extends FunctionInvoker> functions) {
        this.functions = List.copyOf(functions);
    }

    /**
     * Dispatches one request event.
     *
     * @param event the request event
     * @return completes with the result to write; never completes exceptionally
     */
    public CompletableFuture<LambdaResult> dispatch(LambdaEvent event) {
        String id = CorrelationIds.next();
        CompletableFuture<LambdaResult> response = pending.open(id);

        Optional<? extends FunctionInvoker> matched = PathRouter.match(functions, event.pathname());
        if (matched.isEmpty()) {
            LOG.debug("{} {} -> no function ({})", event.httpMethod(), event.pathname(), id);
            deliver(id, LambdaResult.forbidden());
            return response;
        }

        FunctionInvoker function = matched.get();
        LOG.debug("{} {} -> {} ({})", event.httpMethod(), event.pathname(), function.path(), id);
        CompletableFuture<LambdaResult> invocation;
        try {
            invocation = function.invoke(id, event);
        } catch (RuntimeException e) {
            invocation = CompletableFuture.failedFuture(e);
        }
        invocation.whenComplete((result, failure) -> complete(id, result, failure));
        return response;
    }

    /**
     * Resolves the pending request {@code id}.
     *
     * @param id     correlation id
     * @param result result to deliver
     * @throws IllegalStateException if {@code id} is not pending
     */
    public void deliver(String id, LambdaResult result) {
        pending.resolve(id, result);
    }

    /** Whether a request with this id is still waiting for its result. */
    public boolean hasPendingRequest(String id) {
        return pending.contains(id);
    }

    /** Number of requests waiting for a result. */
    public int pendingCount() {
        return pending.size();
    }

    private void complete(String id, LambdaResult result, Throwable failure) {
        LambdaResult response;
        if (failure == null) {
            response = result;
        } else {
            LOG.warn("Invocation {} failed: {}", id, FailureResponses.unwrap(failure).getMessage());
            response = FailureResponses.from(failure);
        }
        try {
            deliver(id, response);
        } catch (IllegalStateException e) {
            LOG.error("Invariant violated for {}: {}", id, e.getMessage());
            Thread thread = Thread.currentThread();
            thread.getUncaughtExceptionHandler().uncaughtException(thread, e);
        }
    }
}
