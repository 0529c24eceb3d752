package io.fakegateway.core.dispatch;

import io.fakegateway.core.model.LambdaResult;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Requests that have been accepted but not yet answered, keyed by correlation id.
 *
 * <p>
 * Requests are served by a thread pool, so the map is concurrent. Each entry is resolved exactly
 * once: resolution removes it atomically, and a second resolution, or one for an id that was never
 * opened, is an invariant violation reported with {@link IllegalStateException}.
 */
public final class PendingRequests {

    private final ConcurrentMap<String, CompletableFuture<LambdaResult>> entries = new ConcurrentHashMap<>();

    /**
     * Records a new pending request.
     *
     * @param id a fresh correlation id
     * @return the response sink, completed by {@link #resolve(String, LambdaResult)}
     * @throws IllegalStateException if {@code id} is already pending
     */
    public CompletableFuture<LambdaResult> open(String id) {
        CompletableFuture<LambdaResult> sink = new CompletableFuture<>();
        if (entries.putIfAbsent(id, sink) != null) {
            throw new IllegalStateException("Duplicate correlation id: " + id);
        }
        return sink;
    }

    /**
     * Delivers the one result of a pending request and forgets it.
     *
     * @param id     the correlation id
     * @param result the result to deliver
     * @throws IllegalStateException if no request with this id is pending
     */
    public void resolve(String id, LambdaResult result) {
        CompletableFuture<LambdaResult> sink = entries.remove(id);
        if (sink == null) {
            throw new IllegalStateException("Response without request: " + id);
        }
        sink.complete(result);
    }

    public boolean contains(String id) {
        return entries.containsKey(id);
    }

    public int size() {
        return entries.size();
    }
}
