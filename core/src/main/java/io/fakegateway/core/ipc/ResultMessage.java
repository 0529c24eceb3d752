package io.fakegateway.core.ipc;

import io.fakegateway.core.model.LambdaResult;

/**
 * Inbound message: the single result a worker process reports before it is terminated.
 *
 * @param id              correlation id of the event being answered
 * @param result          the shape-checked result
 * @param memoryUsedBytes heap in use by the worker when it answered
 */
public record ResultMessage(String id, LambdaResult result, long memoryUsedBytes) {}
