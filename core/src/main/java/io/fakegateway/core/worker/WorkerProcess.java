package io.fakegateway.core.worker;

import io.fakegateway.core.model.LambdaResult;
import java.net.ServerSocket;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * One live worker process, serving exactly one invocation.
 *
 * @param correlationId the invocation it serves
 * @param process       the OS process
 * @param listener      IPC listener the process connects back to
 * @param startedAt     spawn time
 * @param outcome       settles once with the invocation's result or failure
 */
record WorkerProcess(
        String correlationId,
        Process process,
        ServerSocket listener,
        Instant startedAt,
        CompletableFuture<LambdaResult> outcome) {}
