package io.fakegateway.core.worker;

import io.fakegateway.core.dispatch.FunctionInvoker;
import io.fakegateway.core.error.IpcProtocolException;
import io.fakegateway.core.error.WorkerCrashException;
import io.fakegateway.core.error.WorkerSpawnException;
import io.fakegateway.core.ipc.IpcChannel;
import io.fakegateway.core.ipc.IpcCodec;
import io.fakegateway.core.ipc.ResultMessage;
import io.fakegateway.core.model.LambdaEvent;
import io.fakegateway.core.model.LambdaResult;
import java.io.IOException;
import java.net.ServerSocket;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supervises the worker processes of one registered function.
 *
 * <p>
 * Every {@link #invoke(String, LambdaEvent)} spawns a fresh JVM through the
 * {@link WorkerBootstrap}, sends it one event over an {@link IpcChannel} and waits for exactly one
 * terminal signal:
 *
 * <ul>
 *   <li>a valid result message: the invocation resolves and the process is killed
 *   <li>process exit before a result: {@link WorkerCrashException} with the first stderr chunk
 *   <li>spawn or channel failure: {@link WorkerSpawnException}
 *   <li>a malformed message: {@link IpcProtocolException}, logged at ERROR, process killed
 * </ul>
 *
 * <p>
 * Processes are never reused. Live processes are tracked only so that {@link #closeAll()} can
 * kill them. No invocation timeout is enforced: a worker that neither answers nor exits keeps its
 * invocation pending until {@link #closeAll()}. Once closed, the function spawns nothing more and
 * fails new invocations with {@link WorkerSpawnException}.
 *
 * <p>
 * Thread-safe.
 */
public final class FunctionWorker implements FunctionInvoker {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionWorker.class);

    /** How long the exit handler waits for the channel and stderr to drain after the process ended. */
    private static final long EXIT_DRAIN_MS = 2000;

    private final WorkerOptions options;
    private final IpcCodec codec = new IpcCodec();
    private final Set<WorkerProcess> processes = ConcurrentHashMap.newKeySet();
    private final ExecutorService executor;
    private volatile boolean closed;

    public FunctionWorker(WorkerOptions options) {
        this.options = options;
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory("fn" + options.path() + "-"));
    }

    @Override
    public String path() {
        return options.path();
    }

    public WorkerOptions options() {
        return options;
    }

    /** Number of processes currently alive for this function. */
    public int trackedProcessCount() {
        return processes.size();
    }

    @Override
    public CompletableFuture<LambdaResult> invoke(String id, LambdaEvent event) {
        CompletableFuture<LambdaResult> outcome = new CompletableFuture<>();
        if (closed) {
            outcome.completeExceptionally(
                    new WorkerSpawnException("Function " + options.path() + " is closed", id));
            return outcome;
        }
        options.stdout().write(LambdaLogLines.start(id));
        long startNanos = System.nanoTime();
        Instant startedAt = Instant.now();

        ServerSocket listener;
        try {
            listener = IpcChannel.listen();
        } catch (IOException e) {
            outcome.completeExceptionally(
                    new WorkerSpawnException("Could not open IPC channel: " + e.getMessage(), id, e));
            return outcome;
        }

        Process process;
        try {
            process = spawn(listener.getLocalPort());
        } catch (IOException e) {
            closeListener(listener, id);
            LOG.warn("Could not spawn worker for {} ({}): {}", options.path(), id, e.getMessage());
            outcome.completeExceptionally(
                    new WorkerSpawnException("Could not spawn worker: " + e.getMessage(), id, e));
            return outcome;
        }

        WorkerProcess worker = new WorkerProcess(id, process, listener, startedAt, outcome);
        processes.add(worker);
        if (closed) {
            // closeAll() ran between the first check and registration
            processes.remove(worker);
            process.destroyForcibly();
            closeListener(listener, id);
            outcome.completeExceptionally(
                    new WorkerSpawnException("Function " + options.path() + " is closed", id));
            return outcome;
        }
        LOG.debug("Spawned worker pid={} for {} ({})", process.pid(), options.path(), id);

        StreamPump stdoutPump = new StreamPump(process.getInputStream(), options.stdout(), id, "INFO");
        StreamPump stderrPump = new StreamPump(process.getErrorStream(), options.stderr(), id, "ERR");
        executor.execute(stdoutPump);
        executor.execute(stderrPump);

        CompletableFuture<Void> exchange =
                CompletableFuture.runAsync(() -> exchange(worker, event, outcome, startNanos), executor);
        process.onExit().thenRunAsync(() -> onExit(worker, exchange, stderrPump, outcome), executor);
        outcome.whenComplete((result, error) -> release(worker));
        return outcome;
    }

    /**
     * Closes this function: no further process is spawned, and every live process, in flight or
     * not, is killed and forgotten. The pump and exchange threads are released once the killed
     * invocations have settled. Calling it again is harmless.
     *
     * @return completes once all killed processes have exited and their invocations have settled
     */
    public CompletableFuture<Void> closeAll() {
        closed = true;
        List<WorkerProcess> snapshot = new ArrayList<>(processes);
        processes.clear();
        List<CompletableFuture<?>> settled = new ArrayList<>();
        for (WorkerProcess worker : snapshot) {
            worker.process().destroyForcibly();
            closeListener(worker.listener(), worker.correlationId());
            settled.add(worker.process().onExit());
            settled.add(worker.outcome().handle((result, failure) -> null));
        }
        if (!snapshot.isEmpty()) {
            LOG.info("Killed {} worker process(es) for {}", snapshot.size(), options.path());
        }
        return CompletableFuture.allOf(settled.toArray(new CompletableFuture<?>[0]))
                .whenComplete((ignored, failure) -> executor.shutdown());
    }

    /** Whether {@link #closeAll()} has been called. */
    public boolean isClosed() {
        return closed;
    }

    private Process spawn(int ipcPort) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(options.bootstrap().command(options.entry(), options.handler()));
        Map<String, String> environment = builder.environment();
        environment.clear();
        environment.putAll(options.env());
        environment.put(IpcChannel.PORT_ENV, Integer.toString(ipcPort));
        return builder.start();
    }

    private void exchange(
            WorkerProcess worker, LambdaEvent event, CompletableFuture<LambdaResult> outcome, long startNanos) {
        String id = worker.correlationId();
        try (IpcChannel channel = IpcChannel.accept(worker.listener())) {
            channel.send(codec.encodeEvent(id, event));
            String line = channel.receive();
            if (line == null) {
                // closed without a result; the exit handler decides the outcome
                return;
            }
            ResultMessage message = codec.decodeResult(line, id);
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            options.stdout()
                    .write(LambdaLogLines.end(id)
                            + LambdaLogLines.report(id, durationMs, message.memoryUsedBytes()));
            outcome.complete(message.result());
        } catch (IpcProtocolException e) {
            LOG.error("Protocol violation by worker for {} ({}): {}", options.path(), id, e.getMessage());
            outcome.completeExceptionally(e);
        } catch (IOException e) {
            if (worker.process().isAlive() && !outcome.isDone()) {
                LOG.warn("IPC channel failed for {} ({}): {}", options.path(), id, e.getMessage());
                outcome.completeExceptionally(new WorkerSpawnException("IPC channel failed: " + e.getMessage(), id, e));
            } else {
                LOG.debug("IPC channel closed for {} ({}): {}", options.path(), id, e.getMessage());
            }
        }
    }

    private void onExit(
            WorkerProcess worker,
            CompletableFuture<Void> exchange,
            StreamPump stderrPump,
            CompletableFuture<LambdaResult> outcome) {
        String id = worker.correlationId();
        // a worker that died before connecting leaves accept() blocked
        closeListener(worker.listener(), id);
        awaitDrain(exchange, id);
        awaitDrain(stderrPump.drained(), id);
        if (outcome.isDone()) {
            return;
        }

        int exitCode = worker.process().exitValue();
        String stderr = stderrPump.firstChunk().getNow(null);
        WorkerCrashException crash;
        if (exitCode != 0) {
            crash = new WorkerCrashException("Internal Server Error", id, stderr, exitCode);
        } else {
            crash = new WorkerCrashException("Worker exited without sending a result", id, stderr, exitCode);
        }
        options.stdout().write(LambdaLogLines.error(worker.startedAt(), id, crash.stackLines()));
        LOG.warn("Worker for {} ({}) exited with code {} before sending a result", options.path(), id, exitCode);
        outcome.completeExceptionally(crash);
    }

    private void release(WorkerProcess worker) {
        processes.remove(worker);
        worker.process().destroyForcibly();
        closeListener(worker.listener(), worker.correlationId());
    }

    private static void awaitDrain(CompletableFuture<?> future, String id) {
        try {
            future.get(EXIT_DRAIN_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.debug("Worker output for {} still open {} ms after exit", id, EXIT_DRAIN_MS);
        } catch (ExecutionException e) {
            LOG.debug("Worker exchange for {} failed: {}", id, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeListener(ServerSocket listener, String id) {
        try {
            listener.close();
        } catch (IOException e) {
            LOG.debug("Could not close IPC listener for {}: {}", id, e.getMessage());
        }
    }
}
