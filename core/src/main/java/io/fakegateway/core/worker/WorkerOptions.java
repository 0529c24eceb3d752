package io.fakegateway.core.worker;

import java.util.Map;
import java.util.Objects;

/**
 * Static configuration of one function's supervisor.
 *
 * @param path      route pattern the function is registered under
 * @param entry     fully qualified class name of the handler
 * @param handler   public method on {@code entry} that handles one event
 * @param env       the complete environment of each worker process
 * @param stdout    destination for the worker's stdout and lifecycle lines
 * @param stderr    destination for the worker's stderr
 * @param bootstrap the materialized launcher
 */
public record WorkerOptions(
        String path,
        String entry,
        String handler,
        Map<String, String> env,
        LogSink stdout,
        LogSink stderr,
        WorkerBootstrap bootstrap) {

    public WorkerOptions {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(bootstrap, "bootstrap");
        env = env != null ? Map.copyOf(env) : Map.of();
        stdout = stdout != null ? stdout : LogSink.stdout();
        stderr = stderr != null ? stderr : LogSink.stderr();
    }
}
