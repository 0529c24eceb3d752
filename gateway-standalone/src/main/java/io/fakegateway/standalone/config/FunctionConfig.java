package io.fakegateway.standalone.config;

import io.fakegateway.core.worker.LogSink;
import java.util.Map;

/**
 * One registered function.
 *
 * @param path    route pattern, exact ({@code /hello}) or proxy ({@code /api/{proxy+}})
 * @param entry   fully qualified name of the handler class
 * @param handler public one-argument method on {@code entry}
 * @param env     variables added on top of the gateway-wide environment
 * @param stdout  sink for the function's stdout and lifecycle lines, or {@code null} for the
 *                gateway default
 * @param stderr  sink for the function's stderr, or {@code null} for the gateway default
 */
public record FunctionConfig(
        String path, String entry, String handler, Map<String, String> env, LogSink stdout, LogSink stderr) {

    /** Handler method used when none is given. */
    public static final String DEFAULT_HANDLER = "handler";

    public FunctionConfig {
        handler = handler != null ? handler : DEFAULT_HANDLER;
        env = env != null ? Map.copyOf(env) : Map.of();
    }

    /** A function using the default handler method, environment and sinks. */
    public static FunctionConfig of(String path, String entry) {
        return new FunctionConfig(path, entry, DEFAULT_HANDLER, Map.of(), null, null);
    }

    /** A function using the default environment and sinks. */
    public static FunctionConfig of(String path, String entry, String handler) {
        return new FunctionConfig(path, entry, handler, Map.of(), null, null);
    }

    /** Returns a copy with the given extra environment. */
    public FunctionConfig withEnv(Map<String, String> env) {
        return new FunctionConfig(path, entry, handler, env, stdout, stderr);
    }

    /** Returns a copy writing its output to the given sinks. */
    public FunctionConfig withSinks(LogSink stdout, LogSink stderr) {
        return new FunctionConfig(path, entry, handler, env, stdout, stderr);
    }
}
