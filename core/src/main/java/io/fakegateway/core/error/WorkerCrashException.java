package io.fakegateway.core.error;

import java.util.List;

/**
 * A worker process exited before it delivered a result. Carries the first chunk the process wrote
 * to its error stream, which usually holds the handler's stack trace.
 */
public final class WorkerCrashException extends GatewayException {

    private static final long serialVersionUID = 1L;

    private final String capturedStderr;
    private final int exitCode;

    public WorkerCrashException(String message, String correlationId, String capturedStderr, int exitCode) {
        super(message, correlationId);
        this.capturedStderr = capturedStderr;
        this.exitCode = exitCode;
    }

    /** First chunk read from the worker's stderr, or {@code null} if it wrote nothing. */
    public String capturedStderr() {
        return capturedStderr;
    }

    public int exitCode() {
        return exitCode;
    }

    /** The captured stderr split on newlines; empty if nothing was captured. */
    public List<String> stackLines() {
        if (capturedStderr == null) {
            return List.of();
        }
        return List.of(capturedStderr.split("\n", -1));
    }
}
