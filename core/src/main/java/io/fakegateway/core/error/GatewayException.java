package io.fakegateway.core.error;

/**
 * Abstract base for failures of a single function invocation. Never thrown directly: use
 * {@link WorkerCrashException}, {@link WorkerSpawnException} or {@link IpcProtocolException}.
 *
 * <p>
 * These never escape to the HTTP client as exceptions. The dispatcher translates every
 * subclass into a synthesized 500 result carrying the message.
 */
public abstract class GatewayException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String correlationId;

    protected GatewayException(String message, String correlationId) {
        super(message);
        this.correlationId = correlationId;
    }

    protected GatewayException(String message, Throwable cause, String correlationId) {
        super(message, cause);
        this.correlationId = correlationId;
    }

    /** The invocation that failed, or {@code null} if not yet assigned. */
    public String correlationId() {
        return correlationId;
    }
}
