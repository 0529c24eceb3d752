package io.fakegateway.core.error;

/**
 * The OS could not start a worker process, its IPC channel failed while it was running, or the
 * function was already closed.
 */
public final class WorkerSpawnException extends GatewayException {

    private static final long serialVersionUID = 1L;

    public WorkerSpawnException(String message, String correlationId) {
        super(message, correlationId);
    }

    public WorkerSpawnException(String message, String correlationId, Throwable cause) {
        super(message, cause, correlationId);
    }
}
