package io.fakegateway.core.error;

/**
 * A worker sent a message that violates the IPC contract: not a JSON object, wrong {@code type},
 * missing or foreign {@code id}, or a result that fails the shape check. The invocation is aborted;
 * malformed data is never coerced into a response.
 */
public final class IpcProtocolException extends GatewayException {

    private static final long serialVersionUID = 1L;

    public IpcProtocolException(String message, String correlationId) {
        super(message, correlationId);
    }

    public IpcProtocolException(String message, Throwable cause, String correlationId) {
        super(message, cause, correlationId);
    }
}
