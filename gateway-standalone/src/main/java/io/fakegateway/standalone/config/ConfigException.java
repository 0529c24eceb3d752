package io.fakegateway.standalone.config;

/**
 * Thrown when a gateway configuration is invalid or cannot be applied: bad ports, conflicting
 * function tables, incomplete TLS settings, unreadable PEM material. The message is suitable for
 * startup error output.
 */
public class ConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
