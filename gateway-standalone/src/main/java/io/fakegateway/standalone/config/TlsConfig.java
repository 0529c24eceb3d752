package io.fakegateway.standalone.config;

/**
 * Inbound HTTPS listener configuration. The listener is started only when port, key and
 * certificate are all present.
 *
 * @param port    HTTPS port; {@code 0} picks an ephemeral port
 * @param keyPem  PKCS#8 private key in PEM form
 * @param certPem certificate chain in PEM form, leaf first
 */
public record TlsConfig(Integer port, String keyPem, String certPem) {

    /** No HTTPS listener. */
    public static final TlsConfig DISABLED = new TlsConfig(null, null, null);

    /** Whether an HTTPS listener should be started. */
    public boolean enabled() {
        return port != null && keyPem != null && certPem != null;
    }

    /** Whether some, but not all, of the settings are present. */
    boolean partial() {
        return !enabled() && (port != null || keyPem != null || certPem != null);
    }

    @Override
    public String toString() {
        // keep key material out of logs
        return "TlsConfig[port=" + port + ", keyPem=" + (keyPem != null ? "<set>" : null)
                + ", certPem=" + (certPem != null ? "<set>" : null) + "]";
    }
}
