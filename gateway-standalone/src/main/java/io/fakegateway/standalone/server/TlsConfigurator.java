package io.fakegateway.standalone.server;

import io.fakegateway.standalone.config.TlsConfig;
import io.javalin.config.JavalinConfig;
import java.security.KeyStore;
import java.util.UUID;
import java.util.function.Consumer;
import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.SecureRequestCustomizer;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.SslConnectionFactory;
import org.eclipse.jetty.util.ssl.SslContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds the HTTPS listener to Javalin's embedded Jetty. Uses Jetty 11's
 * {@link SslContextFactory.Server} with a key store built in memory from the configured PEM text.
 */
final class TlsConfigurator {

    private static final Logger LOG = LoggerFactory.getLogger(TlsConfigurator.class);

    private TlsConfigurator() {}

    /**
     * Registers an HTTPS {@link ServerConnector} serving the same handlers as the HTTP listener.
     *
     * @param javalinConfig the Javalin configuration to modify
     * @param host          bind address
     * @param tlsConfig     an enabled TLS configuration
     * @param onCreated     receives the connector once Jetty creates it
     */
    static void configureInboundTls(
            JavalinConfig javalinConfig, String host, TlsConfig tlsConfig, Consumer<ServerConnector> onCreated) {
        String password = UUID.randomUUID().toString();
        KeyStore keyStore = PemKeyStores.keyStore(tlsConfig.keyPem(), tlsConfig.certPem(), password.toCharArray());

        javalinConfig.jetty.addConnector((server, httpConfig) -> {
            SslContextFactory.Server sslContextFactory = new SslContextFactory.Server();
            sslContextFactory.setKeyStore(keyStore);
            sslContextFactory.setKeyStorePassword(password);

            HttpConfiguration httpsConfig = new HttpConfiguration(httpConfig);
            httpsConfig.addCustomizer(new SecureRequestCustomizer());

            ServerConnector sslConnector = new ServerConnector(
                    server,
                    new SslConnectionFactory(sslContextFactory, "http/1.1"),
                    new HttpConnectionFactory(httpsConfig));
            sslConnector.setHost(host);
            sslConnector.setPort(tlsConfig.port());

            LOG.info("Inbound TLS configured: host={}, port={}", host, tlsConfig.port());
            onCreated.accept(sslConnector);
            return sslConnector;
        });
    }
}
