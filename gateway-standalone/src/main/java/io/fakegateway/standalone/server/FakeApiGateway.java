package io.fakegateway.standalone.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fakegateway.core.dispatch.Dispatcher;
import io.fakegateway.core.model.LambdaEvent;
import io.fakegateway.core.model.LambdaResult;
import io.fakegateway.core.worker.FunctionWorker;
import io.fakegateway.core.worker.LogSink;
import io.fakegateway.core.worker.WorkerBootstrap;
import io.fakegateway.core.worker.WorkerOptions;
import io.fakegateway.standalone.adapter.EventAdapter;
import io.fakegateway.standalone.config.ConfigException;
import io.fakegateway.standalone.config.FunctionConfig;
import io.fakegateway.standalone.config.GatewayConfig;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.eclipse.jetty.server.ServerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A local stand-in for an API gateway in front of Lambda-style functions.
 *
 * <p>
 * Lifecycle:
 * <ol>
 *   <li>construction writes the worker launcher and creates one {@link FunctionWorker} per
 *       configured function</li>
 *   <li>{@link #start()} binds the HTTP listener and, when configured, the HTTPS listener</li>
 *   <li>{@link #changePort(int)} rebinds both listeners without touching running workers</li>
 *   <li>{@link #close()} stops both listeners and kills every live worker process; nothing is
 *       spawned afterwards</li>
 * </ol>
 *
 * <p>
 * Every request on every path goes through {@link GatewayHandler}. Paths without a function are
 * answered with 403.
 */
public final class FakeApiGateway implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FakeApiGateway.class);

    /** Every HTTP method Javalin can route. Other tokens, such as {@code XMODIFY}, never reach a handler. */
    private static final List<HandlerType> METHODS = List.of(
            HandlerType.GET,
            HandlerType.POST,
            HandlerType.PUT,
            HandlerType.PATCH,
            HandlerType.DELETE,
            HandlerType.HEAD,
            HandlerType.TRACE,
            HandlerType.CONNECT,
            HandlerType.OPTIONS);

    private final GatewayConfig config;
    private final List<FunctionWorker> functions;
    private final Dispatcher dispatcher;
    private final GatewayHandler handler;

    private Javalin app;
    private volatile ServerConnector httpsConnector;

    /**
     * Prepares the gateway without binding any port.
     *
     * @param config validated configuration
     * @throws ConfigException if the worker launcher cannot be written
     */
    public FakeApiGateway(GatewayConfig config) {
        this.config = config;
        if (config.docker()) {
            LOG.warn("Container execution mode is not supported; functions run as local processes");
        }

        WorkerBootstrap bootstrap;
        try {
            bootstrap = WorkerBootstrap.materialize(config.tmp(), config.bin(), config.workerClasspath());
        } catch (UncheckedIOException e) {
            throw new ConfigException(e.getMessage(), e.getCause());
        }

        List<FunctionWorker> workers = new ArrayList<>();
        for (FunctionConfig function : config.functions()) {
            workers.add(new FunctionWorker(options(function, bootstrap)));
        }
        this.functions = List.copyOf(workers);
        this.dispatcher = new Dispatcher(functions);
        this.handler = new GatewayHandler(
                dispatcher,
                new EventAdapter(),
                config.enableCors(),
                config.requestContextProvider(),
                new ObjectMapper());
    }

    /**
     * Binds the listeners.
     *
     * @return {@code localhost:<port>} of the HTTP listener
     * @throws IllegalStateException if already started
     */
    public synchronized String start() {
        if (app != null) {
            throw new IllegalStateException("Gateway is already started");
        }
        long startTime = System.nanoTime();
        app = createApp();
        app.start(config.host(), config.port());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "fake-api-gateway started: http={}:{}, https={}, functions={}, cors={}, startupMs={}",
                config.host(),
                app.port(),
                httpsPort() >= 0 ? httpsPort() : "disabled",
                functions.size(),
                config.enableCors(),
                elapsedMs);
        return "localhost:" + app.port();
    }

    /**
     * Closes both listeners and binds them again, HTTP on {@code newPort}. In-flight invocations
     * and their worker processes are left alone.
     *
     * @param newPort the new HTTP port; {@code 0} picks an ephemeral port
     * @return {@code localhost:<port>} of the new HTTP listener
     */
    public synchronized String changePort(int newPort) {
        stopListeners();
        app = createApp();
        app.start(config.host(), newPort);
        LOG.info("fake-api-gateway moved to port {}", app.port());
        return "localhost:" + app.port();
    }

    /**
     * Stops both listeners, then closes every function: live worker processes are killed and no
     * new one is spawned, even for requests that were already past the listener. Returns once all
     * killed processes have exited.
     */
    @Override
    public synchronized void close() {
        stopListeners();
        List<CompletableFuture<Void>> exits = new ArrayList<>();
        for (FunctionWorker function : functions) {
            exits.add(function.closeAll());
        }
        CompletableFuture.allOf(exits.toArray(new CompletableFuture<?>[0])).join();
        LOG.info("fake-api-gateway stopped");
    }

    /**
     * Dispatches an event without going through HTTP.
     *
     * @param event the request event
     * @return completes with the result; never completes exceptionally
     */
    public CompletableFuture<LambdaResult> dispatch(LambdaEvent event) {
        return dispatcher.dispatch(event);
    }

    /** Whether a request with this correlation id is still waiting for its result. */
    public boolean hasPendingRequest(String id) {
        return dispatcher.hasPendingRequest(id);
    }

    /** Number of requests waiting for a result. */
    public int pendingCount() {
        return dispatcher.pendingCount();
    }

    /** The HTTP port, or {@code -1} if not listening. */
    public synchronized int port() {
        return app != null ? app.port() : -1;
    }

    /** The HTTPS port, or {@code -1} if HTTPS is disabled or not listening. */
    public int httpsPort() {
        ServerConnector connector = httpsConnector;
        if (connector == null || !connector.isRunning()) {
            return -1;
        }
        return connector.getLocalPort();
    }

    /** The supervisors of the registered functions, in match order. */
    public List<FunctionWorker> functions() {
        return functions;
    }

    public GatewayConfig config() {
        return config;
    }

    private Javalin createApp() {
        Javalin created = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            javalinConfig.http.maxRequestSize = Long.MAX_VALUE;
            javalinConfig.http.disableCompression();
            if (config.tls().enabled()) {
                TlsConfigurator.configureInboundTls(
                        javalinConfig, config.host(), config.tls(), connector -> httpsConnector = connector);
            }
        });
        for (HandlerType method : METHODS) {
            created.addHttpHandler(method, "/", handler);
            created.addHttpHandler(method, "/<path>", handler);
        }
        return created;
    }

    private void stopListeners() {
        if (app != null) {
            app.stop();
            app = null;
        }
        httpsConnector = null;
    }

    private WorkerOptions options(FunctionConfig function, WorkerBootstrap bootstrap) {
        Map<String, String> env = new LinkedHashMap<>(config.env());
        env.putAll(function.env());
        LogSink stdout = function.stdout() != null ? function.stdout() : defaultSink(LogSink.stdout());
        LogSink stderr = function.stderr() != null ? function.stderr() : defaultSink(LogSink.stderr());
        return new WorkerOptions(function.path(), function.entry(), function.handler(), env, stdout, stderr, bootstrap);
    }

    private LogSink defaultSink(LogSink sink) {
        return config.silent() ? LogSink.discard() : sink;
    }
}
