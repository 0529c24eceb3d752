package io.fakegateway.standalone.config;

import io.fakegateway.core.routing.RoutePattern;
import io.fakegateway.standalone.server.RequestContextProvider;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Root configuration of a {@link io.fakegateway.standalone.server.FakeApiGateway}.
 *
 * <p>
 * All fields have defaults. Use {@link #builder()} to construct instances; {@link
 * Builder#build()} validates the combination and throws {@link ConfigException}.
 *
 * @param host                   bind address of the HTTP and HTTPS listeners
 * @param port                   HTTP port; {@code 0} picks an ephemeral port
 * @param tls                    HTTPS listener, {@link TlsConfig#DISABLED} by default
 * @param env                    environment given to every worker; the gateway's own environment
 *                               is never inherited
 * @param bin                    {@code java} executable workers run on
 * @param workerClasspath        classpath of worker JVMs: the worker runtime plus function classes
 * @param functions              registered functions, in match order
 * @param enableCors             answer with permissive CORS headers and accept any Referer
 * @param silent                 discard function output unless a function has its own sinks
 * @param requestContextProvider optional hook filling {@code requestContext}; may be {@code null}
 * @param tmp                    directory holding the worker launcher
 * @param docker                 container execution mode; accepted but not supported
 */
public record GatewayConfig(
        String host,
        int port,
        TlsConfig tls,
        Map<String, String> env,
        Path bin,
        String workerClasspath,
        List<FunctionConfig> functions,
        boolean enableCors,
        boolean silent,
        RequestContextProvider requestContextProvider,
        Path tmp,
        boolean docker) {

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link GatewayConfig}. */
    public static final class Builder {
        private String host = "localhost";
        private int port = 0;
        private TlsConfig tls = TlsConfig.DISABLED;
        private Map<String, String> env = Map.of();
        private Path bin;
        private String workerClasspath;
        private Map<String, String> routes;
        private List<FunctionConfig> functions;
        private boolean enableCors;
        private boolean silent;
        private RequestContextProvider requestContextProvider;
        private Path tmp;
        private boolean docker;

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder tls(TlsConfig tls) {
            this.tls = tls;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder bin(Path bin) {
            this.bin = bin;
            return this;
        }

        public Builder workerClasspath(String workerClasspath) {
            this.workerClasspath = workerClasspath;
            return this;
        }

        /**
         * Registers functions as {@code path -> entry} pairs using the default handler method.
         * Iteration order of the map is the match order. Cannot be combined with {@link
         * #functions(List)}.
         */
        public Builder routes(Map<String, String> routes) {
            this.routes = routes;
            return this;
        }

        /** Registers functions in match order. Cannot be combined with {@link #routes(Map)}. */
        public Builder functions(List<FunctionConfig> functions) {
            this.functions = functions;
            return this;
        }

        /** Appends one function. */
        public Builder function(FunctionConfig function) {
            if (this.functions == null) {
                this.functions = new ArrayList<>();
            } else if (!(this.functions instanceof ArrayList)) {
                this.functions = new ArrayList<>(this.functions);
            }
            this.functions.add(function);
            return this;
        }

        public Builder enableCors(boolean enableCors) {
            this.enableCors = enableCors;
            return this;
        }

        public Builder silent(boolean silent) {
            this.silent = silent;
            return this;
        }

        public Builder requestContextProvider(RequestContextProvider requestContextProvider) {
            this.requestContextProvider = requestContextProvider;
            return this;
        }

        public Builder tmp(Path tmp) {
            this.tmp = tmp;
            return this;
        }

        public Builder docker(boolean docker) {
            this.docker = docker;
            return this;
        }

        /**
         * Validates and builds the configuration.
         *
         * @throws ConfigException if a value or combination is invalid
         */
        public GatewayConfig build() {
            if (host == null || host.isBlank()) {
                throw new ConfigException("host must not be blank");
            }
            requirePort("port", port);
            TlsConfig effectiveTls = tls != null ? tls : TlsConfig.DISABLED;
            if (effectiveTls.partial()) {
                throw new ConfigException("tls requires port, keyPem and certPem together: " + effectiveTls);
            }
            if (effectiveTls.enabled()) {
                requirePort("tls.port", effectiveTls.port());
            }
            if (routes != null && functions != null) {
                throw new ConfigException("Configure either routes or functions, not both");
            }

            List<FunctionConfig> table = new ArrayList<>();
            if (routes != null) {
                routes.forEach((path, entry) -> table.add(FunctionConfig.of(path, entry)));
            } else if (functions != null) {
                table.addAll(functions);
            }
            table.forEach(Builder::validate);

            return new GatewayConfig(
                    host,
                    port,
                    effectiveTls,
                    env != null ? Map.copyOf(env) : Map.of(),
                    bin != null ? bin : Path.of(System.getProperty("java.home"), "bin", "java"),
                    workerClasspath != null ? workerClasspath : System.getProperty("java.class.path"),
                    List.copyOf(table),
                    enableCors,
                    silent,
                    requestContextProvider,
                    tmp != null ? tmp : Path.of(System.getProperty("java.io.tmpdir")),
                    docker);
        }

        private static void requirePort(String name, int value) {
            if (value < 0 || value > 65535) {
                throw new ConfigException(name + " must be between 0 and 65535, got " + value);
            }
        }

        private static void validate(FunctionConfig function) {
            if (function == null) {
                throw new ConfigException("functions must not contain null");
            }
            if (function.path() == null || !function.path().startsWith("/")) {
                throw new ConfigException("Function path must start with '/': " + function.path());
            }
            if (function.entry() == null || function.entry().isBlank()) {
                throw new ConfigException("Function " + function.path() + " has no entry");
            }
            if (function.handler().isBlank()) {
                throw new ConfigException("Function " + function.path() + " has a blank handler");
            }
            try {
                RoutePattern.parse(function.path());
            } catch (IllegalArgumentException e) {
                throw new ConfigException(e.getMessage(), e);
            }
        }
    }
}
