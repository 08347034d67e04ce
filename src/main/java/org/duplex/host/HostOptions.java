package org.duplex.host;

import io.grpc.ServerInterceptor;
import io.grpc.ServerStreamTracer;
import org.duplex.host.discovery.NetworkInterfaceAddressResolver;
import org.duplex.host.gateway.TraceOption;
import org.duplex.host.spi.IDiscoveryRegistrar;
import org.duplex.host.spi.IHostAddressResolver;
import org.duplex.host.spi.ITraceInjector;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings of a {@link ServiceHost}. Built programmatically through {@link #builder()} or
 * from HOCON through {@link org.duplex.host.config.HostOptionsFactory}.
 */
public final class HostOptions {

    public static final int DEFAULT_PORT = 50051;
    public static final int DEFAULT_PROXY_PORT = 8080;
    public static final Duration DEFAULT_GATEWAY_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final String name;
    private final int port;
    private final int proxyPort;
    private final boolean enableGateway;
    private final List<ServerInterceptor> unaryInterceptors;
    private final List<ServerInterceptor> streamInterceptors;
    private final ServerStreamTracer.Factory statsHandler;
    private final TraceOption traceOption;
    private final ITraceInjector traceInjector;
    private final IDiscoveryRegistrar registrar;
    private final IHostAddressResolver addressResolver;
    private final Duration rpcShutdownDeadline;
    private final Duration gatewayShutdownTimeout;
    private final Duration gatewayCallTimeout;
    private final int gatewayMinThreads;
    private final int gatewayMaxThreads;
    private final int gatewayIdleTimeoutMs;

    private HostOptions(final Builder builder) {
        this.name = builder.name;
        this.port = builder.port;
        this.proxyPort = builder.proxyPort;
        this.enableGateway = builder.enableGateway;
        this.unaryInterceptors = List.copyOf(builder.unaryInterceptors);
        this.streamInterceptors = List.copyOf(builder.streamInterceptors);
        this.statsHandler = builder.statsHandler;
        this.traceOption = builder.traceOption;
        this.traceInjector = builder.traceInjector;
        this.registrar = builder.registrar;
        this.addressResolver = builder.addressResolver;
        this.rpcShutdownDeadline = builder.rpcShutdownDeadline;
        this.gatewayShutdownTimeout = builder.gatewayShutdownTimeout;
        this.gatewayCallTimeout = builder.gatewayCallTimeout;
        this.gatewayMinThreads = builder.gatewayMinThreads;
        this.gatewayMaxThreads = builder.gatewayMaxThreads;
        this.gatewayIdleTimeoutMs = builder.gatewayIdleTimeoutMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The name of the host, used for thread names.
     */
    public String getName() {
        return name;
    }

    public int getPort() {
        return port;
    }

    public int getProxyPort() {
        return proxyPort;
    }

    public boolean isGatewayEnabled() {
        return enableGateway;
    }

    public List<ServerInterceptor> getUnaryInterceptors() {
        return unaryInterceptors;
    }

    public List<ServerInterceptor> getStreamInterceptors() {
        return streamInterceptors;
    }

    public Optional<ServerStreamTracer.Factory> getStatsHandler() {
        return Optional.ofNullable(statsHandler);
    }

    public TraceOption getTraceOption() {
        return traceOption;
    }

    public ITraceInjector getTraceInjector() {
        return traceInjector;
    }

    public Optional<IDiscoveryRegistrar> getRegistrar() {
        return Optional.ofNullable(registrar);
    }

    public IHostAddressResolver getAddressResolver() {
        return addressResolver;
    }

    /**
     * @return The time the binary listener may take to drain before it is closed forcibly. Empty means
     * the drain is unbounded.
     */
    public Optional<Duration> getRpcShutdownDeadline() {
        return Optional.ofNullable(rpcShutdownDeadline);
    }

    public Duration getGatewayShutdownTimeout() {
        return gatewayShutdownTimeout;
    }

    /**
     * @return The deadline of transcoded gateway calls that carry no {@code Grpc-Timeout} header.
     * Empty means no deadline.
     */
    public Optional<Duration> getGatewayCallTimeout() {
        return Optional.ofNullable(gatewayCallTimeout);
    }

    public int getGatewayMinThreads() {
        return gatewayMinThreads;
    }

    public int getGatewayMaxThreads() {
        return gatewayMaxThreads;
    }

    public int getGatewayIdleTimeoutMs() {
        return gatewayIdleTimeoutMs;
    }

    /**
     * Fluent builder for {@link HostOptions}.
     */
    public static final class Builder {
        private String name = "duplex";
        private int port = DEFAULT_PORT;
        private int proxyPort = DEFAULT_PROXY_PORT;
        private boolean enableGateway = false;
        private final List<ServerInterceptor> unaryInterceptors = new ArrayList<>();
        private final List<ServerInterceptor> streamInterceptors = new ArrayList<>();
        private ServerStreamTracer.Factory statsHandler;
        private TraceOption traceOption = TraceOption.disabled();
        private ITraceInjector traceInjector = ITraceInjector.NOOP;
        private IDiscoveryRegistrar registrar;
        private IHostAddressResolver addressResolver = new NetworkInterfaceAddressResolver();
        private Duration rpcShutdownDeadline;
        private Duration gatewayShutdownTimeout = DEFAULT_GATEWAY_SHUTDOWN_TIMEOUT;
        private Duration gatewayCallTimeout;
        private int gatewayMinThreads = 8;
        private int gatewayMaxThreads = 200;
        private int gatewayIdleTimeoutMs = 60000;

        private Builder() {
        }

        public Builder name(final String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        /**
         * @param port The binary listen port; {@code 0} picks an ephemeral port.
         */
        public Builder port(final int port) {
            this.port = checkPort(port);
            return this;
        }

        /**
         * @param proxyPort The gateway listen port; {@code 0} picks an ephemeral port.
         */
        public Builder proxyPort(final int proxyPort) {
            this.proxyPort = checkPort(proxyPort);
            return this;
        }

        public Builder enableGateway(final boolean enableGateway) {
            this.enableGateway = enableGateway;
            return this;
        }

        public Builder unaryInterceptor(final ServerInterceptor interceptor) {
            unaryInterceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
            return this;
        }

        public Builder streamInterceptor(final ServerInterceptor interceptor) {
            streamInterceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
            return this;
        }

        public Builder statsHandler(final ServerStreamTracer.Factory statsHandler) {
            this.statsHandler = statsHandler;
            return this;
        }

        public Builder traceOption(final TraceOption traceOption) {
            this.traceOption = Objects.requireNonNull(traceOption, "traceOption");
            return this;
        }

        public Builder traceInjector(final ITraceInjector traceInjector) {
            this.traceInjector = Objects.requireNonNull(traceInjector, "traceInjector");
            return this;
        }

        public Builder registrar(final IDiscoveryRegistrar registrar) {
            this.registrar = registrar;
            return this;
        }

        public Builder addressResolver(final IHostAddressResolver addressResolver) {
            this.addressResolver = Objects.requireNonNull(addressResolver, "addressResolver");
            return this;
        }

        /**
         * @param deadline The drain deadline of the binary listener, or null for an unbounded drain.
         */
        public Builder rpcShutdownDeadline(final Duration deadline) {
            this.rpcShutdownDeadline = deadline == null || deadline.isZero() ? null : deadline;
            return this;
        }

        public Builder gatewayShutdownTimeout(final Duration timeout) {
            this.gatewayShutdownTimeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        /**
         * @param timeout The default deadline of transcoded gateway calls, or null for none.
         */
        public Builder gatewayCallTimeout(final Duration timeout) {
            this.gatewayCallTimeout = timeout == null || timeout.isZero() ? null : timeout;
            return this;
        }

        public Builder gatewayThreadPool(final int minThreads, final int maxThreads, final int idleTimeoutMs) {
            if (minThreads < 1 || maxThreads < minThreads) {
                throw new IllegalArgumentException("Invalid gateway thread pool bounds: min=" + minThreads + ", max=" + maxThreads);
            }
            this.gatewayMinThreads = minThreads;
            this.gatewayMaxThreads = maxThreads;
            this.gatewayIdleTimeoutMs = idleTimeoutMs;
            return this;
        }

        public HostOptions build() {
            return new HostOptions(this);
        }

        private static int checkPort(final int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            return port;
        }
    }
}
