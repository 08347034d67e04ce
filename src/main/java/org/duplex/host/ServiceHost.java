package org.duplex.host;

import io.grpc.Context;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.InsecureServerCredentials;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import org.duplex.host.discovery.DiscoveryException;
import org.duplex.host.discovery.Node;
import org.duplex.host.discovery.Protocol;
import org.duplex.host.gateway.GatewayBridge;
import org.duplex.host.interceptors.MethodTypeInterceptor;
import org.duplex.host.spi.IDiscoveryRegistrar;
import org.duplex.host.spi.IService;
import org.duplex.host.spi.ServiceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hosts a set of services on a gRPC listener and, optionally, mirrors them on an HTTP gateway that
 * calls back into the gRPC listener over a loopback channel. Startup, discovery registration and
 * graceful shutdown of both listeners are coordinated as one unit by {@link #run(Context)}.
 *
 * <p>Lifecycle: services are registered while the host is {@link HostPhase#CREATED} or
 * {@link HostPhase#CONFIGURED}. {@code run} moves the host to {@link HostPhase#RUNNING}, after which
 * the service list is frozen. Cancelling the context moves it to {@link HostPhase#DRAINING}; once both
 * listeners have terminated it is {@link HostPhase#STOPPED}. A host runs at most once.</p>
 *
 * <p>Discovery ordering: a transport's nodes are submitted right after its listener has bound, while
 * it is already accepting. Consumers may therefore see a node slightly before the first request is
 * served, never before the socket exists.</p>
 */
public final class ServiceHost {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServiceHost.class);
    private static final String LOOPBACK_HOST = "127.0.0.1";
    private static final Duration LOOPBACK_CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final HostOptions options;
    private final Object lock = new Object();
    private final AtomicReference<HostPhase> phase = new AtomicReference<>(HostPhase.CREATED);
    private final List<IService> services = new ArrayList<>();
    private final List<ServiceDescriptor> descriptors = new ArrayList<>();
    private final AtomicBoolean rpcStopRequested = new AtomicBoolean(false);
    private final AtomicBoolean gatewayStopRequested = new AtomicBoolean(false);

    private volatile String advertisedHost;
    private volatile int rpcPort = -1;
    private volatile int gatewayPort = -1;

    /**
     * @param options The settings of this host.
     */
    public ServiceHost(final HostOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Registers a service. Its descriptor is captured now and is what the listeners will serve.
     *
     * @param service The service to host.
     * @throws ConfigurationException if the descriptor is invalid or has no method bindings.
     * @throws HostPhaseException     if the host has already been run.
     */
    public void register(final IService service) throws ConfigurationException {
        Objects.requireNonNull(service, "service");
        final ServiceDescriptor descriptor = service.describe();
        final String name = descriptor.name();

        synchronized (lock) {
            final HostPhase current = phase.get();
            if (!current.acceptsRegistration()) {
                throw new HostPhaseException("register service '" + name + "'", current);
            }
            if (!descriptor.valid()) {
                throw new ConfigurationException(ConfigurationException.Reason.INVALID_DESCRIPTOR, name,
                    "Service '" + name + "' has an invalid descriptor");
            }
            if (descriptor.methodBindings().isEmpty()) {
                throw new ConfigurationException(ConfigurationException.Reason.NO_METHOD_BINDINGS, name,
                    "Service '" + name + "' has no gRPC method bindings");
            }
            services.add(service);
            descriptors.add(descriptor);
            phase.set(HostPhase.CONFIGURED);
        }
        LOGGER.debug("Registered service '{}' with {} method binding(s) and {} gateway binding(s)",
            name, descriptor.methodBindings().size(), descriptor.gatewayBindings().size());
    }

    /**
     * Starts both listeners, advertises the services and blocks until cancellation of {@code context}
     * has drained both listeners.
     *
     * @param context The cancellation signal shared by both listeners.
     * @throws StartupException     if the host cannot be fully started; nothing is left running.
     * @throws ServingException     if a listener terminated without being asked to.
     * @throws HostPhaseException   if the host has already been run.
     * @throws InterruptedException if the calling thread is interrupted; the listeners are drained first.
     */
    public void run(final Context context) throws HostException, InterruptedException {
        Objects.requireNonNull(context, "context");
        final List<ServiceDescriptor> hosted;
        synchronized (lock) {
            final HostPhase current = phase.get();
            if (!current.acceptsRegistration()) {
                throw new HostPhaseException("run", current);
            }
            phase.set(HostPhase.RUNNING);
            hosted = List.copyOf(descriptors);
        }
        if (hosted.isEmpty()) {
            LOGGER.warn("No services registered. The host will serve nothing.");
        }

        Server server = null;
        ManagedChannel loopback = null;
        GatewayBridge gateway = null;
        try {
            advertisedHost = findListenOn();
            server = startRpcServer(hosted);
            rpcPort = server.getPort();

            if (options.isGatewayEnabled()) {
                loopback = dialLoopback(rpcPort);
                gateway = new GatewayBridge(options);
                gateway.bindServices(context, hosted, loopback);
                gatewayPort = gateway.start(options.getProxyPort());
            }
        } catch (final StartupException e) {
            abortStartup(server, loopback, gateway);
            throw e;
        } catch (final RuntimeException e) {
            abortStartup(server, loopback, gateway);
            throw new StartupException("Host failed to start: " + e.getMessage(), e);
        }

        serve(context, hosted, server, loopback, gateway);
    }

    /**
     * @return The current lifecycle phase.
     */
    public HostPhase getPhase() {
        return phase.get();
    }

    /**
     * @return The services registered so far, in registration order.
     */
    public List<IService> getServices() {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(services));
        }
    }

    /**
     * @return The bound gRPC port, or -1 before the listener is bound.
     */
    public int getRpcPort() {
        return rpcPort;
    }

    /**
     * @return The bound gateway port, or -1 if the gateway is disabled or not bound yet.
     */
    public int getGatewayPort() {
        return gatewayPort;
    }

    /**
     * @return The address advertised in discovery records, or null before {@link #run(Context)}.
     */
    public String getAdvertisedHost() {
        return advertisedHost;
    }

    String findListenOn() throws StartupException {
        final Optional<String> resolved = options.getAddressResolver().resolve().filter(address -> !address.isBlank());
        if (resolved.isEmpty()) {
            throw new StartupException("Could not resolve an address to advertise. Configure the advertised host explicitly.");
        }
        return resolved.get();
    }

    private Server startRpcServer(final List<ServiceDescriptor> hosted) throws StartupException {
        final ServerBuilder<?> builder = Grpc.newServerBuilderForPort(options.getPort(), InsecureServerCredentials.create());

        final List<ServerInterceptor> interceptors = new ArrayList<>();
        final MethodTypeInterceptor unary = MethodTypeInterceptor.unary(options.getUnaryInterceptors());
        final MethodTypeInterceptor streaming = MethodTypeInterceptor.streaming(options.getStreamInterceptors());
        if (!unary.isEmpty()) {
            interceptors.add(unary);
        }
        if (!streaming.isEmpty()) {
            interceptors.add(streaming);
        }

        for (final ServiceDescriptor descriptor : hosted) {
            for (final ServerServiceDefinition definition : descriptor.methodBindings()) {
                builder.addService(ServerInterceptors.intercept(definition, interceptors));
            }
        }
        options.getStatsHandler().ifPresent(builder::addStreamTracerFactory);

        final Server server = builder.build();
        try {
            server.start();
        } catch (final IOException e) {
            throw new StartupException("rpc server could not listen on port " + options.getPort() + ": " + e.getMessage(), e);
        }
        return server;
    }

    private ManagedChannel dialLoopback(final int port) throws StartupException {
        try {
            final ManagedChannel channel = Grpc.newChannelBuilderForAddress(LOOPBACK_HOST, port, InsecureChannelCredentials.create())
                .build();
            channel.getState(true);
            LOGGER.debug("Dialed loopback channel to {}:{}", LOOPBACK_HOST, port);
            return channel;
        } catch (final RuntimeException e) {
            throw new StartupException("Could not dial loopback channel to port " + port + ": " + e.getMessage(), e);
        }
    }

    private void serve(final Context context,
                       final List<ServiceDescriptor> hosted,
                       final Server server,
                       final ManagedChannel loopback,
                       final GatewayBridge gateway) throws HostException, InterruptedException {
        final ExecutorService executor = Executors.newCachedThreadPool(new UnitThreadFactory(options.getName()));
        final AtomicReference<HostException> failure = new AtomicReference<>();

        final Context.CancellationListener rpcWatcher = cancelled -> stopRpc(server);
        final Context.CancellationListener gatewayWatcher = cancelled -> stopGateway(gateway);

        InterruptedException interrupted = null;
        try {
            context.addListener(rpcWatcher, executor);
            final Future<?> rpcUnit = executor.submit(() ->
                runUnit(Protocol.RPC, () -> serveRpc(hosted, server), server, gateway, failure));

            Future<?> gatewayUnit = null;
            if (gateway != null) {
                context.addListener(gatewayWatcher, executor);
                gatewayUnit = executor.submit(() ->
                    runUnit(Protocol.HTTP, () -> serveGateway(hosted, gateway), server, gateway, failure));
            }

            try {
                awaitUnit(rpcUnit);
                if (gatewayUnit != null) {
                    awaitUnit(gatewayUnit);
                }
            } catch (final InterruptedException e) {
                LOGGER.warn("Interrupted while serving. Draining listeners.");
                interrupted = e;
                stopAll(server, gateway);
                awaitUninterruptibly(rpcUnit);
                if (gatewayUnit != null) {
                    awaitUninterruptibly(gatewayUnit);
                }
            } catch (final ExecutionException e) {
                failure.compareAndSet(null, new ServingException("Serving unit failed: " + e.getCause(), e.getCause()));
                stopAll(server, gateway);
            }
        } finally {
            context.removeListener(rpcWatcher);
            context.removeListener(gatewayWatcher);
            closeLoopback(loopback);
            executor.shutdownNow();
            phase.set(HostPhase.STOPPED);
            LOGGER.info("Host '{}' stopped.", options.getName());
        }

        if (failure.get() != null) {
            throw failure.get();
        }
        if (interrupted != null) {
            Thread.currentThread().interrupt();
            throw interrupted;
        }
    }

    private void serveRpc(final List<ServiceDescriptor> hosted, final Server server) throws HostException, InterruptedException {
        registerNodes(hosted, rpcPort, Protocol.RPC, rpcStopRequested);
        LOGGER.info("rpc server start listen on: [{}]", rpcPort);
        server.awaitTermination();
        if (!rpcStopRequested.get()) {
            throw new ServingException("rpc server on port [" + rpcPort + "] terminated without a stop request", null);
        }
        LOGGER.debug("rpc server on port [{}] terminated.", rpcPort);
    }

    private void serveGateway(final List<ServiceDescriptor> hosted, final GatewayBridge gateway) throws HostException, InterruptedException {
        registerNodes(hosted, gatewayPort, Protocol.HTTP, gatewayStopRequested);
        LOGGER.info("gateway start listen on: [{}]", gatewayPort);
        gateway.awaitStopped();
        if (!gatewayStopRequested.get()) {
            throw new ServingException("gateway on port [" + gatewayPort + "] terminated without a stop request", null);
        }
        LOGGER.debug("gateway on port [{}] terminated.", gatewayPort);
    }

    private void registerNodes(final List<ServiceDescriptor> hosted,
                               final int port,
                               final Protocol protocol,
                               final AtomicBoolean stopRequested) throws StartupException {
        final Optional<IDiscoveryRegistrar> registrar = options.getRegistrar();
        if (registrar.isEmpty()) {
            LOGGER.debug("No discovery registrar configured. {} nodes are not advertised.", protocol);
            return;
        }
        for (final ServiceDescriptor descriptor : hosted) {
            if (stopRequested.get()) {
                LOGGER.debug("{} listener is already stopping. Skipping remaining registrations.", protocol);
                return;
            }
            final Node node = new Node(advertisedHost, port, protocol, descriptor.name());
            try {
                registrar.get().register(node);
            } catch (final DiscoveryException | RuntimeException e) {
                throw new StartupException(String.format("Could not register %s node of service '%s': %s",
                    protocol, descriptor.name(), e.getMessage()), e);
            }
            LOGGER.debug("Advertised service '{}' over {} at {}", node.serviceIdentity(), protocol, node.address());
        }
    }

    private void runUnit(final Protocol transport,
                         final UnitBody body,
                         final Server server,
                         final GatewayBridge gateway,
                         final AtomicReference<HostException> failure) {
        Thread.currentThread().setName(options.getName() + "-" + transport.name().toLowerCase());
        try {
            body.run();
        } catch (final HostException e) {
            LOGGER.error("{} unit failed: {}", transport, e.getMessage());
            failure.compareAndSet(null, e);
            stopAll(server, gateway);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.debug("{} unit interrupted.", transport);
        } catch (final RuntimeException e) {
            LOGGER.error("{} unit failed unexpectedly.", transport, e);
            failure.compareAndSet(null, new ServingException(transport + " unit failed: " + e.getMessage(), e));
            stopAll(server, gateway);
        }
    }

    private void stopAll(final Server server, final GatewayBridge gateway) {
        if (gateway != null) {
            stopGateway(gateway);
        }
        stopRpc(server);
    }

    private void stopRpc(final Server server) {
        if (!rpcStopRequested.compareAndSet(false, true)) {
            return;
        }
        phase.compareAndSet(HostPhase.RUNNING, HostPhase.DRAINING);
        LOGGER.info("rpc server stop listen on: [{}]", rpcPort);
        server.shutdown();

        final Optional<Duration> deadline = options.getRpcShutdownDeadline();
        if (deadline.isEmpty()) {
            return;
        }
        try {
            if (!server.awaitTermination(deadline.get().toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("rpc server did not drain within {}. Forcing close.", deadline.get());
                server.shutdownNow();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            server.shutdownNow();
        }
    }

    private void stopGateway(final GatewayBridge gateway) {
        if (!gatewayStopRequested.compareAndSet(false, true)) {
            return;
        }
        phase.compareAndSet(HostPhase.RUNNING, HostPhase.DRAINING);
        LOGGER.info("gateway stop listen on: [{}]", gatewayPort);
        gateway.stop();
    }

    private void abortStartup(final Server server, final ManagedChannel loopback, final GatewayBridge gateway) {
        LOGGER.error("Host '{}' failed to start. Releasing listeners.", options.getName());
        if (gateway != null) {
            gateway.stop();
        }
        if (loopback != null) {
            loopback.shutdownNow();
        }
        if (server != null) {
            server.shutdownNow();
        }
        phase.set(HostPhase.STOPPED);
    }

    private static void closeLoopback(final ManagedChannel loopback) {
        if (loopback == null) {
            return;
        }
        loopback.shutdown();
        try {
            if (!loopback.awaitTermination(LOOPBACK_CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                loopback.shutdownNow();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            loopback.shutdownNow();
        }
    }

    private static void awaitUnit(final Future<?> unit) throws InterruptedException, ExecutionException {
        unit.get();
    }

    private static void awaitUninterruptibly(final Future<?> unit) {
        boolean interrupted = false;
        while (!unit.isDone()) {
            try {
                unit.get();
            } catch (final InterruptedException e) {
                interrupted = true;
            } catch (final ExecutionException e) {
                LOGGER.error("Serving unit failed while draining.", e.getCause());
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    private interface UnitBody {
        void run() throws HostException, InterruptedException;
    }

    private static final class UnitThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        UnitThreadFactory(final String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(final Runnable runnable) {
            final Thread thread = new Thread(runnable, prefix + "-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
