package org.duplex.host.gateway;

import io.grpc.Channel;
import io.grpc.Context;
import io.javalin.Javalin;
import io.javalin.http.HttpResponseException;
import org.duplex.host.HostOptions;
import org.duplex.host.StartupException;
import org.duplex.host.spi.IGatewayBinding;
import org.duplex.host.spi.ITraceInjector;
import org.duplex.host.spi.ServiceDescriptor;
import org.eclipse.jetty.io.EndPoint;
import org.eclipse.jetty.server.Connector;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.util.component.LifeCycle;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The HTTP side of a host. It owns the Javalin application and its {@link GatewayRoutes}, lets every
 * service's gateway bindings register routes against the shared loopback channel, and wraps every
 * request with trace injection and failure recovery.
 *
 * <p>Before any route runs, a {@link GatewayCallContext} is created for the request, headers prefixed
 * {@code Grpc-Metadata-} are copied into it with the prefix stripped, and the configured
 * {@link ITraceInjector} is invoked. A failure anywhere in a request is answered with {@code 500} and
 * the failure message; the listener keeps serving.</p>
 *
 * <p>A bridge serves at most once: {@link #start(int)} then {@link #stop()}.</p>
 */
public final class GatewayBridge {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayBridge.class);
    private static final String METADATA_HEADER_PREFIX = "grpc-metadata-";
    private static final long DRAIN_IDLE_TIMEOUT_MS = 100;

    private final String name;
    private final Javalin app;
    private final GatewayRoutes routes;
    private final ITraceInjector traceInjector;
    private final TraceOption traceOption;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicReference<Server> server = new AtomicReference<>();
    private volatile int boundPort = -1;

    /**
     * Creates the Javalin application without starting it.
     *
     * @param options The host options providing thread pool sizing, stop timeout and tracing.
     */
    public GatewayBridge(final HostOptions options) {
        this.name = options.getName() + "-gateway";
        this.traceInjector = options.getTraceInjector();
        this.traceOption = options.getTraceOption();

        this.app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Request: {} {} -> {} (completed in {} ms)", ctx.method(), ctx.path(), ctx.statusCode(), ms);
                }
            });

            final QueuedThreadPool threadPool = new QueuedThreadPool(
                options.getGatewayMaxThreads(),
                options.getGatewayMinThreads(),
                options.getGatewayIdleTimeoutMs()
            );
            threadPool.setName(name);
            config.jetty.threadPool = threadPool;

            final long stopTimeoutMs = options.getGatewayShutdownTimeout().toMillis();
            config.jetty.modifyServer(jetty -> {
                jetty.setStopTimeout(stopTimeoutMs);
                jetty.addEventListener(new LifeCycle.Listener() {
                    @Override
                    public void lifeCycleStopped(final LifeCycle event) {
                        stopped.countDown();
                    }

                    @Override
                    public void lifeCycleFailure(final LifeCycle event, final Throwable cause) {
                        stopped.countDown();
                    }
                });
                server.set(jetty);
            });

            LOGGER.debug("Configured gateway thread pool '{}' with {} min threads, {} max threads, {} ms idle timeout",
                threadPool.getName(), options.getGatewayMinThreads(), options.getGatewayMaxThreads(), options.getGatewayIdleTimeoutMs());
        });

        app.before(ctx -> {
            final GatewayCallContext call = GatewayCallContext.of(ctx);
            for (final Map.Entry<String, String> header : ctx.headerMap().entrySet()) {
                final String key = header.getKey().toLowerCase(Locale.ROOT);
                if (key.startsWith(METADATA_HEADER_PREFIX)) {
                    call.putHeader(key.substring(METADATA_HEADER_PREFIX.length()), header.getValue());
                }
            }
            traceInjector.inject(ctx, call, traceOption);
        });

        app.exception(Exception.class, (e, ctx) -> {
            if (e instanceof HttpResponseException) {
                final HttpResponseException response = (HttpResponseException) e;
                ctx.status(response.getStatus()).contentType(GatewayRoutes.TEXT).result(response.getMessage());
                return;
            }
            GatewayRoutes.respondWithFailure(ctx, ctx.method() + " " + ctx.path(), e);
        });

        this.routes = new GatewayRoutes(app, options.getGatewayCallTimeout().orElse(null));
    }

    public GatewayRoutes getRoutes() {
        return routes;
    }

    /**
     * Invokes every gateway binding of every service. Any failing binding aborts the whole bind, since
     * a partially exposed gateway is not an acceptable state.
     *
     * @param context  The cancellation context of the host run.
     * @param services The descriptors of the registered services.
     * @param loopback The loopback channel into the binary listener.
     * @throws StartupException if a binding fails.
     */
    public void bindServices(final Context context, final List<ServiceDescriptor> services, final Channel loopback)
        throws StartupException {
        for (final ServiceDescriptor service : services) {
            int index = 0;
            for (final IGatewayBinding binding : service.gatewayBindings()) {
                try {
                    binding.bind(context, routes, loopback);
                } catch (final Exception e) {
                    throw new StartupException(String.format("Gateway binding #%d of service '%s' failed: %s",
                        index, service.name(), e.getMessage()), e);
                }
                index++;
            }
            LOGGER.debug("Bound {} gateway binding(s) of service '{}'", service.gatewayBindings().size(), service.name());
        }
        LOGGER.debug("Gateway routes: {}", routes.getRoutes());
    }

    /**
     * Binds the HTTP listener and starts serving.
     *
     * @param port The port to listen on; {@code 0} picks an ephemeral port.
     * @return The bound port.
     * @throws StartupException if the listener cannot be started.
     */
    public int start(final int port) throws StartupException {
        started.set(true);
        try {
            app.start(port);
        } catch (final RuntimeException e) {
            stopped.countDown();
            throw new StartupException("Gateway could not listen on port " + port + ": " + e.getMessage(), e);
        }
        boundPort = app.port();
        return boundPort;
    }

    /**
     * Stops the HTTP listener, letting in-flight requests finish within the configured stop timeout.
     * Failures are logged; the bridge counts as stopped afterwards in any case. Idempotent.
     */
    public void stop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        if (!started.get() || isStopped()) {
            stopped.countDown();
            return;
        }
        try {
            closeIdleConnections();
            app.stop();
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to shut down gateway on port [{}]: {}", boundPort, e.getMessage(), e);
        } finally {
            stopped.countDown();
        }
    }

    /**
     * Idle keep-alive connections would hold a graceful stop until the stop timeout. Shortening their
     * idle timeout closes them, while connections serving a request stay open until the response is done.
     */
    private void closeIdleConnections() {
        final Server jetty = server.get();
        if (jetty == null) {
            return;
        }
        for (final Connector connector : jetty.getConnectors()) {
            for (final EndPoint endPoint : connector.getConnectedEndPoints()) {
                endPoint.setIdleTimeout(DRAIN_IDLE_TIMEOUT_MS);
            }
        }
    }

    /**
     * Blocks until the HTTP listener has stopped, either through {@link #stop()} or on its own.
     *
     * @throws InterruptedException if interrupted while waiting.
     */
    public void awaitStopped() throws InterruptedException {
        stopped.await();
    }

    public boolean isStopped() {
        return stopped.getCount() == 0;
    }

    /**
     * @return true if {@link #stop()} has been called.
     */
    public boolean isStopRequested() {
        return stopRequested.get();
    }

    Server jettyServer() {
        return server.get();
    }

    /**
     * @return The bound port, or -1 before {@link #start(int)}.
     */
    public int getPort() {
        return boundPort;
    }
}
