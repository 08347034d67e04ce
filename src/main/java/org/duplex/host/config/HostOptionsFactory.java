package org.duplex.host.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import io.grpc.ServerInterceptor;
import io.grpc.ServerStreamTracer;
import org.duplex.host.HostOptions;
import org.duplex.host.discovery.NetworkInterfaceAddressResolver;
import org.duplex.host.discovery.StaticAddressResolver;
import org.duplex.host.gateway.TraceHeaderInjector;
import org.duplex.host.gateway.TraceOption;
import org.duplex.host.spi.IDiscoveryRegistrar;
import org.duplex.host.spi.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link HostOptions} and the configured services from the {@code duplex.host} block.
 * Services, the discovery registrar, interceptors and the stats handler are named by class and
 * instantiated reflectively.
 *
 * <p>Instantiation failures are not skipped: a host missing a configured service or interceptor would
 * silently serve less than intended, so they surface as {@link IllegalStateException}.</p>
 */
public final class HostOptionsFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(HostOptionsFactory.class);
    public static final String HOST_CONFIG_PATH = "duplex.host";
    private static final String SERVICES_CONFIG_PATH = "services";

    private HostOptionsFactory() {
    }

    /**
     * @param config The full application configuration.
     * @return The options of the {@code duplex.host} block, or defaults if the block is missing.
     */
    public static HostOptions create(final Config config) {
        final Config host = config.hasPath(HOST_CONFIG_PATH) ? config.getConfig(HOST_CONFIG_PATH) : ConfigFactory.empty();
        final HostOptions.Builder builder = HostOptions.builder()
            .name(getString(host, "name", "duplex"))
            .port(getInt(host, "port", HostOptions.DEFAULT_PORT))
            .proxyPort(getInt(host, "proxyPort", HostOptions.DEFAULT_PROXY_PORT))
            .enableGateway(host.hasPath("enableGateway") && host.getBoolean("enableGateway"));

        final String advertisedHost = getString(host, "advertisedHost", "");
        builder.addressResolver(advertisedHost.isBlank()
            ? new NetworkInterfaceAddressResolver()
            : new StaticAddressResolver(advertisedHost));

        for (final String className : getStringList(host, "unaryInterceptors")) {
            builder.unaryInterceptor(instantiate(className, ServerInterceptor.class));
        }
        for (final String className : getStringList(host, "streamInterceptors")) {
            builder.streamInterceptor(instantiate(className, ServerInterceptor.class));
        }
        final String statsHandler = getString(host, "statsHandler", "");
        if (!statsHandler.isBlank()) {
            builder.statsHandler(instantiate(statsHandler, ServerStreamTracer.Factory.class));
        }

        final boolean traceEnabled = host.hasPath("trace.enabled") && host.getBoolean("trace.enabled");
        final List<String> traceHeaders = host.hasPath("trace.headers")
            ? host.getStringList("trace.headers")
            : TraceOption.DEFAULT_HEADERS;
        builder.traceOption(new TraceOption(traceEnabled, traceHeaders));
        if (traceEnabled) {
            builder.traceInjector(new TraceHeaderInjector());
        }

        if (host.hasPath("shutdown.rpcDeadline")) {
            builder.rpcShutdownDeadline(host.getDuration("shutdown.rpcDeadline"));
        }
        if (host.hasPath("shutdown.gatewayTimeout")) {
            builder.gatewayShutdownTimeout(host.getDuration("shutdown.gatewayTimeout"));
        }
        if (host.hasPath("gateway.callTimeout")) {
            builder.gatewayCallTimeout(host.getDuration("gateway.callTimeout"));
        }
        builder.gatewayThreadPool(
            getInt(host, "gateway.threadPool.minThreads", 8),
            getInt(host, "gateway.threadPool.maxThreads", 200),
            getInt(host, "gateway.threadPool.idleTimeoutMs", 60000));

        final String registrarClass = getString(host, "discovery.className", "");
        if (!registrarClass.isBlank()) {
            final Config registrarOptions = host.hasPath("discovery.options")
                ? host.getConfig("discovery.options")
                : ConfigFactory.empty();
            builder.registrar(createRegistrar(registrarClass, registrarOptions));
        } else {
            LOGGER.debug("No discovery registrar configured.");
        }

        return builder.build();
    }

    /**
     * Instantiates the services of the {@code duplex.host.services} block in declaration order. Each
     * entry names a class with a {@code (String name, Config options)} constructor.
     *
     * @param config The full application configuration.
     * @return The configured services.
     */
    public static List<IService> createServices(final Config config) {
        final String path = HOST_CONFIG_PATH + "." + SERVICES_CONFIG_PATH;
        final List<IService> services = new ArrayList<>();
        if (!config.hasPath(path)) {
            LOGGER.warn("Configuration path '{}' not found. No services will be loaded.", path);
            return services;
        }

        final ConfigObject servicesConfig = config.getObject(path);
        LOGGER.debug("Found {} configured service(s): {}", servicesConfig.keySet().size(), servicesConfig.keySet());
        for (final String serviceName : servicesConfig.keySet()) {
            final Config serviceConfig = servicesConfig.toConfig().getConfig(serviceName);
            final String className = serviceConfig.getString("className");
            final Config options = serviceConfig.hasPath("options")
                ? serviceConfig.getConfig("options")
                : ConfigFactory.empty();
            try {
                final Class<?> serviceClass = Class.forName(className);
                if (!IService.class.isAssignableFrom(serviceClass)) {
                    throw new IllegalArgumentException("Class " + className + " does not implement IService.");
                }
                final Constructor<?> constructor = serviceClass.getConstructor(String.class, Config.class);
                services.add((IService) constructor.newInstance(serviceName, options));
                LOGGER.debug("Instantiated service '{}' with class '{}'", serviceName, className);
            } catch (final ReflectiveOperationException | IllegalArgumentException e) {
                throw new IllegalStateException("Failed to instantiate service '" + serviceName + "' (" + className + ")", e);
            }
        }
        return services;
    }

    private static IDiscoveryRegistrar createRegistrar(final String className, final Config options) {
        try {
            final Class<?> registrarClass = Class.forName(className);
            if (!IDiscoveryRegistrar.class.isAssignableFrom(registrarClass)) {
                throw new IllegalArgumentException("Class " + className + " does not implement IDiscoveryRegistrar.");
            }
            try {
                return (IDiscoveryRegistrar) registrarClass.getConstructor(Config.class).newInstance(options);
            } catch (final NoSuchMethodException e) {
                return (IDiscoveryRegistrar) registrarClass.getConstructor().newInstance();
            }
        } catch (final ReflectiveOperationException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to instantiate discovery registrar " + className, e);
        }
    }

    private static <T> T instantiate(final String className, final Class<T> expectedType) {
        try {
            final Class<?> type = Class.forName(className);
            if (!expectedType.isAssignableFrom(type)) {
                throw new IllegalArgumentException("Class " + className + " is not a " + expectedType.getName());
            }
            return expectedType.cast(type.getConstructor().newInstance());
        } catch (final ReflectiveOperationException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to instantiate " + className, e);
        }
    }

    private static String getString(final Config config, final String path, final String fallback) {
        return config.hasPath(path) ? config.getString(path) : fallback;
    }

    private static int getInt(final Config config, final String path, final int fallback) {
        return config.hasPath(path) ? config.getInt(path) : fallback;
    }

    private static List<String> getStringList(final Config config, final String path) {
        return config.hasPath(path) ? config.getStringList(path) : List.of();
    }
}
