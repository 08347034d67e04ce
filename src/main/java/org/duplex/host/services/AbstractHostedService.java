package org.duplex.host.services;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.duplex.host.spi.IService;

/**
 * An abstract base class for {@link IService} implementations created from configuration. It provides
 * the constructor shape the configuration layer instantiates services through, so that every service
 * receives its name and its own configuration block.
 *
 * <pre>
 * duplex.host.services {
 *   health {
 *     className = "org.duplex.host.services.health.HealthService"
 *     options { serviceNames = ["orders"] }
 *   }
 * }
 * </pre>
 */
public abstract class AbstractHostedService implements IService {

    protected final String serviceName;
    protected final Config options;

    /**
     * Constructs a new AbstractHostedService.
     *
     * @param serviceName The name of this service instance from the configuration. Used as the
     *                    service identity in discovery records.
     * @param options     The HOCON configuration specific to this service instance.
     */
    protected AbstractHostedService(final String serviceName, final Config options) {
        this.serviceName = serviceName;
        this.options = options != null ? options : ConfigFactory.empty();
    }

    /**
     * Gets the name of this service instance.
     *
     * @return The service name.
     */
    public String getServiceName() {
        return serviceName;
    }
}
