package org.duplex.cli.commands.host;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import io.grpc.Context;
import org.duplex.host.ConfigurationException;
import org.duplex.host.HostException;
import org.duplex.host.ServiceHost;
import org.duplex.host.config.HostOptionsFactory;
import org.duplex.host.spi.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
    name = "run",
    description = "Starts the service host and serves until the process is asked to stop."
)
public class HostRunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(HostRunCommand.class);

    @ParentCommand
    private HostCommand parent;

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: duplex.conf)"
    )
    private File configFile;

    @Override
    public Integer call() throws Exception {
        final ServiceHost host;
        try {
            final Config config = parent.getParent().getConfig(configFile);
            host = new ServiceHost(HostOptionsFactory.create(config));
            final List<IService> services = HostOptionsFactory.createServices(config);
            for (final IService service : services) {
                host.register(service);
            }
        } catch (final ConfigException | IllegalArgumentException | IllegalStateException e) {
            LOGGER.error("Failed to configure the host: {}", e.getMessage());
            return 1;
        } catch (final ConfigurationException e) {
            LOGGER.error("Failed to register service '{}': {}", e.getServiceIdentity(), e.getMessage());
            return 1;
        }

        final Context.CancellableContext context = Context.current().withCancellation();
        final CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutdown signal received, draining host...");
            context.cancel(null);
            try {
                stopped.await();
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "duplex-shutdown-hook"));

        try {
            host.run(context);
            return 0;
        } catch (final HostException e) {
            LOGGER.error("Host terminated: {}", e.getMessage(), e);
            return 1;
        } finally {
            stopped.countDown();
            context.cancel(null);
        }
    }
}
