package org.duplex.cli;

import com.typesafe.config.Config;
import org.duplex.cli.commands.host.HostCommand;
import org.duplex.host.config.ConfigLoader;
import org.duplex.host.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "duplex",
    mixinStandardHelpOptions = true,
    version = "Duplex 1.0",
    description = "Duplex - gRPC service host with an optional HTTP/JSON gateway",
    subcommands = {
        HostCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: duplex.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("duplex");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration once and applies its logging block.
     *
     * @param override A configuration file given to a subcommand, taking precedence over {@code --config}.
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     */
    public Config getConfig(final File override) {
        if (config == null) {
            config = ConfigLoader.load(override != null ? override : configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
