package org.duplex.cli.commands.host;

import org.duplex.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "host",
    description = "Manages the Duplex service host",
    subcommands = {
        HostRunCommand.class
    }
)
public class HostCommand {
    @ParentCommand
    private CommandLineInterface parent;

    public CommandLineInterface getParent() {
        return parent;
    }
}
