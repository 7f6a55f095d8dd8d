package com.congruence.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 */
@Command(
        name = "congruence",
        mixinStandardHelpOptions = true,
        version = "Congruence 0.1.0",
        description = "Socio-technical congruence mining for git repositories",
        subcommands = {
                ValidateRepoCommand.class,
                BranchesCommand.class,
                MineCommand.class,
                StatusCommand.class,
                ContributorsCommand.class,
                CoordinationCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CongruenceCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
