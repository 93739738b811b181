package com.autowake.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Autowake.
 * Routes to subcommands: status, health, ensure, stop, serve.
 */
@Command(
        name = "autowake",
        mixinStandardHelpOptions = true,
        version = "Autowake 0.1.0",
        description = "Starts backing services on demand and stops them when idle",
        subcommands = {
                StatusCommand.class,
                HealthCommand.class,
                EnsureCommand.class,
                StopCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AutowakeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
