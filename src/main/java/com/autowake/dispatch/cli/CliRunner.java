package com.autowake.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Hands the process arguments to the picocli command tree once the Spring context is up,
 * and reports the command's exit code back to {@code SpringApplication.exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AutowakeCommand autowakeCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AutowakeCommand autowakeCommand, IFactory factory) {
        this.autowakeCommand = autowakeCommand;
        this.factory = factory;
    }

    /** True when the arguments ask for the long-running server instead of a one-shot command. */
    public static boolean isServeMode(String... args) {
        return Arrays.asList(args).contains("serve");
    }

    @Override
    public void run(String... args) {
        if (isServeMode(args)) {
            // the embedded web server owns the process from here on
            return;
        }
        exitCode = new CommandLine(autowakeCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
