package com.autowake.dispatch.cli;

import com.autowake.core.health.HealthState;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Autowake CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AUTOWAKE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AUTOWAKE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void serviceState(String service, HealthState state, String extra) {
        String color = switch (state) {
            case HEALTHY, RUNNING -> "fg(green)";
            case DEGRADED, UNHEALTHY -> "fg(yellow)";
            case STOPPED -> "fg(white)";
            case UNKNOWN -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + String.format("%-10s", state.name()) + "|@ " + service
                        + (extra == null || extra.isEmpty() ? "" : "  " + extra)));
    }
}
