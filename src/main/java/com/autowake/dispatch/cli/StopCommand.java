package com.autowake.dispatch.cli;

import com.autowake.core.lifecycle.LifecycleController;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: autowake stop &lt;service&gt;
 * <p>
 * Stops one service. Dependents and dependencies are left as they are.
 */
@Command(name = "stop", mixinStandardHelpOptions = true, description = "Stop a single service")
@Component
public class StopCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "SERVICE", description = "Service to stop")
    String service;

    private final LifecycleController lifecycle;

    public StopCommand(LifecycleController lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public Integer call() {
        if (lifecycle.stop(service)) {
            ConsoleOutput.success("Stopped " + service);
            return 0;
        }
        ConsoleOutput.error("Failed to stop " + service);
        return 1;
    }
}
