package com.autowake.dispatch.cli;

import com.autowake.core.lifecycle.LifecycleController;
import com.autowake.core.resolve.DependencyResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: autowake ensure &lt;service&gt;...
 * <p>
 * Starts the named services and their dependencies in startup order and waits for each
 * to become ready. Exit code 1 if any could not be made ready.
 */
@Command(name = "ensure", mixinStandardHelpOptions = true,
        description = "Start services with their dependencies and wait until ready")
@Component
public class EnsureCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "SERVICE", description = "Services to make ready")
    List<String> services;

    private final LifecycleController lifecycle;
    private final DependencyResolver resolver;

    public EnsureCommand(LifecycleController lifecycle, DependencyResolver resolver) {
        this.lifecycle = lifecycle;
        this.resolver = resolver;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (!lifecycle.isEnabled()) {
            ConsoleOutput.info("Auto-lifecycle disabled; services are managed externally");
            return 0;
        }
        ConsoleOutput.info("Resolved: " + String.join(" -> ", resolver.resolve(services)));
        if (lifecycle.ensureMultipleReady(services)) {
            ConsoleOutput.success("Ready: " + String.join(", ", services));
            return 0;
        }
        ConsoleOutput.error("Could not make all of " + services + " ready");
        return 1;
    }
}
