package com.autowake;

import com.autowake.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

@SpringBootApplication
public class AutowakeApplication {

    public static void main(String[] args) {
        boolean serveMode = CliRunner.isServeMode(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(AutowakeApplication.class);

        if (serveMode) {
            // Web server for the admin API; the idle monitor runs for the life of the process
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            // One-shot CLI command: no web server, no background idle cycles
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off"
            );
            builder.initializers(oneShotOverrides());
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }

    /**
     * Settings forced for one-shot CLI runs. Added as the first property source, so they win
     * over application.yml and environment variables, unlike builder default properties.
     */
    static ApplicationContextInitializer<ConfigurableApplicationContext> oneShotOverrides() {
        return context -> context.getEnvironment().getPropertySources().addFirst(
                new MapPropertySource("autowakeCli", Map.of("autowake.idle.enabled", "false")));
    }
}
