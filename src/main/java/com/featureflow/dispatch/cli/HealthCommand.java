package com.featureflow.dispatch.cli;

import com.featureflow.core.health.HealthCheckService;
import com.featureflow.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: featureflow health
 * <p>
 * Checks git, the specs and templates directories and the state file,
 * and displays results with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check environment health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Mixin
    private CommonOptions options;

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return CliRunner.UNEXPECTED_ERROR;
        }

        List<HealthStatus> checks = healthCheckService.checkAll(options.workingDirectory());
        boolean anyDown = HealthStatus.anyBlocking(checks);
        if (options.json) {
            ConsoleOutput.json(checks);
            return anyDown ? CliRunner.UNEXPECTED_ERROR : 0;
        }

        ConsoleOutput.printBanner();
        boolean allUp = true;
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all checks passed");
        } else if (anyDown) {
            ConsoleOutput.error("Overall: one or more components down");
        } else {
            ConsoleOutput.info("Overall: usable, with warnings");
        }
        return anyDown ? CliRunner.UNEXPECTED_ERROR : 0;
    }
}
