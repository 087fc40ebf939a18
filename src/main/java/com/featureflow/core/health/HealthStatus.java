package com.featureflow.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Outcome of one repository check run by {@code featureflow health}.
 *
 * @param component checked part of the repository: git, specs, templates or state
 * @param status    how the check went
 * @param detail    one line for the console
 * @param metadata  extra values for {@code --json} output
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {

    /**
     * {@code DEGRADED} means commands still work with reduced behavior (no branches,
     * empty artifacts); {@code DOWN} means workflow commands will fail.
     */
    public enum Status { UP, DEGRADED, DOWN }

    public boolean blocksWorkflow() {
        return status == Status.DOWN;
    }

    public static boolean anyBlocking(Collection<HealthStatus> checks) {
        return checks.stream().anyMatch(HealthStatus::blocksWorkflow);
    }
}
