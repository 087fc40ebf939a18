package com.featureflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for feature workflows.
 */
@Service
public class WorkflowMetrics {

    private final MeterRegistry registry;

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPhaseDuration(String phase, long ms) {
        Timer.builder("featureflow.phase.duration")
                .tag("phase", phase)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts phase outcomes.
     *
     * @param phase  phase id
     * @param status "complete", "failed", "in_progress", "skipped" or "blocked"
     */
    public void recordPhaseResult(String phase, String status) {
        Counter.builder("featureflow.phase.results")
                .tag("phase", phase)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordFeatureAllocated() {
        Counter.builder("featureflow.features.allocated")
                .description("Feature numbers handed out")
                .register(registry)
                .increment();
    }

    public void recordTaskCompletion(int percentage) {
        DistributionSummary.builder("featureflow.tasks.completion")
                .description("Task completion percentage observed at implement checkpoints")
                .baseUnit("percent")
                .register(registry)
                .record(percentage);
    }
}
