package com.featureflow.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.featureflow.core.executor.CommandPhaseExecutor;
import com.featureflow.core.executor.ManualPhaseExecutor;
import com.featureflow.core.executor.PhaseExecutor;
import com.featureflow.core.persistence.FileWorkflowStateStore;
import com.featureflow.core.persistence.WorkflowStateStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureflowConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(FeatureflowProperties.class, FeatureflowConfig.class);

    @Test
    @DisplayName("the manual executor is selected by default")
    void manualByDefault() {
        runner.run(context -> {
            assertInstanceOf(ManualPhaseExecutor.class, context.getBean(PhaseExecutor.class));
            assertInstanceOf(FileWorkflowStateStore.class, context.getBean(WorkflowStateStore.class));
        });
    }

    @Test
    @DisplayName("executor.type=command selects the command executor")
    void commandExecutor() {
        runner.withPropertyValues("featureflow.executor.type=command",
                        "featureflow.executor.command=agent run {phase}")
                .run(context -> assertInstanceOf(CommandPhaseExecutor.class, context.getBean(PhaseExecutor.class)));
    }

    @Test
    @DisplayName("nested properties bind from configuration")
    void binding() {
        runner.withPropertyValues("featureflow.layout.specs-dir=features",
                        "featureflow.state.on-completion=delete",
                        "featureflow.feature.slug-word-limit=5")
                .run(context -> {
                    FeatureflowProperties props = context.getBean(FeatureflowProperties.class);
                    assertEquals("features", props.getSpecsDir());
                    assertEquals(FeatureflowProperties.CompletionAction.DELETE, props.getOnCompletion());
                    assertEquals(5, props.getSlugWordLimit());
                });
    }

    @Test
    @DisplayName("the workflow mapper writes ISO timestamps and plain paths")
    void workflowObjectMapper() throws Exception {
        ObjectMapper mapper = FeatureflowConfig.workflowObjectMapper();

        String json = mapper.writeValueAsString(Map.of("at", Instant.parse("2026-03-01T10:00:00Z"),
                "path", Path.of("/repo/specs")));

        assertTrue(json.contains("\"2026-03-01T10:00:00Z\""), json);
        assertTrue(json.contains("\"/repo/specs\""), json);
    }
}
