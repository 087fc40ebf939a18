package com.featureflow.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.featureflow.core.executor.CommandPhaseExecutor;
import com.featureflow.core.executor.ManualPhaseExecutor;
import com.featureflow.core.executor.PhaseExecutor;
import com.featureflow.core.persistence.FileWorkflowStateStore;
import com.featureflow.core.persistence.WorkflowStateMigrator;
import com.featureflow.core.persistence.WorkflowStateStore;
import com.featureflow.core.template.DirectoryTemplateProvider;
import com.featureflow.core.template.TemplateProvider;
import com.featureflow.core.vcs.GitCli;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class FeatureflowConfig {

    /**
     * Mapper for the state document and structured CLI output: ISO-8601 timestamps,
     * paths as plain strings, indented, and strict about unknown properties so a damaged
     * document is reported rather than half-read.
     */
    public static ObjectMapper workflowObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new SimpleModule("featureflow-paths").addSerializer(Path.class, ToStringSerializer.instance))
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public GitCli gitCli() {
        return new GitCli();
    }

    @Bean
    public WorkflowStateStore workflowStateStore(FeatureflowProperties properties) {
        return new FileWorkflowStateStore(workflowObjectMapper(), new WorkflowStateMigrator(),
                properties.getStateFile(), properties.getArchiveDir());
    }

    @Bean
    public TemplateProvider templateProvider(FeatureflowProperties properties) {
        return new DirectoryTemplateProvider(properties.getTemplatesDir());
    }

    @Bean
    @ConditionalOnProperty(name = "featureflow.executor.type", havingValue = "manual", matchIfMissing = true)
    public PhaseExecutor manualPhaseExecutor(TemplateProvider templateProvider) {
        return new ManualPhaseExecutor(templateProvider);
    }

    @Bean
    @ConditionalOnProperty(name = "featureflow.executor.type", havingValue = "command")
    public PhaseExecutor commandPhaseExecutor(FeatureflowProperties properties) {
        return new CommandPhaseExecutor(properties.getExecutor().getCommand(),
                Duration.ofSeconds(properties.getExecutor().getTimeoutSeconds()));
    }
}
