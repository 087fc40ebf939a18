package com.featureflow.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "featureflow")
public class FeatureflowProperties {

    private Layout layout = new Layout();
    private FeatureNaming feature = new FeatureNaming();
    private State state = new State();
    private Executor executor = new Executor();
    private Clarification clarification = new Clarification();

    // -- Flattened accessors --
    public String getSpecsDir() { return layout.specsDir; }
    public String getTemplatesDir() { return layout.templatesDir; }
    public List<String> getRootMarkers() { return layout.markers; }
    public String getOverrideVariable() { return feature.overrideVariable; }
    public int getSlugWordLimit() { return feature.slugWordLimit; }
    public String getStateFile() { return state.file; }
    public String getArchiveDir() { return state.archiveDir; }
    public CompletionAction getOnCompletion() { return state.onCompletion; }

    public Layout getLayout() { return layout; }
    public void setLayout(Layout layout) { this.layout = layout; }
    public FeatureNaming getFeature() { return feature; }
    public void setFeature(FeatureNaming feature) { this.feature = feature; }
    public State getState() { return state; }
    public void setState(State state) { this.state = state; }
    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }
    public Clarification getClarification() { return clarification; }
    public void setClarification(Clarification clarification) { this.clarification = clarification; }

    /** What happens to the state file once a feature reaches the terminal phase. */
    public enum CompletionAction { DELETE, ARCHIVE }

    public static class Layout {
        private String specsDir = "specs";
        private String templatesDir = ".specify/templates";
        private List<String> markers = new ArrayList<>(List.of(".git", ".specify"));

        public String getSpecsDir() { return specsDir; }
        public void setSpecsDir(String specsDir) { this.specsDir = specsDir; }
        public String getTemplatesDir() { return templatesDir; }
        public void setTemplatesDir(String templatesDir) { this.templatesDir = templatesDir; }
        public List<String> getMarkers() { return markers; }
        public void setMarkers(List<String> markers) { this.markers = markers; }
    }

    public static class FeatureNaming {
        private String overrideVariable = "SPECIFY_FEATURE";
        private int slugWordLimit = 3;

        public String getOverrideVariable() { return overrideVariable; }
        public void setOverrideVariable(String overrideVariable) { this.overrideVariable = overrideVariable; }
        public int getSlugWordLimit() { return slugWordLimit; }
        public void setSlugWordLimit(int slugWordLimit) { this.slugWordLimit = slugWordLimit; }
    }

    public static class State {
        private String file = ".featureflow-state.json";
        private String archiveDir = ".featureflow/archive";
        private CompletionAction onCompletion = CompletionAction.ARCHIVE;

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }
        public String getArchiveDir() { return archiveDir; }
        public void setArchiveDir(String archiveDir) { this.archiveDir = archiveDir; }
        public CompletionAction getOnCompletion() { return onCompletion; }
        public void setOnCompletion(CompletionAction onCompletion) { this.onCompletion = onCompletion; }
    }

    public static class Executor {
        /** "manual" or "command". */
        private String type = "manual";
        /** Command line for the command executor; {phase} is replaced by the phase id. */
        private String command = "";
        private int timeoutSeconds = 3600;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Clarification {
        /** Marker count above which status output flags the spec; reporting only. */
        private int threshold = 0;

        public int getThreshold() { return threshold; }
        public void setThreshold(int threshold) { this.threshold = threshold; }
    }
}
