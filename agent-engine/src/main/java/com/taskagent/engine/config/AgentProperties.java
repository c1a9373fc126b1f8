package com.taskagent.engine.config;

import com.taskagent.core.debug.BreakpointType;
import com.taskagent.engine.AgentSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from {@code agent.*}.
 */
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    private boolean autoApproveTools = false;
    private int maxConsecutiveAutoApprovals = 3;
    private int maxIterations = 50;
    private int rateLimit = 60;
    private Duration approvalTimeout;
    private String workingDirectory = ".";
    private StateStorage stateStorage = new StateStorage();
    private Debug debug = new Debug();
    private Oracle oracle = new Oracle();
    private Approval approval = new Approval();

    /**
     * Engine settings derived from these properties.
     */
    public AgentSettings toSettings() {
        Map<String, AgentSettings.BreakpointSettings> breakpoints = new LinkedHashMap<>();
        debug.breakpoints.forEach((name, breakpoint) -> breakpoints.put(name,
            new AgentSettings.BreakpointSettings(breakpoint.type, breakpoint.condition, breakpoint.enabled)));
        return AgentSettings.builder()
            .autoApproveTools(autoApproveTools)
            .maxConsecutiveAutoApprovals(maxConsecutiveAutoApprovals)
            .maxIterations(maxIterations)
            .rateLimit(rateLimit)
            .approvalTimeout(approvalTimeout)
            .autoCheckpoint(stateStorage.autoCheckpoint)
            .maxCheckpoints(stateStorage.maxCheckpoints)
            .debug(new AgentSettings.DebugSettings(debug.enabled, debug.stepByStep, breakpoints))
            .build();
    }

    public boolean isAutoApproveTools() { return autoApproveTools; }
    public void setAutoApproveTools(boolean autoApproveTools) { this.autoApproveTools = autoApproveTools; }
    public int getMaxConsecutiveAutoApprovals() { return maxConsecutiveAutoApprovals; }
    public void setMaxConsecutiveAutoApprovals(int maxConsecutiveAutoApprovals) { this.maxConsecutiveAutoApprovals = maxConsecutiveAutoApprovals; }
    public int getMaxIterations() { return maxIterations; }
    public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
    public int getRateLimit() { return rateLimit; }
    public void setRateLimit(int rateLimit) { this.rateLimit = rateLimit; }
    public Duration getApprovalTimeout() { return approvalTimeout; }
    public void setApprovalTimeout(Duration approvalTimeout) { this.approvalTimeout = approvalTimeout; }
    public String getWorkingDirectory() { return workingDirectory; }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
    public StateStorage getStateStorage() { return stateStorage; }
    public void setStateStorage(StateStorage stateStorage) { this.stateStorage = stateStorage; }
    public Debug getDebug() { return debug; }
    public void setDebug(Debug debug) { this.debug = debug; }
    public Oracle getOracle() { return oracle; }
    public void setOracle(Oracle oracle) { this.oracle = oracle; }
    public Approval getApproval() { return approval; }
    public void setApproval(Approval approval) { this.approval = approval; }

    public static class StateStorage {
        /** {@code file} or {@code jdbc}. */
        private String type = "file";
        private String path = ".task-agent/state";
        private boolean autoCheckpoint = true;
        private int maxCheckpoints = 10;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public boolean isAutoCheckpoint() { return autoCheckpoint; }
        public void setAutoCheckpoint(boolean autoCheckpoint) { this.autoCheckpoint = autoCheckpoint; }
        public int getMaxCheckpoints() { return maxCheckpoints; }
        public void setMaxCheckpoints(int maxCheckpoints) { this.maxCheckpoints = maxCheckpoints; }
    }

    public static class Debug {
        private boolean enabled = false;
        private boolean stepByStep = false;
        private Map<String, Breakpoint> breakpoints = new LinkedHashMap<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isStepByStep() { return stepByStep; }
        public void setStepByStep(boolean stepByStep) { this.stepByStep = stepByStep; }
        public Map<String, Breakpoint> getBreakpoints() { return breakpoints; }
        public void setBreakpoints(Map<String, Breakpoint> breakpoints) { this.breakpoints = breakpoints; }
    }

    public static class Breakpoint {
        private BreakpointType type = BreakpointType.TOOL;
        private String condition;
        private boolean enabled = true;

        public BreakpointType getType() { return type; }
        public void setType(BreakpointType type) { this.type = type; }
        public String getCondition() { return condition; }
        public void setCondition(String condition) { this.condition = condition; }
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Oracle {
        /** Endpoint answering next-action requests; no oracle is created when unset. */
        private String url;
        private Duration timeout = Duration.ofSeconds(60);

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Approval {
        /** Tools approved without asking a human. */
        private List<String> allowedTools = new ArrayList<>();

        public List<String> getAllowedTools() { return allowedTools; }
        public void setAllowedTools(List<String> allowedTools) { this.allowedTools = allowedTools; }
    }
}
