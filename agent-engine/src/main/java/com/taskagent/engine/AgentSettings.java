package com.taskagent.engine;

import com.taskagent.core.debug.BreakpointType;
import com.taskagent.core.exception.ConfigurationException;

import java.time.Duration;
import java.util.Map;

/**
 * Engine configuration.
 * Immutable; one instance may be shared by several engines.
 *
 * Invariants:
 * - maxIterations >= 1
 * - rateLimit >= 1 (requests per minute)
 * - maxCheckpoints >= 0
 * - approvalTimeout, when set, is positive
 *
 * @param approvalTimeout Maximum wait for an approval answer; null waits indefinitely
 */
public record AgentSettings(
    boolean autoApproveTools,
    int maxConsecutiveAutoApprovals,
    int maxIterations,
    int rateLimit,
    Duration approvalTimeout,
    boolean autoCheckpoint,
    int maxCheckpoints,
    DebugSettings debug
) {
    public AgentSettings {
        if (maxIterations < 1) {
            throw new ConfigurationException("maxIterations must be >= 1, got " + maxIterations);
        }
        if (rateLimit < 1) {
            throw new ConfigurationException("rateLimit must be >= 1, got " + rateLimit);
        }
        if (maxCheckpoints < 0) {
            throw new ConfigurationException("maxCheckpoints must be >= 0, got " + maxCheckpoints);
        }
        if (approvalTimeout != null && (approvalTimeout.isNegative() || approvalTimeout.isZero())) {
            throw new ConfigurationException("approvalTimeout must be positive, got " + approvalTimeout);
        }
        debug = debug != null ? debug : DebugSettings.disabled();
    }

    /**
     * Manual approval, 50 iterations, 60 requests per minute, up to 10 automatic checkpoints.
     */
    public static AgentSettings defaults() {
        return builder().build();
    }

    /**
     * Debug configuration.
     *
     * @param breakpoints Breakpoints registered when a task starts, by name
     */
    public record DebugSettings(
        boolean enabled,
        boolean stepByStep,
        Map<String, BreakpointSettings> breakpoints
    ) {
        public DebugSettings {
            breakpoints = breakpoints != null ? Map.copyOf(breakpoints) : Map.of();
        }

        public static DebugSettings disabled() {
            return new DebugSettings(false, false, Map.of());
        }
    }

    /**
     * @param condition Breakpoint condition; null to always break
     */
    public record BreakpointSettings(BreakpointType type, String condition, boolean enabled) {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean autoApproveTools = false;
        private int maxConsecutiveAutoApprovals = 3;
        private int maxIterations = 50;
        private int rateLimit = 60;
        private Duration approvalTimeout;
        private boolean autoCheckpoint = true;
        private int maxCheckpoints = 10;
        private DebugSettings debug = DebugSettings.disabled();

        public Builder autoApproveTools(boolean autoApproveTools) {
            this.autoApproveTools = autoApproveTools;
            return this;
        }

        public Builder maxConsecutiveAutoApprovals(int maxConsecutiveAutoApprovals) {
            this.maxConsecutiveAutoApprovals = maxConsecutiveAutoApprovals;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder rateLimit(int rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder approvalTimeout(Duration approvalTimeout) {
            this.approvalTimeout = approvalTimeout;
            return this;
        }

        public Builder autoCheckpoint(boolean autoCheckpoint) {
            this.autoCheckpoint = autoCheckpoint;
            return this;
        }

        public Builder maxCheckpoints(int maxCheckpoints) {
            this.maxCheckpoints = maxCheckpoints;
            return this;
        }

        public Builder debug(DebugSettings debug) {
            this.debug = debug;
            return this;
        }

        public AgentSettings build() {
            return new AgentSettings(
                autoApproveTools, maxConsecutiveAutoApprovals, maxIterations, rateLimit,
                approvalTimeout, autoCheckpoint, maxCheckpoints, debug
            );
        }
    }
}
