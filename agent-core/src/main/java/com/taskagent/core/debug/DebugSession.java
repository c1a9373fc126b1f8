package com.taskagent.core.debug;

import com.taskagent.core.exception.InvalidConditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether the control loop should stop at an interception point.
 *
 * Breakpoints may be added and removed from another thread while a task runs.
 */
public class DebugSession {

    private static final Logger log = LoggerFactory.getLogger(DebugSession.class);

    private final Clock clock;
    private final Map<String, Breakpoint> breakpoints = new ConcurrentHashMap<>();
    private volatile boolean active;
    private volatile boolean stepByStep;
    private volatile Instant startTime;

    public DebugSession() {
        this(Clock.systemUTC());
    }

    public DebugSession(Clock clock) {
        this.clock = clock;
    }

    public void start() {
        active = true;
        startTime = clock.instant();
        log.debug("Debug session started (stepByStep={}, breakpoints={})", stepByStep, breakpoints.keySet());
    }

    public void stop() {
        active = false;
        log.debug("Debug session stopped");
    }

    /**
     * Register or replace a breakpoint. A condition that cannot be parsed is kept
     * but never matches.
     */
    public Breakpoint addBreakpoint(String name, BreakpointType type, String condition, boolean enabled) {
        BreakpointCondition parsed = null;
        if (condition != null && !condition.isBlank()) {
            try {
                parsed = BreakpointCondition.parse(condition);
            } catch (InvalidConditionException e) {
                log.warn("Breakpoint {} will never match: {}", name, e.getMessage());
            }
        }
        Breakpoint breakpoint = new Breakpoint(name, type, condition, parsed, enabled);
        breakpoints.put(name, breakpoint);
        return breakpoint;
    }

    public Breakpoint addBreakpoint(String name, BreakpointType type) {
        return addBreakpoint(name, type, null, true);
    }

    public void removeBreakpoint(String name) {
        breakpoints.remove(name);
    }

    public void setBreakpointEnabled(String name, boolean enabled) {
        breakpoints.computeIfPresent(name, (key, breakpoint) -> breakpoint.withEnabled(enabled));
    }

    public Optional<Breakpoint> getBreakpoint(String name) {
        return Optional.ofNullable(breakpoints.get(name));
    }

    public Collection<Breakpoint> getBreakpoints() {
        return Collections.unmodifiableCollection(breakpoints.values());
    }

    /**
     * Check if execution should break at the given interception point.
     *
     * @param type The interception point
     * @param context Values the breakpoint conditions are evaluated against
     * @return true if the session is active and step-by-step, or an enabled
     *         breakpoint of the type has no condition or a matching one
     */
    public boolean shouldBreak(BreakpointType type, Map<String, Object> context) {
        if (!active) {
            return false;
        }
        if (stepByStep) {
            return true;
        }
        for (Breakpoint breakpoint : breakpoints.values()) {
            if (!breakpoint.enabled() || breakpoint.type() != type) {
                continue;
            }
            if (breakpoint.isUnconditional()) {
                return true;
            }
            if (breakpoint.hasInvalidCondition()) {
                continue;
            }
            try {
                if (breakpoint.condition().evaluate(context)) {
                    return true;
                }
            } catch (RuntimeException e) {
                log.debug("Skipping breakpoint {}: {}", breakpoint.name(), e.getMessage());
            }
        }
        return false;
    }

    public boolean isActive() {
        return active;
    }

    public boolean isStepByStep() {
        return stepByStep;
    }

    public void setStepByStep(boolean stepByStep) {
        this.stepByStep = stepByStep;
    }

    public Instant getStartTime() {
        return startTime;
    }
}
