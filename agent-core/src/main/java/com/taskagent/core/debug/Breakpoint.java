package com.taskagent.core.debug;

/**
 * A named breakpoint registered with a {@link DebugSession}.
 *
 * @param name Unique name within the session
 * @param type Interception point it applies to
 * @param conditionText Condition as written, or null to always break
 * @param condition Parsed condition; null when absent or unparseable
 * @param enabled Disabled breakpoints never fire
 */
public record Breakpoint(
    String name,
    BreakpointType type,
    String conditionText,
    BreakpointCondition condition,
    boolean enabled
) {
    public boolean isUnconditional() {
        return conditionText == null || conditionText.isBlank();
    }

    /**
     * A condition was given but could not be parsed; such a breakpoint never matches.
     */
    public boolean hasInvalidCondition() {
        return !isUnconditional() && condition == null;
    }

    public Breakpoint withEnabled(boolean value) {
        return new Breakpoint(name, type, conditionText, condition, value);
    }
}
