package com.taskagent.core.debug;

import java.time.Instant;
import java.util.Map;

/**
 * What the engine was about to do when it stopped at a breakpoint.
 *
 * @param timestamp When the break happened
 * @param action The interception point ({@link BreakpointType} name)
 * @param details The values the breakpoint conditions were evaluated against
 * @param context The full task state at the break
 */
public record DebugInfo(
    Instant timestamp,
    String action,
    Map<String, Object> details,
    Map<String, Object> context
) {
}
