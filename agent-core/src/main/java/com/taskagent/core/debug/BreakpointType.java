package com.taskagent.core.debug;

/**
 * Interception points of the control loop.
 */
public enum BreakpointType {
    /**
     * Before a tool is executed.
     */
    TOOL,

    /**
     * After a tool execution changed the task state.
     */
    STATE,

    /**
     * Before the oracle is consulted.
     */
    LLM
}
