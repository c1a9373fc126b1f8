package com.taskagent.core.debug;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DebugSessionTest {

    private DebugSession session;

    @BeforeEach
    void setUp() {
        session = new DebugSession();
    }

    @Test
    void shouldBreak_inactiveSession_shouldNeverBreak() {
        session.addBreakpoint("all-tools", BreakpointType.TOOL);
        session.setStepByStep(true);

        assertFalse(session.shouldBreak(BreakpointType.TOOL, Map.of()));
    }

    @Test
    void shouldBreak_stepByStep_shouldBreakEverywhere() {
        session.setStepByStep(true);
        session.start();

        assertTrue(session.shouldBreak(BreakpointType.LLM, Map.of()));
        assertTrue(session.shouldBreak(BreakpointType.TOOL, Map.of()));
        assertTrue(session.shouldBreak(BreakpointType.STATE, Map.of()));
    }

    @Test
    void shouldBreak_unconditionalBreakpoint_shouldOnlyMatchItsType() {
        session.addBreakpoint("all-tools", BreakpointType.TOOL);
        session.start();

        assertTrue(session.shouldBreak(BreakpointType.TOOL, Map.of()));
        assertFalse(session.shouldBreak(BreakpointType.LLM, Map.of()));
    }

    @Test
    void shouldBreak_disabledBreakpoint_shouldBeIgnored() {
        session.addBreakpoint("all-tools", BreakpointType.TOOL, null, false);
        session.start();

        assertFalse(session.shouldBreak(BreakpointType.TOOL, Map.of()));

        session.setBreakpointEnabled("all-tools", true);
        assertTrue(session.shouldBreak(BreakpointType.TOOL, Map.of()));
    }

    @Test
    void shouldBreak_conditionalBreakpoint_shouldEvaluateAgainstContext() {
        session.addBreakpoint("writes", BreakpointType.TOOL, "tool_name == 'write_file'", true);
        session.start();

        assertTrue(session.shouldBreak(BreakpointType.TOOL, Map.of("tool_name", "write_file")));
        assertFalse(session.shouldBreak(BreakpointType.TOOL, Map.of("tool_name", "read_file")));
    }

    @Test
    void shouldBreak_malformedCondition_shouldBeSkipped() {
        Breakpoint breakpoint = session.addBreakpoint("broken", BreakpointType.TOOL, "context['x'] ==", true);
        session.start();

        assertTrue(breakpoint.hasInvalidCondition());
        assertFalse(session.shouldBreak(BreakpointType.TOOL, Map.of("x", 1)));
    }

    @Test
    void shouldBreak_failingCondition_shouldFallThroughToOtherBreakpoints() {
        session.addBreakpoint("bad-compare", BreakpointType.TOOL, "tool_name > 3", true);
        session.addBreakpoint("writes", BreakpointType.TOOL, "tool_name == 'write_file'", true);
        session.start();

        assertTrue(session.shouldBreak(BreakpointType.TOOL, Map.of("tool_name", "write_file")));
        assertFalse(session.shouldBreak(BreakpointType.TOOL, Map.of("tool_name", "read_file")));
    }

    @Test
    void removeBreakpoint_shouldStopBreaking() {
        session.addBreakpoint("all-tools", BreakpointType.TOOL);
        session.start();
        session.removeBreakpoint("all-tools");

        assertFalse(session.shouldBreak(BreakpointType.TOOL, Map.of()));
        assertTrue(session.getBreakpoint("all-tools").isEmpty());
    }

    @Test
    void startAndStop_shouldToggleActive() {
        session.start();
        assertTrue(session.isActive());
        assertNotNull(session.getStartTime());

        session.stop();
        assertFalse(session.isActive());
    }
}
