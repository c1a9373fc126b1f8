package com.taskagent.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertTrue(TaskStatus.COMPLETE.isTerminal());
        assertTrue(TaskStatus.FAILED.isTerminal());

        assertFalse(TaskStatus.INIT.isTerminal());
        assertFalse(TaskStatus.RUNNING.isTerminal());
    }

    @Test
    void canTransitionTo_fromInit_shouldOnlyAllowRunning() {
        assertTrue(TaskStatus.INIT.canTransitionTo(TaskStatus.RUNNING));

        assertFalse(TaskStatus.INIT.canTransitionTo(TaskStatus.COMPLETE));
        assertFalse(TaskStatus.INIT.canTransitionTo(TaskStatus.FAILED));
    }

    @Test
    void canTransitionTo_fromRunning_shouldAllowCompleteOrFailed() {
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.COMPLETE));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.FAILED));

        assertFalse(TaskStatus.RUNNING.canTransitionTo(TaskStatus.INIT));
    }

    @Test
    void canTransitionTo_fromTerminalStates_shouldOnlyAllowNewRun() {
        assertTrue(TaskStatus.COMPLETE.canTransitionTo(TaskStatus.RUNNING));
        assertTrue(TaskStatus.FAILED.canTransitionTo(TaskStatus.RUNNING));

        assertFalse(TaskStatus.COMPLETE.canTransitionTo(TaskStatus.FAILED));
        assertFalse(TaskStatus.FAILED.canTransitionTo(TaskStatus.COMPLETE));
    }
}
