package com.taskagent.core.spi;

import com.taskagent.core.debug.DebugInfo;

/**
 * Observer notified when the engine stops at a breakpoint.
 */
public interface DebugCallback {

    /**
     * Called when execution breaks.
     */
    default void onBreak(DebugInfo info) {
    }

    /**
     * Called after each break in step-by-step mode.
     */
    default void onStep(DebugInfo info) {
    }

    /**
     * Called when the task fails while a debug session is active.
     */
    default void onError(Throwable error, DebugInfo info) {
    }
}
