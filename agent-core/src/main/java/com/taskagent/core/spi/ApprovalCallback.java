package com.taskagent.core.spi;

import java.util.Map;

/**
 * Asks a human or a policy whether a tool may run. May block for as long as
 * the answer takes.
 */
@FunctionalInterface
public interface ApprovalCallback {

    /**
     * @param toolName The tool about to run
     * @param args Its arguments
     * @param description Why the oracle wants to run it; may be null
     * @return true to run the tool, false to skip it
     */
    boolean getApproval(String toolName, Map<String, Object> args, String description);
}
