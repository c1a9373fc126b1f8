package com.taskagent.api.approval;

import com.taskagent.core.spi.ApprovalCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Approves tools named in a fixed allow-list and rejects everything else.
 * Used when no human is attached to the running service.
 */
public class AllowListApprovalCallback implements ApprovalCallback {

    private static final Logger log = LoggerFactory.getLogger(AllowListApprovalCallback.class);

    private final Set<String> allowedTools;

    public AllowListApprovalCallback(Collection<String> allowedTools) {
        this.allowedTools = Set.copyOf(allowedTools);
    }

    @Override
    public boolean getApproval(String toolName, Map<String, Object> args, String description) {
        boolean allowed = allowedTools.contains(toolName);
        if (!allowed) {
            log.info("Rejected tool {}: not in the allow-list", toolName);
        }
        return allowed;
    }

    public Set<String> getAllowedTools() {
        return allowedTools;
    }
}
