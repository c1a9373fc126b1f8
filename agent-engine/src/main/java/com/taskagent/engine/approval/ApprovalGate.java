package com.taskagent.engine.approval;

import com.taskagent.core.exception.ApprovalException;
import com.taskagent.core.model.TaskState;
import com.taskagent.core.spi.ApprovalCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a tool call may run.
 *
 * Approval is requested from the callback when auto-approval is off or the
 * streak of consecutive auto-approvals has reached its maximum. A grant resets
 * the streak, an auto-approval extends it, a rejection leaves it alone.
 * The streak lives in the {@link TaskState}, never in the gate.
 *
 * With an approval timeout, an unanswered request counts as a rejection.
 * The callback then runs on a worker thread that {@link #close()} releases.
 */
public class ApprovalGate implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    private final boolean autoApproveTools;
    private final int maxConsecutiveAutoApprovals;
    private final ApprovalCallback callback;
    private final Duration approvalTimeout;
    private ExecutorService approvalExecutor;

    /**
     * @param callback Approval source; null rejects every call that needs approval
     * @param approvalTimeout Maximum wait for an answer; null waits indefinitely
     */
    public ApprovalGate(boolean autoApproveTools, int maxConsecutiveAutoApprovals,
                        ApprovalCallback callback, Duration approvalTimeout) {
        this.autoApproveTools = autoApproveTools;
        this.maxConsecutiveAutoApprovals = maxConsecutiveAutoApprovals;
        this.callback = callback;
        this.approvalTimeout = approvalTimeout;
    }

    /**
     * Check whether the next call needs an explicit answer from the callback.
     */
    public boolean requiresApproval(TaskState state) {
        return !autoApproveTools || state.getConsecutiveAutoApprovals() >= maxConsecutiveAutoApprovals;
    }

    /**
     * Apply the policy to one tool call.
     *
     * @return true if the tool may run
     * @throws ApprovalException if the callback fails
     */
    public boolean approve(TaskState state, String toolName, Map<String, Object> args, String description) {
        if (!requiresApproval(state)) {
            state.incrementAutoApprovals();
            log.debug("Auto-approved tool {} ({} consecutive)", toolName, state.getConsecutiveAutoApprovals());
            return true;
        }
        if (callback == null) {
            log.warn("Tool {} needs approval but no approval callback is configured; rejecting", toolName);
            return false;
        }
        boolean granted = approvalTimeout == null
            ? ask(toolName, args, description)
            : askWithTimeout(toolName, args, description);
        if (granted) {
            state.resetAutoApprovals();
            log.info("Tool {} approved", toolName);
        } else {
            log.info("Tool {} rejected", toolName);
        }
        return granted;
    }

    private boolean ask(String toolName, Map<String, Object> args, String description) {
        try {
            return callback.getApproval(toolName, args, description);
        } catch (RuntimeException e) {
            throw new ApprovalException("Approval callback failed for tool " + toolName, e);
        }
    }

    private boolean askWithTimeout(String toolName, Map<String, Object> args, String description) {
        Future<Boolean> answer = executor().submit(() -> callback.getApproval(toolName, args, description));
        try {
            return Boolean.TRUE.equals(answer.get(approvalTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            answer.cancel(true);
            log.warn("No approval for tool {} within {}; treating as rejected", toolName, approvalTimeout);
            return false;
        } catch (ExecutionException e) {
            throw new ApprovalException("Approval callback failed for tool " + toolName, e.getCause());
        } catch (InterruptedException e) {
            answer.cancel(true);
            Thread.currentThread().interrupt();
            throw new ApprovalException("Interrupted while waiting for approval of tool " + toolName, e);
        }
    }

    /**
     * Stop the approval worker threads. The gate stays usable; a later
     * timed request starts a new worker.
     */
    @Override
    public synchronized void close() {
        if (approvalExecutor == null) {
            return;
        }
        approvalExecutor.shutdownNow();
        try {
            if (!approvalExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                log.warn("Approval callback still running after shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            approvalExecutor = null;
        }
    }

    private synchronized ExecutorService executor() {
        if (approvalExecutor == null) {
            approvalExecutor = Executors.newCachedThreadPool(runnable -> {
                Thread thread = new Thread(runnable, "approval-wait");
                thread.setDaemon(true);
                return thread;
            });
        }
        return approvalExecutor;
    }
}
