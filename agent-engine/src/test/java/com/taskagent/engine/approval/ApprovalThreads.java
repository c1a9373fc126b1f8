package com.taskagent.engine.approval;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Looks up the worker threads that answer timed approval requests.
 */
public final class ApprovalThreads {

    private ApprovalThreads() {
    }

    public static Set<Thread> alive() {
        return Thread.getAllStackTraces().keySet().stream()
            .filter(thread -> thread.getName().equals("approval-wait") && thread.isAlive())
            .collect(Collectors.toCollection(HashSet::new));
    }

    /**
     * Approval threads started since {@code before} that are still alive after a short grace period.
     */
    public static Set<Thread> awaitNoneStartedSince(Set<Thread> before) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(2).toNanos();
        Set<Thread> started = startedSince(before);
        while (!started.isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(20);
            started = startedSince(before);
        }
        return started;
    }

    private static Set<Thread> startedSince(Set<Thread> before) {
        Set<Thread> started = alive();
        started.removeAll(before);
        return started;
    }
}
