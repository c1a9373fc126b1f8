package com.taskagent.engine.ratelimit;

import java.time.Duration;

/**
 * Blocks the calling thread. Replaced in tests by a clock-advancing fake.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);

    void sleep(Duration duration) throws InterruptedException;
}
