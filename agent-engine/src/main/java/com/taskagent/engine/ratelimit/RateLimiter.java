package com.taskagent.engine.ratelimit;

import com.taskagent.core.exception.ConfigurationException;
import com.taskagent.engine.metrics.AgentMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window limiter for oracle requests: at most {@code requestsPerMinute}
 * registrations in any 60 second window.
 *
 * Thread-safe. One instance may be shared by several engines to split a quota.
 * The lock is held only for check-and-register; waiting happens outside it.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public static final Duration WINDOW = Duration.ofSeconds(60);

    private final int requestsPerMinute;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Deque<Instant> requests = new ArrayDeque<>();
    private final Object lock = new Object();
    private volatile AgentMetrics metrics;

    public RateLimiter(int requestsPerMinute) {
        this(requestsPerMinute, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public RateLimiter(int requestsPerMinute, Clock clock, Sleeper sleeper) {
        if (requestsPerMinute < 1) {
            throw new ConfigurationException("Rate limit must be at least 1 request per minute, got " + requestsPerMinute);
        }
        this.requestsPerMinute = requestsPerMinute;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Record wait times on the given metrics.
     */
    public void setMetrics(AgentMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Block until a request may be made, then register it.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void acquire() throws InterruptedException {
        while (true) {
            Duration wait;
            synchronized (lock) {
                Instant now = clock.instant();
                prune(now);
                if (requests.size() < requestsPerMinute) {
                    requests.addLast(now);
                    return;
                }
                wait = Duration.between(now.minus(WINDOW), requests.peekFirst());
            }
            log.debug("Rate limit of {} requests/minute reached, waiting {} ms", requestsPerMinute, wait.toMillis());
            AgentMetrics current = metrics;
            if (current != null) {
                current.rateLimitWaited(wait);
            }
            sleeper.sleep(wait);
        }
    }

    /**
     * Number of requests registered in the current window.
     */
    public int getCurrentRpm() {
        synchronized (lock) {
            Instant cutoff = clock.instant().minus(WINDOW);
            return (int) requests.stream().filter(t -> t.isAfter(cutoff)).count();
        }
    }

    /**
     * How long a request made now would have to wait; zero below the limit.
     */
    public Duration getWaitTime() {
        synchronized (lock) {
            Instant cutoff = clock.instant().minus(WINDOW);
            Instant[] live = requests.stream().filter(t -> t.isAfter(cutoff)).toArray(Instant[]::new);
            if (live.length < requestsPerMinute) {
                return Duration.ZERO;
            }
            return Duration.between(cutoff, live[0]);
        }
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!requests.isEmpty() && !requests.peekFirst().isAfter(cutoff)) {
            requests.pollFirst();
        }
    }
}
