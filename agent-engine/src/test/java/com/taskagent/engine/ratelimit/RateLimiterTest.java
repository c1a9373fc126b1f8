package com.taskagent.engine.ratelimit;

import com.taskagent.core.exception.ConfigurationException;
import com.taskagent.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class RateLimiterTest {

    private TimeController time;
    private List<Duration> sleeps;
    private Sleeper sleeper;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(Instant.parse("2024-01-15T10:00:00Z"));
        sleeps = new ArrayList<>();
        sleeper = duration -> {
            sleeps.add(duration);
            time.advance(duration);
        };
    }

    @Test
    @DisplayName("Requests below the limit are registered without waiting")
    void acquire_belowLimit_shouldNotWait() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(3, time, sleeper);

        limiter.acquire();
        limiter.acquire();
        limiter.acquire();

        assertThat(sleeps).isEmpty();
        assertThat(limiter.getCurrentRpm()).isEqualTo(3);
    }

    @Test
    @DisplayName("A request at the limit waits until the oldest request leaves the window")
    void acquire_atLimit_shouldWaitForOldestToExpire() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(2, time, sleeper);

        limiter.acquire();
        time.advanceSeconds(10);
        limiter.acquire();
        limiter.acquire();

        assertThat(sleeps).containsExactly(Duration.ofSeconds(50));
        assertThat(time.now()).isEqualTo(Instant.parse("2024-01-15T10:01:00Z"));
        assertThat(limiter.getCurrentRpm()).isEqualTo(2);
    }

    @Test
    @DisplayName("At most R requests are registered in any 60 second window")
    void acquire_manyRequests_shouldNeverExceedLimitInWindow() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(5, time, sleeper);
        List<Instant> registrations = new ArrayList<>();

        for (int i = 0; i < 23; i++) {
            limiter.acquire();
            registrations.add(time.now());
            time.advanceSeconds(3);
        }

        for (Instant start : registrations) {
            long inWindow = registrations.stream()
                .filter(t -> !t.isBefore(start) && t.isBefore(start.plusSeconds(60)))
                .count();
            assertThat(inWindow).isLessThanOrEqualTo(5);
        }
    }

    @Test
    @DisplayName("Wait time and current rate are read without registering")
    void getWaitTime_shouldReportWithoutRegistering() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(2, time, sleeper);

        assertThat(limiter.getWaitTime()).isEqualTo(Duration.ZERO);

        limiter.acquire();
        time.advanceSeconds(20);
        limiter.acquire();

        assertThat(limiter.getWaitTime()).isEqualTo(Duration.ofSeconds(40));
        assertThat(limiter.getCurrentRpm()).isEqualTo(2);

        time.advanceSeconds(40);
        assertThat(limiter.getWaitTime()).isEqualTo(Duration.ZERO);
        assertThat(limiter.getCurrentRpm()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Concurrent callers never register more than the limit")
    void acquire_concurrentCallers_shouldShareQuota() throws Exception {
        RateLimiter limiter = new RateLimiter(50, time, duration -> {
            throw new InterruptedException("should not wait");
        });
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < 50; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    limiter.acquire();
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(limiter.getCurrentRpm()).isEqualTo(50);
        assertThat(limiter.getWaitTime()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void constructor_shouldRejectNonPositiveLimit() {
        assertThatThrownBy(() -> new RateLimiter(0, time, sleeper))
            .isInstanceOf(ConfigurationException.class);
    }
}
