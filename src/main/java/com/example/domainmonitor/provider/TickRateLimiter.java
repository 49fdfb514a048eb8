package com.example.domainmonitor.provider;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Fixed-cadence limiter shared by every caller of one remote API.
 *
 * One permission is issued per interval and each permission goes to exactly one caller,
 * which bounds the call rate across all threads. Unused permissions do not accumulate,
 * so at most one caller can go immediately after an idle period.
 */
@Slf4j
public class TickRateLimiter {

    static final Duration MAX_WAIT = Duration.ofMinutes(10);

    private final String name;
    private final RateLimiter limiter;

    public TickRateLimiter(String name, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Tick interval must be positive: " + interval);
        }
        this.name = name;
        this.limiter = RateLimiter.of(name, RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(interval)
                .timeoutDuration(MAX_WAIT)
                .build());
        log.debug("[{}] Rate limiter allows one call every {}", name, interval);
    }

    /**
     * Blocks until this caller holds a permission.
     *
     * @throws InterruptedException if the thread is interrupted while waiting
     * @throws IllegalStateException if no permission became free within {@link #MAX_WAIT}
     */
    public void acquire() throws InterruptedException {
        if (limiter.acquirePermission()) {
            return;
        }
        if (Thread.interrupted()) {
            throw new InterruptedException("Interrupted while waiting for rate limiter " + name);
        }
        throw new IllegalStateException("Timed out waiting for rate limiter " + name + " after " + MAX_WAIT);
    }
}
