package com.example.tagsync.service.concurrency;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Adaptive backoff driven by throttling responses from the provider.
 *
 * Any task that sees a rate-limit response records it here; every task reads it before its
 * provider call. For {@link #THROTTLE_WINDOW} after the latest signal the slower delay applies,
 * after that the normal delay comes back without any timer.
 */
@Slf4j
public class RateLimitMonitor {

    public static final Duration THROTTLE_WINDOW = Duration.ofSeconds(10);

    private static final long NO_SIGNAL = Long.MIN_VALUE;

    private final Clock clock;
    // epoch millis of the latest signal, NO_SIGNAL = none; last writer wins
    private final AtomicLong lastSignalAt = new AtomicLong(NO_SIGNAL);

    public RateLimitMonitor() {
        this(Clock.systemUTC());
    }

    public RateLimitMonitor(Clock clock) {
        this.clock = clock;
    }

    public void recordSignal() {
        long now = clock.millis();
        lastSignalAt.set(now);
        log.debug("Rate limit signal recorded at {}", now);
    }

    public boolean shouldThrottle() {
        long last = lastSignalAt.get();
        if (last == NO_SIGNAL) {
            return false;
        }
        return clock.millis() - last < THROTTLE_WINDOW.toMillis();
    }

    public Duration effectiveDelay(ConcurrencyConfig config) {
        return shouldThrottle() ? config.throttledDelay() : config.minDelay();
    }

    public Optional<Instant> lastSignalAt() {
        long last = lastSignalAt.get();
        return last == NO_SIGNAL ? Optional.empty() : Optional.of(Instant.ofEpochMilli(last));
    }
}
