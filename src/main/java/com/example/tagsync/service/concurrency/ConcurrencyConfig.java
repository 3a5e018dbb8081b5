package com.example.tagsync.service.concurrency;

import java.time.Duration;
import java.util.Objects;

/**
 * Concurrency and pacing limits for one batch.
 *
 * @param maxConcurrent  slots available to the batch
 * @param minDelay       delay before each provider call while the provider is healthy
 * @param throttledDelay delay before each provider call after a recent throttling signal
 */
public record ConcurrencyConfig(
    int maxConcurrent,
    Duration minDelay,
    Duration throttledDelay
) {

    public ConcurrencyConfig {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, was " + maxConcurrent);
        }
        Objects.requireNonNull(minDelay, "minDelay");
        Objects.requireNonNull(throttledDelay, "throttledDelay");
        if (minDelay.isNegative() || throttledDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
    }

    /**
     * Candidate search: read-only, tolerates more parallelism.
     */
    public static ConcurrencyConfig forSearch() {
        return new ConcurrencyConfig(4, Duration.ofMillis(100), Duration.ofMillis(2000));
    }

    /**
     * Applying selections: hits the stricter track endpoint.
     */
    public static ConcurrencyConfig forApply() {
        return new ConcurrencyConfig(3, Duration.ofMillis(100), Duration.ofMillis(2000));
    }
}
