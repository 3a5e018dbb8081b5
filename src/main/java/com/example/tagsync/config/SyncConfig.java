package com.example.tagsync.config;

import com.example.tagsync.service.concurrency.ConcurrencyConfig;
import com.example.tagsync.service.concurrency.RateLimitMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Concurrency presets for the two pipelines and the shared rate-limit state.
 */
@Configuration
@Slf4j
public class SyncConfig {

    // ═══════════════════════════════════════════════════════════════
    // SEARCH PIPELINE
    // ═══════════════════════════════════════════════════════════════

    @Value("${app.sync.search.max-concurrent:4}")
    private int searchMaxConcurrent;

    @Value("${app.sync.search.min-delay-ms:100}")
    private long searchMinDelayMs;

    @Value("${app.sync.search.throttled-delay-ms:2000}")
    private long searchThrottledDelayMs;

    // ═══════════════════════════════════════════════════════════════
    // APPLY PIPELINE
    // ═══════════════════════════════════════════════════════════════

    @Value("${app.sync.apply.max-concurrent:3}")
    private int applyMaxConcurrent;

    @Value("${app.sync.apply.min-delay-ms:100}")
    private long applyMinDelayMs;

    @Value("${app.sync.apply.throttled-delay-ms:2000}")
    private long applyThrottledDelayMs;

    @Bean
    public ConcurrencyConfig searchConcurrency() {
        ConcurrencyConfig config = new ConcurrencyConfig(searchMaxConcurrent,
                Duration.ofMillis(searchMinDelayMs), Duration.ofMillis(searchThrottledDelayMs));
        log.info("Search concurrency: {}", config);
        return config;
    }

    @Bean
    public ConcurrencyConfig applyConcurrency() {
        ConcurrencyConfig config = new ConcurrencyConfig(applyMaxConcurrent,
                Duration.ofMillis(applyMinDelayMs), Duration.ofMillis(applyThrottledDelayMs));
        log.info("Apply concurrency: {}", config);
        return config;
    }

    @Bean
    public Clock syncClock() {
        return Clock.systemUTC();
    }

    /**
     * Long-lived monitor, used only when app.sync.rate-limit.shared is true.
     */
    @Bean
    public RateLimitMonitor sharedRateLimitMonitor(Clock syncClock) {
        return new RateLimitMonitor(syncClock);
    }
}
