package com.example.tagsync.service.concurrency;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyConfigTest {

    @Test
    void presets() {
        ConcurrencyConfig search = ConcurrencyConfig.forSearch();
        assertThat(search.maxConcurrent()).isEqualTo(4);
        assertThat(search.minDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(search.throttledDelay()).isEqualTo(Duration.ofMillis(2000));

        ConcurrencyConfig apply = ConcurrencyConfig.forApply();
        assertThat(apply.maxConcurrent()).isEqualTo(3);
        assertThat(apply.minDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(apply.throttledDelay()).isEqualTo(Duration.ofMillis(2000));
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> new ConcurrencyConfig(0, Duration.ZERO, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConcurrencyConfig(1, Duration.ofMillis(-1), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConcurrencyConfig(1, null, Duration.ZERO))
                .isInstanceOf(NullPointerException.class);
    }
}
