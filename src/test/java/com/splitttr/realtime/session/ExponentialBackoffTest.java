package com.splitttr.realtime.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExponentialBackoffTest {

    @Test
    @DisplayName("delays double from the base and stop at the cap")
    void doublesUpToCap() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(200), Duration.ofSeconds(5));

        assertThat(backoff.delayFor(0)).isEqualTo(Duration.ZERO);
        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(backoff.delayFor(2)).isEqualTo(Duration.ofMillis(400));
        assertThat(backoff.delayFor(5)).isEqualTo(Duration.ofMillis(3200));
        assertThat(backoff.delayFor(6)).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.delayFor(100)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("rejects a cap below the base delay")
    void invalidSettings() {
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ofSeconds(2), Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ZERO, Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
