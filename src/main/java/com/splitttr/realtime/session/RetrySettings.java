package com.splitttr.realtime.session;

import java.time.Duration;

public record RetrySettings(int maxAttempts, Duration baseDelay, Duration maxDelay) {

    public RetrySettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static RetrySettings defaults() {
        return new RetrySettings(5, Duration.ofMillis(200), Duration.ofSeconds(5));
    }
}
