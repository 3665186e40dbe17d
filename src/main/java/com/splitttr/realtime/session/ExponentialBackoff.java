package com.splitttr.realtime.session;

import java.time.Duration;

/**
 * Delay before retry {@code n}: {@code min(baseDelay * 2^(n - 1), maxDelay)}.
 */
public class ExponentialBackoff {

    private final Duration baseDelay;
    private final Duration maxDelay;

    public ExponentialBackoff(Duration baseDelay, Duration maxDelay) {
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be greater than or equal to baseDelay");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    public Duration delayFor(int failureCount) {
        if (failureCount <= 0) {
            return Duration.ZERO;
        }
        int shift = Math.min(failureCount - 1, 30);
        long delayMillis = baseDelay.toMillis() << shift;
        return Duration.ofMillis(Math.min(delayMillis, maxDelay.toMillis()));
    }
}
