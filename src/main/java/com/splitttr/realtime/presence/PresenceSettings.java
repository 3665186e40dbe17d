package com.splitttr.realtime.presence;

import java.time.Duration;

public record PresenceSettings(Duration idleTimeout, Duration staleTimeout, Duration sweepInterval) {

    public PresenceSettings {
        if (idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("idleTimeout must be positive");
        }
        if (staleTimeout.compareTo(idleTimeout) <= 0) {
            throw new IllegalArgumentException("staleTimeout must be longer than idleTimeout");
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
    }

    public static PresenceSettings defaults() {
        return new PresenceSettings(Duration.ofMinutes(5), Duration.ofMinutes(30), Duration.ofMinutes(1));
    }
}
