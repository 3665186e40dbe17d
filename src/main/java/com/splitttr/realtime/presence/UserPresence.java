package com.splitttr.realtime.presence;

import java.time.Instant;

public record UserPresence(
    String userId,
    PresenceStatus status,
    Instant lastSeen,
    UserLocation currentLocation,
    String activity
) {
    static UserPresence initial(String userId, Instant now) {
        return new UserPresence(userId, PresenceStatus.OFFLINE, now, null, null);
    }

    public UserPresence withStatus(PresenceStatus newStatus) {
        return new UserPresence(userId, newStatus, lastSeen, currentLocation, activity);
    }

    UserPresence seenAt(Instant now) {
        return new UserPresence(userId, status, now, currentLocation, activity);
    }

    public UserPresence withLocation(UserLocation location) {
        return new UserPresence(userId, status, lastSeen, location, activity);
    }

    UserPresence merge(PresenceUpdate update, Instant now) {
        PresenceStatus nextStatus = update.status() != null ? update.status() : PresenceStatus.ONLINE;
        UserLocation nextLocation = update.clearLocation()
            ? null
            : (update.currentLocation() != null ? update.currentLocation() : currentLocation);
        String nextActivity = update.activity() != null ? update.activity() : activity;
        return new UserPresence(userId, nextStatus, now, nextLocation, nextActivity);
    }
}
