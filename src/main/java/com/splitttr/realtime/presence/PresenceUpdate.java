package com.splitttr.realtime.presence;

/**
 * Partial presence change. Null fields keep their current value; any update counts as activity.
 */
public record PresenceUpdate(
    PresenceStatus status,
    UserLocation currentLocation,
    String activity,
    boolean clearLocation
) {
    public static PresenceUpdate touch() {
        return new PresenceUpdate(null, null, null, false);
    }

    public static PresenceUpdate withStatus(PresenceStatus status) {
        return new PresenceUpdate(status, null, null, false);
    }

    public static PresenceUpdate at(UserLocation location) {
        return new PresenceUpdate(null, location, null, false);
    }

    public static PresenceUpdate doing(String activity) {
        return new PresenceUpdate(null, null, activity, false);
    }
}
