package com.splitttr.realtime.presence;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PresenceStatus {
    @JsonProperty("online") ONLINE,
    @JsonProperty("away") AWAY,
    @JsonProperty("offline") OFFLINE
}
