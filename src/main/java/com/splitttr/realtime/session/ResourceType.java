package com.splitttr.realtime.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.splitttr.realtime.presence.UserLocation;

public enum ResourceType {
    @JsonProperty("conversation") CONVERSATION(UserLocation.Type.CONVERSATION),
    @JsonProperty("artifact") ARTIFACT(UserLocation.Type.ARTIFACT),
    @JsonProperty("document") DOCUMENT(UserLocation.Type.DOCUMENT);

    private final UserLocation.Type locationType;

    ResourceType(UserLocation.Type locationType) {
        this.locationType = locationType;
    }

    public UserLocation locationOf(String resourceId) {
        return new UserLocation(locationType, resourceId);
    }
}
