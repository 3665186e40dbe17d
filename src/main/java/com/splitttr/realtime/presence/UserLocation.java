package com.splitttr.realtime.presence;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where a user currently is. A back-reference only; presence never owns the target.
 */
public record UserLocation(Type type, String id) {

    public enum Type {
        @JsonProperty("workspace") WORKSPACE,
        @JsonProperty("project") PROJECT,
        @JsonProperty("conversation") CONVERSATION,
        @JsonProperty("document") DOCUMENT,
        @JsonProperty("artifact") ARTIFACT
    }

    public static UserLocation workspace(String workspaceId) {
        return new UserLocation(Type.WORKSPACE, workspaceId);
    }
}
