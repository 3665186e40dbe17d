package com.splitttr.realtime.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.splitttr.realtime.operation.EditOperation;
import com.splitttr.realtime.presence.PresenceUpdate;
import com.splitttr.realtime.session.ResourceType;

public record ClientMessage(
    Type type,
    String sessionId,
    String resourceId,
    ResourceType resourceType,
    EditOperation operation,
    CursorPosition cursor,
    TextSelection selection,
    PresenceUpdate presence
) {
    public enum Type {
        @JsonProperty("join_session") JOIN_SESSION,
        @JsonProperty("leave_session") LEAVE_SESSION,
        @JsonProperty("operation") OPERATION,
        @JsonProperty("cursor_update") CURSOR_UPDATE,
        @JsonProperty("selection_update") SELECTION_UPDATE,
        @JsonProperty("presence_update") PRESENCE_UPDATE
    }
}
