package com.splitttr.realtime.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.splitttr.realtime.operation.DocumentState;
import com.splitttr.realtime.operation.EditOperation;
import com.splitttr.realtime.presence.UserPresence;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerMessage(
    Type type,
    String connectionId,
    String sessionId,
    String workspaceId,
    String userId,
    DocumentState state,
    List<String> participants,
    List<EditOperation> operations,
    EditOperation operation,
    CursorPosition cursor,
    TextSelection selection,
    UserPresence presence,
    String message,
    String error,
    Instant timestamp
) {
    public enum Type {
        @JsonProperty("connected") CONNECTED,
        @JsonProperty("session_state") SESSION_STATE,
        @JsonProperty("operation") OPERATION,
        @JsonProperty("cursor_update") CURSOR_UPDATE,
        @JsonProperty("selection_update") SELECTION_UPDATE,
        @JsonProperty("user_joined") USER_JOINED,
        @JsonProperty("user_left") USER_LEFT,
        @JsonProperty("presence_update") PRESENCE_UPDATE,
        @JsonProperty("error") ERROR
    }

    public static ServerMessage connected(String connectionId, String userId, String workspaceId, Instant at) {
        return new ServerMessage(Type.CONNECTED, connectionId, null, workspaceId, userId,
            null, null, null, null, null, null, null, null, null, at);
    }

    public static ServerMessage sessionState(String sessionId, DocumentState state, List<String> participants,
                                             List<EditOperation> operations, Instant at) {
        return new ServerMessage(Type.SESSION_STATE, null, sessionId, null, null,
            state, participants, operations, null, null, null, null, null, null, at);
    }

    public static ServerMessage operation(String sessionId, EditOperation op, String userId, Instant at) {
        return new ServerMessage(Type.OPERATION, null, sessionId, null, userId,
            null, null, null, op, null, null, null, null, null, at);
    }

    public static ServerMessage cursor(String sessionId, String userId, CursorPosition cursor) {
        return new ServerMessage(Type.CURSOR_UPDATE, null, sessionId, null, userId,
            null, null, null, null, cursor, null, null, null, null, cursor.timestamp());
    }

    public static ServerMessage selection(String sessionId, String userId, TextSelection selection) {
        return new ServerMessage(Type.SELECTION_UPDATE, null, sessionId, null, userId,
            null, null, null, null, null, selection, null, null, null, selection.timestamp());
    }

    public static ServerMessage userJoined(String sessionId, String userId, Instant at) {
        return new ServerMessage(Type.USER_JOINED, null, sessionId, null, userId,
            null, null, null, null, null, null, null, null, null, at);
    }

    public static ServerMessage userLeft(String sessionId, String userId, Instant at) {
        return new ServerMessage(Type.USER_LEFT, null, sessionId, null, userId,
            null, null, null, null, null, null, null, null, null, at);
    }

    public static ServerMessage userJoinedWorkspace(String workspaceId, String userId, Instant at) {
        return new ServerMessage(Type.USER_JOINED, null, null, workspaceId, userId,
            null, null, null, null, null, null, null, null, null, at);
    }

    public static ServerMessage userLeftWorkspace(String workspaceId, String userId, Instant at) {
        return new ServerMessage(Type.USER_LEFT, null, null, workspaceId, userId,
            null, null, null, null, null, null, null, null, null, at);
    }

    public static ServerMessage presence(String userId, UserPresence presence, Instant at) {
        return new ServerMessage(Type.PRESENCE_UPDATE, null, null, null, userId,
            null, null, null, null, null, null, presence, null, null, at);
    }

    public static ServerMessage error(String message, String error, Instant at) {
        return new ServerMessage(Type.ERROR, null, null, null, null,
            null, null, null, null, null, null, null, message, error, at);
    }
}
