package com.splitttr.realtime.session;

import com.splitttr.realtime.operation.DocumentState;
import com.splitttr.realtime.operation.EditOperation;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of a session handed to collaborators.
 */
public record SessionSnapshot(
    String id,
    String resourceId,
    ResourceType resourceType,
    String workspaceId,
    List<String> participants,
    DocumentState state,
    List<EditOperation> operations,
    long revision,
    Instant createdAt,
    Instant lastActivity
) {
    public SessionSnapshot {
        participants = List.copyOf(participants);
        operations = List.copyOf(operations);
    }
}
