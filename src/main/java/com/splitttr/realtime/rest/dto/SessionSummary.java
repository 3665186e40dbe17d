package com.splitttr.realtime.rest.dto;

import com.splitttr.realtime.session.CollaborationSession;
import com.splitttr.realtime.session.ResourceType;

import java.time.Instant;
import java.util.List;

public record SessionSummary(
    String id,
    String resourceId,
    ResourceType resourceType,
    String workspaceId,
    List<String> participants,
    long revision,
    int length,
    Instant createdAt,
    Instant lastActivity
) {
    public static SessionSummary from(CollaborationSession session) {
        return new SessionSummary(
            session.getId(),
            session.getResourceId(),
            session.getResourceType(),
            session.getWorkspaceId(),
            session.getParticipants(),
            session.getRevision(),
            session.getState().length(),
            session.getCreatedAt(),
            session.getLastActivity()
        );
    }
}
