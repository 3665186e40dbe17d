package com.splitttr.realtime.security;

import com.splitttr.realtime.presence.PresenceTracker;
import com.splitttr.realtime.session.CollaborationSession;
import com.splitttr.realtime.session.PermissionChecker;

/**
 * Lets a user into a session when they are connected to the session's workspace.
 */
public class WorkspacePermissionChecker implements PermissionChecker {

    private final PresenceTracker presence;

    public WorkspacePermissionChecker(PresenceTracker presence) {
        this.presence = presence;
    }

    @Override
    public boolean checkPermissions(CollaborationSession session, String userId) {
        return presence.isInWorkspace(userId, session.getWorkspaceId());
    }
}
