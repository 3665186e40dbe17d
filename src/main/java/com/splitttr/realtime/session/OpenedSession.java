package com.splitttr.realtime.session;

/**
 * Result of {@link SessionManager#open}: the session and whether the call created it.
 */
public record OpenedSession(CollaborationSession session, boolean created) {
}
