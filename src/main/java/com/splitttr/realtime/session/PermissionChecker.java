package com.splitttr.realtime.session;

@FunctionalInterface
public interface PermissionChecker {

    boolean checkPermissions(CollaborationSession session, String userId);
}
