package com.splitttr.realtime.rest;

import com.splitttr.realtime.presence.PresenceTracker;
import com.splitttr.realtime.presence.UserPresence;
import com.splitttr.realtime.presence.WorkspaceStats;
import com.splitttr.realtime.rest.dto.OpenSessionRequest;
import com.splitttr.realtime.rest.dto.SessionSummary;
import com.splitttr.realtime.security.AuthService;
import com.splitttr.realtime.session.OpenedSession;
import com.splitttr.realtime.session.SessionManager;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

@Path("/api/collab")
@Produces(MediaType.APPLICATION_JSON)
public class SessionResource {

    @Inject AuthService auth;
    @Inject SessionManager sessions;
    @Inject PresenceTracker presence;

    /**
     * Opens the live session for a resource on behalf of the caller: 201 when it was created,
     * 200 when the caller joined one that already existed. The caller must be present in the
     * workspace.
     */
    @POST
    @Path("/sessions")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response open(OpenSessionRequest req) {
        String userId = auth.requireUserId();
        if (req == null || isBlank(req.resourceId()) || req.resourceType() == null || isBlank(req.workspaceId())) {
            throw new SessionManager.ValidationException("resourceId, resourceType and workspaceId are required");
        }
        if (!presence.isInWorkspace(userId, req.workspaceId())) {
            throw new SessionManager.ForbiddenException("Connect to workspace " + req.workspaceId() + " first");
        }
        OpenedSession opened = sessions.open(req.resourceId(), req.resourceType(), userId, req.workspaceId());
        return Response.status(opened.created() ? Response.Status.CREATED : Response.Status.OK)
            .entity(SessionSummary.from(opened.session()))
            .build();
    }

    @POST
    @Path("/sessions/{id}/leave")
    public Response leave(@PathParam("id") String id) {
        sessions.leaveSession(id, auth.requireUserId());
        return Response.noContent().build();
    }

    @GET
    @Path("/sessions")
    public List<SessionSummary> list() {
        auth.requireUserId();
        return sessions.getActiveSessions().stream().map(SessionSummary::from).toList();
    }

    @GET
    @Path("/sessions/{id}")
    public SessionSummary get(@PathParam("id") String id) {
        auth.requireUserId();
        return sessions.getSession(id)
            .map(SessionSummary::from)
            .orElseThrow(() -> new SessionManager.NotFoundException("Collaboration session not found"));
    }

    @GET
    @Path("/workspaces/{id}/presence")
    public List<UserPresence> workspacePresence(@PathParam("id") String workspaceId) {
        auth.requireUserId();
        return presence.getUsersInWorkspace(workspaceId);
    }

    @GET
    @Path("/workspaces/{id}/stats")
    public WorkspaceStats workspaceStats(@PathParam("id") String workspaceId) {
        auth.requireUserId();
        return presence.getWorkspaceStats(workspaceId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
