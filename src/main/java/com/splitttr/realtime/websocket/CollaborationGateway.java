package com.splitttr.realtime.websocket;

import com.splitttr.realtime.message.ClientMessage;
import com.splitttr.realtime.message.MalformedMessageException;
import com.splitttr.realtime.message.MessageCodec;
import com.splitttr.realtime.message.ServerMessage;
import com.splitttr.realtime.presence.PresenceStatus;
import com.splitttr.realtime.presence.PresenceTracker;
import com.splitttr.realtime.presence.PresenceUpdate;
import com.splitttr.realtime.presence.UserLocation;
import com.splitttr.realtime.session.CollaborationSession;
import com.splitttr.realtime.session.SessionManager;
import com.splitttr.realtime.session.SessionManager.CollaborationException;
import com.splitttr.realtime.session.SessionManager.ValidationException;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Routes inbound frames from authenticated connections to the session manager and presence
 * tracker, and releases everything a connection held when it goes away.
 *
 * <p>The user id always comes from the transport's authenticated identity; ids carried in
 * payloads are overwritten.
 */
public class CollaborationGateway {

    private static final Logger LOG = Logger.getLogger(CollaborationGateway.class);

    public static final int MISSING_IDENTITY = 4001;
    public static final int MISSING_WORKSPACE = 4002;
    public static final int INVALID_FRAME = 1007;
    public static final int GOING_AWAY = 1001;

    private final SessionManager sessions;
    private final PresenceTracker presence;
    private final ConnectionRegistry registry;
    private final MessageCodec codec;
    private final Clock clock;

    public CollaborationGateway(SessionManager sessions,
                                PresenceTracker presence,
                                ConnectionRegistry registry,
                                MessageCodec codec,
                                Clock clock,
                                Executor cleanupExecutor) {
        this.sessions = sessions;
        this.presence = presence;
        this.registry = registry;
        this.codec = codec;
        this.clock = clock;
        // failures surface inside send callbacks, possibly under a session lock
        registry.onTransportFailure(connectionId -> cleanupExecutor.execute(() -> disconnect(connectionId)));
        presence.onWorkspaceDeparture(this::releaseWorkspaceSessions);
    }

    public Optional<ClientConnection> connect(ClientChannel channel, String userId, String workspaceId) {
        if (isBlank(userId)) {
            LOG.warnf("Rejecting connection %s: no authenticated user", channel.id());
            channel.close(MISSING_IDENTITY, "Authentication required");
            return Optional.empty();
        }
        if (isBlank(workspaceId)) {
            LOG.warnf("Rejecting connection %s of user %s: no workspace", channel.id(), userId);
            channel.close(MISSING_WORKSPACE, "Workspace required");
            return Optional.empty();
        }

        ClientConnection connection = registry.register(channel, userId, workspaceId);
        presence.addToWorkspace(userId, workspaceId);
        registry.sendToConnection(connection.id(), ServerMessage.connected(connection.id(), userId, workspaceId, clock.instant()));
        LOG.infof("Connection %s opened (user %s, workspace %s)", connection.id(), userId, workspaceId);
        return Optional.of(connection);
    }

    public void onMessage(String connectionId, String frame) {
        Optional<ClientConnection> found = registry.get(connectionId);
        if (found.isEmpty()) {
            LOG.debugf("Ignoring frame from unknown connection %s", connectionId);
            return;
        }
        ClientConnection connection = found.get();
        registry.touch(connectionId);
        if (!presence.isInWorkspace(connection.userId(), connection.workspaceId())) {
            // swept as stale while the socket stayed open
            presence.addToWorkspace(connection.userId(), connection.workspaceId());
        }

        ClientMessage message;
        try {
            message = codec.decode(frame);
        } catch (MalformedMessageException e) {
            LOG.warnf("Malformed frame from connection %s (user %s): %s",
                connectionId, connection.userId(), e.getMessage());
            registry.sendToConnection(connectionId, ServerMessage.error("Invalid message format", "invalid_message", clock.instant()));
            connection.channel().close(INVALID_FRAME, "Invalid message format");
            disconnect(connectionId);
            return;
        }

        try {
            dispatch(connection, message);
        } catch (CollaborationException e) {
            LOG.debugf("Rejected %s from user %s: %s", message.type(), connection.userId(), e.getMessage());
            registry.sendToConnection(connectionId, ServerMessage.error(e.getMessage(), e.code(), clock.instant()));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to process %s from user %s", message.type(), connection.userId());
            registry.sendToConnection(connectionId, ServerMessage.error("Failed to process message", "internal_error", clock.instant()));
        }
    }

    private void dispatch(ClientConnection connection, ClientMessage message) {
        String userId = connection.userId();
        switch (message.type()) {
            case JOIN_SESSION -> join(connection, message);
            case LEAVE_SESSION -> leave(connection, requireSessionId(message));
            case OPERATION -> {
                presence.recordActivity(userId);
                sessions.handleOperation(requireSessionId(message), message.operation(), userId);
            }
            case CURSOR_UPDATE -> sessions.handleCursorUpdate(requireSessionId(message), message.cursor(), userId);
            case SELECTION_UPDATE -> sessions.handleSelectionUpdate(requireSessionId(message), message.selection(), userId);
            case PRESENCE_UPDATE -> updatePresence(userId, message.presence());
        }
    }

    private void join(ClientConnection connection, ClientMessage message) {
        String userId = connection.userId();
        CollaborationSession session;
        if (!isBlank(message.sessionId())) {
            session = sessions.joinSession(message.sessionId(), userId);
        } else if (!isBlank(message.resourceId()) && message.resourceType() != null) {
            session = sessions.openSession(message.resourceId(), message.resourceType(), userId, connection.workspaceId());
        } else {
            throw new ValidationException("Session id or resource required");
        }

        registry.attach(connection.id(), session.getId());
        presence.updatePresence(userId, PresenceUpdate.at(session.getResourceType().locationOf(session.getResourceId())));
    }

    private void leave(ClientConnection connection, String sessionId) {
        registry.detach(connection.id(), sessionId);
        if (registry.isUserInSession(connection.userId(), sessionId)) {
            return;
        }
        sessions.leaveSession(sessionId, connection.userId());
        presence.updatePresence(connection.userId(), PresenceUpdate.at(UserLocation.workspace(connection.workspaceId())));
    }

    private void updatePresence(String userId, PresenceUpdate update) {
        if (update == null) {
            throw new ValidationException("Presence required");
        }
        if (update.status() == PresenceStatus.OFFLINE) {
            throw new ValidationException("Offline is set by disconnecting");
        }
        presence.updatePresence(userId, update);
    }

    /**
     * Releases a connection: leaves every session no other connection of the user still holds and
     * drops workspace presence when this was the user's last connection there, which in turn
     * releases the user's remaining sessions in that workspace. Safe to call twice.
     */
    public void disconnect(String connectionId) {
        Optional<ClientConnection> removed = registry.unregister(connectionId);
        if (removed.isEmpty()) {
            return;
        }
        ClientConnection connection = removed.get();
        String userId = connection.userId();

        for (String sessionId : connection.sessionIds()) {
            if (registry.isUserInSession(userId, sessionId)) {
                continue;
            }
            try {
                sessions.leaveSession(sessionId, userId);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Leaving session %s for closed connection %s failed", sessionId, connectionId);
            }
        }

        if (!registry.isUserInWorkspace(userId, connection.workspaceId())) {
            presence.removeFromWorkspace(userId, connection.workspaceId());
        }
        LOG.infof("Connection %s closed (user %s, workspace %s)", connectionId, userId, connection.workspaceId());
    }

    /**
     * Leaves the workspace's sessions a user still participates in once they have no connection
     * there. This also covers sessions opened over HTTP, which no connection holds.
     */
    private void releaseWorkspaceSessions(String userId, String workspaceId) {
        if (registry.isUserInWorkspace(userId, workspaceId)) {
            return;
        }
        for (CollaborationSession session : sessions.sessionsOf(userId, workspaceId)) {
            if (registry.isUserInSession(userId, session.getId())) {
                continue;
            }
            try {
                sessions.leaveSession(session.getId(), userId);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Leaving session %s for departed user %s failed", session.getId(), userId);
            }
        }
    }

    public void shutdown() {
        for (ClientConnection connection : registry.all()) {
            connection.channel().close(GOING_AWAY, "Server shutting down");
            disconnect(connection.id());
        }
        LOG.info("Collaboration gateway shut down");
    }

    private static String requireSessionId(ClientMessage message) {
        if (isBlank(message.sessionId())) {
            throw new ValidationException("Session id required");
        }
        return message.sessionId();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
