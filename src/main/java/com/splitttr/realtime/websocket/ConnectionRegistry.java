package com.splitttr.realtime.websocket;

import com.splitttr.realtime.message.MessageCodec;
import com.splitttr.realtime.message.ServerMessage;
import com.splitttr.realtime.presence.PresenceTracker;
import com.splitttr.realtime.session.MessageDispatcher;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Maps live connections to users, workspaces and joined sessions, and delivers outbound frames.
 * A user with several connections is reached through the one that was active most recently,
 * among those in the message's session when there are any.
 */
public class ConnectionRegistry implements MessageDispatcher {

    private static final Logger LOG = Logger.getLogger(ConnectionRegistry.class);

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> workspaceConnections = new ConcurrentHashMap<>();
    private final AtomicLong activityClock = new AtomicLong();

    private final PresenceTracker presence;
    private final MessageCodec codec;

    private volatile Consumer<String> transportFailureHandler = connectionId -> { };

    public ConnectionRegistry(PresenceTracker presence, MessageCodec codec) {
        this.presence = presence;
        this.codec = codec;
    }

    public void onTransportFailure(Consumer<String> handler) {
        this.transportFailureHandler = handler;
    }

    public ClientConnection register(ClientChannel channel, String userId, String workspaceId) {
        ClientConnection connection = new ClientConnection(channel, userId, workspaceId, activityClock.incrementAndGet());
        connections.put(connection.id(), connection);
        workspaceConnections.compute(workspaceId, (id, members) -> {
            Set<String> set = members;
            if (set == null) {
                set = ConcurrentHashMap.newKeySet();
                presence.registerBroadcast(workspaceId, message -> broadcastToWorkspace(workspaceId, message));
            }
            set.add(connection.id());
            return set;
        });
        return connection;
    }

    public Optional<ClientConnection> unregister(String connectionId) {
        ClientConnection connection = connections.remove(connectionId);
        if (connection == null) {
            return Optional.empty();
        }
        workspaceConnections.computeIfPresent(connection.workspaceId(), (id, members) -> {
            members.remove(connectionId);
            if (members.isEmpty()) {
                presence.unregisterBroadcast(id);
                return null;
            }
            return members;
        });
        return Optional.of(connection);
    }

    public Optional<ClientConnection> get(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public void touch(String connectionId) {
        ClientConnection connection = connections.get(connectionId);
        if (connection != null) {
            connection.markActive(activityClock.incrementAndGet());
        }
    }

    public void attach(String connectionId, String sessionId) {
        ClientConnection connection = connections.get(connectionId);
        if (connection != null) {
            connection.attach(sessionId);
        }
    }

    public void detach(String connectionId, String sessionId) {
        ClientConnection connection = connections.get(connectionId);
        if (connection != null) {
            connection.detach(sessionId);
        }
    }

    public boolean isUserInSession(String userId, String sessionId) {
        return connections.values().stream()
            .anyMatch(c -> c.userId().equals(userId) && c.isIn(sessionId));
    }

    public boolean isUserInWorkspace(String userId, String workspaceId) {
        return connections.values().stream()
            .anyMatch(c -> c.userId().equals(userId) && c.workspaceId().equals(workspaceId));
    }

    public List<ClientConnection> connectionsOf(String userId) {
        return connections.values().stream()
            .filter(c -> c.userId().equals(userId))
            .toList();
    }

    public List<ClientConnection> all() {
        return List.copyOf(connections.values());
    }

    public int size() {
        return connections.size();
    }

    /**
     * Delivers to the user's most recently active connection, preferring one that joined the
     * message's session when the message belongs to a session.
     */
    @Override
    public void send(String userId, ServerMessage message) {
        List<ClientConnection> open = connections.values().stream()
            .filter(c -> c.userId().equals(userId) && c.channel().isOpen())
            .toList();
        String sessionId = message.sessionId();
        List<ClientConnection> inSession = sessionId == null
            ? List.of()
            : open.stream().filter(c -> c.isIn(sessionId)).toList();
        (inSession.isEmpty() ? open : inSession).stream()
            .max(Comparator.comparingLong(ClientConnection::lastActive))
            .ifPresent(c -> deliver(c, message));
    }

    public void sendToConnection(String connectionId, ServerMessage message) {
        ClientConnection connection = connections.get(connectionId);
        if (connection != null) {
            deliver(connection, message);
        }
    }

    public void broadcastToWorkspace(String workspaceId, ServerMessage message) {
        Set<String> members = workspaceConnections.get(workspaceId);
        if (members == null) {
            return;
        }
        for (String connectionId : List.copyOf(members)) {
            sendToConnection(connectionId, message);
        }
    }

    private void deliver(ClientConnection connection, ServerMessage message) {
        if (!connection.channel().isOpen()) {
            LOG.debugf("Connection %s is closed, dropping %s", connection.id(), message.type());
            transportFailureHandler.accept(connection.id());
            return;
        }
        String frame = codec.encode(message);
        connection.channel().send(frame, failure -> {
            LOG.warnf("Sending %s to connection %s (user %s) failed: %s",
                message.type(), connection.id(), connection.userId(), failure.getMessage());
            transportFailureHandler.accept(connection.id());
        });
    }
}
