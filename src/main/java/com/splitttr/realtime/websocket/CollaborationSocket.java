package com.splitttr.realtime.websocket;

import com.splitttr.realtime.security.AuthService;
import io.quarkus.websockets.next.OnClose;
import io.quarkus.websockets.next.OnError;
import io.quarkus.websockets.next.OnOpen;
import io.quarkus.websockets.next.OnTextMessage;
import io.quarkus.websockets.next.WebSocket;
import io.quarkus.websockets.next.WebSocketConnection;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * WebSocket endpoint for real-time collaboration inside one workspace.
 * Requires JWT authentication - user identity extracted from token.
 */
@WebSocket(path = "/ws/collab/{workspaceId}")
public class CollaborationSocket {

    private static final Logger LOG = Logger.getLogger(CollaborationSocket.class);

    @Inject
    CollaborationGateway gateway;

    @Inject
    AuthService authService;

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        String userId = authService.currentUserId().orElse(null);
        gateway.connect(new WebSocketClientChannel(connection), userId, connection.pathParam("workspaceId"));
    }

    @OnTextMessage
    public void onMessage(String message, WebSocketConnection connection) {
        gateway.onMessage(connection.id(), message);
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        gateway.disconnect(connection.id());
    }

    @OnError
    public void onError(WebSocketConnection connection, Throwable t) {
        LOG.warnf("WebSocket error on %s: %s", connection.id(), t.getMessage());
        gateway.disconnect(connection.id());
    }
}
