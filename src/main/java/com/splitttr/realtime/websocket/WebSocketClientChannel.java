package com.splitttr.realtime.websocket;

import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.WebSocketConnection;
import org.jboss.logging.Logger;

import java.util.function.Consumer;

/**
 * {@link ClientChannel} over a Quarkus WebSocket connection. Sends are non-blocking.
 */
class WebSocketClientChannel implements ClientChannel {

    private static final Logger LOG = Logger.getLogger(WebSocketClientChannel.class);

    private final WebSocketConnection connection;

    WebSocketClientChannel(WebSocketConnection connection) {
        this.connection = connection;
    }

    @Override
    public String id() {
        return connection.id();
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }

    @Override
    public void send(String payload, Consumer<Throwable> onFailure) {
        connection.sendText(payload)
            .subscribe().with(ignored -> { }, onFailure);
    }

    @Override
    public void close(int code, String reason) {
        if (!connection.isOpen()) {
            return;
        }
        connection.close(new CloseReason(code, reason))
            .subscribe().with(
                ignored -> LOG.debugf("Closed connection %s with %d", connection.id(), code),
                failure -> LOG.warnf("Closing connection %s failed: %s", connection.id(), failure.getMessage()));
    }
}
