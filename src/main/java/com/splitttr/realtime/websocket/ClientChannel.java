package com.splitttr.realtime.websocket;

import java.util.function.Consumer;

/**
 * Transport-level connection to one client.
 */
public interface ClientChannel {

    String id();

    boolean isOpen();

    /**
     * Queues a text frame. Frames sent to one channel are delivered in call order.
     * {@code onFailure} may run on another thread.
     */
    void send(String payload, Consumer<Throwable> onFailure);

    void close(int code, String reason);
}
