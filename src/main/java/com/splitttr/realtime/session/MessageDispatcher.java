package com.splitttr.realtime.session;

import com.splitttr.realtime.message.ServerMessage;

/**
 * Delivers an outbound message to a user's live connection, if any.
 */
@FunctionalInterface
public interface MessageDispatcher {

    void send(String userId, ServerMessage message);
}
