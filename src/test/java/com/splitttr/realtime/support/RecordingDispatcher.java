package com.splitttr.realtime.support;

import com.splitttr.realtime.message.ServerMessage;
import com.splitttr.realtime.session.MessageDispatcher;

import java.util.ArrayList;
import java.util.List;

public class RecordingDispatcher implements MessageDispatcher {

    public record Sent(String userId, ServerMessage message) {}

    private final List<Sent> sent = new ArrayList<>();

    @Override
    public synchronized void send(String userId, ServerMessage message) {
        sent.add(new Sent(userId, message));
    }

    public synchronized List<ServerMessage> to(String userId) {
        return sent.stream().filter(s -> s.userId().equals(userId)).map(Sent::message).toList();
    }

    public synchronized List<ServerMessage> to(String userId, ServerMessage.Type type) {
        return to(userId).stream().filter(m -> m.type() == type).toList();
    }

    public synchronized List<Sent> all() {
        return List.copyOf(sent);
    }

    public synchronized void clear() {
        sent.clear();
    }
}
