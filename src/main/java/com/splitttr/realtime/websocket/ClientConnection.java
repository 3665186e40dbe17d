package com.splitttr.realtime.websocket;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class ClientConnection {

    private final ClientChannel channel;
    private final String userId;
    private final String workspaceId;
    private final Set<String> sessionIds = ConcurrentHashMap.newKeySet();
    private volatile long lastActive;

    ClientConnection(ClientChannel channel, String userId, String workspaceId, long lastActive) {
        this.channel = channel;
        this.userId = userId;
        this.workspaceId = workspaceId;
        this.lastActive = lastActive;
    }

    public String id() {
        return channel.id();
    }

    public ClientChannel channel() {
        return channel;
    }

    public String userId() {
        return userId;
    }

    public String workspaceId() {
        return workspaceId;
    }

    public Set<String> sessionIds() {
        return Set.copyOf(sessionIds);
    }

    public boolean isIn(String sessionId) {
        return sessionIds.contains(sessionId);
    }

    long lastActive() {
        return lastActive;
    }

    void markActive(long tick) {
        lastActive = tick;
    }

    void attach(String sessionId) {
        sessionIds.add(sessionId);
    }

    void detach(String sessionId) {
        sessionIds.remove(sessionId);
    }
}
