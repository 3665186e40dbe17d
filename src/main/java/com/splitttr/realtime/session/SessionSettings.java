package com.splitttr.realtime.session;

public record SessionSettings(int historyOnJoin, int retainedOperations) {

    public SessionSettings {
        if (historyOnJoin < 0) {
            throw new IllegalArgumentException("historyOnJoin must not be negative");
        }
        if (retainedOperations < historyOnJoin) {
            throw new IllegalArgumentException("retainedOperations must be at least historyOnJoin");
        }
    }

    public static SessionSettings defaults() {
        return new SessionSettings(100, 1000);
    }
}
