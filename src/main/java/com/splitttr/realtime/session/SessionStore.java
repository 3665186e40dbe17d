package com.splitttr.realtime.session;

/**
 * Durable storage for session state. Called off the request path after every admitted operation
 * and once more when a session is evicted.
 */
@FunctionalInterface
public interface SessionStore {

    void persistSession(SessionSnapshot snapshot);
}
