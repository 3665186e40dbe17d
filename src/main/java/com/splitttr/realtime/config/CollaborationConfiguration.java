package com.splitttr.realtime.config;

import com.splitttr.realtime.client.DocumentServiceGateway;
import com.splitttr.realtime.message.MessageCodec;
import com.splitttr.realtime.presence.PresenceSettings;
import com.splitttr.realtime.presence.PresenceTracker;
import com.splitttr.realtime.security.WorkspacePermissionChecker;
import com.splitttr.realtime.session.RetrySettings;
import com.splitttr.realtime.session.SessionManager;
import com.splitttr.realtime.session.SessionPersister;
import com.splitttr.realtime.session.SessionSettings;
import com.splitttr.realtime.transform.ConflictResolver;
import com.splitttr.realtime.websocket.CollaborationGateway;
import com.splitttr.realtime.websocket.ConnectionRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ForkJoinPool;

/**
 * Wires the collaboration core. The core classes are plain Java; this is the only place that
 * knows about CDI and configuration.
 */
@ApplicationScoped
public class CollaborationConfiguration {

    @ConfigProperty(name = "collab.presence.idle-timeout", defaultValue = "5m")
    Duration idleTimeout;

    @ConfigProperty(name = "collab.presence.stale-timeout", defaultValue = "30m")
    Duration staleTimeout;

    @ConfigProperty(name = "collab.presence.sweep-interval", defaultValue = "1m")
    Duration sweepInterval;

    @ConfigProperty(name = "collab.session.history-on-join", defaultValue = "100")
    int historyOnJoin;

    @ConfigProperty(name = "collab.session.retained-operations", defaultValue = "1000")
    int retainedOperations;

    @ConfigProperty(name = "collab.persistence.max-attempts", defaultValue = "5")
    int maxAttempts;

    @ConfigProperty(name = "collab.persistence.base-delay", defaultValue = "200ms")
    Duration baseDelay;

    @ConfigProperty(name = "collab.persistence.max-delay", defaultValue = "5s")
    Duration maxDelay;

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    ConflictResolver conflictResolver() {
        return new ConflictResolver();
    }

    @Produces
    @Singleton
    MessageCodec messageCodec() {
        return new MessageCodec();
    }

    @Produces
    @Singleton
    PresenceTracker presenceTracker(Clock clock) {
        return new PresenceTracker(new PresenceSettings(idleTimeout, staleTimeout, sweepInterval), clock);
    }

    @Produces
    @Singleton
    ConnectionRegistry connectionRegistry(PresenceTracker presence, MessageCodec codec) {
        return new ConnectionRegistry(presence, codec);
    }

    @Produces
    @Singleton
    SessionPersister sessionPersister(DocumentServiceGateway documents) {
        return new SessionPersister(documents, new RetrySettings(maxAttempts, baseDelay, maxDelay));
    }

    @Produces
    @Singleton
    SessionManager sessionManager(ConflictResolver resolver,
                                  DocumentServiceGateway documents,
                                  PresenceTracker presence,
                                  SessionPersister persister,
                                  ConnectionRegistry registry,
                                  Clock clock) {
        return new SessionManager(resolver, documents, new WorkspacePermissionChecker(presence), persister,
            registry, new SessionSettings(historyOnJoin, retainedOperations), clock);
    }

    @Produces
    @Singleton
    CollaborationGateway collaborationGateway(SessionManager sessions,
                                              PresenceTracker presence,
                                              ConnectionRegistry registry,
                                              MessageCodec codec,
                                              Clock clock) {
        return new CollaborationGateway(sessions, presence, registry, codec, clock, ForkJoinPool.commonPool());
    }
}
