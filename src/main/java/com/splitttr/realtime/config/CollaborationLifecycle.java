package com.splitttr.realtime.config;

import com.splitttr.realtime.presence.PresenceTracker;
import com.splitttr.realtime.session.SessionManager;
import com.splitttr.realtime.session.SessionPersister;
import com.splitttr.realtime.websocket.CollaborationGateway;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Starts the presence sweep and shuts the core down in dependency order: connections first,
 * then sessions, then the persister drains, then the sweep stops.
 */
@ApplicationScoped
public class CollaborationLifecycle {

    private static final Logger LOG = Logger.getLogger(CollaborationLifecycle.class);

    @Inject PresenceTracker presence;
    @Inject SessionManager sessions;
    @Inject SessionPersister persister;
    @Inject CollaborationGateway gateway;

    void onStart(@Observes StartupEvent event) {
        presence.start();
        LOG.info("Real-time collaboration service started");
    }

    void onStop(@Observes ShutdownEvent event) {
        gateway.shutdown();
        sessions.shutdown();
        persister.close();
        presence.close();
        LOG.info("Real-time collaboration service stopped");
    }
}
