package com.splitttr.realtime.session;

import com.splitttr.realtime.message.CursorPosition;
import com.splitttr.realtime.message.ServerMessage;
import com.splitttr.realtime.message.TextSelection;
import com.splitttr.realtime.operation.DocumentState;
import com.splitttr.realtime.operation.EditOperation;
import com.splitttr.realtime.transform.ConflictResolver;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every live {@link CollaborationSession}. Work on one session is serialized by that
 * session's lock; different sessions never contend.
 */
public class SessionManager {

    private static final Logger LOG = Logger.getLogger(SessionManager.class);

    private static final int OPEN_ATTEMPTS = 3;

    private final ConcurrentHashMap<String, CollaborationSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> sessionsByResource = new ConcurrentHashMap<>();

    private final ConflictResolver resolver;
    private final ResourceStateProvider resourceStates;
    private final PermissionChecker permissions;
    private final SessionPersister persister;
    private final MessageDispatcher dispatcher;
    private final SessionSettings settings;
    private final Clock clock;

    public SessionManager(ConflictResolver resolver,
                          ResourceStateProvider resourceStates,
                          PermissionChecker permissions,
                          SessionPersister persister,
                          MessageDispatcher dispatcher,
                          SessionSettings settings,
                          Clock clock) {
        this.resolver = resolver;
        this.resourceStates = resourceStates;
        this.permissions = permissions;
        this.persister = persister;
        this.dispatcher = dispatcher;
        this.settings = settings;
        this.clock = clock;
    }

    public CollaborationSession createSession(String resourceId, ResourceType resourceType,
                                              String initiatorId, String workspaceId) {
        CollaborationSession session = newSession(resourceId, resourceType, initiatorId, workspaceId);
        sessionsByResource.put(resourceKey(resourceId, resourceType), session.getId());
        return session;
    }

    /**
     * Joins the live session for a resource, creating it when there is none. A resource whose
     * session was evicted gets a fresh one seeded from the {@link ResourceStateProvider}.
     */
    public CollaborationSession openSession(String resourceId, ResourceType resourceType,
                                            String userId, String workspaceId) {
        return open(resourceId, resourceType, userId, workspaceId).session();
    }

    /**
     * Same as {@link #openSession} but also reports whether this call created the session.
     */
    public OpenedSession open(String resourceId, ResourceType resourceType, String userId, String workspaceId) {
        String key = resourceKey(resourceId, resourceType);
        for (int attempt = 0; attempt < OPEN_ATTEMPTS; attempt++) {
            boolean[] created = {false};
            String sessionId = sessionsByResource.computeIfAbsent(key, k -> {
                created[0] = true;
                return newSession(resourceId, resourceType, userId, workspaceId).getId();
            });

            if (created[0]) {
                CollaborationSession session = sessions.get(sessionId);
                sendState(session, userId);
                return new OpenedSession(session, true);
            }

            try {
                return new OpenedSession(joinSession(sessionId, userId), false);
            } catch (NotFoundException e) {
                // evicted between lookup and join
                sessionsByResource.remove(key, sessionId);
            }
        }
        throw new NotFoundException("Could not open a session for " + resourceType + " " + resourceId);
    }

    public CollaborationSession joinSession(String sessionId, String userId) {
        CollaborationSession session = requireSession(sessionId);
        if (!isPermitted(session, userId)) {
            LOG.infof("User %s was denied access to session %s", userId, sessionId);
            throw new ForbiddenException("Permission denied");
        }

        session.mutex().lock();
        try {
            ensureOpen(session);
            boolean added = session.addParticipant(userId);
            if (added) {
                broadcast(session, ServerMessage.userJoined(sessionId, userId, clock.instant()), Set.of(userId));
                LOG.infof("User %s joined session %s (%d participants)",
                    userId, sessionId, session.getParticipants().size());
            }
            sendState(session, userId);
        } finally {
            session.mutex().unlock();
        }
        return session;
    }

    public void leaveSession(String sessionId, String userId) {
        CollaborationSession session = sessions.get(sessionId);
        if (session == null) {
            return;
        }

        session.mutex().lock();
        try {
            if (session.isClosed() || !session.removeParticipant(userId)) {
                return;
            }
            broadcast(session, ServerMessage.userLeft(sessionId, userId, clock.instant()), Set.of());
            LOG.infof("User %s left session %s", userId, sessionId);

            if (session.isEmpty()) {
                evict(session);
            }
        } finally {
            session.mutex().unlock();
        }
    }

    /**
     * Admits an edit: checks its shape, transforms it against concurrent edits, validates it
     * against the current text, applies it, and broadcasts the transformed edit to everyone but
     * its author. Returns the admitted edit. An edit whose target text concurrent deletes already
     * removed comes back {@link EditOperation#absorbed() absorbed}, without a revision and without
     * touching the session.
     */
    public EditOperation handleOperation(String sessionId, EditOperation operation, String userId) {
        if (operation == null) {
            throw new ValidationException("Operation required");
        }
        CollaborationSession session = requireSession(sessionId);

        session.mutex().lock();
        try {
            ensureOpen(session);
            ensureParticipant(session, userId);

            Instant now = clock.instant();
            EditOperation stamped = operation.withOrigin(
                operation.id() == null || operation.id().isBlank() ? UUID.randomUUID().toString() : operation.id(),
                sessionId,
                userId,
                operation.timestamp() > 0 ? operation.timestamp() : now.toEpochMilli());

            if (!stamped.isWellFormed()) {
                throw new ValidationException("Invalid operation");
            }
            if (stamped.baseRevision() != null && !session.retainsHistorySince(stamped.baseRevision())) {
                throw new ValidationException("Base revision " + stamped.baseRevision()
                    + " is not available, current revision is " + session.getRevision());
            }

            EditOperation transformed = resolver.transform(stamped, session.getOperations(), userId);
            if (!resolver.validateOperation(transformed, session.getState())) {
                throw new ValidationException("Invalid operation");
            }
            if (transformed.absorbed()) {
                LOG.debugf("Session %s: %s by %s was overtaken by concurrent deletes, nothing to apply",
                    sessionId, transformed.kind(), userId);
                return transformed;
            }

            EditOperation admitted = session.admit(transformed, resolver, now);
            broadcast(session, ServerMessage.operation(sessionId, admitted, userId, now), Set.of(userId));
            persister.submit(snapshotOf(session));

            LOG.debugf("Session %s admitted %s by %s at revision %d",
                sessionId, admitted.kind(), userId, admitted.revision());
            return admitted;
        } finally {
            session.mutex().unlock();
        }
    }

    public void handleCursorUpdate(String sessionId, CursorPosition cursor, String userId) {
        if (cursor == null || cursor.position() < 0) {
            throw new ValidationException("Invalid cursor");
        }
        CollaborationSession session = requireSession(sessionId);

        session.mutex().lock();
        try {
            ensureOpen(session);
            ensureParticipant(session, userId);
            CursorPosition stamped = cursor.stamped(userId, clock.instant());
            session.putCursor(userId, stamped);
            broadcast(session, ServerMessage.cursor(sessionId, userId, stamped), Set.of(userId));
        } finally {
            session.mutex().unlock();
        }
    }

    public void handleSelectionUpdate(String sessionId, TextSelection selection, String userId) {
        if (selection == null || selection.start() < 0 || selection.start() > selection.end()) {
            throw new ValidationException("Invalid selection");
        }
        CollaborationSession session = requireSession(sessionId);

        session.mutex().lock();
        try {
            ensureOpen(session);
            ensureParticipant(session, userId);
            TextSelection stamped = selection.stamped(userId, clock.instant());
            session.putSelection(userId, stamped);
            broadcast(session, ServerMessage.selection(sessionId, userId, stamped), Set.of(userId));
        } finally {
            session.mutex().unlock();
        }
    }

    public Optional<CollaborationSession> getSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<CollaborationSession> findByResource(String resourceId, ResourceType resourceType) {
        String sessionId = sessionsByResource.get(resourceKey(resourceId, resourceType));
        return sessionId == null ? Optional.empty() : getSession(sessionId);
    }

    public List<CollaborationSession> getActiveSessions() {
        return new ArrayList<>(sessions.values());
    }

    /**
     * Live sessions of {@code workspaceId} that {@code userId} participates in.
     */
    public List<CollaborationSession> sessionsOf(String userId, String workspaceId) {
        return sessions.values().stream()
            .filter(session -> Objects.equals(session.getWorkspaceId(), workspaceId))
            .filter(session -> session.hasParticipant(userId))
            .toList();
    }

    /**
     * Hands the final state of every live session to persistence and forgets them.
     */
    public void shutdown() {
        for (CollaborationSession session : List.copyOf(sessions.values())) {
            session.mutex().lock();
            try {
                if (!session.isClosed()) {
                    session.close();
                    persister.submit(snapshotOf(session));
                }
            } finally {
                session.mutex().unlock();
            }
        }
        sessions.clear();
        sessionsByResource.clear();
        LOG.info("Session manager shut down");
    }

    private CollaborationSession newSession(String resourceId, ResourceType resourceType,
                                            String initiatorId, String workspaceId) {
        DocumentState state = loadState(resourceId, resourceType);
        CollaborationSession session = new CollaborationSession(
            UUID.randomUUID().toString(), resourceId, resourceType, workspaceId,
            state, settings.retainedOperations(), clock.instant());
        session.addParticipant(initiatorId);
        sessions.put(session.getId(), session);
        LOG.infof("Created session %s for %s %s in workspace %s (initiator %s)",
            session.getId(), resourceType, resourceId, workspaceId, initiatorId);
        return session;
    }

    private DocumentState loadState(String resourceId, ResourceType resourceType) {
        try {
            return resourceStates.getResourceState(resourceId, resourceType).orElseGet(DocumentState::empty);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Could not load state of %s %s, starting empty", resourceType, resourceId);
            return DocumentState.empty();
        }
    }

    private boolean isPermitted(CollaborationSession session, String userId) {
        try {
            return permissions.checkPermissions(session, userId);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Permission check for user %s on session %s failed", userId, session.getId());
            return false;
        }
    }

    private void evict(CollaborationSession session) {
        session.close();
        sessions.remove(session.getId(), session);
        sessionsByResource.remove(resourceKey(session.getResourceId(), session.getResourceType()), session.getId());
        persister.submit(snapshotOf(session));
        LOG.infof("Evicted empty session %s", session.getId());
    }

    private void sendState(CollaborationSession session, String userId) {
        dispatcher.send(userId, ServerMessage.sessionState(
            session.getId(),
            session.getState(),
            session.getParticipants(),
            session.recentOperations(settings.historyOnJoin()),
            clock.instant()));
    }

    private void broadcast(CollaborationSession session, ServerMessage message, Set<String> excluded) {
        for (String participant : session.getParticipants()) {
            if (!excluded.contains(participant)) {
                dispatcher.send(participant, message);
            }
        }
    }

    private SessionSnapshot snapshotOf(CollaborationSession session) {
        return session.snapshot(compact(session.getOperations()));
    }

    private List<EditOperation> compact(List<EditOperation> log) {
        List<EditOperation> compacted = new ArrayList<>(log.size());
        for (EditOperation op : log) {
            if (!compacted.isEmpty()) {
                EditOperation merged = resolver.compose(compacted.get(compacted.size() - 1), op);
                if (merged != null) {
                    compacted.set(compacted.size() - 1, merged);
                    continue;
                }
            }
            compacted.add(op);
        }
        return compacted;
    }

    private CollaborationSession requireSession(String sessionId) {
        CollaborationSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new NotFoundException("Collaboration session not found");
        }
        return session;
    }

    private static void ensureOpen(CollaborationSession session) {
        if (session.isClosed()) {
            throw new NotFoundException("Collaboration session not found");
        }
    }

    private static void ensureParticipant(CollaborationSession session, String userId) {
        if (!session.hasParticipant(userId)) {
            throw new ForbiddenException("Not a participant of session " + session.getId());
        }
    }

    private static String resourceKey(String resourceId, ResourceType resourceType) {
        return resourceType.name() + ":" + resourceId;
    }

    public abstract static class CollaborationException extends RuntimeException {
        protected CollaborationException(String message) { super(message); }

        public abstract String code();
    }

    public static class ValidationException extends CollaborationException {
        public ValidationException(String message) { super(message); }

        @Override
        public String code() { return "validation_error"; }
    }

    public static class ForbiddenException extends CollaborationException {
        public ForbiddenException(String message) { super(message); }

        @Override
        public String code() { return "permission_denied"; }
    }

    public static class NotFoundException extends CollaborationException {
        public NotFoundException(String message) { super(message); }

        @Override
        public String code() { return "not_found"; }
    }
}
