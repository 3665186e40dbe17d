package com.splitttr.realtime.session;

import com.splitttr.realtime.message.CursorPosition;
import com.splitttr.realtime.message.TextSelection;
import com.splitttr.realtime.operation.DeleteOperation;
import com.splitttr.realtime.operation.DocumentState;
import com.splitttr.realtime.operation.EditOperation;
import com.splitttr.realtime.operation.FormatOperation;
import com.splitttr.realtime.operation.FormattingRange;
import com.splitttr.realtime.operation.InsertOperation;
import com.splitttr.realtime.transform.ConflictResolver;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live collaboration on one resource. Only {@link SessionManager} mutates a session, always while
 * holding its lock; the public accessors return copies.
 */
public class CollaborationSession {

    private final String id;
    private final String resourceId;
    private final ResourceType resourceType;
    private final String workspaceId;
    private final Instant createdAt;
    private final int retainedOperations;

    private final ReentrantLock mutex = new ReentrantLock();
    private final Set<String> participants = new LinkedHashSet<>();
    private final Deque<EditOperation> operations = new ArrayDeque<>();
    private final Map<String, CursorPosition> cursors = new HashMap<>();
    private final Map<String, TextSelection> selections = new HashMap<>();

    private DocumentState state;
    private long revision;
    private Instant lastActivity;
    private boolean closed;

    CollaborationSession(String id, String resourceId, ResourceType resourceType, String workspaceId,
                         DocumentState state, int retainedOperations, Instant createdAt) {
        this.id = id;
        this.resourceId = resourceId;
        this.resourceType = resourceType;
        this.workspaceId = workspaceId;
        this.state = state;
        this.retainedOperations = retainedOperations;
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getResourceId() {
        return resourceId;
    }

    public ResourceType getResourceType() {
        return resourceType;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivity() {
        mutex.lock();
        try {
            return lastActivity;
        } finally {
            mutex.unlock();
        }
    }

    public DocumentState getState() {
        mutex.lock();
        try {
            return state;
        } finally {
            mutex.unlock();
        }
    }

    public long getRevision() {
        mutex.lock();
        try {
            return revision;
        } finally {
            mutex.unlock();
        }
    }

    public List<String> getParticipants() {
        mutex.lock();
        try {
            return List.copyOf(participants);
        } finally {
            mutex.unlock();
        }
    }

    public boolean hasParticipant(String userId) {
        mutex.lock();
        try {
            return participants.contains(userId);
        } finally {
            mutex.unlock();
        }
    }

    public List<EditOperation> getOperations() {
        mutex.lock();
        try {
            return List.copyOf(operations);
        } finally {
            mutex.unlock();
        }
    }

    public List<EditOperation> recentOperations(int limit) {
        mutex.lock();
        try {
            List<EditOperation> all = new ArrayList<>(operations);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        } finally {
            mutex.unlock();
        }
    }

    public Map<String, CursorPosition> getCursors() {
        mutex.lock();
        try {
            return Map.copyOf(cursors);
        } finally {
            mutex.unlock();
        }
    }

    public Map<String, TextSelection> getSelections() {
        mutex.lock();
        try {
            return Map.copyOf(selections);
        } finally {
            mutex.unlock();
        }
    }

    ReentrantLock mutex() {
        return mutex;
    }

    boolean isClosed() {
        return closed;
    }

    void close() {
        closed = true;
    }

    boolean isEmpty() {
        return participants.isEmpty();
    }

    boolean addParticipant(String userId) {
        return participants.add(userId);
    }

    boolean removeParticipant(String userId) {
        cursors.remove(userId);
        selections.remove(userId);
        return participants.remove(userId);
    }

    void putCursor(String userId, CursorPosition cursor) {
        cursors.put(userId, cursor);
    }

    void putSelection(String userId, TextSelection selection) {
        selections.put(userId, selection);
    }

    /**
     * True when every operation admitted after {@code baseRevision} is still in the retained log.
     */
    boolean retainsHistorySince(long baseRevision) {
        return baseRevision <= revision && baseRevision >= revision - operations.size();
    }

    EditOperation admit(EditOperation transformed, ConflictResolver resolver, Instant now) {
        EditOperation admitted = transformed.withRevision(revision + 1);
        // a failing apply must leave the revision untouched
        state = apply(state, admitted, resolver);
        revision = admitted.revision();
        operations.addLast(admitted);
        while (operations.size() > retainedOperations) {
            operations.removeFirst();
        }
        lastActivity = now;
        return admitted;
    }

    SessionSnapshot snapshot(List<EditOperation> log) {
        return new SessionSnapshot(id, resourceId, resourceType, workspaceId, List.copyOf(participants),
            state, log, revision, createdAt, lastActivity);
    }

    private static DocumentState apply(DocumentState current, EditOperation op, ConflictResolver resolver) {
        String text = current.text();
        List<FormattingRange> formatting = new ArrayList<>();
        for (FormattingRange range : current.formatting()) {
            FormattingRange moved = resolver.rebase(range, op);
            if (!moved.isEmpty()) {
                formatting.add(moved);
            }
        }

        switch (op.kind()) {
            case INSERT -> {
                InsertOperation insert = (InsertOperation) op;
                text = text.substring(0, insert.position()) + insert.text() + text.substring(insert.position());
                if (insert.format() != null) {
                    formatting.add(new FormattingRange(insert.position(), insert.position() + insert.length(), insert.format()));
                }
            }
            case DELETE -> {
                DeleteOperation delete = (DeleteOperation) op;
                text = text.substring(0, delete.position()) + text.substring(delete.end());
            }
            case FORMAT -> formatting.add(((FormatOperation) op).toRange());
        }
        return new DocumentState(text, formatting);
    }
}
