package com.splitttr.realtime.presence;

import com.splitttr.realtime.message.ServerMessage;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Tracks online/away/offline state per user and workspace membership. Every status change is
 * announced through the broadcast callback registered for each affected workspace.
 *
 * <p>Idle users are demoted by a single periodic sweep rather than per-user timers.
 */
public class PresenceTracker implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(PresenceTracker.class);

    private final Map<String, UserPresence> presences = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> workspaceMembers = new ConcurrentHashMap<>();
    private final Map<String, Consumer<ServerMessage>> broadcasts = new ConcurrentHashMap<>();

    private final PresenceSettings settings;
    private final Clock clock;

    private volatile BiConsumer<String, String> departureListener = (userId, workspaceId) -> { };

    private ScheduledExecutorService sweeper;

    public PresenceTracker(PresenceSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings);
        this.clock = Objects.requireNonNull(clock);
    }

    public synchronized void start() {
        if (sweeper != null) {
            return;
        }
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "presence-sweep");
            thread.setDaemon(true);
            return thread;
        });
        long interval = settings.sweepInterval().toMillis();
        sweeper.scheduleAtFixedRate(this::sweepSafely, interval, interval, TimeUnit.MILLISECONDS);
        LOG.infof("Presence sweep started (idle=%s, stale=%s, every %s)",
            settings.idleTimeout(), settings.staleTimeout(), settings.sweepInterval());
    }

    @Override
    public synchronized void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
            LOG.info("Presence sweep stopped");
        }
    }

    public synchronized boolean isRunning() {
        return sweeper != null;
    }

    public void registerBroadcast(String workspaceId, Consumer<ServerMessage> callback) {
        broadcasts.put(workspaceId, callback);
    }

    /**
     * Called with {@code (userId, workspaceId)} after a user left a workspace, whether through a
     * disconnect or the stale sweep.
     */
    public void onWorkspaceDeparture(BiConsumer<String, String> listener) {
        this.departureListener = listener;
    }

    public void unregisterBroadcast(String workspaceId) {
        broadcasts.remove(workspaceId);
    }

    public UserPresence updatePresence(String userId, PresenceUpdate update) {
        Instant now = clock.instant();
        UserPresence updated = presences.compute(userId, (id, current) ->
            (current == null ? UserPresence.initial(id, now) : current).merge(update, now));

        ServerMessage message = ServerMessage.presence(userId, updated, now);
        for (String workspaceId : workspacesOf(userId)) {
            broadcast(workspaceId, message);
        }
        return updated;
    }

    /**
     * Marks the user as seen. Only a status change (away or offline back to online) is broadcast.
     */
    public void recordActivity(String userId) {
        Instant now = clock.instant();
        boolean[] refreshed = {false};
        presences.computeIfPresent(userId, (id, p) -> {
            if (p.status() == PresenceStatus.ONLINE) {
                refreshed[0] = true;
                return p.seenAt(now);
            }
            return p;
        });
        if (!refreshed[0]) {
            updatePresence(userId, PresenceUpdate.touch());
        }
    }

    public void updateActivity(String userId, String activity) {
        if (!presences.containsKey(userId)) {
            return;
        }
        updatePresence(userId, PresenceUpdate.doing(activity));
    }

    public void addToWorkspace(String userId, String workspaceId) {
        workspaceMembers.compute(workspaceId, (id, members) -> {
            Set<String> set = members == null ? ConcurrentHashMap.newKeySet() : members;
            set.add(userId);
            return set;
        });

        updatePresence(userId, new PresenceUpdate(PresenceStatus.ONLINE, UserLocation.workspace(workspaceId), null, false));
        broadcast(workspaceId, ServerMessage.userJoinedWorkspace(workspaceId, userId, clock.instant()));
        LOG.debugf("User %s joined workspace %s", userId, workspaceId);
    }

    public void removeFromWorkspace(String userId, String workspaceId) {
        boolean[] removed = {false};
        workspaceMembers.computeIfPresent(workspaceId, (id, members) -> {
            removed[0] = members.remove(userId);
            return members.isEmpty() ? null : members;
        });
        if (!removed[0]) {
            return;
        }

        List<String> remaining = workspacesOf(userId);
        UserPresence current = presences.get(userId);
        if (current != null) {
            UserPresence changed = null;
            if (remaining.isEmpty() && current.status() != PresenceStatus.OFFLINE) {
                changed = apply(userId, p -> p.withStatus(PresenceStatus.OFFLINE).withLocation(null));
            } else if (pointsAt(current, workspaceId)) {
                changed = apply(userId, p -> p.withLocation(null));
            }
            if (changed != null) {
                ServerMessage message = ServerMessage.presence(userId, changed, clock.instant());
                broadcast(workspaceId, message);
                for (String other : remaining) {
                    broadcast(other, message);
                }
            }
        }

        broadcast(workspaceId, ServerMessage.userLeftWorkspace(workspaceId, userId, clock.instant()));
        LOG.debugf("User %s left workspace %s", userId, workspaceId);
        try {
            departureListener.accept(userId, workspaceId);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Workspace departure handling failed for user %s in %s", userId, workspaceId);
        }
    }

    public void setOffline(String userId) {
        UserPresence current = presences.get(userId);
        if (current == null) {
            return;
        }
        List<String> workspaces = workspacesOf(userId);
        if (current.status() == PresenceStatus.OFFLINE && workspaces.isEmpty()) {
            return;
        }

        UserPresence offline = apply(userId, p -> p.withStatus(PresenceStatus.OFFLINE).withLocation(null));
        ServerMessage message = ServerMessage.presence(userId, offline, clock.instant());
        for (String workspaceId : workspaces) {
            broadcast(workspaceId, message);
        }
        for (String workspaceId : workspaces) {
            removeFromWorkspace(userId, workspaceId);
        }
        LOG.debugf("User %s is offline", userId);
    }

    /**
     * Demotes idle users to away and stale users to offline. Works on a snapshot, so concurrent
     * updates are never lost; a user who became active since the snapshot is left alone.
     */
    public void sweep() {
        Instant now = clock.instant();
        for (UserPresence observed : List.copyOf(presences.values())) {
            Duration idle = Duration.between(observed.lastSeen(), now);
            if (observed.status() != PresenceStatus.OFFLINE && idle.compareTo(settings.staleTimeout()) > 0) {
                if (isUnchangedSince(observed)) {
                    setOffline(observed.userId());
                }
            } else if (observed.status() == PresenceStatus.ONLINE && idle.compareTo(settings.idleTimeout()) > 0) {
                markAway(observed);
            }
        }
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Presence sweep failed");
        }
    }

    private void markAway(UserPresence observed) {
        boolean[] demoted = {false};
        UserPresence updated = presences.computeIfPresent(observed.userId(), (id, p) -> {
            if (p.status() == PresenceStatus.ONLINE && p.lastSeen().equals(observed.lastSeen())) {
                demoted[0] = true;
                return p.withStatus(PresenceStatus.AWAY);
            }
            return p;
        });
        if (!demoted[0]) {
            return;
        }
        ServerMessage message = ServerMessage.presence(observed.userId(), updated, clock.instant());
        for (String workspaceId : workspacesOf(observed.userId())) {
            broadcast(workspaceId, message);
        }
        LOG.debugf("User %s is away", observed.userId());
    }

    private boolean isUnchangedSince(UserPresence observed) {
        UserPresence current = presences.get(observed.userId());
        return current != null && current.lastSeen().equals(observed.lastSeen());
    }

    public Optional<UserPresence> getPresence(String userId) {
        return Optional.ofNullable(presences.get(userId));
    }

    public boolean isInWorkspace(String userId, String workspaceId) {
        Set<String> members = workspaceMembers.get(workspaceId);
        return members != null && members.contains(userId);
    }

    public List<UserPresence> getUsersInWorkspace(String workspaceId) {
        Set<String> members = workspaceMembers.getOrDefault(workspaceId, Set.of());
        List<UserPresence> result = new ArrayList<>();
        for (String userId : members) {
            UserPresence presence = presences.get(userId);
            if (presence != null && presence.status() != PresenceStatus.OFFLINE) {
                result.add(presence);
            }
        }
        return result;
    }

    public int getOnlineCount(String workspaceId) {
        return (int) getUsersInWorkspace(workspaceId).stream()
            .filter(p -> p.status() == PresenceStatus.ONLINE)
            .count();
    }

    public WorkspaceStats getWorkspaceStats(String workspaceId) {
        List<UserPresence> users = getUsersInWorkspace(workspaceId);
        int online = 0;
        int active = 0;
        int away = 0;
        for (UserPresence user : users) {
            if (user.status() == PresenceStatus.ONLINE) {
                online++;
                if (user.activity() != null && !user.activity().isBlank()) {
                    active++;
                }
            } else if (user.status() == PresenceStatus.AWAY) {
                away++;
            }
        }
        return new WorkspaceStats(users.size(), online, active, away);
    }

    public Map<String, UserPresence> getAllPresence() {
        return new HashMap<>(presences);
    }

    public void clearAll() {
        presences.clear();
        workspaceMembers.clear();
    }

    private UserPresence apply(String userId, UnaryOperator<UserPresence> change) {
        return presences.computeIfPresent(userId, (id, p) -> change.apply(p));
    }

    private List<String> workspacesOf(String userId) {
        List<String> result = new ArrayList<>();
        workspaceMembers.forEach((workspaceId, members) -> {
            if (members.contains(userId)) {
                result.add(workspaceId);
            }
        });
        return result;
    }

    private static boolean pointsAt(UserPresence presence, String workspaceId) {
        UserLocation location = presence.currentLocation();
        return location != null
            && location.type() == UserLocation.Type.WORKSPACE
            && workspaceId.equals(location.id());
    }

    private void broadcast(String workspaceId, ServerMessage message) {
        Consumer<ServerMessage> callback = broadcasts.get(workspaceId);
        if (callback == null) {
            return;
        }
        try {
            callback.accept(message);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Presence broadcast to workspace %s failed", workspaceId);
        }
    }
}
