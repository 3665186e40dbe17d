package com.splitttr.realtime.session;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Writes session snapshots to the {@link SessionStore} on a background thread so that broadcasts
 * never wait for durable storage. Snapshots queued for the same session collapse to the latest
 * one; failed writes are retried with exponential backoff unless a newer snapshot supersedes them.
 */
public class SessionPersister implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SessionPersister.class);

    private final SessionStore store;
    private final RetrySettings retry;
    private final ExponentialBackoff backoff;
    private final ScheduledExecutorService executor;

    private final Map<String, SessionSnapshot> pending = new ConcurrentHashMap<>();
    private final Map<String, Long> latestRevision = new ConcurrentHashMap<>();
    private final Set<String> retrying = ConcurrentHashMap.newKeySet();

    public SessionPersister(SessionStore store, RetrySettings retry) {
        this.store = store;
        this.retry = retry;
        this.backoff = new ExponentialBackoff(retry.baseDelay(), retry.maxDelay());
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "session-persister");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void submit(SessionSnapshot snapshot) {
        latestRevision.merge(snapshot.id(), snapshot.revision(), Math::max);
        if (pending.put(snapshot.id(), snapshot) != null) {
            return;
        }
        try {
            executor.execute(() -> flush(snapshot.id()));
        } catch (RejectedExecutionException e) {
            pending.remove(snapshot.id());
            LOG.errorf("Persister is shut down, session %s at revision %d was not stored",
                snapshot.id(), snapshot.revision());
        }
    }

    private void flush(String sessionId) {
        SessionSnapshot snapshot = pending.remove(sessionId);
        if (snapshot != null) {
            attempt(snapshot, 1);
        }
    }

    private void attempt(SessionSnapshot snapshot, int attempt) {
        try {
            store.persistSession(snapshot);
            LOG.debugf("Persisted session %s at revision %d", snapshot.id(), snapshot.revision());
            if (!pending.containsKey(snapshot.id()) && !retrying.contains(snapshot.id())) {
                latestRevision.remove(snapshot.id(), snapshot.revision());
            }
        } catch (RuntimeException e) {
            if (attempt >= retry.maxAttempts()) {
                LOG.errorf(e, "Giving up on persisting session %s at revision %d after %d attempts",
                    snapshot.id(), snapshot.revision(), attempt);
                return;
            }
            Duration delay = backoff.delayFor(attempt);
            LOG.warnf("Persisting session %s failed (attempt %d/%d), retrying in %s: %s",
                snapshot.id(), attempt, retry.maxAttempts(), delay, e.getMessage());
            try {
                retrying.add(snapshot.id());
                executor.schedule(() -> retryIfCurrent(snapshot, attempt + 1), delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException rejected) {
                retrying.remove(snapshot.id());
                LOG.errorf(e, "Persister is shut down, session %s at revision %d was not stored",
                    snapshot.id(), snapshot.revision());
            }
        }
    }

    private void retryIfCurrent(SessionSnapshot snapshot, int attempt) {
        retrying.remove(snapshot.id());
        Long latest = latestRevision.get(snapshot.id());
        if (pending.containsKey(snapshot.id()) || (latest != null && latest > snapshot.revision())) {
            LOG.debugf("Dropping retry for session %s at revision %d, a newer snapshot exists",
                snapshot.id(), snapshot.revision());
            if (latest != null && !pending.containsKey(snapshot.id()) && !retrying.contains(snapshot.id())) {
                latestRevision.remove(snapshot.id(), latest);
            }
            return;
        }
        attempt(snapshot, attempt);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warnf("Session persister did not drain in time, %d snapshots pending", pending.size());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
