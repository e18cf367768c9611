package com.mimecast.labeller.session;

import com.mimecast.labeller.config.SessionConfig;
import com.mimecast.labeller.credentials.Secret;
import com.mimecast.labeller.error.AuthenticationException;
import com.mimecast.labeller.error.LabellerException;
import com.mimecast.labeller.error.RateLimitedException;
import com.mimecast.labeller.error.ResourceExhaustedException;
import com.mimecast.labeller.error.TransientConnectionException;
import com.mimecast.labeller.error.ValidationException;
import com.mimecast.labeller.quota.AuthAttemptLimiter;
import com.mimecast.labeller.util.BackoffPolicy;
import com.mimecast.labeller.util.Principals;
import com.mimecast.labeller.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns authenticated mailbox sessions.
 *
 * <p>All sessions live in one map guarded by one lock. The lock covers map and state
 * mutation only and is never held across a transport call or a listener callback.
 * <p>Connect failures are retried with {@link BackoffPolicy} delays:
 * <table>
 *   <caption>Default delays (before jitter)</caption>
 *   <tr><th>Retry</th><th>Delay</th></tr>
 *   <tr><td>1</td><td>2s</td></tr>
 *   <tr><td>2</td><td>4s</td></tr>
 *   <tr><td>3</td><td>8s</td></tr>
 *   <tr><td>4+</td><td>15s</td></tr>
 * </table>
 * <p>Bad credentials are never retried and count against the {@link AuthAttemptLimiter}.
 * <p>A single daemon thread sweeps stale sessions and keeps idle ones alive.
 */
public class SessionManager {
    private static final Logger log = LogManager.getLogger(SessionManager.class);

    private final SessionConfig config;
    private final MailboxTransport transport;
    private final AuthAttemptLimiter authLimiter;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, MailboxSession> sessions = new LinkedHashMap<>();
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService logoutExecutor;

    private volatile ScheduledExecutorService sweeper;

    public SessionManager(SessionConfig config, MailboxTransport transport, AuthAttemptLimiter authLimiter,
                          BackoffPolicy backoff, Sleeper sleeper, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.authLimiter = Objects.requireNonNull(authLimiter, "authLimiter");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logoutExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "Labeller-Logout");
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(SessionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Authenticates a new session.
     * <p>When the principal already holds the maximum number of sessions the least recently
     * active ones are removed before the new one is added, in the same critical section.
     *
     * @param principal Principal.
     * @param secret    Password or token.
     * @return Connected session.
     * @throws ValidationException          Malformed principal or missing secret.
     * @throws RateLimitedException         Principal locked out. No remote call is made.
     * @throws AuthenticationException      Bad credentials.
     * @throws TransientConnectionException Connect retries exhausted.
     */
    public MailboxSession authenticate(String principal, Secret secret) {
        if (!Principals.isValid(principal)) {
            throw new ValidationException("Malformed principal");
        }
        if (secret == null || secret.isCleared()) {
            throw new ValidationException("Missing secret for " + Principals.hash(principal));
        }
        authLimiter.check(principal);

        MailboxSession session = new MailboxSession(principal, transport.name(), secret, clock.instant());
        fire(new Change(session, null, SessionState.CONNECTING));

        MailboxConnection connection;
        try {
            connection = connectWithRetry(session);
        } catch (LabellerException e) {
            Change change;
            synchronized (lock) {
                change = transition(session, SessionState.ERROR);
                session.setExhausted(true);
            }
            fire(change);
            throw e;
        }

        List<Change> evictions = new ArrayList<>();
        Change connected;
        synchronized (lock) {
            Instant now = clock.instant();
            session.setConnection(connection);
            session.touch(now);
            session.probed(now);
            connected = transition(session, SessionState.CONNECTED);

            List<MailboxSession> owned = sessionsOf(principal);
            owned.sort(Comparator.comparing(MailboxSession::getLastActivityAt));
            for (int i = 0; owned.size() - i >= config.getMaxSessions(); i++) {
                MailboxSession victim = owned.get(i);
                sessions.remove(victim.getId());
                evictions.add(close(victim, now));
            }
            sessions.put(session.getId(), session);
        }

        fire(connected);
        log.info("Session {} connected for {} via {}", session.getId(), Principals.hash(principal), transport.name());

        for (Change eviction : evictions) {
            ResourceExhaustedException reason = new ResourceExhaustedException(
                    "Session cap " + config.getMaxSessions() + " reached for " + Principals.hash(principal));
            log.warn("Evicting session {}: {}", eviction.session.getId(), reason.getMessage());
            fire(eviction);
            logout(eviction.session, eviction.connection);
        }
        return session;
    }

    /**
     * Gets the session's connection for a caller operation and records the activity.
     *
     * @param session Session.
     * @return MailboxConnection instance.
     * @throws TransientConnectionException When the session is not connected.
     */
    public MailboxConnection connection(MailboxSession session) {
        MailboxConnection connection = session.getConnection();
        synchronized (lock) {
            session.touch(clock.instant());
        }
        return connection;
    }

    /**
     * Probes a session.
     * <p>Consecutive failures up to the threshold leave the session connected. Reaching the
     * threshold moves it to ERROR and starts reconnect attempts.
     *
     * @param session Session.
     * @return KeepaliveResult.
     */
    public KeepaliveResult keepalive(MailboxSession session) {
        SessionState state = session.getState();
        if (state == SessionState.DISCONNECTED) {
            return KeepaliveResult.FAILED;
        }
        if (state == SessionState.ERROR) {
            if (session.isExhausted()) {
                log.debug("Session {} gave up reconnecting, staying in ERROR", session.getId());
                return KeepaliveResult.FAILED;
            }
            return reconnect(session);
        }
        if (state != SessionState.CONNECTED) {
            log.debug("Session {} is {}, skipping keepalive", session.getId(), state);
            return KeepaliveResult.PROBE_FAILED;
        }

        MailboxConnection connection = session.currentConnection();
        boolean ok = connection != null && transport.keepalive(connection);

        int failures;
        synchronized (lock) {
            session.probed(clock.instant());
            failures = ok ? 0 : session.getProbeFailures() + 1;
            session.setProbeFailures(failures);
        }
        if (ok) {
            return KeepaliveResult.OK;
        }
        if (failures < config.getKeepaliveFailureThreshold()) {
            log.warn("Session {} keepalive failed ({}/{})", session.getId(), failures, config.getKeepaliveFailureThreshold());
            return KeepaliveResult.PROBE_FAILED;
        }

        Change change;
        synchronized (lock) {
            if (session.getState() != SessionState.CONNECTED) {
                return KeepaliveResult.FAILED;
            }
            change = transition(session, SessionState.ERROR);
            session.setConnection(null);
        }
        fire(change);
        log.warn("Session {} failed {} consecutive keepalives, reconnecting", session.getId(), failures);
        logout(session, connection);
        return reconnect(session);
    }

    /**
     * Disconnects a session. Calling it again is a no-op.
     * <p>The session leaves the active set immediately; the remote logout is best effort and
     * bounded by the logout timeout.
     *
     * @param session Session.
     */
    public void disconnect(MailboxSession session) {
        Change change;
        synchronized (lock) {
            if (session.getState() == SessionState.DISCONNECTED) {
                return;
            }
            sessions.remove(session.getId());
            change = close(session, clock.instant());
        }
        fire(change);
        logout(session, change.connection);
        log.info("Session {} disconnected", session.getId());
    }

    public boolean isAlive(MailboxSession session) {
        MailboxConnection connection = session.currentConnection();
        return session.getState() == SessionState.CONNECTED && connection != null && transport.isAlive(connection);
    }

    /**
     * Lists the active sessions of a principal.
     *
     * @param principal Principal.
     * @return List of MailboxSession, oldest activity first.
     */
    public List<MailboxSession> getSessions(String principal) {
        synchronized (lock) {
            List<MailboxSession> owned = sessionsOf(principal);
            owned.sort(Comparator.comparing(MailboxSession::getLastActivityAt));
            return owned;
        }
    }

    public int getActiveCount() {
        synchronized (lock) {
            return sessions.size();
        }
    }

    /**
     * Disconnects stale sessions and probes idle connected ones.
     * <p>A failure on one session is logged and the sweep moves on.
     *
     * @return Sessions disconnected as stale.
     */
    public int sweep() {
        List<MailboxSession> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(sessions.values());
        }

        Instant now = clock.instant();
        int closed = 0;
        for (MailboxSession session : snapshot) {
            try {
                Duration idle = Duration.between(session.getLastActivityAt(), now);
                if (idle.compareTo(config.getStaleTimeout()) > 0) {
                    log.info("Session {} idle for {}s, disconnecting", session.getId(), idle.getSeconds());
                    disconnect(session);
                    closed++;
                } else if (session.getState() == SessionState.CONNECTED
                        && Duration.between(session.getLastProbeAt(), now).compareTo(config.getKeepaliveInterval()) >= 0) {
                    keepalive(session);
                }
            } catch (RuntimeException e) {
                log.warn("Sweep of session {} failed: {}", session.getId(), e.getMessage());
            }
        }
        if (closed > 0) {
            log.info("Sweep closed {} stale sessions", closed);
        }
        return closed;
    }

    /**
     * Starts the background sweep.
     */
    public synchronized void start() {
        if (sweeper != null) {
            return;
        }
        long interval = config.getSweepInterval().getSeconds();
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Labeller-SessionSweep");
            t.setDaemon(true);
            return t;
        });
        sweeper.scheduleAtFixedRate(() -> {
            try {
                sweep();
            } catch (Exception e) {
                log.error("Session sweep tick failed: {}", e.getMessage());
            }
        }, interval, interval, TimeUnit.SECONDS);
        log.debug("Session sweep started every {}s", interval);
    }

    /**
     * Stops the background sweep.
     */
    public synchronized void stop() {
        if (sweeper == null) {
            return;
        }
        sweeper.shutdownNow();
        try {
            if (!sweeper.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Session sweep did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping session sweep");
        }
        sweeper = null;
    }

    public boolean isRunning() {
        return sweeper != null;
    }

    /**
     * Stops the sweep and disconnects every session in parallel.
     * <p>Sessions not closed within the grace period are abandoned; they are already gone
     * from the active set.
     *
     * @param grace Grace period.
     * @return Sessions that did not close in time.
     */
    public int shutdown(Duration grace) {
        stop();

        List<Change> changes = new ArrayList<>();
        synchronized (lock) {
            Instant now = clock.instant();
            for (MailboxSession session : sessions.values()) {
                changes.add(close(session, now));
            }
            sessions.clear();
        }

        List<Future<?>> pending = new ArrayList<>();
        for (Change change : changes) {
            fire(change);
            if (change.connection != null) {
                pending.add(submitLogout(change.session, change.connection));
            }
        }

        long deadline = System.nanoTime() + grace.toNanos();
        int abandoned = 0;
        for (Future<?> future : pending) {
            if (future == null || !await(future, Math.max(0, deadline - System.nanoTime()))) {
                abandoned++;
            }
        }
        logoutExecutor.shutdownNow();

        if (abandoned > 0) {
            log.warn("Abandoned {} sessions that did not close within {}ms", abandoned, grace.toMillis());
        }
        log.info("Session manager shut down, {} sessions closed", changes.size() - abandoned);
        return abandoned;
    }

    /**
     * Gets session counts by state and by hashed principal.
     *
     * @return SessionStats instance.
     */
    public SessionStats stats() {
        Map<SessionState, Integer> byState = new EnumMap<>(SessionState.class);
        Map<String, Integer> byPrincipal = new TreeMap<>();
        int total;
        synchronized (lock) {
            total = sessions.size();
            for (MailboxSession session : sessions.values()) {
                byState.merge(session.getState(), 1, Integer::sum);
                byPrincipal.merge(Principals.hash(session.getPrincipal()), 1, Integer::sum);
            }
        }
        return new SessionStats(total, byState, byPrincipal);
    }

    private MailboxConnection connectWithRetry(MailboxSession session) {
        String principal = session.getPrincipal();
        int attempt = 0;
        while (true) {
            try {
                MailboxConnection connection = transport.authenticate(principal, session.getSecret());
                authLimiter.recordSuccess(principal);
                return connection;
            } catch (AuthenticationException e) {
                int failures = authLimiter.recordFailure(principal);
                log.warn("Authentication failed for {} ({} recent failures): {}",
                        Principals.hash(principal), failures, e.getMessage());
                throw e;
            } catch (TransientConnectionException e) {
                if (attempt >= config.getMaxConnectRetries()) {
                    log.error("Connect for {} failed after {} retries: {}", Principals.hash(principal), attempt, e.getMessage());
                    throw e;
                }
                Duration delay = backoff.delay(attempt);
                attempt++;
                synchronized (lock) {
                    session.setRetryCount(attempt);
                }
                log.warn("Connect for {} failed, retry {} in {}ms: {}",
                        Principals.hash(principal), attempt, delay.toMillis(), e.getMessage());
                pause(delay);
            }
        }
    }

    private KeepaliveResult reconnect(MailboxSession session) {
        String principal = session.getPrincipal();
        for (int attempt = 0; attempt < config.getMaxConnectRetries(); attempt++) {
            Duration delay = backoff.delay(attempt);
            log.info("Session {} reconnect attempt {} in {}ms", session.getId(), attempt + 1, delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Session {} reconnect interrupted", session.getId());
                return KeepaliveResult.FAILED;
            }

            Change connecting;
            synchronized (lock) {
                if (session.getState() != SessionState.ERROR) {
                    return session.getState() == SessionState.CONNECTED ? KeepaliveResult.RECONNECTED : KeepaliveResult.FAILED;
                }
                connecting = transition(session, SessionState.CONNECTING);
                session.setRetryCount(session.getRetryCount() + 1);
            }
            fire(connecting);

            try {
                authLimiter.check(principal);
                MailboxConnection fresh = transport.authenticate(principal, session.getSecret());
                authLimiter.recordSuccess(principal);

                Change connected;
                synchronized (lock) {
                    if (session.getState() != SessionState.CONNECTING) {
                        connected = null;
                    } else {
                        Instant now = clock.instant();
                        session.setConnection(fresh);
                        session.setProbeFailures(0);
                        session.probed(now);
                        connected = transition(session, SessionState.CONNECTED);
                    }
                }
                if (connected == null) {
                    logout(session, fresh);
                    return KeepaliveResult.FAILED;
                }
                fire(connected);
                log.info("Session {} reconnected after {} attempts", session.getId(), attempt + 1);
                return KeepaliveResult.RECONNECTED;
            } catch (AuthenticationException e) {
                authLimiter.recordFailure(principal);
                toError(session);
                giveUp(session);
                log.error("Session {} reconnect rejected: {}", session.getId(), e.getMessage());
                return KeepaliveResult.FAILED;
            } catch (RateLimitedException e) {
                toError(session);
                log.error("Session {} reconnect locked out for {}s", session.getId(), e.getRemainingSeconds());
                return KeepaliveResult.FAILED;
            } catch (TransientConnectionException e) {
                toError(session);
                log.warn("Session {} reconnect attempt {} failed: {}", session.getId(), attempt + 1, e.getMessage());
            }
        }
        giveUp(session);
        log.error("Session {} reconnect attempts exhausted, staying in ERROR", session.getId());
        return KeepaliveResult.FAILED;
    }

    private void giveUp(MailboxSession session) {
        synchronized (lock) {
            if (session.getState() == SessionState.ERROR) {
                session.setExhausted(true);
            }
        }
    }

    private void toError(MailboxSession session) {
        Change change = null;
        synchronized (lock) {
            if (session.getState() == SessionState.CONNECTING) {
                change = transition(session, SessionState.ERROR);
            }
        }
        fire(change);
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientConnectionException("Interrupted while waiting to reconnect", e);
        }
    }

    // Caller holds the lock.
    private List<MailboxSession> sessionsOf(String principal) {
        List<MailboxSession> owned = new ArrayList<>();
        for (MailboxSession session : sessions.values()) {
            if (session.getPrincipal().equalsIgnoreCase(principal)) {
                owned.add(session);
            }
        }
        return owned;
    }

    // Caller holds the lock.
    private Change close(MailboxSession session, Instant now) {
        MailboxConnection connection = session.currentConnection();
        Change change = transition(session, SessionState.DISCONNECTED);
        session.setConnection(null);
        session.setClosedAt(now);
        change.connection = connection;
        return change;
    }

    // Caller holds the lock.
    private Change transition(MailboxSession session, SessionState target) {
        SessionState previous = session.getState();
        if (!previous.canTransitionTo(target)) {
            throw new IllegalStateException("Invalid session transition: " + previous + " -> " + target);
        }
        session.setState(target);
        log.debug("Session {} {} -> {}", session.getId(), previous, target);
        return new Change(session, previous, target);
    }

    private void logout(MailboxSession session, MailboxConnection connection) {
        if (connection == null) {
            return;
        }
        Future<?> future = submitLogout(session, connection);
        if (future != null && !await(future, config.getLogoutTimeout().toNanos())) {
            log.warn("Logout of session {} timed out after {}ms, abandoned", session.getId(), config.getLogoutTimeout().toMillis());
        }
    }

    private Future<?> submitLogout(MailboxSession session, MailboxConnection connection) {
        try {
            return logoutExecutor.submit(() -> transport.disconnect(connection));
        } catch (RejectedExecutionException e) {
            log.warn("Logout of session {} skipped, manager is shut down", session.getId());
            return null;
        }
    }

    private boolean await(Future<?> future, long nanos) {
        try {
            future.get(nanos, TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            future.cancel(true);
            return false;
        } catch (ExecutionException e) {
            log.warn("Logout failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return false;
        }
    }

    private void fire(Change change) {
        if (change == null) {
            return;
        }
        for (SessionListener listener : listeners) {
            try {
                listener.onStateChange(change.session, change.previous, change.current);
            } catch (RuntimeException e) {
                log.warn("Session listener failed for {}: {}", change.session.getId(), e.getMessage());
            }
        }
    }

    /**
     * State change captured under the lock and published after it.
     */
    private static final class Change {
        private final MailboxSession session;
        private final SessionState previous;
        private final SessionState current;
        private MailboxConnection connection;

        Change(MailboxSession session, SessionState previous, SessionState current) {
            this.session = session;
            this.previous = previous;
            this.current = current;
        }
    }
}
