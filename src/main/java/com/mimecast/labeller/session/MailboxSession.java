package com.mimecast.labeller.session;

import com.mimecast.labeller.credentials.Secret;
import com.mimecast.labeller.error.TransientConnectionException;
import com.mimecast.labeller.store.domain.SessionSnapshot;
import com.mimecast.labeller.util.Principals;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * A live authenticated handle to the remote mailbox.
 *
 * <p>Owned by {@link SessionManager}. Mutable fields are only written under the manager's
 * lock and are volatile so they can be read without it.
 */
public class MailboxSession {

    private final String id = UUID.randomUUID().toString();
    private final String principal;
    private final String transport;
    private final Secret secret;
    private final Instant createdAt;

    private volatile SessionState state = SessionState.CONNECTING;
    private volatile MailboxConnection connection;
    private volatile Instant lastActivityAt;
    private volatile Instant lastProbeAt;
    private volatile Instant closedAt;
    private volatile int retryCount;
    private volatile int probeFailures;
    private volatile boolean exhausted;

    MailboxSession(String principal, String transport, Secret secret, Instant now) {
        this.principal = principal;
        this.transport = transport;
        this.secret = secret;
        this.createdAt = now;
        this.lastActivityAt = now;
        this.lastProbeAt = now;
    }

    public String getId() {
        return id;
    }

    public String getPrincipal() {
        return principal;
    }

    public String getTransport() {
        return transport;
    }

    public SessionState getState() {
        return state;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Gets the time of the last caller operation. Keepalive probes do not count.
     *
     * @return Instant.
     */
    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public Instant getLastProbeAt() {
        return lastProbeAt;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getProbeFailures() {
        return probeFailures;
    }

    /**
     * Checks if reconnecting has been given up. The session then stays in ERROR until it is
     * disconnected.
     *
     * @return Boolean.
     */
    public boolean isExhausted() {
        return exhausted;
    }

    /**
     * Gets the open connection for remote calls.
     *
     * @return MailboxConnection instance.
     * @throws TransientConnectionException When the session is not connected.
     */
    public MailboxConnection getConnection() {
        MailboxConnection current = connection;
        if (state != SessionState.CONNECTED || current == null) {
            throw new TransientConnectionException("Session " + id + " is " + state);
        }
        return current;
    }

    public SessionSnapshot toSnapshot() {
        SessionSnapshot snapshot = new SessionSnapshot();
        snapshot.setId(id);
        snapshot.setPrincipal(principal);
        snapshot.setTransport(transport);
        snapshot.setState(state.name());
        snapshot.setCreatedAt(createdAt.atOffset(ZoneOffset.UTC));
        snapshot.setLastActivityAt(lastActivityAt.atOffset(ZoneOffset.UTC));
        snapshot.setRetryCount(retryCount);
        snapshot.setClosedAt(closedAt != null ? closedAt.atOffset(ZoneOffset.UTC) : null);
        return snapshot;
    }

    Secret getSecret() {
        return secret;
    }

    MailboxConnection currentConnection() {
        return connection;
    }

    void setConnection(MailboxConnection connection) {
        this.connection = connection;
    }

    void setState(SessionState state) {
        this.state = state;
    }

    void touch(Instant now) {
        this.lastActivityAt = now;
    }

    void probed(Instant now) {
        this.lastProbeAt = now;
    }

    void setClosedAt(Instant closedAt) {
        this.closedAt = closedAt;
    }

    void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    void setProbeFailures(int probeFailures) {
        this.probeFailures = probeFailures;
    }

    void setExhausted(boolean exhausted) {
        this.exhausted = exhausted;
    }

    @Override
    public String toString() {
        return "MailboxSession{id=" + id + ", principal=" + Principals.hash(principal) + ", state=" + state + "}";
    }
}
