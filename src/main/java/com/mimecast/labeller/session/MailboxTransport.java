package com.mimecast.labeller.session;

import com.mimecast.labeller.credentials.Secret;

/**
 * Authentication mechanism for the remote mailbox.
 */
public interface MailboxTransport {

    /**
     * Transport name recorded on session snapshots.
     *
     * @return Name.
     */
    String name();

    /**
     * Connects and logs in.
     *
     * @param principal Principal.
     * @param secret    Password or token.
     * @return Open connection.
     * @throws com.mimecast.labeller.error.AuthenticationException       Bad credentials. Never retried.
     * @throws com.mimecast.labeller.error.TransientConnectionException  Network failure or timeout.
     */
    MailboxConnection authenticate(String principal, Secret secret);

    /**
     * Logs out. Failures are reported but the connection is considered gone.
     *
     * @param connection Connection.
     */
    void disconnect(MailboxConnection connection);

    /**
     * Probes the connection.
     *
     * @param connection Connection.
     * @return True if the probe answered.
     */
    boolean keepalive(MailboxConnection connection);

    boolean isAlive(MailboxConnection connection);
}
