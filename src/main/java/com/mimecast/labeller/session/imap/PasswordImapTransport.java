package com.mimecast.labeller.session.imap;

import com.mimecast.labeller.credentials.Secret;
import com.mimecast.labeller.session.MailboxConnection;
import com.mimecast.labeller.session.MailboxTransport;

/**
 * IMAP LOGIN/PLAIN with a password or app password.
 */
public class PasswordImapTransport implements MailboxTransport {

    private final ImapConnector connector;

    public PasswordImapTransport(ImapConnector connector) {
        this.connector = connector;
    }

    @Override
    public String name() {
        return "password";
    }

    @Override
    public MailboxConnection authenticate(String principal, Secret secret) {
        return connector.connect(principal, secret.reveal(), null);
    }

    @Override
    public void disconnect(MailboxConnection connection) {
        connection.logout();
    }

    @Override
    public boolean keepalive(MailboxConnection connection) {
        return connector.probe(connection);
    }

    @Override
    public boolean isAlive(MailboxConnection connection) {
        return connection.isOpen();
    }
}
