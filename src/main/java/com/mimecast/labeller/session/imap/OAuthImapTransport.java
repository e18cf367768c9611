package com.mimecast.labeller.session.imap;

import com.mimecast.labeller.credentials.Secret;
import com.mimecast.labeller.session.MailboxConnection;
import com.mimecast.labeller.session.MailboxTransport;

/**
 * IMAP SASL XOAUTH2 with an OAuth bearer token.
 * <p>The secret is the access token; refreshing it is the credential store's concern.
 */
public class OAuthImapTransport implements MailboxTransport {

    private final ImapConnector connector;

    public OAuthImapTransport(ImapConnector connector) {
        this.connector = connector;
    }

    @Override
    public String name() {
        return "oauth";
    }

    @Override
    public MailboxConnection authenticate(String principal, Secret secret) {
        return connector.connect(principal, secret.reveal(), "XOAUTH2");
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
