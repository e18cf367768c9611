package com.mimecast.labeller.session.imap;

import com.mimecast.labeller.config.MailboxConfig;
import com.mimecast.labeller.error.TransientConnectionException;
import com.mimecast.labeller.session.MailboxConnection;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class ImapConnectorTest {

    private final ImapConnector connector = new ImapConnector(new MailboxConfig(Map.of(
            "host", "imap.example.com",
            "port", 993,
            "connectTimeoutMillis", 7000,
            "readTimeoutMillis", 9000)));

    @Test
    void passwordPropertiesUseImplicitTls() {
        Properties props = connector.buildProperties(null);

        assertEquals("imaps", props.getProperty("mail.store.protocol"));
        assertEquals("imap.example.com", props.getProperty("mail.imaps.host"));
        assertEquals("993", props.getProperty("mail.imaps.port"));
        assertEquals("true", props.getProperty("mail.imaps.ssl.enable"));
        assertEquals("true", props.getProperty("mail.imaps.ssl.checkserveridentity"));
        assertEquals("7000", props.getProperty("mail.imaps.connectiontimeout"));
        assertEquals("9000", props.getProperty("mail.imaps.timeout"));
        assertNull(props.getProperty("mail.imaps.auth.mechanisms"));
    }

    @Test
    void oauthPropertiesOfferOnlyXoauth2() {
        Properties props = connector.buildProperties("XOAUTH2");

        assertEquals("XOAUTH2", props.getProperty("mail.imaps.auth.mechanisms"));
        assertEquals("true", props.getProperty("mail.imaps.auth.login.disable"));
        assertEquals("true", props.getProperty("mail.imaps.auth.plain.disable"));
    }

    @Test
    void probeReportsFailureInsteadOfThrowing() {
        MailboxConnection healthy = mock(MailboxConnection.class);
        MailboxConnection broken = mock(MailboxConnection.class);
        doThrow(new TransientConnectionException("NOOP timed out")).when(broken).probe();

        assertTrue(connector.probe(healthy));
        assertFalse(connector.probe(broken));
    }

    @Test
    void transportsNameTheirMechanism() {
        assertEquals("password", new PasswordImapTransport(connector).name());
        assertEquals("oauth", new OAuthImapTransport(connector).name());
    }
}
