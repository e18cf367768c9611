package com.mimecast.labeller.session.imap;

import com.mimecast.labeller.config.MailboxConfig;
import com.mimecast.labeller.error.AuthenticationException;
import com.mimecast.labeller.error.LabellerException;
import com.mimecast.labeller.error.TransientConnectionException;
import com.mimecast.labeller.session.MailboxConnection;
import com.mimecast.labeller.util.Principals;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Properties;

/**
 * Opens Jakarta Mail IMAP stores over implicit TLS.
 *
 * <p>Shared by both transports; they differ only in the SASL mechanism they allow.
 */
public class ImapConnector {
    private static final Logger log = LogManager.getLogger(ImapConnector.class);

    static final String PROTOCOL = "imaps";

    private final MailboxConfig config;

    public ImapConnector(MailboxConfig config) {
        this.config = config;
    }

    /**
     * Builds Jakarta Mail session properties.
     *
     * @param mechanisms SASL mechanisms to offer, or null for the provider defaults.
     * @return Properties instance.
     */
    Properties buildProperties(String mechanisms) {
        Properties props = new Properties();
        String port = String.valueOf(config.getPort());

        props.put("mail.store.protocol", PROTOCOL);
        props.put("mail.imaps.host", config.getHost());
        props.put("mail.imaps.port", port);
        props.put("mail.imaps.ssl.enable", "true");
        props.put("mail.imaps.ssl.checkserveridentity", "true");
        props.put("mail.imaps.connectiontimeout", String.valueOf(config.getConnectTimeoutMillis()));
        props.put("mail.imaps.timeout", String.valueOf(config.getReadTimeoutMillis()));
        props.put("mail.imaps.writetimeout", String.valueOf(config.getReadTimeoutMillis()));

        if (mechanisms != null) {
            props.put("mail.imaps.auth.mechanisms", mechanisms);
        }
        if ("XOAUTH2".equals(mechanisms)) {
            props.put("mail.imaps.auth.login.disable", "true");
            props.put("mail.imaps.auth.plain.disable", "true");
            props.put("mail.imaps.auth.xoauth2.disable", "false");
        }

        props.put("mail.debug", String.valueOf(config.isDebug()));
        return props;
    }

    /**
     * Connects and logs in.
     *
     * @param principal  Login name.
     * @param password   Password or bearer token.
     * @param mechanisms SASL mechanisms, or null.
     * @return ImapMailboxConnection with the configured folder selected.
     * @throws AuthenticationException      Credentials rejected.
     * @throws TransientConnectionException Any other failure.
     */
    public MailboxConnection connect(String principal, String password, String mechanisms) {
        Session session = Session.getInstance(buildProperties(mechanisms));
        Store store = null;
        try {
            store = session.getStore(PROTOCOL);
            store.connect(config.getHost(), config.getPort(), principal, password);
            log.debug("IMAP login for {} on {}:{} succeeded", Principals.hash(principal), config.getHost(), config.getPort());

            ImapMailboxConnection connection = new ImapMailboxConnection(store);
            connection.selectFolder(config.getFolder());
            return connection;
        } catch (AuthenticationFailedException e) {
            closeQuietly(store);
            throw new AuthenticationException("IMAP authentication rejected by " + config.getHost(), e);
        } catch (MessagingException e) {
            closeQuietly(store);
            throw new TransientConnectionException("IMAP connect to " + config.getHost() + " failed: " + e.getMessage(), e);
        } catch (LabellerException e) {
            closeQuietly(store);
            throw e;
        }
    }

    /**
     * Probes a connection.
     *
     * @param connection Connection.
     * @return True if the probe answered.
     */
    public boolean probe(MailboxConnection connection) {
        try {
            connection.probe();
            return true;
        } catch (TransientConnectionException e) {
            log.debug("IMAP probe failed: {}", e.getMessage());
            return false;
        }
    }

    private static void closeQuietly(Store store) {
        if (store == null) {
            return;
        }
        try {
            store.close();
        } catch (MessagingException e) {
            log.debug("Closing failed IMAP store: {}", e.getMessage());
        }
    }
}
