package com.mimecast.labeller.config;

import java.util.Locale;
import java.util.Map;

/**
 * Remote mailbox configuration.
 *
 * <p>This class provides type safe access to mailbox connection settings.
 */
public class MailboxConfig extends ConfigFoundation {

    /**
     * Mailbox authentication modes.
     */
    public enum AuthMode {
        PASSWORD,
        OAUTH
    }

    /**
     * Constructs a new MailboxConfig instance.
     *
     * @param map Configuration map.
     */
    public MailboxConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets IMAP server host.
     *
     * @return Hostname.
     */
    public String getHost() {
        return getStringProperty("host", "imap.gmail.com");
    }

    /**
     * Gets IMAP server port.
     *
     * @return Port number, 993 for implicit TLS.
     */
    public int getPort() {
        return Math.toIntExact(getLongProperty("port", 993L));
    }

    /**
     * Gets the default principal used when none is given on the command line.
     *
     * @return Principal or null.
     */
    public String getPrincipal() {
        return getStringProperty("principal");
    }

    /**
     * Gets authentication mode.
     *
     * @return AuthMode.
     */
    public AuthMode getAuthMode() {
        return AuthMode.valueOf(getStringProperty("authMode", "password").toUpperCase(Locale.ROOT));
    }

    /**
     * Gets the folder scanned by classify.
     *
     * @return Folder name.
     */
    public String getFolder() {
        return getStringProperty("folder", "INBOX");
    }

    /**
     * Gets connect timeout in milliseconds.
     *
     * @return Timeout.
     */
    public int getConnectTimeoutMillis() {
        return Math.toIntExact(getLongProperty("connectTimeoutMillis", 10000L));
    }

    /**
     * Gets read timeout in milliseconds.
     *
     * @return Timeout.
     */
    public int getReadTimeoutMillis() {
        return Math.toIntExact(getLongProperty("readTimeoutMillis", 30000L));
    }

    /**
     * Checks if Jakarta Mail protocol debug is enabled.
     *
     * @return Boolean.
     */
    public boolean isDebug() {
        return getBooleanProperty("debug", false);
    }
}
