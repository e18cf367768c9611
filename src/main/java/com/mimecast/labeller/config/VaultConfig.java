package com.mimecast.labeller.config;

import java.util.Map;

/**
 * HashiCorp Vault credential store configuration.
 */
public class VaultConfig extends ConfigFoundation {

    /**
     * Constructs a new VaultConfig instance.
     *
     * @param map Configuration map.
     */
    public VaultConfig(Map<String, Object> map) {
        super(map);
    }

    public boolean isEnabled() {
        return getBooleanProperty("enabled", false);
    }

    public String getAddress() {
        return getStringProperty("address", "http://localhost:8200");
    }

    /**
     * Gets Vault token.
     * <p>Falls back to the VAULT_TOKEN environment variable.
     *
     * @return Token or null.
     */
    public String getToken() {
        return getStringProperty("token", System.getenv("VAULT_TOKEN"));
    }

    public String getNamespace() {
        return getStringProperty("namespace");
    }

    /**
     * Gets the KV v2 mount.
     *
     * @return Mount name.
     */
    public String getMount() {
        return getStringProperty("mount", "secret");
    }

    /**
     * Gets the path prefix under which credentials are kept, one secret per principal.
     *
     * @return Prefix.
     */
    public String getPathPrefix() {
        return getStringProperty("pathPrefix", "labeller/credentials");
    }

    public int getTimeoutSeconds() {
        return Math.toIntExact(getLongProperty("timeoutSeconds", 30L));
    }
}
