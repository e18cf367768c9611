package com.mimecast.labeller.config;

import java.time.Duration;
import java.util.Map;

/**
 * Local state store configuration.
 */
public class StoreConfig extends ConfigFoundation {

    /**
     * Constructs a new StoreConfig instance.
     *
     * @param map Configuration map.
     */
    public StoreConfig(Map<String, Object> map) {
        super(map);
    }

    public String getJdbcUrl() {
        return getStringProperty("jdbcUrl", "jdbc:h2:file:./data/labeller;MODE=PostgreSQL");
    }

    public String getUsername() {
        return getStringProperty("username", "sa");
    }

    public String getPassword() {
        return getStringProperty("password", "");
    }

    public int getMaximumPoolSize() {
        return Math.toIntExact(getLongProperty("maximumPoolSize", 4L));
    }

    /**
     * Gets folder cache time to live.
     *
     * @return Duration.
     */
    public Duration getFolderCacheTtl() {
        return Duration.ofMinutes(getLongProperty("folderCacheTtlMinutes", 10L));
    }

    /**
     * Gets default retention for cleanup.
     *
     * @return Days.
     */
    public int getRetentionDays() {
        return Math.toIntExact(getLongProperty("retentionDays", 30L));
    }
}
