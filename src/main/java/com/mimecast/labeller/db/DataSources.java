package com.mimecast.labeller.db;

import com.mimecast.labeller.config.StoreConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the pooled data source for the local state store.
 *
 * <p>The caller owns the returned pool and closes it on shutdown.
 */
public final class DataSources {
    private static final Logger log = LogManager.getLogger(DataSources.class);

    private DataSources() {
        // static utility
    }

    /**
     * Creates a HikariDataSource from store configuration.
     *
     * @param config StoreConfig instance.
     * @return HikariDataSource instance.
     */
    public static HikariDataSource create(StoreConfig config) {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(config.getJdbcUrl());
        cfg.setUsername(config.getUsername());
        cfg.setPassword(config.getPassword());
        cfg.setMaximumPoolSize(config.getMaximumPoolSize());
        cfg.setPoolName("LabellerStorePool");

        try {
            HikariDataSource ds = new HikariDataSource(cfg);
            log.info("Initialized state store datasource: {}", config.getJdbcUrl());
            return ds;
        } catch (RuntimeException e) {
            log.error("Failed to initialize state store datasource: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Closes a data source, logging rather than failing.
     *
     * @param ds HikariDataSource instance, may be null.
     */
    public static void close(HikariDataSource ds) {
        if (ds == null) {
            return;
        }
        try {
            ds.close();
            log.info("Closed state store datasource");
        } catch (RuntimeException e) {
            log.warn("Error closing state store datasource: {}", e.getMessage());
        }
    }
}
