package com.mimecast.labeller.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Root configuration.
 *
 * <p>Constructed once at startup and handed to components by section.
 * <p>Every section view is immutable.
 *
 * @see MailboxConfig
 * @see SessionConfig
 * @see QuotaConfig
 * @see StoreConfig
 * @see BatchConfig
 * @see ClassifierConfig
 * @see VaultConfig
 */
public class LabellerConfig extends ConfigFoundation {
    private static final Logger log = LogManager.getLogger(LabellerConfig.class);

    /**
     * Bundled defaults resource.
     */
    public static final String DEFAULT_RESOURCE = "labeller-default.json5";

    /**
     * Constructs a new LabellerConfig instance.
     *
     * @param map Configuration map.
     */
    public LabellerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Loads configuration from a file, or the bundled defaults when the file is absent.
     *
     * @param path Path to JSON5 file, may be null.
     * @return LabellerConfig instance.
     * @throws IOException Unable to read configuration.
     */
    public static LabellerConfig load(Path path) throws IOException {
        if (path != null && Files.isRegularFile(path)) {
            log.info("Loading configuration from {}", path);
            return new LabellerConfig(parse(Files.readString(path, StandardCharsets.UTF_8)));
        }

        if (path != null) {
            log.warn("Configuration file {} not found, using bundled defaults", path);
        }
        try (InputStream input = LabellerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new IOException("Missing configuration resource: " + DEFAULT_RESOURCE);
            }
            return new LabellerConfig(parse(new String(input.readAllBytes(), StandardCharsets.UTF_8)));
        }
    }

    public MailboxConfig getMailbox() {
        return new MailboxConfig(getMapProperty("mailbox"));
    }

    public SessionConfig getSession() {
        return new SessionConfig(getMapProperty("session"));
    }

    public QuotaConfig getQuota() {
        return new QuotaConfig(getMapProperty("quota"));
    }

    public StoreConfig getStore() {
        return new StoreConfig(getMapProperty("store"));
    }

    public BatchConfig getBatch() {
        return new BatchConfig(getMapProperty("batch"));
    }

    public ClassifierConfig getClassifier() {
        return new ClassifierConfig(getMapProperty("classifier"));
    }

    public VaultConfig getVault() {
        return new VaultConfig(getMapProperty("vault"));
    }
}
