package com.mimecast.labeller.quota;

import java.util.Locale;

/**
 * Independent quota scopes.
 */
public enum QuotaScope {
    MAILBOX(60),
    CLASSIFICATION(30);

    private final int defaultPermits;

    QuotaScope(int defaultPermits) {
        this.defaultPermits = defaultPermits;
    }

    public int getDefaultPermits() {
        return defaultPermits;
    }

    /**
     * Gets the configuration key of this scope.
     *
     * @return Lower case key.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
