package com.mimecast.labeller.config;

import java.time.Duration;
import java.util.Map;

/**
 * Quota guard configuration.
 *
 * <p>Scope limits live under <i>scopes.mailbox</i> and <i>scopes.classification</i>.
 */
public class QuotaConfig extends ConfigFoundation {

    /**
     * Constructs a new QuotaConfig instance.
     *
     * @param map Configuration map.
     */
    public QuotaConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets permits allowed per window for a scope.
     *
     * @param scope    Scope key.
     * @param fallback Default permits.
     * @return Permits.
     */
    public int getPermits(String scope, long fallback) {
        return Math.toIntExact(getLongProperty("scopes." + scope + ".permits", fallback));
    }

    /**
     * Gets window length for a scope.
     *
     * @param scope Scope key.
     * @return Duration.
     */
    public Duration getWindow(String scope) {
        return Duration.ofSeconds(getLongProperty("scopes." + scope + ".windowSeconds", 60L));
    }

    /**
     * Gets retries allowed after provider throttling.
     *
     * @return Retry count.
     */
    public int getMaxThrottleRetries() {
        return Math.toIntExact(getLongProperty("maxThrottleRetries", 5L));
    }

    /**
     * Gets the sliding window for failed authentications.
     *
     * @return Duration.
     */
    public Duration getAuthWindow() {
        return Duration.ofMinutes(getLongProperty("authWindowMinutes", 15L));
    }

    /**
     * Gets failures within the window that trigger a lockout.
     *
     * @return Threshold.
     */
    public int getAuthFailureThreshold() {
        return Math.toIntExact(getLongProperty("authFailureThreshold", 5L));
    }

    /**
     * Gets the longest lockout.
     *
     * @return Duration.
     */
    public Duration getMaxLockout() {
        return Duration.ofMinutes(getLongProperty("maxLockoutMinutes", 64L));
    }
}
