package com.mimecast.labeller.config;

import java.time.Duration;
import java.util.Map;

/**
 * Session manager configuration.
 */
public class SessionConfig extends ConfigFoundation {

    /**
     * Constructs a new SessionConfig instance.
     *
     * @param map Configuration map.
     */
    public SessionConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets maximum concurrent sessions per principal.
     *
     * @return Session cap.
     */
    public int getMaxSessions() {
        return Math.toIntExact(getLongProperty("maxSessions", 5L));
    }

    /**
     * Gets maximum connect attempts before a session stays in error.
     *
     * @return Attempt count.
     */
    public int getMaxConnectRetries() {
        return Math.toIntExact(getLongProperty("maxConnectRetries", 5L));
    }

    /**
     * Gets consecutive keepalive failures that move a session to error.
     *
     * @return Failure threshold.
     */
    public int getKeepaliveFailureThreshold() {
        return Math.toIntExact(getLongProperty("keepaliveFailureThreshold", 3L));
    }

    public Duration getSweepInterval() {
        return Duration.ofSeconds(getLongProperty("sweepIntervalSeconds", 300L));
    }

    public Duration getStaleTimeout() {
        return Duration.ofMinutes(getLongProperty("staleTimeoutMinutes", 25L));
    }

    public Duration getKeepaliveInterval() {
        return Duration.ofMinutes(getLongProperty("keepaliveIntervalMinutes", 10L));
    }

    public Duration getLogoutTimeout() {
        return Duration.ofSeconds(getLongProperty("logoutTimeoutSeconds", 5L));
    }

    public Duration getShutdownGrace() {
        return Duration.ofSeconds(getLongProperty("shutdownGraceSeconds", 10L));
    }

    /**
     * Gets backoff base delay.
     *
     * @return Duration.
     */
    public Duration getBackoffBase() {
        return Duration.ofMillis(getLongProperty("backoffBaseMillis", 2000L));
    }

    /**
     * Gets backoff cap.
     *
     * @return Duration.
     */
    public Duration getBackoffCap() {
        return Duration.ofMillis(getLongProperty("backoffCapMillis", 15000L));
    }

    /**
     * Gets backoff jitter ratio, 0.25 meaning plus or minus 25%.
     *
     * @return Ratio.
     */
    public double getBackoffJitter() {
        return getDoubleProperty("backoffJitter", 0.25);
    }
}
