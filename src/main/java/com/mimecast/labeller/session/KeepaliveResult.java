package com.mimecast.labeller.session;

/**
 * Outcome of one keepalive check.
 */
public enum KeepaliveResult {
    /**
     * Probe answered.
     */
    OK,
    /**
     * Probe failed below the failure threshold; session still CONNECTED.
     */
    PROBE_FAILED,
    /**
     * Threshold reached and a reconnect succeeded.
     */
    RECONNECTED,
    /**
     * Reconnect attempts exhausted or the session is closed.
     */
    FAILED
}
