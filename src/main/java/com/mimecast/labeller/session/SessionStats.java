package com.mimecast.labeller.session;

import java.util.Collections;
import java.util.Map;

/**
 * Point-in-time session counts.
 */
public class SessionStats {

    private final int total;
    private final Map<SessionState, Integer> byState;
    private final Map<String, Integer> byPrincipal;

    public SessionStats(int total, Map<SessionState, Integer> byState, Map<String, Integer> byPrincipal) {
        this.total = total;
        this.byState = Collections.unmodifiableMap(byState);
        this.byPrincipal = Collections.unmodifiableMap(byPrincipal);
    }

    public int getTotal() {
        return total;
    }

    public Map<SessionState, Integer> getByState() {
        return byState;
    }

    /**
     * Gets counts keyed by hashed principal.
     *
     * @return Map of hash to count.
     */
    public Map<String, Integer> getByPrincipal() {
        return byPrincipal;
    }

    @Override
    public String toString() {
        return "SessionStats{total=" + total + ", byState=" + byState + ", byPrincipal=" + byPrincipal + "}";
    }
}
