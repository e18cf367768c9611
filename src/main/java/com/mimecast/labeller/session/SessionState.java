package com.mimecast.labeller.session;

import java.util.EnumSet;
import java.util.Set;

/**
 * Mailbox session states.
 *
 * <p>Valid transitions:
 * <pre>
 *   CONNECTING → CONNECTED → DISCONNECTED
 *       │            │           │
 *       └─→ ERROR ←──┘           │
 *            │  ↑                │
 *            ↓  │                │
 *        CONNECTING ←────────────┘ (reconnect)
 * </pre>
 */
public enum SessionState {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    ERROR;

    /**
     * Checks if moving to the target state is legal.
     *
     * @param target Target state.
     * @return Boolean.
     */
    public boolean canTransitionTo(SessionState target) {
        return allowed().contains(target);
    }

    private Set<SessionState> allowed() {
        return switch (this) {
            case CONNECTING -> EnumSet.of(CONNECTED, ERROR, DISCONNECTED);
            case CONNECTED -> EnumSet.of(DISCONNECTED, ERROR);
            case ERROR -> EnumSet.of(CONNECTING, DISCONNECTED);
            case DISCONNECTED -> EnumSet.of(CONNECTING);
        };
    }
}
