package com.mimecast.labeller.store.domain;

/**
 * Processing run states.
 *
 * <p>Valid transitions:
 * <pre>
 *   PENDING → IN_PROGRESS → COMPLETED
 *                ↓    ↑
 *              PAUSED        (page failure or cancellation, resumable)
 *                ↓
 *              FAILED
 * </pre>
 * <p>COMPLETED and FAILED are terminal.
 */
public enum RunStatus {
    PENDING,
    IN_PROGRESS,
    PAUSED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean isResumable() {
        return this == PENDING || this == PAUSED;
    }
}
