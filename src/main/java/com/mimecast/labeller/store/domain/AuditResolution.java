package com.mimecast.labeller.store.domain;

/**
 * How an audit entry was settled.
 */
public enum AuditResolution {
    /**
     * Remote call and local update committed together.
     */
    SYNCED,
    /**
     * Reconciliation found the mutation on the remote and applied it locally.
     */
    CONFIRMED_APPLIED,
    /**
     * Reconciliation found the mutation missing on the remote; local status left as is.
     */
    NOT_APPLIED,
    /**
     * Local status already matched the remote.
     */
    ALREADY_CONSISTENT,
    /**
     * Remote state could not be expressed as a legal local transition.
     */
    STATUS_CONFLICT,
    /**
     * The suggestion the entry refers to no longer exists.
     */
    ORPHANED
}
