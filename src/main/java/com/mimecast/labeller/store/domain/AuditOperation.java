package com.mimecast.labeller.store.domain;

/**
 * Remote mutations recorded in the audit log.
 */
public enum AuditOperation {
    ADD_LABEL,
    REMOVE_LABEL
}
