package com.mimecast.labeller.store.domain;

import java.time.OffsetDateTime;

/**
 * Intended remote mutation, stored in {@code audit_log}.
 *
 * <p>Written before the remote call; marked synced only once the matching suggestion
 * update has committed.
 */
public class AuditLogEntry {

    private Long id;
    private String runId;
    private Long suggestionId;
    private AuditOperation operation;
    private String remoteItemId;
    private String desiredValue;
    private OffsetDateTime attemptedAt;
    private boolean synced;
    private OffsetDateTime syncedAt;
    private AuditResolution resolution;
    private String errorMessage;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public Long getSuggestionId() {
        return suggestionId;
    }

    public void setSuggestionId(Long suggestionId) {
        this.suggestionId = suggestionId;
    }

    public AuditOperation getOperation() {
        return operation;
    }

    public void setOperation(AuditOperation operation) {
        this.operation = operation;
    }

    public String getRemoteItemId() {
        return remoteItemId;
    }

    public void setRemoteItemId(String remoteItemId) {
        this.remoteItemId = remoteItemId;
    }

    /**
     * Gets the label the mutation adds or removes.
     *
     * @return Label.
     */
    public String getDesiredValue() {
        return desiredValue;
    }

    public void setDesiredValue(String desiredValue) {
        this.desiredValue = desiredValue;
    }

    public OffsetDateTime getAttemptedAt() {
        return attemptedAt;
    }

    public void setAttemptedAt(OffsetDateTime attemptedAt) {
        this.attemptedAt = attemptedAt;
    }

    public boolean isSynced() {
        return synced;
    }

    public void setSynced(boolean synced) {
        this.synced = synced;
    }

    public OffsetDateTime getSyncedAt() {
        return syncedAt;
    }

    public void setSyncedAt(OffsetDateTime syncedAt) {
        this.syncedAt = syncedAt;
    }

    public AuditResolution getResolution() {
        return resolution;
    }

    public void setResolution(AuditResolution resolution) {
        this.resolution = resolution;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }
}
