package com.mimecast.labeller.store.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One classification execution stored in {@code processing_runs}.
 */
public class ProcessingRun {

    private String id;
    private String principal;
    private RunStatus status = RunStatus.PENDING;
    private boolean applyMode;
    private String folder;
    private Integer itemLimit;
    private int totalItems;
    private int processedItems;
    private int generatedSuggestions;
    private int appliedSuggestions;
    private String cursor;
    private List<String> errorLog = new ArrayList<>();
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private OffsetDateTime completedAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getPrincipal() {
        return principal;
    }

    public void setPrincipal(String principal) {
        this.principal = principal;
    }

    public RunStatus getStatus() {
        return status;
    }

    public void setStatus(RunStatus status) {
        this.status = status;
    }

    public boolean isApplyMode() {
        return applyMode;
    }

    public void setApplyMode(boolean applyMode) {
        this.applyMode = applyMode;
    }

    public String getFolder() {
        return folder;
    }

    public void setFolder(String folder) {
        this.folder = folder;
    }

    /**
     * Gets the requested item limit.
     *
     * @return Limit, or null to process until the folder is exhausted.
     */
    public Integer getItemLimit() {
        return itemLimit;
    }

    public void setItemLimit(Integer itemLimit) {
        this.itemLimit = itemLimit;
    }

    public int getTotalItems() {
        return totalItems;
    }

    public void setTotalItems(int totalItems) {
        this.totalItems = totalItems;
    }

    public int getProcessedItems() {
        return processedItems;
    }

    public void setProcessedItems(int processedItems) {
        this.processedItems = processedItems;
    }

    public int getGeneratedSuggestions() {
        return generatedSuggestions;
    }

    public void setGeneratedSuggestions(int generatedSuggestions) {
        this.generatedSuggestions = generatedSuggestions;
    }

    public int getAppliedSuggestions() {
        return appliedSuggestions;
    }

    public void setAppliedSuggestions(int appliedSuggestions) {
        this.appliedSuggestions = appliedSuggestions;
    }

    /**
     * Gets the opaque page token of the last committed page.
     *
     * @return Cursor, or null before the first page.
     */
    public String getCursor() {
        return cursor;
    }

    public void setCursor(String cursor) {
        this.cursor = cursor;
    }

    public List<String> getErrorLog() {
        return errorLog;
    }

    public void setErrorLog(List<String> errorLog) {
        this.errorLog = errorLog != null ? new ArrayList<>(errorLog) : new ArrayList<>();
    }

    public void addError(String message) {
        errorLog.add(message);
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(OffsetDateTime completedAt) {
        this.completedAt = completedAt;
    }

    /**
     * Gets remaining items before the limit.
     *
     * @return Remaining, or Integer.MAX_VALUE without a limit.
     */
    public int remaining() {
        return itemLimit == null ? Integer.MAX_VALUE : Math.max(0, itemLimit - processedItems);
    }

    /**
     * Gets progress against the item limit.
     * <p>Without a limit the total is only known once the run completes.
     *
     * @return Percentage between 0 and 100.
     */
    public double progressPercentage() {
        if (status == RunStatus.COMPLETED) {
            return 100.0;
        }
        if (itemLimit == null || itemLimit <= 0) {
            return 0.0;
        }
        return Math.min(100.0, processedItems * 100.0 / itemLimit);
    }
}
