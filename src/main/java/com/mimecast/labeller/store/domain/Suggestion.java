package com.mimecast.labeller.store.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Classification outcome for one remote item, stored in {@code suggestions}.
 */
public class Suggestion {

    private Long id;
    private String runId;
    private String remoteItemId;
    private String subject;
    private List<SuggestedLabel> labels = new ArrayList<>();
    private SuggestionStatus status = SuggestionStatus.PENDING;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

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

    public String getRemoteItemId() {
        return remoteItemId;
    }

    public void setRemoteItemId(String remoteItemId) {
        this.remoteItemId = remoteItemId;
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public List<SuggestedLabel> getLabels() {
        return labels;
    }

    public void setLabels(List<SuggestedLabel> labels) {
        this.labels = labels != null ? new ArrayList<>(labels) : new ArrayList<>();
    }

    public SuggestionStatus getStatus() {
        return status;
    }

    public void setStatus(SuggestionStatus status) {
        this.status = status;
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

    /**
     * Gets the top ranked label.
     *
     * @return Optional of SuggestedLabel, empty for no match.
     */
    public Optional<SuggestedLabel> best() {
        return labels.stream().min(Comparator.comparingInt(SuggestedLabel::getRank));
    }

    public double bestConfidence() {
        return best().map(SuggestedLabel::getConfidence).orElse(0.0);
    }
}
