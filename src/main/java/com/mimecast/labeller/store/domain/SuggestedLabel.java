package com.mimecast.labeller.store.domain;

import java.util.Objects;

/**
 * One ranked label candidate with its confidence.
 */
public class SuggestedLabel {

    private final String label;
    private final double confidence;
    private final int rank;

    public SuggestedLabel(String label, double confidence, int rank) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Label cannot be empty");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be 0.0-1.0, got " + confidence);
        }
        if (rank < 1) {
            throw new IllegalArgumentException("Rank must be >= 1, got " + rank);
        }
        this.label = label;
        this.confidence = confidence;
        this.rank = rank;
    }

    public String getLabel() {
        return label;
    }

    public double getConfidence() {
        return confidence;
    }

    public int getRank() {
        return rank;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SuggestedLabel)) return false;
        SuggestedLabel that = (SuggestedLabel) o;
        return Double.compare(that.confidence, confidence) == 0 && rank == that.rank && label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, confidence, rank);
    }

    @Override
    public String toString() {
        return label + " (" + confidence + ", #" + rank + ")";
    }
}
