package com.mimecast.labeller.batch;

/**
 * One scored label for one item.
 */
public final class Classification {

    private final String itemRef;
    private final String label;
    private final double confidence;

    public Classification(String itemRef, String label, double confidence) {
        this.itemRef = itemRef;
        this.label = label;
        this.confidence = confidence;
    }

    /**
     * Gets the remote item id the score refers to.
     *
     * @return Item id.
     */
    public String getItemRef() {
        return itemRef;
    }

    public String getLabel() {
        return label;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return "Classification{" + itemRef + " -> " + label + " @ " + confidence + "}";
    }
}
