package com.mimecast.labeller.config;

import java.util.Map;

/**
 * Batch coordinator configuration.
 */
public class BatchConfig extends ConfigFoundation {

    /**
     * Constructs a new BatchConfig instance.
     *
     * @param map Configuration map.
     */
    public BatchConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets items fetched per page.
     *
     * @return Page size.
     */
    public int getPageSize() {
        return Math.toIntExact(getLongProperty("pageSize", 100L));
    }

    /**
     * Gets the lowest confidence that still yields a label suggestion.
     *
     * @return Confidence between 0 and 1.
     */
    public double getMinConfidence() {
        return getDoubleProperty("minConfidence", 0.5);
    }

    /**
     * Gets the confidence at which apply mode approves suggestions automatically.
     *
     * @return Confidence between 0 and 1.
     */
    public double getAutoApproveConfidence() {
        return getDoubleProperty("autoApproveConfidence", 0.8);
    }

    /**
     * Gets maximum labels kept per suggestion.
     *
     * @return Label count.
     */
    public int getMaxLabelsPerItem() {
        return Math.toIntExact(getLongProperty("maxLabelsPerItem", 3L));
    }
}
