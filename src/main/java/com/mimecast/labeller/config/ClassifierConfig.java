package com.mimecast.labeller.config;

import java.util.List;
import java.util.Map;

/**
 * Classifier service configuration.
 */
public class ClassifierConfig extends ConfigFoundation {

    /**
     * Constructs a new ClassifierConfig instance.
     *
     * @param map Configuration map.
     */
    public ClassifierConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets classifier endpoint URL.
     *
     * @return URL.
     */
    public String getEndpoint() {
        return getStringProperty("endpoint", "http://localhost:8088/classify");
    }

    /**
     * Gets bearer token sent to the classifier, if any.
     *
     * @return Token or null.
     */
    public String getApiToken() {
        return getStringProperty("apiToken");
    }

    public int getTimeoutSeconds() {
        return Math.toIntExact(getLongProperty("timeoutSeconds", 30L));
    }

    /**
     * Gets the label set offered to the classifier.
     *
     * @return Labels.
     */
    public List<String> getLabels() {
        return getStringListProperty("labels");
    }

    /**
     * Gets maximum characters of body text sent per item.
     *
     * @return Character count.
     */
    public int getMaxTextLength() {
        return Math.toIntExact(getLongProperty("maxTextLength", 2000L));
    }
}
