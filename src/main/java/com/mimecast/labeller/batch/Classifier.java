package com.mimecast.labeller.batch;

import com.mimecast.labeller.session.MailItem;

import java.util.List;

/**
 * External scorer.
 */
public interface Classifier {

    /**
     * Scores items against a label set.
     * <p>An item may receive several results or none.
     *
     * @param items  Items.
     * @param labels Candidate labels.
     * @return List of Classification.
     * @throws com.mimecast.labeller.error.RateLimitedException         Provider throttling.
     * @throws com.mimecast.labeller.error.TransientConnectionException Network or server failure.
     */
    List<Classification> classify(List<MailItem> items, List<String> labels);
}
