package com.mimecast.labeller.store.domain;

/**
 * Suggestion review states.
 *
 * <p>Valid transitions:
 * <pre>
 *   PENDING → APPROVED → APPLIED
 *      ├────→ REJECTED
 *      └────→ NO_MATCH
 * </pre>
 */
public enum SuggestionStatus {
    PENDING,
    APPROVED,
    REJECTED,
    NO_MATCH,
    APPLIED
}
