package com.mimecast.labeller.reconcile;

import com.mimecast.labeller.error.ValidationException;
import com.mimecast.labeller.store.StateStore;
import com.mimecast.labeller.store.domain.Suggestion;
import com.mimecast.labeller.store.domain.SuggestionStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Enforces suggestion status transitions.
 *
 * <p>Legal moves: PENDING to APPROVED, REJECTED or NO_MATCH, and APPROVED to APPLIED.
 * Anything else is rejected and the stored status is left unchanged.
 */
public class SuggestionLifecycle {
    private static final Logger log = LogManager.getLogger(SuggestionLifecycle.class);

    private final StateStore store;

    public SuggestionLifecycle(StateStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public Suggestion approve(long suggestionId) {
        return transition(suggestionId, SuggestionStatus.APPROVED);
    }

    public Suggestion reject(long suggestionId) {
        return transition(suggestionId, SuggestionStatus.REJECTED);
    }

    public Suggestion markNoMatch(long suggestionId) {
        return transition(suggestionId, SuggestionStatus.NO_MATCH);
    }

    public Suggestion markApplied(long suggestionId) {
        return transition(suggestionId, SuggestionStatus.APPLIED);
    }

    /**
     * Moves a suggestion to a new status.
     * <p>The update is a compare-and-set on the status read here, so a concurrent change
     * makes it fail instead of overwriting.
     *
     * @param suggestionId Suggestion id.
     * @param target       Target status.
     * @return Updated suggestion.
     * @throws ValidationException Unknown suggestion, illegal or concurrent transition.
     */
    public Suggestion transition(long suggestionId, SuggestionStatus target) {
        Suggestion suggestion = store.findSuggestion(suggestionId)
                .orElseThrow(() -> new ValidationException("Unknown suggestion: " + suggestionId));
        SuggestionStatus current = suggestion.getStatus();
        validateTransition(current, target);

        if (!store.updateStatus(suggestionId, current, target)) {
            throw new ValidationException("Suggestion " + suggestionId + " changed concurrently, expected " + current);
        }
        suggestion.setStatus(target);
        log.debug("Suggestion {} {} -> {}", suggestionId, current, target);
        return suggestion;
    }

    /**
     * Checks a transition without applying it.
     *
     * @param current Current status.
     * @param target  Target status.
     * @return Boolean.
     */
    public static boolean isAllowed(SuggestionStatus current, SuggestionStatus target) {
        if (current == null || target == null) {
            return false;
        }
        return switch (current) {
            case PENDING -> target == SuggestionStatus.APPROVED
                    || target == SuggestionStatus.REJECTED
                    || target == SuggestionStatus.NO_MATCH;
            case APPROVED -> target == SuggestionStatus.APPLIED;
            case REJECTED, NO_MATCH, APPLIED -> false;
        };
    }

    public static void validateTransition(SuggestionStatus current, SuggestionStatus target) {
        if (current == null) {
            throw new ValidationException("Current suggestion status is missing");
        }
        if (target == null) {
            throw new ValidationException("Target suggestion status is required");
        }
        if (!isAllowed(current, target)) {
            throw new ValidationException("Invalid suggestion transition: " + current + " -> " + target);
        }
    }
}
