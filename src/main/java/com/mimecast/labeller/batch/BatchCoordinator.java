package com.mimecast.labeller.batch;

import com.mimecast.labeller.config.BatchConfig;
import com.mimecast.labeller.error.AuthenticationException;
import com.mimecast.labeller.error.LabellerException;
import com.mimecast.labeller.error.ValidationException;
import com.mimecast.labeller.quota.QuotaGuard;
import com.mimecast.labeller.quota.QuotaScope;
import com.mimecast.labeller.reconcile.ApplyReport;
import com.mimecast.labeller.reconcile.ReconciliationEngine;
import com.mimecast.labeller.reconcile.SuggestionLifecycle;
import com.mimecast.labeller.session.MailItem;
import com.mimecast.labeller.session.MailPage;
import com.mimecast.labeller.session.MailboxConnection;
import com.mimecast.labeller.store.StateStore;
import com.mimecast.labeller.store.domain.ProcessingRun;
import com.mimecast.labeller.store.domain.RunStatus;
import com.mimecast.labeller.store.domain.SuggestedLabel;
import com.mimecast.labeller.store.domain.Suggestion;
import com.mimecast.labeller.store.domain.SuggestionStatus;
import com.mimecast.labeller.util.Principals;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Drives paginated fetch, classification and persistence of a run.
 *
 * <p>Per page: fetch under the mailbox quota, classify under the classification quota,
 * then commit suggestions together with the new cursor. Only one page is held in memory.
 * <p>A failing page is recorded in the run's error log and the run is paused at the last
 * committed cursor, or failed when resuming cannot help. Cancellation is checked between
 * pages only.
 */
public class BatchCoordinator {
    private static final Logger log = LogManager.getLogger(BatchCoordinator.class);

    private final BatchConfig config;
    private final StateStore store;
    private final QuotaGuard quota;
    private final Classifier classifier;
    private final List<String> labels;
    private final SuggestionLifecycle lifecycle;
    private final ReconciliationEngine engine;
    private final Clock clock;

    public BatchCoordinator(BatchConfig config, StateStore store, QuotaGuard quota, Classifier classifier,
                            List<String> labels, SuggestionLifecycle lifecycle, ReconciliationEngine engine,
                            Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.quota = Objects.requireNonNull(quota, "quota");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.labels = List.copyOf(labels);
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (this.labels.isEmpty()) {
            throw new ValidationException("No classification labels configured");
        }
    }

    /**
     * Starts a new run.
     *
     * @param request    RunRequest instance.
     * @param connection Mailbox connection.
     * @param token      Cancellation token, marked stopped on return.
     * @return RunOutcome instance.
     */
    public RunOutcome start(RunRequest request, MailboxConnection connection, CancellationToken token) {
        try {
            return begin(request, connection, token);
        } finally {
            token.markStopped();
        }
    }

    private RunOutcome begin(RunRequest request, MailboxConnection connection, CancellationToken token) {
        if (!Principals.isValid(request.getPrincipal())) {
            throw new ValidationException("Malformed principal");
        }
        ProcessingRun run = new ProcessingRun();
        run.setId(UUID.randomUUID().toString());
        run.setPrincipal(request.getPrincipal());
        run.setFolder(request.getFolder());
        run.setItemLimit(request.getLimit());
        run.setApplyMode(request.isApplyMode());
        run.setStatus(RunStatus.IN_PROGRESS);
        store.saveRun(run);

        log.info("Run {} started for {} on {} (limit {})", run.getId(),
                Principals.hash(run.getPrincipal()), run.getFolder(),
                run.getItemLimit() != null ? run.getItemLimit() : "none");
        return process(run, connection, token);
    }

    /**
     * Resumes a paused or pending run at its stored cursor.
     * <p>A run still marked IN_PROGRESS was left behind by a process that stopped without
     * reaching a page boundary; it resumes the same way.
     *
     * @param runId      Run id.
     * @param connection Mailbox connection.
     * @param token      Cancellation token.
     * @return RunOutcome instance.
     * @throws ValidationException Unknown run or not resumable.
     */
    public RunOutcome resume(String runId, MailboxConnection connection, CancellationToken token) {
        try {
            return proceed(runId, connection, token);
        } finally {
            token.markStopped();
        }
    }

    private RunOutcome proceed(String runId, MailboxConnection connection, CancellationToken token) {
        ProcessingRun run = store.getRun(runId);
        if (run.getStatus() == RunStatus.IN_PROGRESS) {
            log.warn("Run {} was interrupted mid-page, resuming at cursor {}", runId, run.getCursor());
        } else if (!run.getStatus().isResumable()) {
            throw new ValidationException("Run " + runId + " is " + run.getStatus() + " and cannot be resumed");
        }
        run.setStatus(RunStatus.IN_PROGRESS);
        store.saveRun(run);

        log.info("Run {} resumed at cursor {} with {} items done", runId, run.getCursor(), run.getProcessedItems());
        return process(run, connection, token);
    }

    /**
     * Approves pending suggestions at or above the auto-approve confidence and applies every
     * approved suggestion of the run.
     *
     * @param run        Completed run.
     * @param connection Mailbox connection.
     * @return ApplyReport instance.
     */
    public ApplyReport applyConfident(ProcessingRun run, MailboxConnection connection) {
        int approved = 0;
        for (Suggestion suggestion : store.findSuggestions(run.getId(), SuggestionStatus.PENDING)) {
            if (suggestion.bestConfidence() >= config.getAutoApproveConfidence()) {
                lifecycle.approve(suggestion.getId());
                approved++;
            }
        }
        log.info("Run {} auto-approved {} suggestions at >= {}", run.getId(), approved, config.getAutoApproveConfidence());
        return engine.apply(run.getId(), connection);
    }

    private RunOutcome process(ProcessingRun run, MailboxConnection connection, CancellationToken token) {
        try {
            quota.run(QuotaScope.MAILBOX, () -> connection.selectFolder(run.getFolder()));
        } catch (RuntimeException e) {
            fail(run, "Selecting " + run.getFolder() + " failed", e);
            throw e;
        }

        while (true) {
            if (token.isCancelled()) {
                run.setStatus(RunStatus.PAUSED);
                store.saveRun(run);
                log.info("Run {} cancelled, paused at cursor {}", run.getId(), run.getCursor());
                return new RunOutcome(run, null);
            }

            int size = Math.min(config.getPageSize(), run.remaining());
            if (size == 0) {
                break;
            }

            String cursor = run.getCursor();
            int fetched;
            try {
                MailPage page = quota.call(QuotaScope.MAILBOX, () -> connection.fetchPage(cursor, size));
                if (page.isEmpty()) {
                    break;
                }
                List<Classification> results = quota.call(QuotaScope.CLASSIFICATION,
                        () -> classifier.classify(page.getItems(), labels));
                int inserted = store.commitPage(run, buildSuggestions(page, results), page.getNextCursor());
                fetched = page.size();
                log.info("Run {} committed {} of {} items, {} processed ({}%)", run.getId(), inserted, fetched,
                        run.getProcessedItems(), String.format("%.1f", run.progressPercentage()));
            } catch (RuntimeException e) {
                fail(run, "Page after cursor " + cursor + " failed", e);
                throw e;
            }

            if (fetched < size) {
                break;
            }
        }

        complete(run);
        ApplyReport report = run.isApplyMode() ? applyConfident(run, connection) : null;
        return new RunOutcome(run, report);
    }

    /**
     * Turns classifier output into one suggestion per item.
     * <p>Labels outside the configured set are dropped. The best remaining label at or above
     * the minimum confidence makes the suggestion PENDING, otherwise it is NO_MATCH.
     */
    List<Suggestion> buildSuggestions(MailPage page, List<Classification> results) {
        Set<String> allowed = new LinkedHashSet<>(labels);
        Map<String, List<Classification>> byItem = new HashMap<>();
        for (Classification result : results) {
            if (!allowed.contains(result.getLabel())) {
                log.debug("Dropping unknown label {} for item {}", result.getLabel(), result.getItemRef());
                continue;
            }
            byItem.computeIfAbsent(result.getItemRef(), k -> new ArrayList<>()).add(result);
        }

        List<Suggestion> suggestions = new ArrayList<>();
        for (MailItem item : page.getItems()) {
            List<Classification> scored = byItem.getOrDefault(item.getId(), new ArrayList<>());
            scored.sort(Comparator.comparingDouble(Classification::getConfidence).reversed());

            List<SuggestedLabel> ranked = new ArrayList<>();
            Set<String> seen = new LinkedHashSet<>();
            for (Classification result : scored) {
                if (ranked.size() >= config.getMaxLabelsPerItem()) {
                    break;
                }
                if (seen.add(result.getLabel())) {
                    ranked.add(new SuggestedLabel(result.getLabel(), result.getConfidence(), ranked.size() + 1));
                }
            }

            Suggestion suggestion = new Suggestion();
            suggestion.setRemoteItemId(item.getId());
            suggestion.setSubject(item.getSubject());
            suggestion.setLabels(ranked);
            suggestion.setStatus(suggestion.bestConfidence() >= config.getMinConfidence() && !ranked.isEmpty()
                    ? SuggestionStatus.PENDING
                    : SuggestionStatus.NO_MATCH);
            suggestions.add(suggestion);
        }
        return suggestions;
    }

    private void complete(ProcessingRun run) {
        run.setStatus(RunStatus.COMPLETED);
        run.setTotalItems(run.getProcessedItems());
        run.setCompletedAt(OffsetDateTime.now(clock));
        store.saveRun(run);
        log.info("Run {} completed: {} items, {} suggestions", run.getId(), run.getProcessedItems(),
                run.getGeneratedSuggestions());
    }

    /**
     * Records a failure in the run's error log.
     * <p>Rejected credentials and invalid input end the run as FAILED; anything else pauses
     * it at the last committed cursor.
     */
    private void fail(ProcessingRun run, String context, RuntimeException cause) {
        boolean fatal = isFatal(cause);
        String kind = cause instanceof LabellerException
                ? ((LabellerException) cause).getKind().name()
                : cause.getClass().getSimpleName();
        String message = context + ": " + kind + ": " + cause.getMessage();
        try {
            if (fatal) {
                log.error("Run {} failed: {}", run.getId(), message, cause);
                store.recordRunFailure(run, message);
            } else {
                log.error("Run {} paused: {}", run.getId(), message, cause);
                store.recordPageFailure(run, message);
            }
        } catch (RuntimeException e) {
            log.error("Could not record failure of run {}: {}", run.getId(), e.getMessage());
            cause.addSuppressed(e);
        }
    }

    private static boolean isFatal(RuntimeException cause) {
        return cause instanceof ValidationException || cause instanceof AuthenticationException;
    }
}
