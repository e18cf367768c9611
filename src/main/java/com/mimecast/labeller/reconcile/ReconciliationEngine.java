package com.mimecast.labeller.reconcile;

import com.mimecast.labeller.error.DataIntegrityException;
import com.mimecast.labeller.error.LabellerException;
import com.mimecast.labeller.quota.QuotaGuard;
import com.mimecast.labeller.quota.QuotaScope;
import com.mimecast.labeller.session.LabelAction;
import com.mimecast.labeller.session.MailboxConnection;
import com.mimecast.labeller.store.StateStore;
import com.mimecast.labeller.store.domain.AuditLogEntry;
import com.mimecast.labeller.store.domain.AuditOperation;
import com.mimecast.labeller.store.domain.AuditResolution;
import com.mimecast.labeller.store.domain.SuggestedLabel;
import com.mimecast.labeller.store.domain.Suggestion;
import com.mimecast.labeller.store.domain.SuggestionStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies approved suggestions to the remote mailbox and repairs drift between remote and
 * local state.
 *
 * <p>Apply protocol, per suggestion:
 * <ol>
 *   <li>append an unsynced audit entry (own transaction)</li>
 *   <li>mutate the remote label</li>
 *   <li>mark the suggestion APPLIED and the entry synced (one transaction)</li>
 * </ol>
 * <p>If step 3 fails after step 2 succeeded the entry stays unsynced. Reconciliation reads
 * the remote for every unsynced entry, treats it as authoritative and settles the entry
 * without ever repeating the mutation. Local transactions never span a remote call.
 */
public class ReconciliationEngine {
    private static final Logger log = LogManager.getLogger(ReconciliationEngine.class);

    private final StateStore store;
    private final QuotaGuard quota;

    public ReconciliationEngine(StateStore store, QuotaGuard quota) {
        this.store = Objects.requireNonNull(store, "store");
        this.quota = Objects.requireNonNull(quota, "quota");
    }

    /**
     * Applies every APPROVED suggestion of a run.
     *
     * @param runId      Run id.
     * @param connection Connection with the run's folder selected.
     * @return ApplyReport instance.
     */
    public ApplyReport apply(String runId, MailboxConnection connection) {
        store.getRun(runId);
        List<Suggestion> approved = store.findSuggestions(runId, SuggestionStatus.APPROVED);
        ApplyReport report = new ApplyReport();

        for (Suggestion suggestion : approved) {
            Optional<String> label = suggestion.best().map(SuggestedLabel::getLabel);
            if (label.isEmpty()) {
                log.warn("Suggestion {} is approved without a label, skipping", suggestion.getId());
                report.skipped();
                continue;
            }

            AuditLogEntry entry = new AuditLogEntry();
            entry.setRunId(runId);
            entry.setSuggestionId(suggestion.getId());
            entry.setOperation(AuditOperation.ADD_LABEL);
            entry.setRemoteItemId(suggestion.getRemoteItemId());
            entry.setDesiredValue(label.get());
            store.appendAuditEntry(entry);

            try {
                quota.run(QuotaScope.MAILBOX,
                        () -> connection.mutateLabel(suggestion.getRemoteItemId(), label.get(), LabelAction.ADD));
            } catch (LabellerException e) {
                log.warn("Applying {} to item {} failed: {}", label.get(), suggestion.getRemoteItemId(), e.getMessage());
                recordError(entry, e);
                report.remoteFailure();
                continue;
            }

            try {
                store.markAppliedAndSynced(suggestion, entry);
                report.applied();
            } catch (LabellerException e) {
                DataIntegrityException fault = new DataIntegrityException(
                        "Label applied remotely but local update failed for suggestion " + suggestion.getId(), e);
                log.error("{}; audit entry {} left for reconciliation: {}", fault.getMessage(), entry.getId(), e.getMessage());
                report.pendingReconciliation();
            }
        }

        log.info("Run {} apply finished: {}", runId, report);
        return report;
    }

    /**
     * Settles unsynced audit entries against the remote.
     * <p>Only reads the remote. Running it again converges: settled entries are never
     * looked at twice.
     *
     * @param runId      Run id, or null for every run.
     * @param connection Connection with the relevant folder selected.
     * @return ReconcileReport instance.
     */
    public ReconcileReport reconcile(String runId, MailboxConnection connection) {
        List<AuditLogEntry> unsynced = store.findUnsynced(runId);
        ReconcileReport report = new ReconcileReport();
        if (unsynced.isEmpty()) {
            log.debug("No unsynced audit entries{}", runId != null ? " for run " + runId : "");
            return report;
        }
        log.warn("Found {} unsynced audit entries, reconciling", unsynced.size());

        for (AuditLogEntry entry : unsynced) {
            report.examined();
            try {
                report.resolved(settle(entry, connection, report));
            } catch (LabellerException e) {
                log.warn("Reconciling audit entry {} failed, left unsynced: {}", entry.getId(), e.getMessage());
                report.failed();
            }
        }

        log.info("Reconciliation finished: {}", report);
        return report;
    }

    private AuditResolution settle(AuditLogEntry entry, MailboxConnection connection, ReconcileReport report) {
        Optional<Suggestion> found = entry.getSuggestionId() != null
                ? store.findSuggestion(entry.getSuggestionId())
                : Optional.empty();
        if (found.isEmpty()) {
            store.resolveAuditEntry(entry, AuditResolution.ORPHANED, null, null);
            return AuditResolution.ORPHANED;
        }
        Suggestion suggestion = found.get();

        report.remoteCheck();
        boolean present = quota.call(QuotaScope.MAILBOX,
                () -> connection.hasLabel(entry.getRemoteItemId(), entry.getDesiredValue()));
        boolean remoteApplied = entry.getOperation() == AuditOperation.ADD_LABEL ? present : !present;

        AuditResolution resolution;
        SuggestionStatus target = null;
        if (!remoteApplied) {
            resolution = AuditResolution.NOT_APPLIED;
        } else if (suggestion.getStatus() == SuggestionStatus.APPLIED) {
            resolution = AuditResolution.ALREADY_CONSISTENT;
        } else if (SuggestionLifecycle.isAllowed(suggestion.getStatus(), SuggestionStatus.APPLIED)) {
            resolution = AuditResolution.CONFIRMED_APPLIED;
            target = SuggestionStatus.APPLIED;
        } else {
            resolution = AuditResolution.STATUS_CONFLICT;
            log.warn("Data integrity conflict: item {} carries {} but suggestion {} is {}",
                    entry.getRemoteItemId(), entry.getDesiredValue(), suggestion.getId(), suggestion.getStatus());
        }

        store.resolveAuditEntry(entry, resolution, suggestion, target);
        log.debug("Audit entry {} resolved as {}", entry.getId(), resolution);
        return resolution;
    }

    private void recordError(AuditLogEntry entry, LabellerException cause) {
        try {
            store.recordAuditError(entry, cause.getKind() + ": " + cause.getMessage());
        } catch (LabellerException e) {
            log.error("Could not record error on audit entry {}: {}", entry.getId(), e.getMessage());
        }
    }
}
