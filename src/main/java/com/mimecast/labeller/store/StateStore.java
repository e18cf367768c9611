package com.mimecast.labeller.store;

import com.mimecast.labeller.db.Transactions;
import com.mimecast.labeller.error.DataIntegrityException;
import com.mimecast.labeller.error.ValidationException;
import com.mimecast.labeller.store.domain.AuditLogEntry;
import com.mimecast.labeller.store.domain.AuditResolution;
import com.mimecast.labeller.store.domain.FolderCacheEntry;
import com.mimecast.labeller.store.domain.ProcessingRun;
import com.mimecast.labeller.store.domain.RunStatus;
import com.mimecast.labeller.store.domain.SessionSnapshot;
import com.mimecast.labeller.store.domain.Suggestion;
import com.mimecast.labeller.store.domain.SuggestionStatus;
import com.mimecast.labeller.store.repository.AuditLogRepository;
import com.mimecast.labeller.store.repository.FolderCacheRepository;
import com.mimecast.labeller.store.repository.RunRepository;
import com.mimecast.labeller.store.repository.SessionRepository;
import com.mimecast.labeller.store.repository.SuggestionRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Transactional facade over the local database.
 *
 * <p>Every write runs in exactly one transaction; on failure nothing of it is visible.
 * In-memory domain objects passed in are only updated after the commit succeeds.
 */
public class StateStore {
    private static final Logger log = LogManager.getLogger(StateStore.class);

    private final DataSource dataSource;
    private final Clock clock;
    private final Duration folderCacheTtl;

    private final RunRepository runs = new RunRepository();
    private final SuggestionRepository suggestions = new SuggestionRepository();
    private final AuditLogRepository audit = new AuditLogRepository();
    private final FolderCacheRepository folders = new FolderCacheRepository();
    private final SessionRepository sessions = new SessionRepository();

    public StateStore(DataSource dataSource, Clock clock) {
        this(dataSource, clock, Duration.ofMinutes(10));
    }

    public StateStore(DataSource dataSource, Clock clock, Duration folderCacheTtl) {
        this.dataSource = dataSource;
        this.clock = clock;
        this.folderCacheTtl = folderCacheTtl;
    }

    public Clock getClock() {
        return clock;
    }

    // Runs.

    /**
     * Inserts or updates a run.
     *
     * @param run ProcessingRun instance.
     * @return Same instance with timestamps set.
     */
    public ProcessingRun saveRun(ProcessingRun run) {
        OffsetDateTime now = now();
        ProcessingRun saved = copy(run);
        if (saved.getCreatedAt() == null) {
            saved.setCreatedAt(now);
        }
        saved.setUpdatedAt(now);

        Transactions.inTransaction(dataSource, "save run", c -> {
            if (runs.update(c, saved) == 0) {
                runs.insert(c, saved);
            }
            return null;
        });

        run.setCreatedAt(saved.getCreatedAt());
        run.setUpdatedAt(now);
        return run;
    }

    public Optional<ProcessingRun> findRun(String runId) {
        return Transactions.read(dataSource, "find run", c -> runs.findById(c, runId));
    }

    public ProcessingRun getRun(String runId) {
        return findRun(runId).orElseThrow(() -> new ValidationException("Unknown run: " + runId));
    }

    public List<ProcessingRun> listRecentRuns(int limit) {
        return Transactions.read(dataSource, "list recent runs", c -> runs.findRecent(c, limit));
    }

    public List<ProcessingRun> listRuns(String principal, RunStatus status) {
        return Transactions.read(dataSource, "list runs", c -> runs.findByPrincipalAndStatus(c, principal, status));
    }

    /**
     * Commits one fetched page.
     * <p>Inserts suggestions not yet stored for the run, then advances cursor and counters,
     * all in one transaction. Items already committed are skipped and not counted again.
     *
     * @param run        Run being processed.
     * @param page       Suggestions built for the page.
     * @param nextCursor Cursor after the page.
     * @return Number of suggestions inserted.
     */
    public int commitPage(ProcessingRun run, List<Suggestion> page, String nextCursor) {
        OffsetDateTime now = now();
        List<String> itemIds = new ArrayList<>();
        for (Suggestion suggestion : page) {
            itemIds.add(suggestion.getRemoteItemId());
        }

        ProcessingRun next = copy(run);
        int inserted = Transactions.inTransaction(dataSource, "commit page", c -> {
            Set<String> existing = suggestions.findExistingItemIds(c, run.getId(), itemIds);
            int count = 0;
            int generated = 0;
            for (Suggestion suggestion : page) {
                if (existing.contains(suggestion.getRemoteItemId())) {
                    continue;
                }
                suggestion.setRunId(run.getId());
                suggestion.setCreatedAt(now);
                suggestion.setUpdatedAt(now);
                suggestions.insert(c, suggestion);
                existing.add(suggestion.getRemoteItemId());
                count++;
                if (suggestion.getStatus() != SuggestionStatus.NO_MATCH) {
                    generated++;
                }
            }

            next.setProcessedItems(run.getProcessedItems() + count);
            next.setTotalItems(Math.max(run.getTotalItems(), next.getProcessedItems()));
            next.setGeneratedSuggestions(run.getGeneratedSuggestions() + generated);
            next.setCursor(nextCursor);
            next.setUpdatedAt(now);
            runs.update(c, next);
            return count;
        });

        run.setProcessedItems(next.getProcessedItems());
        run.setTotalItems(next.getTotalItems());
        run.setGeneratedSuggestions(next.getGeneratedSuggestions());
        run.setCursor(nextCursor);
        run.setUpdatedAt(now);

        if (inserted < page.size()) {
            log.info("Run {} page skipped {} already committed items", run.getId(), page.size() - inserted);
        }
        log.debug("Run {} committed page of {} at cursor {}", run.getId(), inserted, nextCursor);
        return inserted;
    }

    /**
     * Records a failed page and pauses the run at its last committed cursor.
     *
     * @param run     Run being processed.
     * @param message Failure description.
     */
    public void recordPageFailure(ProcessingRun run, String message) {
        recordFailure(run, message, RunStatus.PAUSED);
    }

    /**
     * Records a failure that resuming cannot fix and ends the run as FAILED.
     *
     * @param run     Run being processed.
     * @param message Failure description.
     */
    public void recordRunFailure(ProcessingRun run, String message) {
        recordFailure(run, message, RunStatus.FAILED);
    }

    private void recordFailure(ProcessingRun run, String message, RunStatus status) {
        ProcessingRun failed = copy(run);
        failed.addError(message);
        failed.setStatus(status);
        failed.setUpdatedAt(now());
        if (status.isTerminal()) {
            failed.setCompletedAt(failed.getUpdatedAt());
        }
        Transactions.inTransaction(dataSource, "record run failure", c -> runs.update(c, failed));

        run.setErrorLog(failed.getErrorLog());
        run.setStatus(status);
        run.setUpdatedAt(failed.getUpdatedAt());
        run.setCompletedAt(failed.getCompletedAt());
    }

    // Suggestions.

    public Suggestion saveSuggestion(Suggestion suggestion) {
        OffsetDateTime now = now();
        if (suggestion.getCreatedAt() == null) {
            suggestion.setCreatedAt(now);
        }
        suggestion.setUpdatedAt(now);
        Transactions.inTransaction(dataSource, "save suggestion", c -> {
            suggestions.insert(c, suggestion);
            return null;
        });
        return suggestion;
    }

    public Optional<Suggestion> findSuggestion(long id) {
        return Transactions.read(dataSource, "find suggestion", c -> suggestions.findById(c, id));
    }

    /**
     * Lists suggestions of a run, highest confidence first.
     *
     * @param runId  Run id.
     * @param status Status filter, or null for all.
     * @return List of Suggestion.
     */
    public List<Suggestion> findSuggestions(String runId, SuggestionStatus status) {
        return Transactions.read(dataSource, "find suggestions", c -> suggestions.findByRun(c, runId, status));
    }

    /**
     * Compare-and-set status update.
     *
     * @return True when the stored status was {@code from} and is now {@code to}.
     */
    public boolean updateStatus(long suggestionId, SuggestionStatus from, SuggestionStatus to) {
        return Transactions.inTransaction(dataSource, "update suggestion status",
                c -> suggestions.compareAndSetStatus(c, suggestionId, from, to, now()));
    }

    // Audit log.

    public AuditLogEntry appendAuditEntry(AuditLogEntry entry) {
        if (entry.getAttemptedAt() == null) {
            entry.setAttemptedAt(now());
        }
        Transactions.inTransaction(dataSource, "append audit entry", c -> {
            audit.insert(c, entry);
            return null;
        });
        return entry;
    }

    public void recordAuditError(AuditLogEntry entry, String message) {
        Transactions.inTransaction(dataSource, "record audit error", c -> {
            audit.recordError(c, entry.getId(), message);
            return null;
        });
        entry.setErrorMessage(message);
    }

    /**
     * Marks an approved suggestion applied, its audit entry synced and bumps the run's applied
     * counter, in one transaction.
     *
     * @throws DataIntegrityException When the suggestion is no longer approved or the entry already synced.
     */
    public void markAppliedAndSynced(Suggestion suggestion, AuditLogEntry entry) {
        OffsetDateTime now = now();
        Transactions.inTransaction(dataSource, "mark applied and synced", c -> {
            if (!suggestions.compareAndSetStatus(c, suggestion.getId(), SuggestionStatus.APPROVED, SuggestionStatus.APPLIED, now)) {
                throw new DataIntegrityException("Suggestion " + suggestion.getId() + " is no longer APPROVED");
            }
            if (!audit.markSynced(c, entry.getId(), AuditResolution.SYNCED, now)) {
                throw new DataIntegrityException("Audit entry " + entry.getId() + " already synced");
            }
            runs.incrementApplied(c, suggestion.getRunId(), 1, now);
            return null;
        });

        suggestion.setStatus(SuggestionStatus.APPLIED);
        suggestion.setUpdatedAt(now);
        entry.setSynced(true);
        entry.setSyncedAt(now);
        entry.setResolution(AuditResolution.SYNCED);
    }

    /**
     * Settles an unsynced audit entry, optionally moving its suggestion, in one transaction.
     *
     * @param entry      Unsynced entry.
     * @param resolution Resolution to record.
     * @param suggestion Suggestion the entry refers to, or null.
     * @param newStatus  Status to move the suggestion to, or null to leave it.
     */
    public void resolveAuditEntry(AuditLogEntry entry, AuditResolution resolution,
                                  Suggestion suggestion, SuggestionStatus newStatus) {
        OffsetDateTime now = now();
        Transactions.inTransaction(dataSource, "resolve audit entry", c -> {
            if (suggestion != null && newStatus != null) {
                if (!suggestions.compareAndSetStatus(c, suggestion.getId(), suggestion.getStatus(), newStatus, now)) {
                    throw new DataIntegrityException("Suggestion " + suggestion.getId() + " changed during reconciliation");
                }
                if (newStatus == SuggestionStatus.APPLIED) {
                    runs.incrementApplied(c, suggestion.getRunId(), 1, now);
                }
            }
            audit.markSynced(c, entry.getId(), resolution, now);
            return null;
        });

        if (suggestion != null && newStatus != null) {
            suggestion.setStatus(newStatus);
            suggestion.setUpdatedAt(now);
        }
        entry.setSynced(true);
        entry.setSyncedAt(now);
        entry.setResolution(resolution);
    }

    /**
     * Lists unsynced audit entries.
     *
     * @param runId Run filter, or null for every run.
     * @return List of AuditLogEntry.
     */
    public List<AuditLogEntry> findUnsynced(String runId) {
        return Transactions.read(dataSource, "find unsynced audit entries", c -> audit.findUnsynced(c, runId));
    }

    public Optional<AuditLogEntry> findAuditEntry(long id) {
        return Transactions.read(dataSource, "find audit entry", c -> audit.findById(c, id));
    }

    // Housekeeping.

    /**
     * Deletes completed and failed runs older than the given days with their suggestions and
     * audit entries, closed session snapshots older than the same cutoff and expired folder
     * cache rows.
     *
     * @param olderThanDays Age in days, zero or more.
     * @return CleanupReport instance.
     */
    public CleanupReport cleanup(int olderThanDays) {
        if (olderThanDays < 0) {
            throw new ValidationException("Days must be zero or more, got " + olderThanDays);
        }
        OffsetDateTime now = now();
        OffsetDateTime cutoff = now.minusDays(olderThanDays);

        CleanupReport report = Transactions.inTransaction(dataSource, "cleanup", c -> new CleanupReport(
                runs.deleteTerminalBefore(c, cutoff),
                sessions.deleteClosedBefore(c, cutoff),
                folders.deleteBefore(c, now.minus(folderCacheTtl))));

        log.info("Cleanup older than {} days removed {}", olderThanDays, report);
        return report;
    }

    // Sessions and folders.

    public void saveSessionSnapshot(SessionSnapshot snapshot) {
        Transactions.inTransaction(dataSource, "save session snapshot", c -> {
            sessions.upsert(c, snapshot);
            return null;
        });
    }

    public List<SessionSnapshot> listSessionSnapshots(int limit) {
        return Transactions.read(dataSource, "list session snapshots", c -> sessions.findRecent(c, limit));
    }

    /**
     * Replaces the cached folder list of a principal.
     */
    public void cacheFolders(String principal, List<FolderCacheEntry> entries) {
        Transactions.inTransaction(dataSource, "cache folders", c -> {
            folders.replace(c, principal, entries);
            return null;
        });
    }

    /**
     * Reads cached folders regardless of age. Callers check the TTL.
     */
    public List<FolderCacheEntry> findFolders(String principal) {
        return Transactions.read(dataSource, "find folders", c -> folders.findByPrincipal(c, principal));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static ProcessingRun copy(ProcessingRun run) {
        ProcessingRun copy = new ProcessingRun();
        copy.setId(run.getId());
        copy.setPrincipal(run.getPrincipal());
        copy.setStatus(run.getStatus());
        copy.setApplyMode(run.isApplyMode());
        copy.setFolder(run.getFolder());
        copy.setItemLimit(run.getItemLimit());
        copy.setTotalItems(run.getTotalItems());
        copy.setProcessedItems(run.getProcessedItems());
        copy.setGeneratedSuggestions(run.getGeneratedSuggestions());
        copy.setAppliedSuggestions(run.getAppliedSuggestions());
        copy.setCursor(run.getCursor());
        copy.setErrorLog(run.getErrorLog());
        copy.setCreatedAt(run.getCreatedAt());
        copy.setUpdatedAt(run.getUpdatedAt());
        copy.setCompletedAt(run.getCompletedAt());
        return copy;
    }
}
