package com.mimecast.labeller.store;

import com.mimecast.labeller.db.Migrations;
import com.mimecast.labeller.error.DataIntegrityException;
import com.mimecast.labeller.error.StorageException;
import com.mimecast.labeller.error.ValidationException;
import com.mimecast.labeller.store.domain.AuditLogEntry;
import com.mimecast.labeller.store.domain.AuditOperation;
import com.mimecast.labeller.store.domain.AuditResolution;
import com.mimecast.labeller.store.domain.ProcessingRun;
import com.mimecast.labeller.store.domain.RunStatus;
import com.mimecast.labeller.store.domain.SessionSnapshot;
import com.mimecast.labeller.store.domain.SuggestedLabel;
import com.mimecast.labeller.store.domain.Suggestion;
import com.mimecast.labeller.store.domain.SuggestionStatus;
import com.mimecast.labeller.util.MutableClock;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Execution(ExecutionMode.SAME_THREAD)
class StateStoreTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private static HikariDataSource ds;

    private MutableClock clock;
    private StateStore store;

    @BeforeAll
    static void setupDatabase() {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:h2:mem:state_store_test;MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        cfg.setUsername("sa");
        cfg.setPassword("");
        cfg.setMaximumPoolSize(2);
        ds = new HikariDataSource(cfg);
        Migrations.apply(ds, java.time.Clock.systemUTC());
    }

    @AfterAll
    static void closeDatabase() {
        if (ds != null) {
            ds.close();
        }
    }

    @BeforeEach
    void clearTables() throws Exception {
        try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("DELETE FROM audit_log");
            stmt.execute("DELETE FROM suggestions");
            stmt.execute("DELETE FROM processing_runs");
            stmt.execute("DELETE FROM sessions");
            stmt.execute("DELETE FROM folder_cache");
        }
        clock = new MutableClock(START);
        store = new StateStore(ds, clock, Duration.ofMinutes(10));
    }

    // --- runs ---

    @Test
    void saveRunInsertsThenUpdates() {
        ProcessingRun run = newRun(RunStatus.IN_PROGRESS);
        run.setItemLimit(null);
        store.saveRun(run);
        assertNotNull(run.getCreatedAt());

        clock.advance(Duration.ofMinutes(1));
        run.setCursor("42");
        run.addError("first failure");
        run.setStatus(RunStatus.PAUSED);
        store.saveRun(run);

        ProcessingRun found = store.getRun(run.getId());
        assertEquals(RunStatus.PAUSED, found.getStatus());
        assertEquals("42", found.getCursor());
        assertEquals(List.of("first failure"), found.getErrorLog());
        assertNull(found.getItemLimit());
        assertEquals(START, found.getCreatedAt().toInstant());
        assertEquals(START.plusSeconds(60), found.getUpdatedAt().toInstant());
        assertEquals(1, store.listRuns(run.getPrincipal(), RunStatus.PAUSED).size());
    }

    @Test
    void getRunRejectsUnknownId() {
        ValidationException e = assertThrows(ValidationException.class, () -> store.getRun("missing"));
        assertTrue(e.getMessage().contains("missing"));
    }

    // --- page commits ---

    @Test
    void commitPageAdvancesCursorAndCounters() {
        ProcessingRun run = store.saveRun(newRun(RunStatus.IN_PROGRESS));

        int inserted = store.commitPage(run, List.of(
                suggestion("1", "Finance", 0.9, SuggestionStatus.PENDING),
                suggestion("2", null, 0.0, SuggestionStatus.NO_MATCH)), "2");

        assertEquals(2, inserted);
        assertEquals("2", run.getCursor());
        assertEquals(2, run.getProcessedItems());
        assertEquals(1, run.getGeneratedSuggestions());

        ProcessingRun stored = store.getRun(run.getId());
        assertEquals("2", stored.getCursor());
        assertEquals(2, stored.getProcessedItems());
        assertEquals(2, store.findSuggestions(run.getId(), null).size());
    }

    @Test
    void replayedPageInsertsNothing() {
        ProcessingRun run = store.saveRun(newRun(RunStatus.IN_PROGRESS));
        store.commitPage(run, List.of(suggestion("1", "Finance", 0.9, SuggestionStatus.PENDING)), "1");

        int inserted = store.commitPage(run, List.of(
                suggestion("1", "Finance", 0.9, SuggestionStatus.PENDING),
                suggestion("2", "Travel", 0.7, SuggestionStatus.PENDING)), "2");

        assertEquals(1, inserted);
        assertEquals(2, store.getRun(run.getId()).getProcessedItems());
        assertEquals(2, store.findSuggestions(run.getId(), null).size());
    }

    @Test
    void failedPageLeavesNothingBehind() {
        ProcessingRun run = store.saveRun(newRun(RunStatus.IN_PROGRESS));
        Suggestion tooLong = suggestion("2", "Travel", 0.7, SuggestionStatus.PENDING);
        tooLong.setSubject("x".repeat(2000));

        assertThrows(StorageException.class, () -> store.commitPage(run, List.of(
                suggestion("1", "Finance", 0.9, SuggestionStatus.PENDING), tooLong), "2"));

        assertNull(run.getCursor());
        assertEquals(0, run.getProcessedItems());
        ProcessingRun stored = store.getRun(run.getId());
        assertNull(stored.getCursor());
        assertEquals(0, stored.getProcessedItems());
        assertTrue(store.findSuggestions(run.getId(), null).isEmpty());
    }

    @Test
    void recordPageFailurePausesWithError() {
        ProcessingRun run = store.saveRun(newRun(RunStatus.IN_PROGRESS));

        store.recordPageFailure(run, "connection: reset");

        assertEquals(RunStatus.PAUSED, run.getStatus());
        ProcessingRun stored = store.getRun(run.getId());
        assertEquals(RunStatus.PAUSED, stored.getStatus());
        assertEquals(List.of("connection: reset"), stored.getErrorLog());
    }

    @Test
    void recordRunFailureEndsRun() {
        ProcessingRun run = store.saveRun(newRun(RunStatus.IN_PROGRESS));

        store.recordRunFailure(run, "VALIDATION: Folder 'Gone' does not exist");

        assertEquals(RunStatus.FAILED, run.getStatus());
        ProcessingRun stored = store.getRun(run.getId());
        assertEquals(RunStatus.FAILED, stored.getStatus());
        assertNotNull(stored.getCompletedAt());
        assertEquals(List.of("VALIDATION: Folder 'Gone' does not exist"), stored.getErrorLog());
    }

    // --- suggestions ---

    @Test
    void suggestionsOrderedByConfidenceAndFilteredByStatus() {
        ProcessingRun run = store.saveRun(newRun(RunStatus.IN_PROGRESS));
        store.commitPage(run, List.of(
                suggestion("1", "Finance", 0.6, SuggestionStatus.PENDING),
                suggestion("2", "Travel", 0.95, SuggestionStatus.PENDING),
                suggestion("3", null, 0.0, SuggestionStatus.NO_MATCH)), "3");

        List<Suggestion> all = store.findSuggestions(run.getId(), null);
        assertEquals(List.of("2", "1", "3"), all.stream().map(Suggestion::getRemoteItemId).toList());
        assertEquals("Travel", all.get(0).best().orElseThrow().getLabel());

        assertEquals(2, store.findSuggestions(run.getId(), SuggestionStatus.PENDING).size());
        assertEquals(1, store.findSuggestions(run.getId(), SuggestionStatus.NO_MATCH).size());
    }

    @Test
    void updateStatusIsCompareAndSet() {
        ProcessingRun run = store.saveRun(newRun(RunStatus.IN_PROGRESS));
        Suggestion s = suggestion("1", "Finance", 0.9, SuggestionStatus.PENDING);
        store.commitPage(run, List.of(s), "1");

        assertTrue(store.updateStatus(s.getId(), SuggestionStatus.PENDING, SuggestionStatus.APPROVED));
        assertFalse(store.updateStatus(s.getId(), SuggestionStatus.PENDING, SuggestionStatus.REJECTED));
        assertEquals(SuggestionStatus.APPROVED, store.findSuggestion(s.getId()).orElseThrow().getStatus());
    }

    // --- audit log ---

    @Test
    void markAppliedAndSyncedUpdatesAllThreeTables() {
        ProcessingRun run = store.saveRun(newRun(RunStatus.COMPLETED));
        Suggestion s = approved(run, "1");
        AuditLogEntry entry = store.appendAuditEntry(entry(run, s));
        assertEquals(1, store.findUnsynced(run.getId()).size());

        store.markAppliedAndSynced(s, entry);

        assertEquals(SuggestionStatus.APPLIED, store.findSuggestion(s.getId()).orElseThrow().getStatus());
        AuditLogEntry stored = store.findAuditEntry(entry.getId()).orElseThrow();
        assertTrue(stored.isSynced());
        assertEquals(AuditResolution.SYNCED, stored.getResolution());
        assertEquals(1, store.getRun(run.getId()).getAppliedSuggestions());
        assertTrue(store.findUnsynced(null).isEmpty());
    }

    @Test
    void markAppliedAndSyncedRollsBackWhenSuggestionMoved() {
        ProcessingRun run = store.saveRun(newRun(RunStatus.COMPLETED));
        Suggestion s = approved(run, "1");
        AuditLogEntry entry = store.appendAuditEntry(entry(run, s));
        store.markAppliedAndSynced(s, entry);

        Suggestion again = store.findSuggestion(s.getId()).orElseThrow();
        AuditLogEntry second = store.appendAuditEntry(entry(run, again));
        assertThrows(DataIntegrityException.class, () -> store.markAppliedAndSynced(again, second));

        assertFalse(store.findAuditEntry(second.getId()).orElseThrow().isSynced());
        assertEquals(1, store.getRun(run.getId()).getAppliedSuggestions());
    }

    @Test
    void recordAuditErrorKeepsEntryUnsynced() {
        ProcessingRun run = store.saveRun(newRun(RunStatus.COMPLETED));
        Suggestion s = approved(run, "1");
        AuditLogEntry entry = store.appendAuditEntry(entry(run, s));

        store.recordAuditError(entry, "connection: timeout");

        AuditLogEntry stored = store.findAuditEntry(entry.getId()).orElseThrow();
        assertFalse(stored.isSynced());
        assertEquals("connection: timeout", stored.getErrorMessage());
    }

    // --- housekeeping ---

    @Test
    void cleanupRemovesOldTerminalRunsWithDependents() {
        clock.set(START.minus(Duration.ofDays(40)));
        ProcessingRun old = store.saveRun(newRun(RunStatus.COMPLETED));
        Suggestion s = approved(old, "1");
        store.appendAuditEntry(entry(old, s));
        ProcessingRun paused = store.saveRun(newRun(RunStatus.PAUSED));

        clock.set(START);
        ProcessingRun recent = store.saveRun(newRun(RunStatus.COMPLETED));

        CleanupReport report = store.cleanup(30);

        assertEquals(1, report.getRuns());
        assertTrue(store.findRun(old.getId()).isEmpty());
        assertTrue(store.findSuggestions(old.getId(), null).isEmpty());
        assertTrue(store.findUnsynced(old.getId()).isEmpty());
        assertTrue(store.findRun(paused.getId()).isPresent());
        assertTrue(store.findRun(recent.getId()).isPresent());
    }

    @Test
    void cleanupRejectsNegativeDays() {
        assertThrows(ValidationException.class, () -> store.cleanup(-1));
    }

    @Test
    void sessionSnapshotsAreUpserted() {
        SessionSnapshot snapshot = new SessionSnapshot();
        snapshot.setId(UUID.randomUUID().toString());
        snapshot.setPrincipal("user@example.com");
        snapshot.setTransport("password");
        snapshot.setState("CONNECTED");
        snapshot.setCreatedAt(OffsetDateTime.ofInstant(START, ZoneOffset.UTC));
        snapshot.setLastActivityAt(OffsetDateTime.ofInstant(START, ZoneOffset.UTC));
        store.saveSessionSnapshot(snapshot);

        snapshot.setState("DISCONNECTED");
        snapshot.setClosedAt(OffsetDateTime.ofInstant(START.plusSeconds(5), ZoneOffset.UTC));
        store.saveSessionSnapshot(snapshot);

        List<SessionSnapshot> listed = store.listSessionSnapshots(10);
        assertEquals(1, listed.size());
        assertEquals("DISCONNECTED", listed.get(0).getState());
        assertNotNull(listed.get(0).getClosedAt());

        clock.set(START.plus(Duration.ofDays(31)));
        assertEquals(1, store.cleanup(30).getSessions());
        assertTrue(store.listSessionSnapshots(10).isEmpty());
    }

    @Test
    void hotPathIndexesExist() throws Exception {
        Set<String> indexes = new HashSet<>();
        try (Connection conn = ds.getConnection()) {
            DatabaseMetaData meta = conn.getMetaData();
            for (String table : List.of("suggestions", "processing_runs", "audit_log")) {
                for (String name : tableNames(meta, table)) {
                    try (ResultSet rs = meta.getIndexInfo(null, null, name, false, false)) {
                        while (rs.next()) {
                            String index = rs.getString("INDEX_NAME");
                            if (index != null) {
                                indexes.add(index.toLowerCase(Locale.ROOT));
                            }
                        }
                    }
                }
            }
        }

        assertTrue(indexes.contains("idx_suggestions_run_status"), indexes.toString());
        assertTrue(indexes.contains("idx_runs_principal_status"), indexes.toString());
        assertTrue(indexes.contains("idx_audit_synced_run"), indexes.toString());
    }

    private static List<String> tableNames(DatabaseMetaData meta, String table) throws Exception {
        List<String> names = new ArrayList<>();
        try (ResultSet rs = meta.getTables(null, null, "%", new String[]{"TABLE"})) {
            while (rs.next()) {
                if (table.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                    names.add(rs.getString("TABLE_NAME"));
                }
            }
        }
        return names;
    }

    private ProcessingRun newRun(RunStatus status) {
        ProcessingRun run = new ProcessingRun();
        run.setId(UUID.randomUUID().toString());
        run.setPrincipal("user@example.com");
        run.setFolder("INBOX");
        run.setItemLimit(100);
        run.setStatus(status);
        return run;
    }

    private Suggestion approved(ProcessingRun run, String itemId) {
        Suggestion s = suggestion(itemId, "Finance", 0.9, SuggestionStatus.APPROVED);
        s.setRunId(run.getId());
        return store.saveSuggestion(s);
    }

    private static AuditLogEntry entry(ProcessingRun run, Suggestion s) {
        AuditLogEntry entry = new AuditLogEntry();
        entry.setRunId(run.getId());
        entry.setSuggestionId(s.getId());
        entry.setOperation(AuditOperation.ADD_LABEL);
        entry.setRemoteItemId(s.getRemoteItemId());
        entry.setDesiredValue("Finance");
        return entry;
    }

    private static Suggestion suggestion(String itemId, String label, double confidence, SuggestionStatus status) {
        Suggestion s = new Suggestion();
        s.setRemoteItemId(itemId);
        s.setSubject("Subject " + itemId);
        s.setLabels(label != null ? List.of(new SuggestedLabel(label, confidence, 1)) : List.of());
        s.setStatus(status);
        return s;
    }
}
