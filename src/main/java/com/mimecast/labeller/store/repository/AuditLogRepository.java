package com.mimecast.labeller.store.repository;

import com.mimecast.labeller.store.domain.AuditLogEntry;
import com.mimecast.labeller.store.domain.AuditOperation;
import com.mimecast.labeller.store.domain.AuditResolution;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.mimecast.labeller.store.repository.JdbcSupport.getNullableLong;
import static com.mimecast.labeller.store.repository.JdbcSupport.setNullableLong;
import static com.mimecast.labeller.store.repository.JdbcSupport.setTimestamp;
import static com.mimecast.labeller.store.repository.JdbcSupport.toOffsetDateTime;

/**
 * JDBC DAO for {@code audit_log}.
 *
 * <p>Entries are append-only apart from the sync columns and the error message.
 */
public class AuditLogRepository {

    private static final String INSERT_ENTRY =
            "INSERT INTO audit_log " +
            "(run_id, suggestion_id, operation, remote_item_id, desired_value, attempted_at, synced) " +
            "VALUES (?, ?, ?, ?, ?, ?, FALSE)";

    private static final String SELECT_BY_ID =
            "SELECT * FROM audit_log WHERE id = ?";

    private static final String SELECT_UNSYNCED =
            "SELECT * FROM audit_log WHERE synced = FALSE ORDER BY id";

    private static final String SELECT_UNSYNCED_BY_RUN =
            "SELECT * FROM audit_log WHERE synced = FALSE AND run_id = ? ORDER BY id";

    private static final String MARK_SYNCED =
            "UPDATE audit_log SET synced = TRUE, synced_at = ?, resolution = ? WHERE id = ? AND synced = FALSE";

    private static final String RECORD_ERROR =
            "UPDATE audit_log SET error_message = ? WHERE id = ?";

    /**
     * Inserts an unsynced entry and sets its generated id.
     */
    public void insert(Connection c, AuditLogEntry entry) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(INSERT_ENTRY, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, entry.getRunId());
            setNullableLong(ps, 2, entry.getSuggestionId());
            ps.setString(3, entry.getOperation().name());
            ps.setString(4, entry.getRemoteItemId());
            ps.setString(5, entry.getDesiredValue());
            setTimestamp(ps, 6, entry.getAttemptedAt());
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    entry.setId(keys.getLong(1));
                }
            }
        }
    }

    public Optional<AuditLogEntry> findById(Connection c, long id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SELECT_BY_ID)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Lists unsynced entries in insertion order.
     *
     * @param runId Run filter, or null for every run.
     */
    public List<AuditLogEntry> findUnsynced(Connection c, String runId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(runId == null ? SELECT_UNSYNCED : SELECT_UNSYNCED_BY_RUN)) {
            if (runId != null) {
                ps.setString(1, runId);
            }
            List<AuditLogEntry> entries = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(map(rs));
                }
            }
            return entries;
        }
    }

    /**
     * Marks an entry synced.
     *
     * @return True when the entry was still unsynced.
     */
    public boolean markSynced(Connection c, long id, AuditResolution resolution, OffsetDateTime at) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(MARK_SYNCED)) {
            setTimestamp(ps, 1, at);
            ps.setString(2, resolution.name());
            ps.setLong(3, id);
            return ps.executeUpdate() == 1;
        }
    }

    public void recordError(Connection c, long id, String message) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(RECORD_ERROR)) {
            ps.setString(1, message);
            ps.setLong(2, id);
            ps.executeUpdate();
        }
    }

    private AuditLogEntry map(ResultSet rs) throws SQLException {
        AuditLogEntry entry = new AuditLogEntry();
        entry.setId(rs.getLong("id"));
        entry.setRunId(rs.getString("run_id"));
        entry.setSuggestionId(getNullableLong(rs, "suggestion_id"));
        entry.setOperation(AuditOperation.valueOf(rs.getString("operation")));
        entry.setRemoteItemId(rs.getString("remote_item_id"));
        entry.setDesiredValue(rs.getString("desired_value"));
        entry.setAttemptedAt(toOffsetDateTime(rs.getTimestamp("attempted_at")));
        entry.setSynced(rs.getBoolean("synced"));
        entry.setSyncedAt(toOffsetDateTime(rs.getTimestamp("synced_at")));
        String resolution = rs.getString("resolution");
        entry.setResolution(resolution != null ? AuditResolution.valueOf(resolution) : null);
        entry.setErrorMessage(rs.getString("error_message"));
        return entry;
    }
}
