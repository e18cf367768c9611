package com.mimecast.labeller.store.repository;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.mimecast.labeller.store.domain.ProcessingRun;
import com.mimecast.labeller.store.domain.RunStatus;

import java.lang.reflect.Type;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.mimecast.labeller.store.repository.JdbcSupport.getNullableInt;
import static com.mimecast.labeller.store.repository.JdbcSupport.setNullableInt;
import static com.mimecast.labeller.store.repository.JdbcSupport.setTimestamp;
import static com.mimecast.labeller.store.repository.JdbcSupport.toOffsetDateTime;

/**
 * JDBC DAO for {@code processing_runs}.
 *
 * <p>Methods run on the caller's connection so they compose into larger transactions.
 */
public class RunRepository {

    private static final Type ERROR_LOG_TYPE = new TypeToken<List<String>>() {
    }.getType();

    private static final String INSERT_RUN =
            "INSERT INTO processing_runs " +
            "(id, principal, status, apply_mode, folder, item_limit, total_items, processed_items, " +
            " generated_suggestions, applied_suggestions, page_cursor, error_log, created_at, updated_at, completed_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String UPDATE_RUN =
            "UPDATE processing_runs SET " +
            "status = ?, total_items = ?, processed_items = ?, generated_suggestions = ?, applied_suggestions = ?, " +
            "page_cursor = ?, error_log = ?, updated_at = ?, completed_at = ? " +
            "WHERE id = ?";

    private static final String SELECT_BY_ID =
            "SELECT * FROM processing_runs WHERE id = ?";

    private static final String SELECT_RECENT =
            "SELECT * FROM processing_runs ORDER BY created_at DESC LIMIT ?";

    private static final String SELECT_BY_PRINCIPAL_STATUS =
            "SELECT * FROM processing_runs WHERE principal = ? AND status = ? ORDER BY created_at DESC";

    private static final String INCREMENT_APPLIED =
            "UPDATE processing_runs SET applied_suggestions = applied_suggestions + ?, updated_at = ? WHERE id = ?";

    private static final String DELETE_TERMINAL_BEFORE =
            "DELETE FROM processing_runs WHERE status IN ('COMPLETED', 'FAILED') AND created_at < ?";

    private final Gson gson = new Gson();

    /**
     * Inserts a new run.
     */
    public void insert(Connection c, ProcessingRun run) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(INSERT_RUN)) {
            ps.setString(1, run.getId());
            ps.setString(2, run.getPrincipal());
            ps.setString(3, run.getStatus().name());
            ps.setBoolean(4, run.isApplyMode());
            ps.setString(5, run.getFolder());
            setNullableInt(ps, 6, run.getItemLimit());
            ps.setInt(7, run.getTotalItems());
            ps.setInt(8, run.getProcessedItems());
            ps.setInt(9, run.getGeneratedSuggestions());
            ps.setInt(10, run.getAppliedSuggestions());
            ps.setString(11, run.getCursor());
            ps.setString(12, gson.toJson(run.getErrorLog()));
            setTimestamp(ps, 13, run.getCreatedAt());
            setTimestamp(ps, 14, run.getUpdatedAt());
            setTimestamp(ps, 15, run.getCompletedAt());
            ps.executeUpdate();
        }
    }

    /**
     * Updates the mutable columns of an existing run.
     *
     * @return Rows updated.
     */
    public int update(Connection c, ProcessingRun run) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(UPDATE_RUN)) {
            ps.setString(1, run.getStatus().name());
            ps.setInt(2, run.getTotalItems());
            ps.setInt(3, run.getProcessedItems());
            ps.setInt(4, run.getGeneratedSuggestions());
            ps.setInt(5, run.getAppliedSuggestions());
            ps.setString(6, run.getCursor());
            ps.setString(7, gson.toJson(run.getErrorLog()));
            setTimestamp(ps, 8, run.getUpdatedAt());
            setTimestamp(ps, 9, run.getCompletedAt());
            ps.setString(10, run.getId());
            return ps.executeUpdate();
        }
    }

    public Optional<ProcessingRun> findById(Connection c, String id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SELECT_BY_ID)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Returns the most recent runs, newest first.
     */
    public List<ProcessingRun> findRecent(Connection c, int limit) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SELECT_RECENT)) {
            ps.setInt(1, limit);
            return mapAll(ps);
        }
    }

    /**
     * Returns runs of a principal in a status, served by the (principal, status) index.
     */
    public List<ProcessingRun> findByPrincipalAndStatus(Connection c, String principal, RunStatus status) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SELECT_BY_PRINCIPAL_STATUS)) {
            ps.setString(1, principal);
            ps.setString(2, status.name());
            return mapAll(ps);
        }
    }

    public void incrementApplied(Connection c, String runId, int delta, OffsetDateTime now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(INCREMENT_APPLIED)) {
            ps.setInt(1, delta);
            setTimestamp(ps, 2, now);
            ps.setString(3, runId);
            ps.executeUpdate();
        }
    }

    /**
     * Deletes completed and failed runs created before the cutoff; suggestions and audit rows cascade.
     *
     * @return Rows deleted.
     */
    public int deleteTerminalBefore(Connection c, OffsetDateTime cutoff) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(DELETE_TERMINAL_BEFORE)) {
            setTimestamp(ps, 1, cutoff);
            return ps.executeUpdate();
        }
    }

    private List<ProcessingRun> mapAll(PreparedStatement ps) throws SQLException {
        List<ProcessingRun> runs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                runs.add(map(rs));
            }
        }
        return runs;
    }

    private ProcessingRun map(ResultSet rs) throws SQLException {
        ProcessingRun run = new ProcessingRun();
        run.setId(rs.getString("id"));
        run.setPrincipal(rs.getString("principal"));
        run.setStatus(RunStatus.valueOf(rs.getString("status")));
        run.setApplyMode(rs.getBoolean("apply_mode"));
        run.setFolder(rs.getString("folder"));
        run.setItemLimit(getNullableInt(rs, "item_limit"));
        run.setTotalItems(rs.getInt("total_items"));
        run.setProcessedItems(rs.getInt("processed_items"));
        run.setGeneratedSuggestions(rs.getInt("generated_suggestions"));
        run.setAppliedSuggestions(rs.getInt("applied_suggestions"));
        run.setCursor(rs.getString("page_cursor"));

        String errors = rs.getString("error_log");
        List<String> errorLog = errors != null ? gson.fromJson(errors, ERROR_LOG_TYPE) : null;
        run.setErrorLog(errorLog);

        run.setCreatedAt(toOffsetDateTime(rs.getTimestamp("created_at")));
        run.setUpdatedAt(toOffsetDateTime(rs.getTimestamp("updated_at")));
        run.setCompletedAt(toOffsetDateTime(rs.getTimestamp("completed_at")));
        return run;
    }
}
