package com.mimecast.labeller.store.repository;

import com.mimecast.labeller.store.domain.SessionSnapshot;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import static com.mimecast.labeller.store.repository.JdbcSupport.setTimestamp;
import static com.mimecast.labeller.store.repository.JdbcSupport.toOffsetDateTime;

/**
 * JDBC DAO for {@code sessions}.
 *
 * <p>Rows are snapshots of mailbox sessions, written after each state change.
 */
public class SessionRepository {

    private static final String UPDATE_SESSION =
            "UPDATE sessions SET state = ?, last_activity_at = ?, retry_count = ?, closed_at = ? WHERE id = ?";

    private static final String INSERT_SESSION =
            "INSERT INTO sessions (id, principal, transport, state, created_at, last_activity_at, retry_count, closed_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT_RECENT =
            "SELECT * FROM sessions ORDER BY last_activity_at DESC LIMIT ?";

    private static final String DELETE_CLOSED_BEFORE =
            "DELETE FROM sessions WHERE closed_at IS NOT NULL AND closed_at < ?";

    /**
     * Updates the snapshot row, inserting it on first sight.
     */
    public void upsert(Connection c, SessionSnapshot snapshot) throws SQLException {
        int updated;
        try (PreparedStatement ps = c.prepareStatement(UPDATE_SESSION)) {
            ps.setString(1, snapshot.getState());
            setTimestamp(ps, 2, snapshot.getLastActivityAt());
            ps.setInt(3, snapshot.getRetryCount());
            setTimestamp(ps, 4, snapshot.getClosedAt());
            ps.setString(5, snapshot.getId());
            updated = ps.executeUpdate();
        }
        if (updated > 0) {
            return;
        }

        try (PreparedStatement ps = c.prepareStatement(INSERT_SESSION)) {
            ps.setString(1, snapshot.getId());
            ps.setString(2, snapshot.getPrincipal());
            ps.setString(3, snapshot.getTransport());
            ps.setString(4, snapshot.getState());
            setTimestamp(ps, 5, snapshot.getCreatedAt());
            setTimestamp(ps, 6, snapshot.getLastActivityAt());
            ps.setInt(7, snapshot.getRetryCount());
            setTimestamp(ps, 8, snapshot.getClosedAt());
            ps.executeUpdate();
        }
    }

    public List<SessionSnapshot> findRecent(Connection c, int limit) throws SQLException {
        List<SessionSnapshot> snapshots = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(SELECT_RECENT)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    SessionSnapshot snapshot = new SessionSnapshot();
                    snapshot.setId(rs.getString("id"));
                    snapshot.setPrincipal(rs.getString("principal"));
                    snapshot.setTransport(rs.getString("transport"));
                    snapshot.setState(rs.getString("state"));
                    snapshot.setCreatedAt(toOffsetDateTime(rs.getTimestamp("created_at")));
                    snapshot.setLastActivityAt(toOffsetDateTime(rs.getTimestamp("last_activity_at")));
                    snapshot.setRetryCount(rs.getInt("retry_count"));
                    snapshot.setClosedAt(toOffsetDateTime(rs.getTimestamp("closed_at")));
                    snapshots.add(snapshot);
                }
            }
        }
        return snapshots;
    }

    public int deleteClosedBefore(Connection c, OffsetDateTime cutoff) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(DELETE_CLOSED_BEFORE)) {
            setTimestamp(ps, 1, cutoff);
            return ps.executeUpdate();
        }
    }
}
