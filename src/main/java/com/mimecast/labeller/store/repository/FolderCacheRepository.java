package com.mimecast.labeller.store.repository;

import com.mimecast.labeller.store.domain.FolderCacheEntry;

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
 * JDBC DAO for {@code folder_cache}.
 */
public class FolderCacheRepository {

    private static final String DELETE_BY_PRINCIPAL =
            "DELETE FROM folder_cache WHERE principal = ?";

    private static final String INSERT_ENTRY =
            "INSERT INTO folder_cache (principal, folder_name, message_count, cached_at) VALUES (?, ?, ?, ?)";

    private static final String SELECT_BY_PRINCIPAL =
            "SELECT * FROM folder_cache WHERE principal = ? ORDER BY folder_name";

    private static final String DELETE_BEFORE =
            "DELETE FROM folder_cache WHERE cached_at < ?";

    /**
     * Replaces every cached folder of a principal.
     */
    public void replace(Connection c, String principal, List<FolderCacheEntry> entries) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(DELETE_BY_PRINCIPAL)) {
            ps.setString(1, principal);
            ps.executeUpdate();
        }
        try (PreparedStatement ps = c.prepareStatement(INSERT_ENTRY)) {
            for (FolderCacheEntry entry : entries) {
                ps.setString(1, principal);
                ps.setString(2, entry.getFolderName());
                ps.setInt(3, entry.getMessageCount());
                setTimestamp(ps, 4, entry.getCachedAt());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    public List<FolderCacheEntry> findByPrincipal(Connection c, String principal) throws SQLException {
        List<FolderCacheEntry> entries = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(SELECT_BY_PRINCIPAL)) {
            ps.setString(1, principal);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new FolderCacheEntry(
                            rs.getString("principal"),
                            rs.getString("folder_name"),
                            rs.getInt("message_count"),
                            toOffsetDateTime(rs.getTimestamp("cached_at"))));
                }
            }
        }
        return entries;
    }

    public int deleteBefore(Connection c, OffsetDateTime cutoff) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(DELETE_BEFORE)) {
            setTimestamp(ps, 1, cutoff);
            return ps.executeUpdate();
        }
    }
}
