package com.mimecast.labeller.store.repository;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.mimecast.labeller.store.domain.SuggestedLabel;
import com.mimecast.labeller.store.domain.Suggestion;
import com.mimecast.labeller.store.domain.SuggestionStatus;

import java.lang.reflect.Type;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.mimecast.labeller.store.repository.JdbcSupport.placeholders;
import static com.mimecast.labeller.store.repository.JdbcSupport.setTimestamp;
import static com.mimecast.labeller.store.repository.JdbcSupport.toOffsetDateTime;

/**
 * JDBC DAO for {@code suggestions}.
 */
public class SuggestionRepository {

    private static final Type LABELS_TYPE = new TypeToken<List<LabelRow>>() {
    }.getType();

    private static final String INSERT_SUGGESTION =
            "INSERT INTO suggestions " +
            "(run_id, remote_item_id, best_label, confidence, labels_json, subject, status, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT_BY_ID =
            "SELECT * FROM suggestions WHERE id = ?";

    private static final String SELECT_BY_RUN =
            "SELECT * FROM suggestions WHERE run_id = ? ORDER BY confidence DESC, id";

    private static final String SELECT_BY_RUN_STATUS =
            "SELECT * FROM suggestions WHERE run_id = ? AND status = ? ORDER BY confidence DESC, id";

    private static final String SELECT_ITEM_IDS =
            "SELECT remote_item_id FROM suggestions WHERE run_id = ? AND remote_item_id IN (%s)";

    private static final String COMPARE_AND_SET_STATUS =
            "UPDATE suggestions SET status = ?, updated_at = ? WHERE id = ? AND status = ?";

    private final Gson gson = new Gson();

    /**
     * Inserts a suggestion and sets its generated id.
     */
    public void insert(Connection c, Suggestion suggestion) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(INSERT_SUGGESTION, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, suggestion.getRunId());
            ps.setString(2, suggestion.getRemoteItemId());
            ps.setString(3, suggestion.best().map(SuggestedLabel::getLabel).orElse(null));
            ps.setDouble(4, suggestion.bestConfidence());
            ps.setString(5, toJson(suggestion.getLabels()));
            ps.setString(6, suggestion.getSubject());
            ps.setString(7, suggestion.getStatus().name());
            setTimestamp(ps, 8, suggestion.getCreatedAt());
            setTimestamp(ps, 9, suggestion.getUpdatedAt());
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    suggestion.setId(keys.getLong(1));
                }
            }
        }
    }

    public Optional<Suggestion> findById(Connection c, long id) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SELECT_BY_ID)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Lists suggestions of a run, highest confidence first.
     *
     * @param status Status filter, or null for all.
     */
    public List<Suggestion> findByRun(Connection c, String runId, SuggestionStatus status) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(status == null ? SELECT_BY_RUN : SELECT_BY_RUN_STATUS)) {
            ps.setString(1, runId);
            if (status != null) {
                ps.setString(2, status.name());
            }
            List<Suggestion> list = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    list.add(map(rs));
                }
            }
            return list;
        }
    }

    /**
     * Returns which of the given remote item ids already have a suggestion in the run.
     */
    public Set<String> findExistingItemIds(Connection c, String runId, Collection<String> itemIds) throws SQLException {
        Set<String> existing = new HashSet<>();
        if (itemIds.isEmpty()) {
            return existing;
        }

        String sql = String.format(SELECT_ITEM_IDS, placeholders(itemIds.size()));
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            int idx = 2;
            for (String itemId : itemIds) {
                ps.setString(idx++, itemId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    existing.add(rs.getString(1));
                }
            }
        }
        return existing;
    }

    /**
     * Moves a suggestion to a new status only if it is still in the expected one.
     *
     * @return True when the row was updated.
     */
    public boolean compareAndSetStatus(Connection c, long id, SuggestionStatus expected, SuggestionStatus next,
                                       OffsetDateTime now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(COMPARE_AND_SET_STATUS)) {
            ps.setString(1, next.name());
            setTimestamp(ps, 2, now);
            ps.setLong(3, id);
            ps.setString(4, expected.name());
            return ps.executeUpdate() == 1;
        }
    }

    private String toJson(List<SuggestedLabel> labels) {
        List<LabelRow> rows = new ArrayList<>();
        for (SuggestedLabel label : labels) {
            rows.add(new LabelRow(label.getLabel(), label.getConfidence(), label.getRank()));
        }
        return gson.toJson(rows);
    }

    private List<SuggestedLabel> fromJson(String json) {
        List<SuggestedLabel> labels = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return labels;
        }
        List<LabelRow> rows = gson.fromJson(json, LABELS_TYPE);
        for (LabelRow row : rows) {
            labels.add(new SuggestedLabel(row.label, row.confidence, row.rank));
        }
        return labels;
    }

    private Suggestion map(ResultSet rs) throws SQLException {
        Suggestion suggestion = new Suggestion();
        suggestion.setId(rs.getLong("id"));
        suggestion.setRunId(rs.getString("run_id"));
        suggestion.setRemoteItemId(rs.getString("remote_item_id"));
        suggestion.setSubject(rs.getString("subject"));
        suggestion.setLabels(fromJson(rs.getString("labels_json")));
        suggestion.setStatus(SuggestionStatus.valueOf(rs.getString("status")));
        suggestion.setCreatedAt(toOffsetDateTime(rs.getTimestamp("created_at")));
        suggestion.setUpdatedAt(toOffsetDateTime(rs.getTimestamp("updated_at")));
        return suggestion;
    }

    /**
     * Serialized form of one ranked label.
     */
    private static final class LabelRow {
        private String label;
        private double confidence;
        private int rank;

        LabelRow(String label, double confidence, int rank) {
            this.label = label;
            this.confidence = confidence;
            this.rank = rank;
        }
    }
}
