package com.mimecast.labeller.db;

import com.mimecast.labeller.error.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered schema migrations tracked in {@code schema_version}.
 *
 * <p>Each migration is a classpath SQL resource applied once, in version order, together
 * with its version row. The version table is the only source of truth; existing tables are
 * never used to infer the schema version.
 * <p>Statements use IF NOT EXISTS so a version interrupted by an implicit DDL commit can
 * be re-applied.
 */
public final class Migrations {
    private static final Logger log = LogManager.getLogger(Migrations.class);

    private static final String CREATE_VERSION_TABLE =
            "CREATE TABLE IF NOT EXISTS schema_version (" +
            " version     INTEGER PRIMARY KEY," +
            " description VARCHAR(255) NOT NULL," +
            " applied_at  TIMESTAMP WITH TIME ZONE NOT NULL)";

    private static final String SELECT_VERSIONS =
            "SELECT version FROM schema_version ORDER BY version";

    private static final String INSERT_VERSION =
            "INSERT INTO schema_version (version, description, applied_at) VALUES (?, ?, ?)";

    /**
     * Registered migrations, in version order.
     */
    private static final List<Migration> MIGRATIONS = List.of(
            new Migration(1, "Initial schema", "db/migration/V1__initial_schema.sql"),
            new Migration(2, "Composite indexes", "db/migration/V2__composite_indexes.sql"),
            new Migration(3, "Sessions and folder cache", "db/migration/V3__sessions_and_folder_cache.sql")
    );

    private Migrations() {
        // static utility
    }

    /**
     * Applies pending migrations.
     *
     * @param dataSource DataSource instance.
     * @param clock      Clock used for applied_at.
     * @return Number of migrations applied, zero when already current.
     */
    public static int apply(DataSource dataSource, Clock clock) {
        Transactions.inTransaction(dataSource, "create schema_version table", c -> {
            try (Statement st = c.createStatement()) {
                st.execute(CREATE_VERSION_TABLE);
            }
            return null;
        });

        List<Integer> applied = appliedVersions(dataSource);
        int count = 0;
        for (Migration migration : MIGRATIONS) {
            if (applied.contains(migration.version)) {
                continue;
            }
            List<String> statements = splitStatements(loadSql(migration.resource));
            Transactions.inTransaction(dataSource, "apply migration V" + migration.version, c -> {
                try (Statement st = c.createStatement()) {
                    for (String sql : statements) {
                        st.execute(sql);
                    }
                }
                try (PreparedStatement ps = c.prepareStatement(INSERT_VERSION)) {
                    ps.setInt(1, migration.version);
                    ps.setString(2, migration.description);
                    ps.setObject(3, OffsetDateTime.now(clock));
                    ps.executeUpdate();
                }
                return null;
            });
            log.info("Applied migration V{} {} ({} statements)", migration.version, migration.description, statements.size());
            count++;
        }

        if (count == 0) {
            log.debug("Schema is current at version {}", latestVersion());
        }
        return count;
    }

    /**
     * Gets the highest applied version.
     *
     * @param dataSource DataSource instance.
     * @return Version, zero for an empty database.
     */
    public static int currentVersion(DataSource dataSource) {
        List<Integer> versions = appliedVersions(dataSource);
        return versions.isEmpty() ? 0 : Collections.max(versions);
    }

    /**
     * Gets the newest registered version.
     *
     * @return Version.
     */
    public static int latestVersion() {
        return MIGRATIONS.get(MIGRATIONS.size() - 1).version;
    }

    private static List<Integer> appliedVersions(DataSource dataSource) {
        return Transactions.read(dataSource, "read schema versions", c -> {
            List<Integer> versions = new ArrayList<>();
            if (!hasVersionTable(c)) {
                return versions;
            }
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery(SELECT_VERSIONS)) {
                while (rs.next()) {
                    versions.add(rs.getInt(1));
                }
            }
            return versions;
        });
    }

    private static boolean hasVersionTable(Connection c) throws SQLException {
        try (ResultSet rs = c.getMetaData().getTables(null, null, "%", new String[]{"TABLE"})) {
            while (rs.next()) {
                if ("schema_version".equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String loadSql(String resource) {
        try (InputStream input = Migrations.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                throw new IOException("Missing migration resource: " + resource);
            }
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to load migration {}: {}", resource, e.getMessage());
            throw new StorageException("Failed to load migration " + resource, e);
        }
    }

    static List<String> splitStatements(String sql) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;

        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            char next = i + 1 < sql.length() ? sql.charAt(i + 1) : '\0';

            if (!inQuote && c == '-' && next == '-') {
                while (i < sql.length() && sql.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }
            if (c == '\'') {
                inQuote = !inQuote;
            }
            if (c == ';' && !inQuote) {
                addIfPresent(statements, current);
                continue;
            }
            current.append(c);
        }
        addIfPresent(statements, current);
        return statements;
    }

    private static void addIfPresent(List<String> statements, StringBuilder current) {
        String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
        current.setLength(0);
    }

    /**
     * Registered migration.
     */
    private static final class Migration {
        private final int version;
        private final String description;
        private final String resource;

        Migration(int version, String description, String resource) {
            this.version = version;
            this.description = description;
            this.resource = resource;
        }
    }
}
