package com.mimecast.labeller.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Execution(ExecutionMode.SAME_THREAD)
class MigrationsTest {

    private static HikariDataSource ds;

    @BeforeAll
    static void setupDatabase() {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:h2:mem:migrations_test;MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        cfg.setUsername("sa");
        cfg.setPassword("");
        cfg.setMaximumPoolSize(2);
        ds = new HikariDataSource(cfg);
    }

    @AfterAll
    static void closeDatabase() {
        if (ds != null) {
            ds.close();
        }
    }

    @Test
    void appliesOnceAndRecordsVersions() throws Exception {
        assertEquals(0, Migrations.currentVersion(ds));

        assertEquals(Migrations.latestVersion(), Migrations.apply(ds, Clock.systemUTC()));
        assertEquals(Migrations.latestVersion(), Migrations.currentVersion(ds));

        assertEquals(0, Migrations.apply(ds, Clock.systemUTC()));

        try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM schema_version")) {
            rs.next();
            assertEquals(Migrations.latestVersion(), rs.getInt(1));
        }
        try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM folder_cache")) {
            assertTrue(rs.next());
        }
    }

    @Test
    void splitsOnSemicolonsOutsideQuotesAndDropsComments() {
        String sql = """
                -- leading comment; with a semicolon
                CREATE TABLE a (id INT);
                INSERT INTO a VALUES (1); -- trailing
                INSERT INTO b VALUES ('x;y');

                """;

        List<String> statements = Migrations.splitStatements(sql);

        assertEquals(3, statements.size());
        assertEquals("CREATE TABLE a (id INT)", statements.get(0));
        assertEquals("INSERT INTO a VALUES (1)", statements.get(1));
        assertEquals("INSERT INTO b VALUES ('x;y')", statements.get(2));
    }
}
