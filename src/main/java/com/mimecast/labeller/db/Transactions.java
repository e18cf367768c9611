package com.mimecast.labeller.db;

import com.mimecast.labeller.error.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs JDBC work atomically.
 *
 * <p>Commits when the work returns, rolls back on any exception. A failed write is never
 * partially visible.
 */
public final class Transactions {
    private static final Logger log = LogManager.getLogger(Transactions.class);

    private Transactions() {
        // static utility
    }

    /**
     * Runs work inside one transaction.
     *
     * @param dataSource DataSource instance.
     * @param operation  Operation name for logs and errors.
     * @param work       Work to run.
     * @param <T>        Result type.
     * @return Work result.
     * @throws StorageException On SQL failure, after rollback.
     */
    public static <T> T inTransaction(DataSource dataSource, String operation, SqlWork<T> work) {
        try (Connection c = dataSource.getConnection()) {
            c.setAutoCommit(false);
            try {
                T result = work.apply(c);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(c, operation);
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.error("Failed to {}: {}", operation, e.getMessage(), e);
            throw new StorageException("Failed to " + operation, e);
        }
    }

    /**
     * Runs read-only work on a connection in auto-commit mode.
     *
     * @param dataSource DataSource instance.
     * @param operation  Operation name for logs and errors.
     * @param work       Work to run.
     * @param <T>        Result type.
     * @return Work result.
     * @throws StorageException On SQL failure.
     */
    public static <T> T read(DataSource dataSource, String operation, SqlWork<T> work) {
        try (Connection c = dataSource.getConnection()) {
            return work.apply(c);
        } catch (SQLException e) {
            log.error("Failed to {}: {}", operation, e.getMessage(), e);
            throw new StorageException("Failed to " + operation, e);
        }
    }

    private static void rollback(Connection c, String operation) throws SQLException {
        try {
            c.rollback();
            log.debug("Rolled back {}", operation);
        } catch (SQLException e) {
            log.error("Rollback of {} failed: {}", operation, e.getMessage());
            throw e;
        }
    }
}
