package com.mimecast.labeller.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of JDBC work run on a borrowed connection.
 *
 * @param <T> Result type.
 */
@FunctionalInterface
public interface SqlWork<T> {

    T apply(Connection connection) throws SQLException;
}
