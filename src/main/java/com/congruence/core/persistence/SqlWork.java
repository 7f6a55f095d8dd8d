package com.congruence.core.persistence;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of JDBC work bound to one connection.
 */
@FunctionalInterface
public interface SqlWork<T> {
    T execute(Connection conn) throws SQLException;
}
