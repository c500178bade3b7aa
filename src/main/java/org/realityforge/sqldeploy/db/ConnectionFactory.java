package org.realityforge.sqldeploy.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

@FunctionalInterface
public interface ConnectionFactory {
    Connection connect() throws SQLException;

    static ConnectionFactory driverManager(final SqlDialect dialect, final DatabaseConnection connection) {
        return () -> DriverManager.getConnection(
                dialect.jdbcUrl(connection), connection.username(), connection.password());
    }
}
