package org.realityforge.sqldeploy.db;

import java.util.Locale;
import org.realityforge.sqldeploy.config.ConfigException;

public enum SqlDialect {
    SQLSERVER {
        @Override
        String jdbcUrl(final DatabaseConnection connection) {
            return "jdbc:sqlserver://"
                    + connection.host()
                    + ':'
                    + connection.port()
                    + ";databaseName="
                    + connection.database()
                    + ";encrypt=false;trustServerCertificate=true";
        }

        @Override
        public String createLedgerTableSql(final String table) {
            return "IF OBJECT_ID(N'" + table + "', N'U') IS NULL CREATE TABLE " + table + '('
                    + ledgerColumns("DATETIME2") + ')';
        }
    },
    POSTGRES {
        @Override
        String jdbcUrl(final DatabaseConnection connection) {
            return "jdbc:postgresql://" + connection.host() + ':' + connection.port() + '/' + connection.database();
        }

        @Override
        public String createLedgerTableSql(final String table) {
            return "CREATE TABLE IF NOT EXISTS " + table + '(' + ledgerColumns("TIMESTAMP") + ')';
        }
    };

    public static final int SCRIPT_PATH_WIDTH = 1024;
    public static final int FAILURE_REASON_WIDTH = 4000;

    abstract String jdbcUrl(DatabaseConnection connection);

    public abstract String createLedgerTableSql(String table);

    public static SqlDialect fromDriver(final String driver) {
        final var normalized = driver.toLowerCase(Locale.ROOT);
        if ("sqlserver".equals(normalized)) {
            return SQLSERVER;
        }
        if ("postgres".equals(normalized)) {
            return POSTGRES;
        }
        throw new ConfigException("Unsupported database driver '" + driver + "'. Supported: sqlserver, postgres");
    }

    private static String ledgerColumns(final String timestampType) {
        return "deployment_id VARCHAR(255) NOT NULL,"
                + "script_name VARCHAR(255) NOT NULL,"
                + "script_path VARCHAR(" + SCRIPT_PATH_WIDTH + ") NOT NULL,"
                + "deployed_at " + timestampType + " NOT NULL,"
                + "status VARCHAR(16) NOT NULL,"
                + "failure_reason VARCHAR(" + FAILURE_REASON_WIDTH + "),"
                + "PRIMARY KEY (deployment_id, script_name)";
    }
}
