package org.realityforge.sqldeploy.ledger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.realityforge.sqldeploy.db.ConnectionFactory;
import org.realityforge.sqldeploy.db.SqlDialect;

public final class JdbcExecutionLedger implements ExecutionLedger {
    private final ConnectionFactory connectionFactory;
    private final String createTableSql;
    private final String table;
    private boolean tableReady;

    public JdbcExecutionLedger(final ConnectionFactory connectionFactory, final SqlDialect dialect, final String table) {
        this.connectionFactory = connectionFactory;
        this.createTableSql = dialect.createLedgerTableSql(table);
        this.table = table;
    }

    @Override
    public Optional<ExecutionRecord> find(final String deploymentId, final String scriptName) {
        final var sql = "SELECT script_path, deployed_at, status, failure_reason FROM " + table
                + " WHERE deployment_id = ? AND script_name = ?";
        try (Connection connection = connectionFactory.connect()) {
            ensureTable(connection);
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, deploymentId);
                statement.setString(2, scriptName);
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(new ExecutionRecord(
                            deploymentId,
                            scriptName,
                            resultSet.getString(1),
                            resultSet.getObject(2, LocalDateTime.class).toInstant(ZoneOffset.UTC),
                            ExecutionStatus.valueOf(resultSet.getString(3)),
                            resultSet.getString(4)));
                }
            }
        } catch (final SQLException sqle) {
            throw new LedgerException("Failed to query execution record for " + deploymentId + '/' + scriptName, sqle);
        }
    }

    @Override
    public void put(final ExecutionRecord record) {
        final var deleteSql = "DELETE FROM " + table + " WHERE deployment_id = ? AND script_name = ?";
        final var insertSql = "INSERT INTO " + table
                + " (deployment_id, script_name, script_path, deployed_at, status, failure_reason)"
                + " VALUES (?, ?, ?, ?, ?, ?)";
        try (Connection connection = connectionFactory.connect()) {
            ensureTable(connection);
            connection.setAutoCommit(false);
            try (PreparedStatement delete = connection.prepareStatement(deleteSql);
                    PreparedStatement insert = connection.prepareStatement(insertSql)) {
                delete.setString(1, record.deploymentId());
                delete.setString(2, record.scriptName());
                delete.executeUpdate();

                insert.setString(1, record.deploymentId());
                insert.setString(2, record.scriptName());
                insert.setString(3, truncate(record.scriptPath(), SqlDialect.SCRIPT_PATH_WIDTH));
                insert.setObject(4, LocalDateTime.ofInstant(record.deployedAt(), ZoneOffset.UTC));
                insert.setString(5, record.status().name());
                insert.setString(6, truncate(record.failureReason(), SqlDialect.FAILURE_REASON_WIDTH));
                insert.executeUpdate();
                connection.commit();
            } catch (final SQLException sqle) {
                try {
                    connection.rollback();
                } catch (final SQLException rollbackFailure) {
                    sqle.addSuppressed(rollbackFailure);
                }
                throw sqle;
            }
        } catch (final SQLException sqle) {
            throw new LedgerException(
                    "Failed to store execution record for " + record.deploymentId() + '/' + record.scriptName(), sqle);
        }
    }

    private void ensureTable(final Connection connection) throws SQLException {
        if (tableReady) {
            return;
        }
        try (Statement statement = connection.createStatement()) {
            statement.execute(createTableSql);
        }
        tableReady = true;
    }

    static @Nullable String truncate(final @Nullable String value, final int width) {
        if (null == value || value.length() <= width) {
            return value;
        }
        final int end = Character.isHighSurrogate(value.charAt(width - 1)) ? width - 1 : width;
        return value.substring(0, end);
    }
}
