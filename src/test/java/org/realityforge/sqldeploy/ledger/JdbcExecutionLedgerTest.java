package org.realityforge.sqldeploy.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;
import org.realityforge.sqldeploy.db.SqlDialect;

final class JdbcExecutionLedgerTest {
    private static final Instant NOW = Instant.parse("2024-06-01T10:15:30Z");

    @Test
    void findReadsRecordByKey() throws Exception {
        final var connection = mock(Connection.class);
        final var statement = mock(Statement.class);
        final var query = mock(PreparedStatement.class);
        final var resultSet = mock(ResultSet.class);
        when(connection.createStatement()).thenReturn(statement);
        when(connection.prepareStatement(anyString())).thenReturn(query);
        when(query.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getString(1)).thenReturn("sql_data/deployment/SCT-1/a_2024_01_01_v1.sql");
        when(resultSet.getObject(2, LocalDateTime.class)).thenReturn(LocalDateTime.of(2024, 6, 1, 10, 15, 30));
        when(resultSet.getString(3)).thenReturn("SUCCESS");
        when(resultSet.getString(4)).thenReturn(null);

        final var ledger = new JdbcExecutionLedger(() -> connection, SqlDialect.POSTGRES, "sql_deployments");

        assertThat(ledger.find("SCT-1", "a_2024_01_01_v1.sql"))
                .contains(ExecutionRecord.success(
                        "SCT-1",
                        "a_2024_01_01_v1.sql",
                        "sql_data/deployment/SCT-1/a_2024_01_01_v1.sql",
                        NOW));
        verify(statement).execute(SqlDialect.POSTGRES.createLedgerTableSql("sql_deployments"));
        verify(connection)
                .prepareStatement("SELECT script_path, deployed_at, status, failure_reason FROM sql_deployments"
                        + " WHERE deployment_id = ? AND script_name = ?");
        verify(query).setString(1, "SCT-1");
        verify(query).setString(2, "a_2024_01_01_v1.sql");
    }

    @Test
    void findReturnsEmptyWhenNoRow() throws Exception {
        final var connection = mock(Connection.class);
        final var query = mock(PreparedStatement.class);
        final var resultSet = mock(ResultSet.class);
        when(connection.createStatement()).thenReturn(mock(Statement.class));
        when(connection.prepareStatement(anyString())).thenReturn(query);
        when(query.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(false);

        final var ledger = new JdbcExecutionLedger(() -> connection, SqlDialect.SQLSERVER, "sql_deployments");

        assertThat(ledger.find("SCT-1", "a.sql")).isEmpty();
    }

    @Test
    void tableIsCreatedOnlyOnce() throws Exception {
        final var connection = mock(Connection.class);
        final var statement = mock(Statement.class);
        final var query = mock(PreparedStatement.class);
        final var resultSet = mock(ResultSet.class);
        when(connection.createStatement()).thenReturn(statement);
        when(connection.prepareStatement(anyString())).thenReturn(query);
        when(query.executeQuery()).thenReturn(resultSet);

        final var ledger = new JdbcExecutionLedger(() -> connection, SqlDialect.POSTGRES, "sql_deployments");
        ledger.find("SCT-1", "a.sql");
        ledger.find("SCT-1", "b.sql");

        verify(statement, times(1)).execute(anyString());
    }

    @Test
    void putReplacesRecordInOneTransaction() throws Exception {
        final var connection = mock(Connection.class);
        final var delete = mock(PreparedStatement.class);
        final var insert = mock(PreparedStatement.class);
        when(connection.createStatement()).thenReturn(mock(Statement.class));
        when(connection.prepareStatement(anyString())).thenAnswer(invocation -> {
            final var sql = invocation.<String>getArgument(0);
            return sql.startsWith("DELETE") ? delete : insert;
        });

        final var ledger = new JdbcExecutionLedger(() -> connection, SqlDialect.POSTGRES, "sql_deployments");
        ledger.put(new ExecutionRecord("SCT-1", "a.sql", "p/a.sql", NOW, ExecutionStatus.FAILED, "boom"));

        verify(connection).setAutoCommit(false);
        verify(delete).setString(1, "SCT-1");
        verify(delete).setString(2, "a.sql");
        verify(delete).executeUpdate();
        verify(insert).setString(3, "p/a.sql");
        verify(insert).setObject(4, LocalDateTime.of(2024, 6, 1, 10, 15, 30));
        verify(insert).setString(5, "FAILED");
        verify(insert).setString(6, "boom");
        verify(insert).executeUpdate();
        verify(connection).commit();
    }

    @Test
    void putFitsAuditColumnsToTheirWidths() throws Exception {
        final var connection = mock(Connection.class);
        final var insert = mock(PreparedStatement.class);
        when(connection.createStatement()).thenReturn(mock(Statement.class));
        when(connection.prepareStatement(anyString())).thenReturn(insert);
        final String reason = "Failed to execute a.sql: " + "syntax error ".repeat(1_000);
        final String path = "sql_data/deployment/SCT-1/" + "nested/".repeat(200) + "a.sql";

        final var ledger = new JdbcExecutionLedger(() -> connection, SqlDialect.SQLSERVER, "sql_deployments");
        ledger.put(new ExecutionRecord("SCT-1", "a.sql", path, NOW, ExecutionStatus.FAILED, reason));

        verify(insert).setString(eq(3), argThat(value -> value.length() == SqlDialect.SCRIPT_PATH_WIDTH
                && path.startsWith(value)));
        verify(insert).setString(eq(6), argThat(value -> value.length() == SqlDialect.FAILURE_REASON_WIDTH
                && reason.startsWith(value)));
        verify(connection).commit();
    }

    @Test
    void truncateKeepsShortValuesAndSurrogatePairs() {
        assertThat(JdbcExecutionLedger.truncate(null, 4)).isNull();
        assertThat(JdbcExecutionLedger.truncate("abc", 4)).isEqualTo("abc");
        assertThat(JdbcExecutionLedger.truncate("abcdef", 4)).isEqualTo("abcd");
        assertThat(JdbcExecutionLedger.truncate("abc\uD83D\uDE00", 4)).isEqualTo("abc");
    }

    @Test
    void putRollsBackAndWrapsFailures() throws Exception {
        final var connection = mock(Connection.class);
        final var delete = mock(PreparedStatement.class);
        when(connection.createStatement()).thenReturn(mock(Statement.class));
        when(connection.prepareStatement(anyString())).thenReturn(delete);
        when(delete.executeUpdate()).thenThrow(new SQLException("deadlock"));

        final var ledger = new JdbcExecutionLedger(() -> connection, SqlDialect.POSTGRES, "sql_deployments");

        assertThatThrownBy(() -> ledger.put(ExecutionRecord.success("SCT-1", "a.sql", "p/a.sql", NOW)))
                .isInstanceOf(LedgerException.class)
                .hasMessageContaining("SCT-1/a.sql")
                .hasRootCauseMessage("deadlock");
        verify(connection).rollback();
    }

    @Test
    void connectionFailureIsLedgerException() {
        final var ledger = new JdbcExecutionLedger(
                () -> {
                    throw new SQLException("refused");
                },
                SqlDialect.POSTGRES,
                "sql_deployments");

        assertThatThrownBy(() -> ledger.find("SCT-1", "a.sql"))
                .isInstanceOf(LedgerException.class)
                .hasRootCauseMessage("refused");
    }
}
