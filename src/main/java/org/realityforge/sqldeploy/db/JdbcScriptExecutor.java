package org.realityforge.sqldeploy.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.realityforge.sqldeploy.request.ScriptFile;

public final class JdbcScriptExecutor implements ScriptExecutor {
    private static final Logger LOGGER = Logger.getLogger(JdbcScriptExecutor.class.getName());
    private static final Pattern GO_SPLIT_PATTERN = Pattern.compile("(?im)^[ \\t]*GO[ \\t]*$");

    private final ConnectionFactory connectionFactory;
    private final int statementTimeoutSeconds;

    public JdbcScriptExecutor(final ConnectionFactory connectionFactory, final int statementTimeoutSeconds) {
        this.connectionFactory = connectionFactory;
        this.statementTimeoutSeconds = statementTimeoutSeconds;
    }

    @Override
    public void execute(final ScriptFile script) {
        final List<String> batches = batches(script.content());
        if (batches.isEmpty()) {
            LOGGER.log(Level.FINE, "Script {0} contains no statements", script.path());
            return;
        }
        try (Connection connection = connectionFactory.connect()) {
            connection.setAutoCommit(false);
            try {
                for (final String batch : batches) {
                    executeBatch(connection, batch);
                }
                connection.commit();
            } catch (final SQLException sqle) {
                rollback(connection, sqle);
                throw new ScriptExecutionException(
                        "Failed to execute " + script.scriptName() + ": " + sqle.getMessage(), sqle);
            }
        } catch (final SQLException sqle) {
            throw new ScriptExecutionException(
                    "Database connection failure while executing " + script.scriptName() + ": " + sqle.getMessage(),
                    sqle);
        }
    }

    static List<String> batches(final String sql) {
        final String normalizedSql = sql.replace("\r", "");
        return GO_SPLIT_PATTERN.splitAsStream(normalizedSql)
                .filter(batch -> !batch.isBlank())
                .toList();
    }

    private void executeBatch(final Connection connection, final String batch) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            if (statementTimeoutSeconds > 0) {
                statement.setQueryTimeout(statementTimeoutSeconds);
            }
            statement.execute(batch);
        }
    }

    private static void rollback(final Connection connection, final SQLException failure) {
        try {
            connection.rollback();
        } catch (final SQLException sqle) {
            failure.addSuppressed(sqle);
        }
    }
}
