package org.realityforge.sqldeploy.db;

import org.jspecify.annotations.Nullable;
import org.realityforge.sqldeploy.config.ConfigException;

public class ScriptExecutorFactory {
    public ScriptExecutor create(
            final String driver, final @Nullable DatabaseConnection target, final int statementTimeoutSeconds) {
        if ("noop".equalsIgnoreCase(driver)) {
            return new NoOpScriptExecutor();
        }
        final var dialect = SqlDialect.fromDriver(driver);
        if (null == target) {
            throw new ConfigException("Driver '" + driver + "' requires target connection options");
        }
        return new JdbcScriptExecutor(ConnectionFactory.driverManager(dialect, target), statementTimeoutSeconds);
    }
}
