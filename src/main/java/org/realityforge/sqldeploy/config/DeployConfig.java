package org.realityforge.sqldeploy.config;

import java.net.URI;
import org.jspecify.annotations.Nullable;

public record DeployConfig(
        int maxSqlAgeMonths,
        boolean ledgerFailOpen,
        boolean notifyAlreadyExecuted,
        String deploymentRoot,
        String deploymentIdPrefix,
        String ledgerTable,
        @Nullable URI notifyUrl,
        String notifyRecipient,
        int scriptTimeoutSeconds) {

    public static final int DEFAULT_MAX_SQL_AGE_MONTHS = 12;

    public DeployConfig {
        if (maxSqlAgeMonths < 0) {
            throw new ConfigException("maxSqlAgeMonths must not be negative but was " + maxSqlAgeMonths);
        }
        if (scriptTimeoutSeconds < 0) {
            throw new ConfigException("scriptTimeoutSeconds must not be negative but was " + scriptTimeoutSeconds);
        }
        if (deploymentRoot.isEmpty() || deploymentRoot.contains("/")) {
            throw new ConfigException("deploymentRoot must be a single non-empty path segment: '" + deploymentRoot + "'");
        }
        if (!ledgerTable.matches("[A-Za-z_][A-Za-z0-9_.]*")) {
            throw new ConfigException("ledgerTable is not a valid table name: '" + ledgerTable + "'");
        }
    }

    public static DeployConfig defaults() {
        return new DeployConfig(
                DEFAULT_MAX_SQL_AGE_MONTHS,
                true,
                true,
                "deployment",
                "SCT-",
                "sql_deployments",
                null,
                "sql-deployments@localhost",
                0);
    }
}
