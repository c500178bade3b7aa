package org.realityforge.sqldeploy.cli;

import java.nio.file.Path;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.realityforge.sqldeploy.db.DatabaseConnection;
import org.realityforge.sqldeploy.runtime.DeploymentReport;

interface CommandRunner {
    DeploymentReport run(
            String request,
            @Nullable Path configFile,
            String driver,
            LedgerType ledger,
            @Nullable DatabaseConnection target);

    List<String> validate(String request, @Nullable Path configFile);

    enum LedgerType {
        JDBC,
        MEMORY
    }
}
