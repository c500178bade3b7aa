package org.realityforge.sqldeploy.runtime;

import java.util.List;
import org.realityforge.sqldeploy.ledger.ExecutionStatus;
import org.realityforge.sqldeploy.request.ScriptFile;

public record DeploymentReport(
        DeploymentStatus status,
        List<ScriptResult> results,
        List<String> haltedDeployments,
        List<ScriptFile> pendingScripts) {

    public DeploymentReport {
        results = List.copyOf(results);
        haltedDeployments = List.copyOf(haltedDeployments);
        pendingScripts = List.copyOf(pendingScripts);
    }

    public static DeploymentReport noFiles() {
        return new DeploymentReport(DeploymentStatus.NO_FILES, List.of(), List.of(), List.of());
    }

    public long count(final ExecutionStatus executionStatus) {
        return results.stream()
                .filter(result -> executionStatus == result.outcome().status())
                .count();
    }

    public String summary() {
        return status
                + ": " + count(ExecutionStatus.SUCCESS) + " succeeded, "
                + count(ExecutionStatus.FAILED) + " failed, "
                + count(ExecutionStatus.IGNORED) + " ignored, "
                + pendingScripts.size() + " not attempted";
    }
}
