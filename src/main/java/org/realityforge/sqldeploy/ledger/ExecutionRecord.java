package org.realityforge.sqldeploy.ledger;

import java.time.Instant;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

public record ExecutionRecord(
        String deploymentId,
        String scriptName,
        String scriptPath,
        Instant deployedAt,
        ExecutionStatus status,
        @Nullable String failureReason) {

    public ExecutionRecord {
        Objects.requireNonNull(deploymentId, "deploymentId");
        Objects.requireNonNull(scriptName, "scriptName");
        Objects.requireNonNull(scriptPath, "scriptPath");
        Objects.requireNonNull(deployedAt, "deployedAt");
        Objects.requireNonNull(status, "status");
        if (ExecutionStatus.SUCCESS == status && null != failureReason) {
            throw new IllegalArgumentException("Successful record for " + scriptName + " must not carry a reason");
        }
        if (ExecutionStatus.SUCCESS != status && null == failureReason) {
            throw new IllegalArgumentException(status + " record for " + scriptName + " requires a reason");
        }
    }

    public static ExecutionRecord success(
            final String deploymentId, final String scriptName, final String scriptPath, final Instant deployedAt) {
        return new ExecutionRecord(deploymentId, scriptName, scriptPath, deployedAt, ExecutionStatus.SUCCESS, null);
    }
}
