package org.realityforge.sqldeploy.runtime;

import org.jspecify.annotations.Nullable;
import org.realityforge.sqldeploy.ledger.ExecutionStatus;

public record Outcome(ExecutionStatus status, @Nullable String reason) {
    public static Outcome success() {
        return new Outcome(ExecutionStatus.SUCCESS, null);
    }

    public static Outcome ignored(final String reason) {
        return new Outcome(ExecutionStatus.IGNORED, reason);
    }

    public static Outcome failed(final String reason) {
        return new Outcome(ExecutionStatus.FAILED, reason);
    }

    public boolean isFailure() {
        return ExecutionStatus.FAILED == status;
    }
}
