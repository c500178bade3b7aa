package org.realityforge.sqldeploy.ledger;

public enum ExecutionStatus {
    SUCCESS,
    FAILED,
    IGNORED
}
