package org.realityforge.sqldeploy.ledger;

import java.util.Optional;

public interface ExecutionLedger {
    Optional<ExecutionRecord> find(String deploymentId, String scriptName);

    void put(ExecutionRecord record);
}
