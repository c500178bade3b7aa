package org.realityforge.sqldeploy.ledger;

import java.util.logging.Level;
import java.util.logging.Logger;

public final class LedgerClient {
    public static final String ALREADY_EXECUTED_REASON = "Already executed";

    private static final Logger LOGGER = Logger.getLogger(LedgerClient.class.getName());

    private final ExecutionLedger ledger;
    private final boolean failOpen;

    public LedgerClient(final ExecutionLedger ledger, final boolean failOpen) {
        this.ledger = ledger;
        this.failOpen = failOpen;
    }

    public boolean lookup(final String deploymentId, final String scriptName) {
        try {
            return ledger.find(deploymentId, scriptName)
                    .map(LedgerClient::isTerminal)
                    .orElse(false);
        } catch (final RuntimeException re) {
            if (!failOpen) {
                throw new LedgerException(
                        "Ledger lookup failed for " + deploymentId + '/' + scriptName + ": " + re.getMessage(), re);
            }
            LOGGER.log(
                    Level.WARNING,
                    "Ledger lookup failed for " + deploymentId + '/' + scriptName + "; proceeding as not executed",
                    re);
            return false;
        }
    }

    // "Already executed" overwrites the SUCCESS record it stands for.
    private static boolean isTerminal(final ExecutionRecord record) {
        return ExecutionStatus.SUCCESS == record.status()
                || (ExecutionStatus.IGNORED == record.status()
                        && ALREADY_EXECUTED_REASON.equals(record.failureReason()));
    }

    public void put(final ExecutionRecord record) {
        try {
            ledger.put(record);
        } catch (final RuntimeException re) {
            LOGGER.log(
                    Level.SEVERE,
                    "Failed to record " + record.status() + " for " + record.deploymentId() + '/'
                            + record.scriptName(),
                    re);
        }
    }
}
