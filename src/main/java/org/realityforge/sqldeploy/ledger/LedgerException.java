package org.realityforge.sqldeploy.ledger;

import org.realityforge.sqldeploy.runtime.RuntimeExecutionException;

public final class LedgerException extends RuntimeExecutionException {
    public LedgerException(final String message) {
        super(message);
    }

    public LedgerException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
