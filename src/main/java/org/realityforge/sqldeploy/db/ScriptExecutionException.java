package org.realityforge.sqldeploy.db;

import org.realityforge.sqldeploy.runtime.RuntimeExecutionException;

public final class ScriptExecutionException extends RuntimeExecutionException {
    public ScriptExecutionException(final String message) {
        super(message);
    }

    public ScriptExecutionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
