package org.realityforge.sqldeploy.db;

import org.realityforge.sqldeploy.request.ScriptFile;

public final class NoOpScriptExecutor implements ScriptExecutor {
    public static final String FAILURE_MARKER = "-- sqldeploy:fail";

    @Override
    public void execute(final ScriptFile script) {
        if (script.content().contains(FAILURE_MARKER)) {
            throw new ScriptExecutionException("Forced failure for " + script.scriptName());
        }
    }
}
