package org.realityforge.sqldeploy.db;

import org.realityforge.sqldeploy.request.ScriptFile;

public interface ScriptExecutor {
    void execute(ScriptFile script);
}
