package org.realityforge.sqldeploy.runtime;

import org.realityforge.sqldeploy.request.ScriptFile;

public record ScriptResult(String deploymentId, ScriptFile script, Outcome outcome) {}
