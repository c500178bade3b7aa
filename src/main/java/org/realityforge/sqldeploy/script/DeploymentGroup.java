package org.realityforge.sqldeploy.script;

import java.util.List;
import org.realityforge.sqldeploy.request.ScriptFile;

public record DeploymentGroup(String deploymentId, List<ScriptFile> scripts) {
    public DeploymentGroup {
        scripts = List.copyOf(scripts);
    }
}
