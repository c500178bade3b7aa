package org.realityforge.sqldeploy.request;

import java.util.List;

public record DeploymentRequest(List<ScriptFile> files) {
    public DeploymentRequest {
        files = List.copyOf(files);
    }
}
