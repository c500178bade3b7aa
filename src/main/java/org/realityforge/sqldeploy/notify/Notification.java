package org.realityforge.sqldeploy.notify;

import org.jspecify.annotations.Nullable;
import org.realityforge.sqldeploy.ledger.ExecutionStatus;

public record Notification(
        String deploymentId, String scriptName, String scriptPath, ExecutionStatus status, @Nullable String reason) {

    public String subject() {
        return "[SQL DEPLOYMENT] " + status;
    }

    public String body() {
        return "Deployment ID : " + deploymentId + '\n'
                + "Script Name  : " + scriptName + '\n'
                + "Script Path  : " + scriptPath + '\n'
                + "Status       : " + status + '\n'
                + "Reason       : " + reason + '\n';
    }
}
