package org.realityforge.sqldeploy.notify;

import org.realityforge.sqldeploy.runtime.RuntimeExecutionException;

public final class NotificationException extends RuntimeExecutionException {
    public NotificationException(final String message) {
        super(message);
    }

    public NotificationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
