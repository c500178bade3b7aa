package org.realityforge.sqldeploy.notify;

import java.util.logging.Level;
import java.util.logging.Logger;

public final class SafeNotifier implements Notifier {
    private static final Logger LOGGER = Logger.getLogger(SafeNotifier.class.getName());

    private final Notifier delegate;

    public SafeNotifier(final Notifier delegate) {
        this.delegate = delegate;
    }

    @Override
    public void notify(final Notification notification) {
        try {
            delegate.notify(notification);
        } catch (final RuntimeException re) {
            LOGGER.log(
                    Level.WARNING,
                    "Failed to send " + notification.status() + " notification for " + notification.deploymentId()
                            + '/' + notification.scriptName(),
                    re);
        }
    }
}
