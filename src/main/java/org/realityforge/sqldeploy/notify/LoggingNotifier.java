package org.realityforge.sqldeploy.notify;

import java.util.logging.Level;
import java.util.logging.Logger;

public final class LoggingNotifier implements Notifier {
    private static final Logger LOGGER = Logger.getLogger(LoggingNotifier.class.getName());

    @Override
    public void notify(final Notification notification) {
        LOGGER.log(Level.WARNING, "{0}\n{1}", new Object[] {notification.subject(), notification.body()});
    }
}
