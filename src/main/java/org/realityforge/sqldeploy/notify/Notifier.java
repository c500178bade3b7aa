package org.realityforge.sqldeploy.notify;

public interface Notifier {
    void notify(Notification notification);
}
