package org.gudu0.progression.events;

import org.gudu0.progression.util.ConsoleLog;

/**
 * Routes engine events to the notification service and analytics sink.
 * <p>
 * Collaborator failures are logged and never reach the caller.
 */
public class EventDispatcher {
    private final NotificationService notifications;
    private final AnalyticsSink analytics;

    public EventDispatcher(NotificationService notifications, AnalyticsSink analytics) {
        this.notifications = notifications;
        this.analytics = analytics;
    }

    public void dispatch(ProgressionEvent event) {
        // Claims are bookkeeping only: no player-facing notification.
        if (!(event instanceof AchievementClaimed)) {
            toNotifications(event);
        }
        toAnalytics(event);
    }

    private void toNotifications(ProgressionEvent event) {
        if (notifications == null) return;
        try {
            notifications.notify(event);
        } catch (Exception e) {
            ConsoleLog.error("Events", "Notification failed for " + event.name() + ": " + e.getMessage(), e);
        }
    }

    private void toAnalytics(ProgressionEvent event) {
        if (analytics == null) return;
        try {
            analytics.record(event);
        } catch (Exception e) {
            ConsoleLog.error("Events", "Analytics record failed for " + event.name() + ": " + e.getMessage(), e);
        }
    }
}
