package org.gudu0.progression.notify;

import org.gudu0.progression.events.NotificationService;
import org.gudu0.progression.events.ProgressionEvent;
import org.gudu0.progression.util.ConsoleLog;

/**
 * Prints notifications to the console; the default when Discord is not configured.
 */
public class ConsoleNotificationService implements NotificationService {
    private final String slot;

    public ConsoleNotificationService(String slot) {
        this.slot = slot;
    }

    @Override
    public void notify(ProgressionEvent event) {
        ConsoleLog.info("Notify", Messages.describe(slot, event));
    }
}
