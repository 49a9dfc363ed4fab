package org.gudu0.progression.events;

/**
 * Displays player-facing notifications (banners, toasts, chat messages...).
 */
public interface NotificationService {
    void notify(ProgressionEvent event);
}
