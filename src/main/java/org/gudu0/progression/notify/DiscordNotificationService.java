package org.gudu0.progression.notify;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import org.gudu0.progression.events.AchievementUnlocked;
import org.gudu0.progression.events.CollectionCompleted;
import org.gudu0.progression.events.NotificationService;
import org.gudu0.progression.events.ProgressionEvent;
import org.gudu0.progression.util.ConsoleLog;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Posts achievement unlocks and collection completions to a Discord channel.
 * <p>
 * Always echoes to the console; Discord delivery is best effort and skipped until
 * {@link #attach(JDA)} has been called.
 */
public class DiscordNotificationService implements NotificationService {
    public static final DateTimeFormatter TS = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM);

    private final String slot;
    private final String channelId;
    private final ZoneId zone;

    private final AtomicBoolean ready = new AtomicBoolean(false);
    private volatile JDA jda;

    public DiscordNotificationService(String slot, String channelId, ZoneId zone) {
        this.slot = slot;
        this.channelId = channelId;
        this.zone = zone;
    }

    public void attach(JDA jda) {
        this.jda = jda;
        this.ready.set(true);
    }

    @Override
    public void notify(ProgressionEvent event) {
        String message = Messages.describe(slot, event);
        ConsoleLog.info("Notify", message);

        // item pickups are too chatty for a channel
        if (!(event instanceof AchievementUnlocked) && !(event instanceof CollectionCompleted)) return;

        if (channelId == null || channelId.isBlank()) {
            ConsoleLog.debug("Notify", "Discord notifications disabled (discordChannelId missing)");
            return;
        }
        if (!ready.get() || jda == null) {
            ConsoleLog.debug("Notify", "Discord notification skipped (JDA not ready yet)");
            return;
        }

        MessageChannel ch = jda.getChannelById(MessageChannel.class, channelId);
        if (ch == null) {
            ConsoleLog.warn("Notify", "discordChannelId not found: " + channelId);
            return;
        }

        String out = "[" + ZonedDateTime.now(zone).format(TS) + "] " + message;

        ch.sendMessage(out).queue(
                ok -> ConsoleLog.debug("Notify", "Sent discord notification"),
                err -> ConsoleLog.error("Notify", "Discord notification failed: " + err.getMessage(), err)
        );
    }
}
