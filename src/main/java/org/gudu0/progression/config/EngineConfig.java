package org.gudu0.progression.config;

import org.gudu0.progression.util.ConsoleLog;

/**
 * Engine settings.
 * Stored at: data/config.json
 * <p>
 * The Discord bot token is read from the DISCORD_TOKEN environment variable, never from this file.
 */
public class EngineConfig {
    /** Seconds between safety sweeps that re-check every locked achievement. */
    public int sweepIntervalSeconds = 5;

    /** Seconds between background flushes of counter changes to the save file. */
    public int autoFlushSeconds = 10;

    /** Save slot the console starts on. */
    public String defaultSlot = "default";

    /** Catalog validation: at most this many achievements per category. */
    public int maxAchievementsPerCategory = 50;

    /** JSON catalog file; blank means the built-in catalog. */
    public String catalogPath = "";

    public boolean debugLogging = false;

    /** Post unlocks and collection completions to a Discord channel. */
    public boolean discordNotifications = false;
    public String discordChannelId = "";

    /** Replaces out-of-range values with defaults, logging each fix. */
    public EngineConfig sanitized() {
        EngineConfig d = new EngineConfig();
        if (sweepIntervalSeconds <= 0) {
            ConsoleLog.warn("EngineConfig", "sweepIntervalSeconds=" + sweepIntervalSeconds + " invalid, using " + d.sweepIntervalSeconds);
            sweepIntervalSeconds = d.sweepIntervalSeconds;
        }
        if (autoFlushSeconds <= 0) {
            ConsoleLog.warn("EngineConfig", "autoFlushSeconds=" + autoFlushSeconds + " invalid, using " + d.autoFlushSeconds);
            autoFlushSeconds = d.autoFlushSeconds;
        }
        if (maxAchievementsPerCategory <= 0) {
            ConsoleLog.warn("EngineConfig", "maxAchievementsPerCategory=" + maxAchievementsPerCategory + " invalid, using " + d.maxAchievementsPerCategory);
            maxAchievementsPerCategory = d.maxAchievementsPerCategory;
        }
        if (defaultSlot == null || defaultSlot.isBlank()) {
            defaultSlot = d.defaultSlot;
        }
        if (catalogPath == null) catalogPath = "";
        if (discordChannelId == null) discordChannelId = "";
        return this;
    }
}
