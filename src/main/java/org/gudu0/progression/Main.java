package org.gudu0.progression;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import org.gudu0.progression.config.Catalog;
import org.gudu0.progression.config.CatalogLoader;
import org.gudu0.progression.config.ConfigurationException;
import org.gudu0.progression.config.DefaultCatalog;
import org.gudu0.progression.config.EngineConfig;
import org.gudu0.progression.config.TypedConfigStore;
import org.gudu0.progression.console.ConsoleCommandService;
import org.gudu0.progression.engine.EngineCollaborators;
import org.gudu0.progression.engine.EngineRegistry;
import org.gudu0.progression.events.NotificationService;
import org.gudu0.progression.notify.ConsoleAnalyticsSink;
import org.gudu0.progression.notify.ConsoleNotificationService;
import org.gudu0.progression.notify.DiscordNotificationService;
import org.gudu0.progression.rewards.LoggingRewardGrantService;
import org.gudu0.progression.util.ConsoleLog;
import org.gudu0.progression.util.EnginePaths;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.time.ZoneId;

public class Main {

    public static void main(String[] args) throws Exception {
        ConsoleLog.info("Main", "Starting progression engine");
        EnginePaths.ensureBaseDirs();

        // 1) Config (data/config.json)
        TypedConfigStore<EngineConfig> cfgStore = new TypedConfigStore<>(EnginePaths.CONFIG_FILE, EngineConfig.class, EngineConfig::new);
        cfgStore.saveIfMissing();
        EngineConfig cfg = cfgStore.cfg().sanitized();
        ConsoleLog.setDebug(cfg.debugLogging);

        ConsoleLog.info("Main", "EngineConfig: sweepIntervalSeconds=" + cfg.sweepIntervalSeconds
                + " autoFlushSeconds=" + cfg.autoFlushSeconds
                + " defaultSlot=" + cfg.defaultSlot
                + " catalogPath=" + (cfg.catalogPath.isBlank() ? "<built-in>" : cfg.catalogPath));

        // 2) Catalog (malformed catalogs stop startup)
        Catalog catalog;
        try {
            catalog = loadCatalog(cfg);
        } catch (ConfigurationException e) {
            ConsoleLog.error("Main", "Catalog rejected: " + e.getMessage());
            System.exit(1);
            return;
        }

        // 3) Optional Discord notifications
        JDA jda = cfg.discordNotifications ? startDiscord() : null;

        // 4) One engine per save slot
        LoggingRewardGrantService wallet = new LoggingRewardGrantService();
        EngineRegistry engines = new EngineRegistry(cfg, catalog,
                slot -> new EngineCollaborators(notificationsFor(slot, cfg, jda), new ConsoleAnalyticsSink(slot), wallet));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            ConsoleLog.info("Main", "Shutdown hook: flushing all save slots");
            engines.shutdownAll();
            if (jda != null) jda.shutdown();
        }, "ShutdownHook"));

        engines.get(cfg.defaultSlot);
        ConsoleLog.info("Main", "Startup complete");

        // 5) Console loop (blocks until exit / EOF)
        ConsoleCommandService console = new ConsoleCommandService(engines, wallet, cfg.defaultSlot);
        console.run();

        System.exit(0);
    }

    private static Catalog loadCatalog(EngineConfig cfg) {
        if (cfg.catalogPath.isBlank()) {
            ConsoleLog.info("Main", "Using built-in catalog");
            return DefaultCatalog.create(cfg.maxAchievementsPerCategory);
        }
        return CatalogLoader.load(Path.of(cfg.catalogPath), cfg.maxAchievementsPerCategory);
    }

    private static NotificationService notificationsFor(String slot, EngineConfig cfg, @Nullable JDA jda) {
        if (jda == null) return new ConsoleNotificationService(slot);

        DiscordNotificationService discord = new DiscordNotificationService(slot, cfg.discordChannelId, ZoneId.systemDefault());
        discord.attach(jda);
        return discord;
    }

    private static @Nullable JDA startDiscord() throws InterruptedException {
        String token = System.getenv("DISCORD_TOKEN");
        if (token == null || token.isBlank()) {
            ConsoleLog.warn("Main", "discordNotifications=true but DISCORD_TOKEN is not set; using console notifications");
            return null;
        }

        ConsoleLog.info("Main", "Building JDA");
        JDA jda = JDABuilder.createDefault(token).build();
        jda.awaitReady();
        ConsoleLog.info("Main", "JDA ready as " + jda.getSelfUser().getName());
        return jda;
    }
}
