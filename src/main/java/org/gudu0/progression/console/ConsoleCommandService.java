package org.gudu0.progression.console;

import org.gudu0.progression.achievements.AchievementView;
import org.gudu0.progression.collections.CollectionView;
import org.gudu0.progression.engine.EngineRegistry;
import org.gudu0.progression.engine.ProgressionEngine;
import org.gudu0.progression.rewards.LoggingRewardGrantService;
import org.gudu0.progression.rewards.RewardKind;
import org.gudu0.progression.util.ConsoleLog;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads host commands from stdin and drives the engine of the current save slot.
 */
public final class ConsoleCommandService {

    private final EngineRegistry engines;
    private final LoggingRewardGrantService wallet;

    private volatile String slot;
    private volatile boolean running = true;

    public ConsoleCommandService(EngineRegistry engines, LoggingRewardGrantService wallet, String initialSlot) {
        this.engines = engines;
        this.wallet = wallet;
        this.slot = initialSlot;
    }

    /** Blocks reading stdin until EOF or {@code exit}. */
    public void run() {
        ConsoleLog.info("Console", "Console commands enabled. Type 'help' for commands.");
        run(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }

    void run(Reader input) {
        try (BufferedReader br = new BufferedReader(input)) {
            while (running) {
                String line = br.readLine();
                if (line == null) {
                    ConsoleLog.warn("Console", "STDIN closed; console commands disabled.");
                    return;
                }

                line = line.trim();
                if (line.isEmpty()) continue;

                handle(line);
            }
        } catch (IOException e) {
            ConsoleLog.error("Console", "Console command loop crashed: " + e.getMessage(), e);
        }
    }

    public boolean isRunning() {
        return running;
    }

    public String currentSlot() {
        return slot;
    }

    void handle(String raw) {
        String[] parts = raw.trim().split("\\s+");
        String cmd = parts[0].toLowerCase(Locale.ROOT);

        switch (cmd) {
            case "help" -> printHelp();

            case "slots" -> ConsoleLog.info("Console", "Open slots: " + engines.slots() + " (current: " + slot + ")");

            case "slot" -> {
                if (parts.length < 2) {
                    ConsoleLog.info("Console", "Current slot: " + slot);
                    return;
                }
                try {
                    engines.get(parts[1]);
                    slot = parts[1];
                    ConsoleLog.info("Console", "Switched to slot " + slot);
                } catch (IllegalArgumentException e) {
                    ConsoleLog.warn("Console", e.getMessage());
                }
            }

            case "report", "add" -> {
                if (parts.length < 3) {
                    ConsoleLog.warn("Console", "Usage: report <key> <delta>");
                    return;
                }
                Long delta = parseLong(parts[2]);
                if (delta == null) return;
                long now = engine().reportProgress(parts[1], delta);
                ConsoleLog.info("Console", parts[1] + " = " + now);
            }

            case "set" -> {
                if (parts.length < 3) {
                    ConsoleLog.warn("Console", "Usage: set <key> <value>");
                    return;
                }
                Long value = parseLong(parts[2]);
                if (value == null) return;
                long old = engine().setProgress(parts[1], value);
                ConsoleLog.info("Console", parts[1] + " = " + engine().getProgress(parts[1]) + " (was " + old + ")");
            }

            case "get" -> {
                if (parts.length < 2) {
                    ConsoleLog.warn("Console", "Usage: get <key>");
                    return;
                }
                ConsoleLog.info("Console", parts[1] + " = " + engine().getProgress(parts[1]));
            }

            case "counters" -> {
                Map<String, Long> counters = engine().getCounters();
                if (counters.isEmpty()) ConsoleLog.info("Console", "No counters yet.");
                counters.forEach((k, v) -> ConsoleLog.info("Console", "  " + k + " = " + v));
            }

            case "collect" -> {
                if (parts.length < 3) {
                    ConsoleLog.warn("Console", "Usage: collect <collectionId> <itemId>");
                    return;
                }
                boolean ok = engine().collectItem(parts[1], parts[2]);
                if (!ok) ConsoleLog.warn("Console", "Nothing collected (unknown or already collected): " + parts[1] + "/" + parts[2]);
            }

            case "claim" -> {
                if (parts.length < 2) {
                    ConsoleLog.warn("Console", "Usage: claim <achievementId>");
                    return;
                }
                boolean ok = engine().claimAchievement(parts[1]);
                if (!ok) ConsoleLog.warn("Console", "Nothing to claim for " + parts[1]);
            }

            case "achievements" -> printAchievements(engine().getAchievements());

            case "claimable" -> printAchievements(engine().listClaimable());

            case "collections" -> printCollections(engine().getCollections());

            case "sweep" -> {
                engine().scheduler().sweepNow();
                ConsoleLog.info("Console", "Sweep done.");
            }

            case "save" -> {
                engine().flush();
                ConsoleLog.info("Console", "Saved slot " + slot);
            }

            case "wallet" -> ConsoleLog.info("Console", "Session rewards: coins=" + wallet.total(RewardKind.CURRENCY)
                    + " gems=" + wallet.total(RewardKind.PREMIUM_CURRENCY)
                    + " items=" + wallet.items());

            case "shutdown", "exit", "quit" -> {
                ConsoleLog.warn("Console", "Shutdown requested from console.");
                running = false;
            }

            default -> ConsoleLog.warn("Console", "Unknown command: " + cmd + " (type 'help')");
        }
    }

    private ProgressionEngine engine() {
        return engines.get(slot);
    }

    private void printHelp() {
        ConsoleLog.info("Console", """
                Commands:
                  help                          - show this help
                  slots                         - list open save slots
                  slot [name]                   - show or switch the current save slot
                  report|add <key> <delta>      - add to a progress counter
                  set <key> <value>             - set a progress counter
                  get <key>                     - show one counter
                  counters                      - show all counters
                  collect <collection> <item>   - collect a collection item
                  claim <achievementId>         - claim an unlocked achievement
                  achievements                  - list all achievements
                  claimable                     - list achievements ready to claim
                  collections                   - list collections and items
                  sweep                         - force a safety sweep
                  save                          - write the slot to disk now
                  wallet                        - rewards granted this session
                  shutdown|exit|quit            - save and stop

                Examples:
                  report levels_completed 1
                  claim first_level
                  collect gems_collection red_gem
                """.trim());
    }

    private static void printAchievements(List<AchievementView> list) {
        if (list.isEmpty()) {
            ConsoleLog.info("Console", "None.");
            return;
        }
        for (AchievementView a : list) {
            String status = a.claimed() ? "CLAIMED" : a.unlocked() ? "UNLOCKED" : "locked";
            ConsoleLog.info("Console", String.format(Locale.ROOT, "  %-22s %-9s %-10s %s/%s  %s",
                    a.id(), status, a.rarity(), a.progress(), a.target(), a.name()));
        }
    }

    private static void printCollections(List<CollectionView> list) {
        if (list.isEmpty()) {
            ConsoleLog.info("Console", "None.");
            return;
        }
        for (CollectionView c : list) {
            ConsoleLog.info("Console", "  " + c.id() + " \"" + c.name() + "\" " + c.completionPercentage() + "%"
                    + (c.completed() ? " (complete)" : ""));
            for (CollectionView.ItemView i : c.items()) {
                ConsoleLog.info("Console", "    [" + (i.collected() ? "x" : " ") + "] " + i.id() + " - " + i.name() + " (" + i.rarity() + ")");
            }
        }
    }

    private static Long parseLong(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            ConsoleLog.warn("Console", "Not a number: " + raw);
            return null;
        }
    }
}
