package org.gudu0.progression.console;

import org.gudu0.progression.config.DefaultCatalog;
import org.gudu0.progression.config.EngineConfig;
import org.gudu0.progression.engine.EngineCollaborators;
import org.gudu0.progression.engine.EngineRegistry;
import org.gudu0.progression.persistence.InMemorySaveSlot;
import org.gudu0.progression.rewards.LoggingRewardGrantService;
import org.gudu0.progression.rewards.RewardKind;
import org.gudu0.progression.util.ConsoleLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

public class ConsoleCommandServiceTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final Map<String, InMemorySaveSlot> slots = new ConcurrentHashMap<>();

    private LoggingRewardGrantService wallet;
    private EngineRegistry engines;
    private ConsoleCommandService console;

    @BeforeEach
    void setUp() {
        ConsoleLog.redirect(new PrintStream(out, true, StandardCharsets.UTF_8), null);
        wallet = new LoggingRewardGrantService();
        engines = new EngineRegistry(new EngineConfig(), DefaultCatalog.create(50),
                slot -> new EngineCollaborators(null, null, wallet),
                slot -> slots.computeIfAbsent(slot, s -> new InMemorySaveSlot()),
                false);
        console = new ConsoleCommandService(engines, wallet, "default");
    }

    @AfterEach
    void tearDown() {
        engines.shutdownAll();
        ConsoleLog.redirect(null, null);
    }

    private String log() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testReportAndClaim() {
        console.handle("report levels_completed 1");
        console.handle("claim first_level");

        assertEquals(1, engines.get("default").getProgress("levels_completed"));
        assertEquals(100, wallet.total(RewardKind.CURRENCY));
        assertEquals(10, wallet.total(RewardKind.PREMIUM_CURRENCY));

        console.handle("wallet");
        assertTrue(log().contains("Session rewards: coins=100 gems=10"));
    }

    @Test
    void testSetAndGet() {
        console.handle("set max_combo 12");
        console.handle("get max_combo");

        assertEquals(12, engines.get("default").getProgress("max_combo"));
        assertTrue(log().contains("max_combo = 12"));
    }

    @Test
    void testBadNumbersAndUsageDoNotChangeState() {
        console.handle("report levels_completed lots");
        console.handle("report levels_completed");
        console.handle("claim");

        assertEquals(0, engines.get("default").getProgress("levels_completed"));
        assertTrue(log().contains("Not a number: lots"));
        assertTrue(log().contains("Usage: report <key> <delta>"));
    }

    @Test
    void testCollectAndListCollections() {
        console.handle("collect gems_collection red_gem");
        console.handle("collect gems_collection red_gem");
        console.handle("collections");

        assertEquals(1, engines.get("default").getProgress("items_collected"));
        assertTrue(log().contains("Nothing collected"));
        assertTrue(log().contains("gems_collection \"Gem Collection\" 16%"));
    }

    @Test
    void testSwitchSlots() {
        console.handle("slot alice");
        console.handle("report levels_completed 3");
        console.handle("slot ../oops");

        assertEquals("alice", console.currentSlot());
        assertEquals(3, engines.get("alice").getProgress("levels_completed"));
        assertEquals(0, engines.get("default").getProgress("levels_completed"));
    }

    @Test
    void testSaveWritesSlot() {
        console.handle("report matches_made 5");
        console.handle("save");

        assertTrue(slots.get("default").contents().contains("\"matches_made\" : 5"));
    }

    @Test
    void testUnknownCommand() {
        console.handle("dance");
        assertTrue(log().contains("Unknown command: dance"));
    }

    @Test
    void testLoopStopsAtExit() {
        console.run(new StringReader("""
                report levels_completed 2

                achievements
                claimable
                sweep
                help
                exit
                report levels_completed 5
                """));

        assertFalse(console.isRunning());
        assertEquals(2, engines.get("default").getProgress("levels_completed"));
    }
}
