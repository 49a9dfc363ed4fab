package org.gudu0.progression.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.gudu0.progression.achievements.AchievementCategory;
import org.gudu0.progression.achievements.AchievementDef;
import org.gudu0.progression.achievements.AchievementRarity;
import org.gudu0.progression.collections.CollectionDef;
import org.gudu0.progression.rewards.RewardKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogLoaderTest {

    @TempDir
    Path dir;

    private static String resource(String name) throws Exception {
        try (InputStream in = CatalogLoaderTest.class.getResourceAsStream(name)) {
            assertNotNull(in, "missing test resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void testParsesSampleCatalog() throws Exception {
        Catalog catalog = CatalogLoader.parse(resource("/catalogs/sample-catalog.json"), 50);

        assertEquals(2, catalog.achievements().size());
        AchievementDef weekly = catalog.achievements().get(1);
        assertEquals("weekly_regular", weekly.id);
        assertEquals(AchievementCategory.TIME_BASED, weekly.category);
        assertEquals(AchievementRarity.RARE, weekly.rarity);
        assertEquals(2, weekly.requirements.size());
        assertEquals(12, weekly.target());
        assertEquals(1, weekly.rewards.total(RewardKind.ITEM));

        CollectionDef fruit = catalog.collections().get(0);
        assertEquals("fruit_basket", fruit.id);
        assertEquals(3, fruit.items.size());
        assertEquals("red", fruit.item("apple").properties().get("color"));
        assertEquals(250, fruit.completionRewards.total(RewardKind.CURRENCY));
    }

    @Test
    void testLoadFromFile() throws Exception {
        Path file = dir.resolve("catalog.json");
        Files.writeString(file, resource("/catalogs/sample-catalog.json"), StandardCharsets.UTF_8);

        assertEquals(2, CatalogLoader.load(file, 50).achievements().size());
    }

    @Test
    void testMissingFileIsConfigurationError() {
        assertThrows(ConfigurationException.class, () -> CatalogLoader.load(dir.resolve("nope.json"), 50));
    }

    @Test
    void testMalformedJsonIsConfigurationError() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> CatalogLoader.parse("{ \"achievements\": [", 50));
        assertTrue(e.getMessage().startsWith("Malformed catalog JSON: "), e.getMessage());
        assertInstanceOf(JsonProcessingException.class, e.getCause());
        assertThrows(ConfigurationException.class, () -> CatalogLoader.parse("null", 50));
    }

    @Test
    void testUnknownFieldIsRejected() {
        String json = """
                { "achievements": [ { "id": "a", "category": "SKILL", "rarity": "COMMON",
                    "requirements": [ { "key": "k", "threshold": 1 } ], "colour": "blue" } ] }
                """;
        assertThrows(ConfigurationException.class, () -> CatalogLoader.parse(json, 50));
    }

    @Test
    void testUnknownCategoryIsRejected() {
        String json = """
                { "achievements": [ { "id": "a", "category": "COOKING", "rarity": "COMMON",
                    "requirements": [ { "key": "k", "threshold": 1 } ] } ] }
                """;
        assertThrows(ConfigurationException.class, () -> CatalogLoader.parse(json, 50));
    }

    @Test
    void testAchievementWithoutRequirementsIsRejected() {
        String json = """
                { "achievements": [ { "id": "a", "category": "SKILL", "rarity": "COMMON", "requirements": [] } ] }
                """;
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> CatalogLoader.parse(json, 50));
        assertTrue(e.getMessage().contains("a"));
    }

    @Test
    void testDuplicateRequirementKeyIsRejected() {
        String json = """
                { "achievements": [ { "id": "a", "category": "SKILL", "rarity": "COMMON",
                    "requirements": [ { "key": "k", "threshold": 1 }, { "key": "k", "threshold": 2 } ] } ] }
                """;
        assertThrows(ConfigurationException.class, () -> CatalogLoader.parse(json, 50));
    }

    @Test
    void testInvalidRewardIsRejected() {
        String json = """
                { "collections": [ { "id": "c", "items": [ { "id": "x" } ],
                    "rewards": [ { "kind": "CURRENCY", "amount": 0 } ] } ] }
                """;
        assertThrows(ConfigurationException.class, () -> CatalogLoader.parse(json, 50));
    }

    @Test
    void testPerCategoryLimitApplies() throws Exception {
        assertThrows(ConfigurationException.class,
                () -> CatalogLoader.parse(resource("/catalogs/sample-catalog.json"), 0));
    }
}
