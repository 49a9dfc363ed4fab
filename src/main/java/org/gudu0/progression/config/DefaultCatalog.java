package org.gudu0.progression.config;

import org.gudu0.progression.achievements.AchievementCategory;
import org.gudu0.progression.achievements.AchievementDef;
import org.gudu0.progression.achievements.AchievementRarity;
import org.gudu0.progression.collections.CollectionDef;
import org.gudu0.progression.collections.CollectionItemDef;
import org.gudu0.progression.requirements.RequirementSet;
import org.gudu0.progression.rewards.Reward;
import org.gudu0.progression.rewards.RewardManifest;

import java.util.List;

import static org.gudu0.progression.achievements.AchievementCategory.*;
import static org.gudu0.progression.achievements.AchievementRarity.*;

/**
 * Built-in catalog used when no catalog file is configured.
 */
public final class DefaultCatalog {
    private DefaultCatalog() {}

    public static Catalog create(int maxPerCategory) {
        return Catalog.of(achievements(), collections(), maxPerCategory);
    }

    public static List<AchievementDef> achievements() {
        return List.of(
                // Progression
                def("first_level", "First Steps", "Complete your first level",
                        PROGRESSION, COMMON, RequirementSet.single("levels_completed", 1),
                        rewards(100, 10), 10),

                def("level_master", "Level Master", "Complete 100 levels",
                        PROGRESSION, RARE, RequirementSet.single("levels_completed", 100),
                        rewards(5000, 100), 5),

                def("level_legend", "Level Legend", "Complete 500 levels",
                        PROGRESSION, LEGENDARY, RequirementSet.single("levels_completed", 500),
                        rewards(25_000, 500), 1),

                // Skill
                def("match_master", "Match Master", "Make 1000 matches",
                        SKILL, UNCOMMON, RequirementSet.single("matches_made", 1000),
                        rewards(2000, 50), 7),

                def("combo_king", "Combo King", "Make a 10x combo",
                        SKILL, EPIC, RequirementSet.single("max_combo", 10),
                        rewards(3000, 75), 3),

                def("perfect_level", "Perfectionist", "Complete a level with 3 stars",
                        SKILL, UNCOMMON, RequirementSet.single("three_star_levels", 1),
                        rewards(1000, 25), 8),

                // Collection (fed by CollectionAggregator.ITEMS_COLLECTED)
                def("collector", "Collector", "Collect 50 items",
                        COLLECTION, UNCOMMON, RequirementSet.single("items_collected", 50),
                        rewards(1500, 30), 6),

                def("hoarder", "Hoarder", "Collect 200 items",
                        COLLECTION, RARE, RequirementSet.single("items_collected", 200),
                        rewards(5000, 100), 4),

                // Social
                def("social_butterfly", "Social Butterfly", "Add 10 friends",
                        SOCIAL, UNCOMMON, RequirementSet.single("friends_added", 10),
                        rewards(2000, 40), 5),

                def("leaderboard_champion", "Leaderboard Champion", "Reach top 10 on any leaderboard",
                        SOCIAL, EPIC, RequirementSet.single("top_10_rank", 1),
                        rewards(4000, 100), 2),

                // Special
                def("lucky_streak", "Lucky Streak", "Win 5 levels in a row",
                        SPECIAL, RARE, RequirementSet.single("win_streak", 5),
                        rewards(3000, 75), 4),

                def("speed_demon", "Speed Demon", "Complete a level in under 30 seconds",
                        SPECIAL, EPIC, RequirementSet.single("fast_level", 30),
                        rewards(2500, 60), 3)
        );
    }

    public static List<CollectionDef> collections() {
        return List.of(
                new CollectionDef("gems_collection", "Gem Collection", "Collect all types of magical gems",
                        List.of(
                                item("red_gem", "Ruby", "A fiery red gem", "gems", "common"),
                                item("blue_gem", "Sapphire", "A cool blue gem", "gems", "common"),
                                item("green_gem", "Emerald", "A vibrant green gem", "gems", "common"),
                                item("yellow_gem", "Topaz", "A bright yellow gem", "gems", "common"),
                                item("purple_gem", "Amethyst", "A mysterious purple gem", "gems", "uncommon"),
                                item("diamond", "Diamond", "The rarest of gems", "gems", "rare")
                        ),
                        rewards(5000, 200)),

                new CollectionDef("special_pieces", "Special Pieces", "Collect all special match pieces",
                        List.of(
                                item("rocket_h", "Horizontal Rocket", "Clears a row", "special", "common"),
                                item("rocket_v", "Vertical Rocket", "Clears a column", "special", "common"),
                                item("bomb", "Bomb", "Explodes in a 3x3 area", "special", "uncommon"),
                                item("color_bomb", "Color Bomb", "Clears all pieces of one color", "special", "rare")
                        ),
                        rewards(3000, 150))
        );
    }

    private static RewardManifest rewards(long coins, long gems) {
        return RewardManifest.of(Reward.coins(coins), Reward.gems(gems));
    }

    private static CollectionItemDef item(String id, String name, String desc, String category, String rarity) {
        return new CollectionItemDef(id, name, desc, category, rarity);
    }

    private static AchievementDef def(String id, String name, String desc,
                                      AchievementCategory category, AchievementRarity rarity,
                                      RequirementSet requirements, RewardManifest rewards,
                                      int priority) {
        return new AchievementDef(id, name, desc, category, rarity, requirements, rewards, priority);
    }
}
