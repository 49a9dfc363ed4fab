package org.gudu0.progression.achievements;

public enum AchievementCategory {
    PROGRESSION,
    SKILL,
    COLLECTION,
    SOCIAL,
    SPECIAL,
    TIME_BASED
}
