package org.gudu0.progression.notify;

import org.gudu0.progression.events.AchievementClaimed;
import org.gudu0.progression.events.AchievementUnlocked;
import org.gudu0.progression.events.CollectionCompleted;
import org.gudu0.progression.events.ItemCollected;
import org.gudu0.progression.events.ProgressionEvent;

/**
 * Player-facing text for engine events.
 */
final class Messages {
    private Messages() {}

    static String describe(String slot, ProgressionEvent event) {
        String prefix = slot == null || slot.isBlank() ? "" : "[" + slot + "] ";

        if (event instanceof AchievementUnlocked e) {
            return prefix + "Achievement unlocked: " + e.achievementId() + " (" + e.rarity() + " " + e.category() + ")";
        }
        if (event instanceof AchievementClaimed e) {
            return prefix + "Achievement claimed: " + e.achievementId();
        }
        if (event instanceof ItemCollected e) {
            return prefix + "Item collected: " + e.itemId() + " (" + e.rarity() + ") for collection " + e.collectionId();
        }
        if (event instanceof CollectionCompleted e) {
            return prefix + "Collection completed: " + e.collectionId() + "!";
        }
        return prefix + event.name() + " " + event.attributes();
    }
}
