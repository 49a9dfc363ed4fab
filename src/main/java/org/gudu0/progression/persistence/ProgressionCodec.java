package org.gudu0.progression.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.gudu0.progression.util.ConsoleLog;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes the save document:
 * <pre>
 * {
 *   "version": 1,
 *   "savedAtMillis": ...,
 *   "counters":     { key: value },
 *   "achievements": { id: { unlocked, claimed, unlockTimestamp, progress, grantPending } },
 *   "collections":  { id: { completed, rewardGranted, grantPending,
 *                           items: { itemId: { collected, collectTimestamp } } } }
 * }
 * </pre>
 * Decoding is tolerant: unknown fields are ignored, a corrupt entry is dropped and logged,
 * and an unreadable document decodes to an empty save.
 */
public class ProgressionCodec {
    public static final int VERSION = 1;

    private final ObjectMapper om;

    public ProgressionCodec() {
        this.om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String encode(SaveData data) {
        ObjectNode root = om.createObjectNode();
        root.put("version", VERSION);
        root.put("savedAtMillis", data.savedAtMillis);

        ObjectNode counters = root.putObject("counters");
        for (Map.Entry<String, Long> e : data.counters.entrySet()) {
            counters.put(e.getKey(), e.getValue());
        }

        ObjectNode achievements = root.putObject("achievements");
        for (Map.Entry<String, SaveData.AchievementRecord> e : data.achievements.entrySet()) {
            SaveData.AchievementRecord r = e.getValue();
            ObjectNode n = achievements.putObject(e.getKey());
            n.put("unlocked", r.unlocked());
            n.put("claimed", r.claimed());
            if (r.unlockedAtMillis() != null) n.put("unlockTimestamp", r.unlockedAtMillis());
            else n.putNull("unlockTimestamp");
            n.put("progress", r.progress());
            n.put("grantPending", r.grantPending());
        }

        ObjectNode collections = root.putObject("collections");
        for (Map.Entry<String, SaveData.CollectionRecord> e : data.collections.entrySet()) {
            SaveData.CollectionRecord r = e.getValue();
            ObjectNode n = collections.putObject(e.getKey());
            n.put("completed", r.completed());
            n.put("rewardGranted", r.rewardGranted());
            n.put("grantPending", r.grantPending());

            ObjectNode items = n.putObject("items");
            for (Map.Entry<String, SaveData.ItemRecord> ie : r.items().entrySet()) {
                ObjectNode in = items.putObject(ie.getKey());
                in.put("collected", ie.getValue().collected());
                if (ie.getValue().collectedAtMillis() != null) in.put("collectTimestamp", ie.getValue().collectedAtMillis());
                else in.putNull("collectTimestamp");
            }
        }

        try {
            return om.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            // a tree of plain values always serializes
            throw new IllegalStateException("Failed to encode save document", e);
        }
    }

    public SaveData decode(String blob) {
        if (blob == null || blob.isBlank()) return SaveData.empty();

        JsonNode root;
        try {
            root = om.readTree(blob);
        } catch (Exception e) {
            ConsoleLog.error("Codec", "Save document unreadable, starting fresh: " + e.getMessage());
            return SaveData.empty();
        }
        if (root == null || !root.isObject()) {
            ConsoleLog.error("Codec", "Save document is not a JSON object, starting fresh");
            return SaveData.empty();
        }

        int version = root.path("version").asInt(VERSION);
        if (version > VERSION) {
            ConsoleLog.warn("Codec", "Save document version " + version + " is newer than " + VERSION + "; reading known fields only");
        }

        long savedAt = root.path("savedAtMillis").canConvertToLong() ? root.path("savedAtMillis").asLong() : 0L;

        return new SaveData(
                decodeCounters(root.get("counters")),
                decodeAchievements(root.get("achievements")),
                decodeCollections(root.get("collections")),
                savedAt
        );
    }

    private Map<String, Long> decodeCounters(JsonNode node) {
        Map<String, Long> out = new LinkedHashMap<>();
        if (!sectionIsObject("counters", node)) return out;

        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            if (!v.isIntegralNumber() || !v.canConvertToLong() || v.asLong() < 0) {
                ConsoleLog.warn("Codec", "Dropping corrupt counter key=" + e.getKey() + " value=" + v);
                continue;
            }
            out.put(e.getKey(), v.asLong());
        }
        return out;
    }

    private Map<String, SaveData.AchievementRecord> decodeAchievements(JsonNode node) {
        Map<String, SaveData.AchievementRecord> out = new LinkedHashMap<>();
        if (!sectionIsObject("achievements", node)) return out;

        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            try {
                out.put(e.getKey(), decodeAchievement(e.getValue()));
            } catch (CorruptEntryException ex) {
                ConsoleLog.warn("Codec", "Dropping corrupt achievement id=" + e.getKey() + ": " + ex.getMessage());
            }
        }
        return out;
    }

    private SaveData.AchievementRecord decodeAchievement(JsonNode n) {
        if (!n.isObject()) throw new CorruptEntryException("not an object");

        boolean unlocked = bool(n, "unlocked");
        boolean claimed = bool(n, "claimed");
        if (claimed && !unlocked) throw new CorruptEntryException("claimed without unlocked");

        return new SaveData.AchievementRecord(
                unlocked,
                claimed,
                optionalLong(n, "unlockTimestamp"),
                nonNegativeLong(n, "progress"),
                bool(n, "grantPending")
        );
    }

    private Map<String, SaveData.CollectionRecord> decodeCollections(JsonNode node) {
        Map<String, SaveData.CollectionRecord> out = new LinkedHashMap<>();
        if (!sectionIsObject("collections", node)) return out;

        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            try {
                out.put(e.getKey(), decodeCollection(e.getKey(), e.getValue()));
            } catch (CorruptEntryException ex) {
                ConsoleLog.warn("Codec", "Dropping corrupt collection id=" + e.getKey() + ": " + ex.getMessage());
            }
        }
        return out;
    }

    private SaveData.CollectionRecord decodeCollection(String collectionId, JsonNode n) {
        if (!n.isObject()) throw new CorruptEntryException("not an object");

        Map<String, SaveData.ItemRecord> items = new LinkedHashMap<>();
        JsonNode itemsNode = n.get("items");
        if (itemsNode != null && !itemsNode.isNull()) {
            if (!itemsNode.isObject()) throw new CorruptEntryException("items is not an object");

            for (Iterator<Map.Entry<String, JsonNode>> it = itemsNode.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> ie = it.next();
                try {
                    JsonNode in = ie.getValue();
                    if (!in.isObject()) throw new CorruptEntryException("not an object");
                    items.put(ie.getKey(), new SaveData.ItemRecord(bool(in, "collected"), optionalLong(in, "collectTimestamp")));
                } catch (CorruptEntryException ex) {
                    ConsoleLog.warn("Codec", "Dropping corrupt item=" + ie.getKey() + " in collection=" + collectionId + ": " + ex.getMessage());
                }
            }
        }

        return new SaveData.CollectionRecord(
                bool(n, "completed"),
                bool(n, "rewardGranted"),
                bool(n, "grantPending"),
                items
        );
    }

    private static boolean sectionIsObject(String name, JsonNode node) {
        if (node == null || node.isNull()) return false;
        if (!node.isObject()) {
            ConsoleLog.warn("Codec", "Dropping corrupt section \"" + name + "\" (not an object)");
            return false;
        }
        return true;
    }

    private static boolean bool(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return false;
        if (!v.isBoolean()) throw new CorruptEntryException(field + " is not a boolean");
        return v.booleanValue();
    }

    private static Long optionalLong(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isIntegralNumber() || !v.canConvertToLong()) throw new CorruptEntryException(field + " is not an integer");
        return v.asLong();
    }

    private static long nonNegativeLong(JsonNode n, String field) {
        Long v = optionalLong(n, field);
        if (v == null) return 0L;
        if (v < 0) throw new CorruptEntryException(field + " is negative");
        return v;
    }

    private static final class CorruptEntryException extends RuntimeException {
        CorruptEntryException(String message) {
            super(message);
        }
    }
}
