package org.gudu0.progression.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.gudu0.progression.achievements.AchievementDef;
import org.gudu0.progression.collections.CollectionDef;
import org.gudu0.progression.collections.CollectionItemDef;
import org.gudu0.progression.requirements.Requirement;
import org.gudu0.progression.requirements.RequirementSet;
import org.gudu0.progression.rewards.Reward;
import org.gudu0.progression.rewards.RewardManifest;
import org.gudu0.progression.util.ConsoleLog;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a JSON catalog file. Unlike runtime state, the catalog is strict: any malformed
 * entry or unknown field fails the whole load with a {@link ConfigurationException}.
 */
public final class CatalogLoader {
    private CatalogLoader() {}

    private static final ObjectMapper OM = new ObjectMapper();

    public static Catalog load(Path path, int maxPerCategory) {
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read catalog " + path + ": " + e.getMessage(), e);
        }
        Catalog catalog = parse(json, maxPerCategory);
        ConsoleLog.info("CatalogLoader", "Loaded catalog from " + path + ": "
                + catalog.achievements().size() + " achievements, "
                + catalog.collections().size() + " collections");
        return catalog;
    }

    public static Catalog parse(String json, int maxPerCategory) {
        CatalogFile file;
        try {
            file = OM.readValue(json, CatalogFile.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed catalog JSON: " + e.getOriginalMessage(), e);
        }
        if (file == null) throw new ConfigurationException("Catalog is empty");

        List<AchievementDef> achievements = new ArrayList<>();
        if (file.achievements != null) {
            for (CatalogFile.AchievementEntry e : file.achievements) {
                if (e == null) throw new ConfigurationException("Null achievement entry");
                achievements.add(new AchievementDef(
                        e.id, e.name, e.description, e.category, e.rarity,
                        requirements(e.id, e.requirements),
                        rewards(e.rewards),
                        e.priority
                ));
            }
        }

        List<CollectionDef> collections = new ArrayList<>();
        if (file.collections != null) {
            for (CatalogFile.CollectionEntry e : file.collections) {
                if (e == null) throw new ConfigurationException("Null collection entry");
                List<CollectionItemDef> items = new ArrayList<>();
                if (e.items != null) {
                    for (CatalogFile.ItemEntry i : e.items) {
                        if (i == null) throw new ConfigurationException("Null item in collection " + e.id);
                        items.add(new CollectionItemDef(i.id, i.name, i.description, i.category, i.rarity, i.properties));
                    }
                }
                collections.add(new CollectionDef(e.id, e.name, e.description, items, rewards(e.rewards)));
            }
        }

        return Catalog.of(achievements, collections, maxPerCategory);
    }

    private static RequirementSet requirements(String achievementId, List<CatalogFile.RequirementEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new ConfigurationException("Achievement " + achievementId + " has no requirements");
        }
        List<Requirement> out = new ArrayList<>(entries.size());
        for (CatalogFile.RequirementEntry r : entries) {
            if (r == null) throw new ConfigurationException("Null requirement in achievement " + achievementId);
            out.add(new Requirement(r.key, r.threshold));
        }
        try {
            return RequirementSet.of(out);
        } catch (ConfigurationException e) {
            throw new ConfigurationException("Achievement " + achievementId + ": " + e.getMessage(), e);
        }
    }

    private static RewardManifest rewards(List<CatalogFile.RewardEntry> entries) {
        if (entries == null || entries.isEmpty()) return RewardManifest.none();
        List<Reward> out = new ArrayList<>(entries.size());
        for (CatalogFile.RewardEntry r : entries) {
            if (r == null) throw new ConfigurationException("Null reward entry");
            out.add(new Reward(r.kind, r.amount, r.itemId));
        }
        return new RewardManifest(out);
    }
}
