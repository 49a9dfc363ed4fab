package org.gudu0.progression.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

public final class EnginePaths {
    private EnginePaths() {}

    public static final Path DATA = Path.of("data");

    public static final Path CONFIG_FILE = DATA.resolve("config.json");
    public static final Path SLOTS_DIR = DATA.resolve("slots");

    private static final Pattern SLOT_NAME = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    public static boolean isValidSlotName(String slot) {
        return slot != null && SLOT_NAME.matcher(slot).matches();
    }

    public static Path slotDir(String slot) {
        if (!isValidSlotName(slot)) {
            throw new IllegalArgumentException("Invalid save slot name: " + slot);
        }
        return SLOTS_DIR.resolve(slot);
    }

    public static Path slotFile(String slot) {
        return slotDir(slot).resolve("progress.json");
    }

    public static void ensureBaseDirs() {
        try {
            Files.createDirectories(SLOTS_DIR);
            ConsoleLog.info("EnginePaths", "Ensured data dirs: " + DATA + " and " + SLOTS_DIR);
        } catch (Exception e) {
            ConsoleLog.error("EnginePaths", "Failed to create base data dirs: " + e.getMessage(), e);
        }
    }
}
