package org.gudu0.progression.persistence;

import org.gudu0.progression.util.ConsoleLog;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Save document stored as a JSON file, written via tmp file + atomic move.
 */
public class FileSaveSlot implements SaveSlot {
    private final Path path;

    public FileSaveSlot(Path path) {
        this.path = path;
    }

    @Override
    public Optional<String> read() throws IOException {
        if (!Files.exists(path)) {
            ConsoleLog.warn("FileSaveSlot", "No save at " + path + ", starting fresh");
            return Optional.empty();
        }
        return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
    }

    @Override
    public synchronized void write(String blob) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, blob, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            ConsoleLog.debug("FileSaveSlot", "Atomic move unsupported for " + path + ", replacing instead");
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public String describe() {
        return path.toString();
    }
}
