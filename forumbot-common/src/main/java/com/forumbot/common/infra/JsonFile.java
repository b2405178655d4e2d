package com.forumbot.common.infra;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.UUID;

/**
 * JSON state file load/save.
 * Writes go through a temp file in the same directory followed by a move, so a
 * reader never observes a half-written file.
 */
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Read and parse a JSON file.
     *
     * @return the parsed value, or null if the file does not exist
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static <T> T read(Path path, TypeReference<T> type) throws IOException {
        if (!Files.exists(path))
            return null;
        String raw = Files.readString(path, StandardCharsets.UTF_8);
        if (raw.isBlank())
            throw new IOException("empty JSON file: " + path);
        return MAPPER.readValue(raw, type);
    }

    /**
     * Serialize {@code data} and replace {@code path} with it. Missing parent
     * directories are created.
     */
    public static void write(Path path, Object data) throws IOException {
        Path target = path.toAbsolutePath();
        Path dir = target.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        String json = MAPPER.writeValueAsString(data) + "\n";
        Path tmp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.writeString(tmp, json, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            try {
                Files.setPosixFilePermissions(tmp, PosixFilePermissions.fromString("rw-------"));
            } catch (UnsupportedOperationException ignored) {
                // non-POSIX file system
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
