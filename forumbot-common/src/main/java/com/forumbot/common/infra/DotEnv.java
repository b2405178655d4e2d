package com.forumbot.common.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads {@code .env} files into an environment overlay.
 * Values already present (and non-blank) in the target are NOT overridden, so
 * the real process environment always wins over the file.
 */
public final class DotEnv {

    private DotEnv() {
    }

    private static final Logger log = LoggerFactory.getLogger(DotEnv.class);

    /**
     * Build an environment view: the process environment overlaid on
     * {@code <user.dir>/.env}.
     */
    public static Map<String, String> processEnvironment() {
        Map<String, String> env = new LinkedHashMap<>(System.getenv());
        loadFile(Path.of(System.getProperty("user.dir"), ".env"), env);
        return env;
    }

    /**
     * Apply the entries of a {@code .env} file to {@code target} without
     * overriding existing non-blank values.
     *
     * @return the number of entries applied
     */
    public static int loadFile(Path path, Map<String, String> target) {
        if (!Files.exists(path)) {
            return 0;
        }
        int applied = 0;
        for (Map.Entry<String, String> entry : parseEnvFile(path).entrySet()) {
            String existing = target.get(entry.getKey());
            if (existing != null && !existing.isBlank()) {
                continue;
            }
            target.put(entry.getKey(), entry.getValue());
            applied++;
        }
        if (applied > 0) {
            log.debug("dotenv: loaded {} vars from {}", applied, path);
        }
        return applied;
    }

    /**
     * Parse a .env file into key-value pairs.
     * Supports: KEY=value, KEY="quoted value", KEY='quoted value', export
     * KEY=value. Lines starting with # are comments.
     */
    public static Map<String, String> parseEnvFile(Path path) {
        Map<String, String> result = new LinkedHashMap<>();
        if (!Files.exists(path)) {
            return result;
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                if (trimmed.startsWith("export ")) {
                    trimmed = trimmed.substring(7).trim();
                }
                int eq = trimmed.indexOf('=');
                if (eq <= 0) {
                    continue;
                }
                String key = trimmed.substring(0, eq).trim();
                String value = unquote(trimmed.substring(eq + 1).trim());
                if (!key.isEmpty()) {
                    result.put(key, value);
                }
            }
        } catch (IOException e) {
            log.warn("dotenv: failed to read {}: {}", path, e.getMessage());
        }
        return result;
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\""))
                        || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
