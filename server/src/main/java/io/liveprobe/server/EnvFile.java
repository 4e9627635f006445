package io.liveprobe.server;

import io.liveprobe.core.config.ConfigurationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal .env loader.
 *
 * Accepts KEY=VALUE lines with an optional "export " prefix, single or
 * double quoted values, blank lines and # comments. Values from the real
 * process environment always win over the file.
 */
public final class EnvFile {

    private EnvFile() {
        // utility
    }

    /**
     * Parse a .env file. A missing file yields an empty map.
     */
    public static Map<String, String> load(Path path) {
        if (!Files.isRegularFile(path)) {
            return Map.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + path + ": " + e.getMessage(), e);
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("export ")) {
                line = line.substring("export ".length()).strip();
            }
            int eq = line.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = line.substring(0, eq).strip();
            String value = unquote(line.substring(eq + 1).strip());
            out.put(key, value);
        }
        return out;
    }

    /**
     * The .env file's values overlaid by the real environment.
     */
    public static Map<String, String> overlay(Path dotEnv, Map<String, String> processEnv) {
        Map<String, String> merged = new HashMap<>(load(dotEnv));
        merged.putAll(processEnv);
        return merged;
    }

    static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        // Trailing comment on an unquoted value.
        int hash = value.indexOf(" #");
        return hash >= 0 ? value.substring(0, hash).strip() : value;
    }
}
