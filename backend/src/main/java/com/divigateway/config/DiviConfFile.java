package com.divigateway.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the node's divi.conf for the RPC credentials the gateway needs.
 */
public final class DiviConfFile {

    /** Keys picked up from divi.conf; everything else is node-only configuration. */
    public static final Set<String> KEYS = Set.of("rpcuser", "rpcpassword", "rpcport");

    private DiviConfFile() {
    }

    /**
     * Platform default location: %APPDATA%\DIVI on Windows, ~/Library/Application Support/DIVI
     * on macOS, ~/.divi elsewhere.
     */
    public static Path defaultPath(String osName, String userHome, String appData) {
        String os = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        if (os.startsWith("windows")) {
            String base = appData != null ? appData : Path.of(userHome, "AppData", "Roaming").toString();
            return Path.of(base, "DIVI", "divi.conf");
        }
        if (os.startsWith("mac")) {
            return Path.of(userHome, "Library", "Application Support", "DIVI", "divi.conf");
        }
        return Path.of(userHome, ".divi", "divi.conf");
    }

    public static Map<String, String> read(Path path) throws IOException {
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    /**
     * {@code key=value} lines; comments, blank values and unknown keys are skipped. Last one wins.
     */
    public static Map<String, String> parse(List<String> lines) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String line : lines) {
            String trimmed = line.strip();
            if (trimmed.startsWith("#")) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String key = trimmed.substring(0, eq).strip();
            String value = trimmed.substring(eq + 1).strip();
            if (KEYS.contains(key) && !value.isEmpty()) {
                values.put(key, value);
            }
        }
        return values;
    }
}
