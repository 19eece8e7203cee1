package io.kairos.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return home().resolve(".kairos").resolve("config.json");
    }

    /**
     * Resolves a configured path, expanding a leading {@code ~/} to the user's home.
     */
    public static Path resolve(String rawPath, Path fallback) {
        if (rawPath == null || rawPath.isBlank()) {
            return fallback;
        }
        if (rawPath.startsWith("~/")) {
            return home().resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    public static Path resolveStorage(String rawPath) {
        return resolve(rawPath, home().resolve(".kairos").resolve("memories"));
    }

    public static Path resolveAuditFile(String rawPath) {
        return resolve(rawPath, home().resolve(".kairos").resolve("observability").resolve("audit-events.json"));
    }

    private static Path home() {
        return Path.of(System.getProperty("user.home"));
    }
}
