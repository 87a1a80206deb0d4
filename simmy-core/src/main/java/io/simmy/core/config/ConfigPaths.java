package io.simmy.core.config;

import java.nio.file.Path;

/**
 * Default locations under {@code ~/.simmy}, and {@code ~} expansion for paths read from the config file.
 */
public final class ConfigPaths {
    static final String DEFAULT_LOG_DIRECTORY = "simmy-agent-logs";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return simmyHome().resolve("config.json");
    }

    public static Path resolveWorkspace(String configured) {
        return isBlank(configured) ? simmyHome().resolve("workspace") : expandHome(configured);
    }

    /** Relative log directories resolve against the working directory. */
    public static Path resolveLogDirectory(String configured) {
        return expandHome(isBlank(configured) ? DEFAULT_LOG_DIRECTORY : configured);
    }

    static Path expandHome(String raw) {
        if (raw.equals("~")) {
            return userHome();
        }
        if (raw.startsWith("~/")) {
            return userHome().resolve(raw.substring(2));
        }
        return Path.of(raw);
    }

    private static Path simmyHome() {
        return userHome().resolve(".simmy");
    }

    private static Path userHome() {
        return Path.of(System.getProperty("user.home"));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
