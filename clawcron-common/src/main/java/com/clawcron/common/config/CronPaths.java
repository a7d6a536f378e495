package com.clawcron.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * State directory and cron store path resolution.
 */
public final class CronPaths {

    private CronPaths() {
    }

    private static final String STATE_DIRNAME = ".clawcron";
    private static final String STORE_DIRNAME = "cron";
    private static final String STORE_FILENAME = "jobs.json";

    /**
     * State directory for mutable data. Overridden via CLAWCRON_STATE_DIR.
     * Default: ~/.clawcron
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv(), homeDir());
    }

    public static Path resolveStateDir(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, "CLAWCRON_STATE_DIR");
        if (override != null) {
            return resolveUserPath(override);
        }
        return Path.of(homedir, STATE_DIRNAME);
    }

    /**
     * Store file path: the configured {@code cron.store} value, or
     * {@code <stateDir>/cron/jobs.json}.
     */
    public static Path resolveCronStorePath(ClawcronConfig.CronConfig cron) {
        return resolveCronStorePath(cron, System.getenv(), homeDir());
    }

    public static Path resolveCronStorePath(ClawcronConfig.CronConfig cron, Map<String, String> env,
            String homedir) {
        String configured = cron != null ? cron.getStore() : null;
        if (configured != null && !configured.isBlank()) {
            return resolveUserPath(configured);
        }
        return resolveStateDir(env, homedir).resolve(STORE_DIRNAME).resolve(STORE_FILENAME);
    }

    /**
     * Resolve a user path: expands ~ to the home directory, resolves to absolute.
     */
    public static Path resolveUserPath(String input) {
        if (input == null)
            return Path.of("");
        String trimmed = input.trim();
        if (trimmed.isEmpty())
            return Path.of("");
        if (trimmed.startsWith("~")) {
            return Path.of(homeDir() + trimmed.substring(1)).toAbsolutePath().normalize();
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }

    private static String homeDir() {
        return System.getProperty("user.home");
    }

    private static String envTrimmed(Map<String, String> env, String key) {
        String val = env.get(key);
        return val != null && !val.trim().isEmpty() ? val.trim() : null;
    }
}
