package com.clawcron.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the scheduler configuration file.
 */
@Slf4j
public class CronConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, ClawcronConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public CronConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public CronConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        this.configPath = CronPaths.resolveUserPath(configPath.toString());
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public ClawcronConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public ClawcronConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Shortcut for the cron section, never null.
     */
    public ClawcronConfig.CronConfig loadCronConfig() {
        return loadConfig().getCron();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private ClawcronConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new ClawcronConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            ClawcronConfig config = raw.isBlank()
                    ? new ClawcronConfig()
                    : objectMapper.readValue(raw, ClawcronConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new ClawcronConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String value = env.apply(matcher.group(1));
            if (value == null) {
                String defaultValue = matcher.group(2);
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    ClawcronConfig applyDefaults(ClawcronConfig config) {
        if (config.getCron() == null) {
            config.setCron(new ClawcronConfig.CronConfig());
        }
        return config;
    }

    /**
     * Build a config service whose environment lookups come from a fixed map.
     */
    static CronConfigService withEnv(Path configPath, Map<String, String> env) {
        return new CronConfigService(configPath, DEFAULT_CACHE_TTL, env::get);
    }
}
