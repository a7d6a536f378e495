package com.clawcron.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CronConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("config.json");
    }

    @Test
    void loadConfig_validJson_returnsCronSection() throws IOException {
        String json = """
                {
                  "cron": {
                    "enabled": false,
                    "store": "/var/lib/clawcron/jobs.json",
                    "maxConcurrentRuns": 3,
                    "webhook": "https://hooks.example.invalid/cron",
                    "webhookToken": "secret"
                  },
                  "gateway": { "port": 4000 }
                }
                """;
        Files.writeString(configPath, json);

        ClawcronConfig.CronConfig cron = new CronConfigService(configPath).loadCronConfig();

        assertFalse(cron.isEnabledOrDefault());
        assertEquals("/var/lib/clawcron/jobs.json", cron.getStore());
        assertEquals(3, cron.resolveMaxConcurrentRuns());
        assertEquals("https://hooks.example.invalid/cron", cron.getWebhook());
        assertEquals("secret", cron.getWebhookToken());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        CronConfigService service = new CronConfigService(tempDir.resolve("nonexistent.json"));
        ClawcronConfig.CronConfig cron = service.loadCronConfig();

        assertNotNull(cron);
        assertTrue(cron.isEnabledOrDefault());
        assertEquals(ClawcronConfig.CronConfig.DEFAULT_MAX_CONCURRENT_RUNS, cron.resolveMaxConcurrentRuns());
        assertEquals(ClawcronConfig.CronConfig.DEFAULT_TICK_INTERVAL_MS, cron.resolveTickIntervalMs());
        assertEquals(ClawcronConfig.CronConfig.DEFAULT_RUN_TIMEOUT_MS, cron.resolveRunTimeoutMs());
    }

    @Test
    void loadConfig_malformedJson_fallsBackToDefaults() throws IOException {
        Files.writeString(configPath, "{ \"cron\": ");

        ClawcronConfig config = new CronConfigService(configPath).loadConfig();

        assertNotNull(config.getCron());
        assertNull(config.getCron().getStore());
    }

    @Test
    void loadConfig_substitutesEnvironment() throws IOException {
        Files.writeString(configPath, """
                { "cron": { "webhookToken": "${CRON_TOKEN}", "store": "${CRON_STORE:-/tmp/jobs.json}" } }
                """);

        CronConfigService service = CronConfigService.withEnv(configPath, Map.of("CRON_TOKEN", "tok-1"));
        ClawcronConfig.CronConfig cron = service.loadCronConfig();

        assertEquals("tok-1", cron.getWebhookToken());
        assertEquals("/tmp/jobs.json", cron.getStore());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        CronConfigService service = CronConfigService.withEnv(configPath, Map.of());
        assertEquals("hello", service.substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_missingWithoutDefault_isEmpty() {
        CronConfigService service = CronConfigService.withEnv(configPath, Map.of());
        assertEquals("[]", service.substituteEnvVars("[${NOPE}]"));
    }

    @Test
    void loadConfig_isCachedUntilReload() throws IOException {
        Files.writeString(configPath, "{ \"cron\": { \"maxConcurrentRuns\": 2 } }");

        CronConfigService service = new CronConfigService(configPath);
        ClawcronConfig first = service.loadConfig();
        assertSame(first, service.loadConfig());

        Files.writeString(configPath, "{ \"cron\": { \"maxConcurrentRuns\": 5 } }");
        assertEquals(5, service.reloadConfig().getCron().resolveMaxConcurrentRuns());
    }

    @Test
    void cronConfig_clampsOutOfRangeValues() {
        ClawcronConfig.CronConfig cron = new ClawcronConfig.CronConfig();
        cron.setMaxConcurrentRuns(0);
        cron.setTickIntervalMs(5L);

        assertEquals(1, cron.resolveMaxConcurrentRuns());
        assertEquals(ClawcronConfig.CronConfig.MIN_TICK_INTERVAL_MS, cron.resolveTickIntervalMs());
    }
}
