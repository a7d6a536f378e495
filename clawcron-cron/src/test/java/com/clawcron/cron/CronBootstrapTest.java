package com.clawcron.cron;

import com.clawcron.common.config.ClawcronConfig;
import com.clawcron.common.config.CronConfigService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CronBootstrapTest {

    @TempDir
    Path tempDir;

    private CronState.CronServiceDeps.CronServiceDepsBuilder collaborators() {
        return CronState.CronServiceDeps.builder()
                .runner(new CronTestSupport.FakeRunner())
                .runExecutor(Runnable::run);
    }

    @Test
    void defaults_storeUnderStateDir() {
        CronBootstrap bootstrap = new CronBootstrap(null, Map.of(), tempDir.toString(), collaborators());
        try {
            assertTrue(bootstrap.isCronEnabled());
            assertEquals(tempDir.resolve(".clawcron").resolve("cron").resolve("jobs.json").toString(),
                    bootstrap.getCronService().status().getStorePath());
            assertEquals(1, bootstrap.getCronService().status().getMaxConcurrentRuns());
        } finally {
            bootstrap.stop();
        }
    }

    @Test
    void stateDirOverrideFromEnv() {
        Path stateDir = tempDir.resolve("state");
        CronBootstrap bootstrap = new CronBootstrap(new ClawcronConfig.CronConfig(),
                Map.of("CLAWCRON_STATE_DIR", stateDir.toString()), tempDir.toString(), collaborators());
        try {
            assertEquals(stateDir.resolve("cron").resolve("jobs.json").toString(),
                    bootstrap.getCronService().status().getStorePath());
        } finally {
            bootstrap.stop();
        }
    }

    @Test
    void skipEnvDisablesTimerButKeepsManagement() {
        ClawcronConfig.CronConfig cron = new ClawcronConfig.CronConfig();
        cron.setStore(tempDir.resolve("jobs.json").toString());
        CronBootstrap bootstrap = new CronBootstrap(cron, Map.of("CLAWCRON_SKIP_CRON", "1"),
                tempDir.toString(), collaborators());
        try {
            bootstrap.start();
            assertFalse(bootstrap.isCronEnabled());
            assertTrue(bootstrap.getCronService().isStarted());
            assertFalse(bootstrap.getCronService().status().isEnabled());
            bootstrap.getCronService().add(CronTestSupport.everyJob("managed", 60_000));
            assertTrue(Files.exists(tempDir.resolve("jobs.json")));
        } finally {
            bootstrap.stop();
        }
    }

    @Test
    void configDisabled() {
        ClawcronConfig.CronConfig cron = new ClawcronConfig.CronConfig();
        cron.setEnabled(false);
        cron.setStore(tempDir.resolve("jobs.json").toString());
        CronBootstrap bootstrap = new CronBootstrap(cron, Map.of(), tempDir.toString(), collaborators());
        try {
            assertFalse(bootstrap.isCronEnabled());
        } finally {
            bootstrap.stop();
        }
    }

    @Test
    void fromConfigFile() throws IOException {
        Path store = tempDir.resolve("custom").resolve("jobs.json");
        Path configPath = tempDir.resolve("clawcron.json");
        Files.writeString(configPath, """
                { "cron": { "store": "%s", "maxConcurrentRuns": 4, "enabled": false } }
                """.formatted(store.toString().replace("\\", "\\\\")));

        CronBootstrap bootstrap = new CronBootstrap(new CronConfigService(configPath),
                new CronTestSupport.FakeRunner(), null, null, null);
        try {
            CronState.CronStatusSummary status = bootstrap.getCronService().status();
            assertEquals(store.toString(), status.getStorePath());
            assertEquals(4, status.getMaxConcurrentRuns());
            assertFalse(status.isEnabled());
        } finally {
            bootstrap.stop();
        }
    }
}
