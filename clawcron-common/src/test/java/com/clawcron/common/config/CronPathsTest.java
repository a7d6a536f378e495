package com.clawcron.common.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CronPathsTest {

    @Test
    void resolveStateDir_defaultsUnderHome() {
        assertEquals(Path.of("/home/u", ".clawcron"), CronPaths.resolveStateDir(Map.of(), "/home/u"));
    }

    @Test
    void resolveStateDir_envOverride() {
        Path dir = CronPaths.resolveStateDir(Map.of("CLAWCRON_STATE_DIR", " /srv/state "), "/home/u");
        assertEquals(Path.of("/srv/state"), dir);
    }

    @Test
    void resolveCronStorePath_defaultsToJobsJson() {
        Path path = CronPaths.resolveCronStorePath(new ClawcronConfig.CronConfig(), Map.of(), "/home/u");
        assertEquals(Path.of("/home/u", ".clawcron", "cron", "jobs.json"), path);
    }

    @Test
    void resolveCronStorePath_usesConfiguredStore() {
        ClawcronConfig.CronConfig cron = new ClawcronConfig.CronConfig();
        cron.setStore("/data/cron.json");

        assertEquals(Path.of("/data/cron.json"), CronPaths.resolveCronStorePath(cron, Map.of(), "/home/u"));
    }

    @Test
    void resolveUserPath_expandsTilde() {
        Path resolved = CronPaths.resolveUserPath("~/jobs.json");
        assertEquals(Path.of(System.getProperty("user.home"), "jobs.json").toAbsolutePath().normalize(), resolved);
    }
}
