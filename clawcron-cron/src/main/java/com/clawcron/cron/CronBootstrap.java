package com.clawcron.cron;

import com.clawcron.common.config.ClawcronConfig;
import com.clawcron.common.config.CronConfigService;
import com.clawcron.common.config.CronPaths;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Builds and configures the cron service from the {@code cron} config section
 * and the host's collaborators.
 *
 * <p>
 * {@code CLAWCRON_SKIP_CRON=1} keeps the timer off while leaving job
 * management available.
 */
@Slf4j
public class CronBootstrap {

    static final String SKIP_CRON_ENV = "CLAWCRON_SKIP_CRON";

    private final CronService cronService;
    private final boolean cronEnabled;

    public CronBootstrap(CronConfigService configService,
            CronState.CronJobRunner runner,
            CronState.SystemEventSink systemEventSink,
            CronState.HeartbeatRequester heartbeatRequester,
            Consumer<CronState.CronEvent> onEvent) {
        this(configService.loadCronConfig(), System.getenv(), System.getProperty("user.home"),
                CronState.CronServiceDeps.builder()
                        .runner(runner)
                        .systemEventSink(systemEventSink)
                        .heartbeatRequester(heartbeatRequester)
                        .onEvent(onEvent));
    }

    /**
     * @param collaborators deps builder carrying the runner and sinks; config
     *                      derived fields are overwritten
     */
    public CronBootstrap(ClawcronConfig.CronConfig cron,
            Map<String, String> env,
            String homedir,
            CronState.CronServiceDeps.CronServiceDepsBuilder collaborators) {
        ClawcronConfig.CronConfig cfg = cron != null ? cron : new ClawcronConfig.CronConfig();
        this.cronEnabled = !"1".equals(env.get(SKIP_CRON_ENV)) && cfg.isEnabledOrDefault();

        Path storePath = CronPaths.resolveCronStorePath(cfg, env, homedir);
        CronState.CronServiceDeps deps = collaborators
                .storePath(storePath)
                .cronEnabled(cronEnabled)
                .maxConcurrentRuns(cfg.resolveMaxConcurrentRuns())
                .tickIntervalMs(cfg.resolveTickIntervalMs())
                .runTimeoutMs(cfg.resolveRunTimeoutMs())
                .legacyWebhook(cfg.getWebhook())
                .webhookToken(cfg.getWebhookToken())
                .build();
        this.cronService = new CronService(deps);
        log.debug("cron: store {}, enabled {}", storePath, cronEnabled);
    }

    /**
     * Load the store and, when enabled, start the timer.
     */
    public void start() {
        if (!cronEnabled) {
            log.info("cron: disabled by config or {}", SKIP_CRON_ENV);
        }
        cronService.start();
    }

    public void stop() {
        cronService.close();
    }

    public boolean isCronEnabled() {
        return cronEnabled;
    }

    public CronService getCronService() {
        return cronService;
    }
}
