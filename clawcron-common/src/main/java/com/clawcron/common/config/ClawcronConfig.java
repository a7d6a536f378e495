package com.clawcron.common.config;

import lombok.Data;

/**
 * Root configuration type. Only the {@code cron} section is consumed by the
 * scheduler; unknown sections are ignored on load.
 */
@Data
public class ClawcronConfig {

    /** Cron/scheduling settings. */
    private CronConfig cron;

    @Data
    public static class CronConfig {
        public static final int DEFAULT_MAX_CONCURRENT_RUNS = 1;
        public static final long DEFAULT_TICK_INTERVAL_MS = 1_000;
        public static final long MIN_TICK_INTERVAL_MS = 100;
        public static final long DEFAULT_RUN_TIMEOUT_MS = 10 * 60_000;

        /** Master on/off switch for the run loop. */
        private Boolean enabled;
        /** Store file path; supports a leading {@code ~}. */
        private String store;
        private Integer maxConcurrentRuns;
        /**
         * Deprecated legacy fallback webhook URL, used only for jobs without a
         * per-job delivery. Prefer delivery.mode="webhook" with delivery.to.
         */
        private String webhook;
        /** Bearer token for cron webhook POST delivery. */
        private String webhookToken;
        private Long tickIntervalMs;
        /** Upper bound for a single run; zero or negative disables the bound. */
        private Long runTimeoutMs;

        public boolean isEnabledOrDefault() {
            return enabled == null || enabled;
        }

        public int resolveMaxConcurrentRuns() {
            if (maxConcurrentRuns == null)
                return DEFAULT_MAX_CONCURRENT_RUNS;
            return Math.max(1, maxConcurrentRuns);
        }

        public long resolveTickIntervalMs() {
            if (tickIntervalMs == null)
                return DEFAULT_TICK_INTERVAL_MS;
            return Math.max(MIN_TICK_INTERVAL_MS, tickIntervalMs);
        }

        public long resolveRunTimeoutMs() {
            return runTimeoutMs != null ? runTimeoutMs : DEFAULT_RUN_TIMEOUT_MS;
        }
    }
}
