package com.clawcron.cron;

import lombok.Builder;
import lombok.Data;
import okhttp3.OkHttpClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Cron service state types: collaborator contracts, dependencies, run
 * outcomes and lifecycle events.
 */
public final class CronState {

    private CronState() {
    }

    // =========================================================================
    // Collaborators
    // =========================================================================

    /**
     * Execution backend. Runs a job's payload and reports the outcome; the
     * scheduler never looks inside the payload.
     */
    @FunctionalInterface
    public interface CronJobRunner {
        CompletableFuture<CronRunOutcome> run(CronJob job);
    }

    /**
     * Fire-and-forget sink for system events observed by the main session.
     */
    @FunctionalInterface
    public interface SystemEventSink {
        void enqueue(String text, String contextKey);
    }

    /**
     * Requests an out-of-band heartbeat of the main session.
     */
    @FunctionalInterface
    public interface HeartbeatRequester {
        void requestNow(String reason);
    }

    // =========================================================================
    // Event types
    // =========================================================================

    public enum CronAction {
        ADDED, UPDATED, REMOVED, STARTED, FINISHED
    }

    /**
     * Cron lifecycle event.
     */
    @Data
    @Builder
    public static class CronEvent {
        private String jobId;
        private CronAction action;
        private Instant runAt;
        private Long durationMs;
        private CronTypes.RunStatus status;
        private String error;
        private String summary;
        private Instant nextRunAt;
    }

    // =========================================================================
    // Dependencies
    // =========================================================================

    /**
     * Dependencies for cron service initialization. Only {@code storePath} and
     * {@code runner} are required.
     */
    @Data
    @Builder
    public static class CronServiceDeps {
        private Path storePath;
        @Builder.Default
        private boolean cronEnabled = true;
        @Builder.Default
        private int maxConcurrentRuns = 1;
        @Builder.Default
        private long tickIntervalMs = 1_000;
        /** Zero or negative disables the per-run bound. */
        @Builder.Default
        private long runTimeoutMs = 10 * 60_000;
        /** Deprecated process-wide fallback for jobs without a delivery. */
        private String legacyWebhook;
        private String webhookToken;
        private CronJobRunner runner;
        private SystemEventSink systemEventSink;
        private HeartbeatRequester heartbeatRequester;
        private Consumer<CronEvent> onEvent;
        @Builder.Default
        private Clock clock = Clock.systemUTC();
        /** Webhook client; a default client is built when absent. */
        private OkHttpClient httpClient;
        /** Executor that invokes the runner; an owned pool is created when absent. */
        private Executor runExecutor;
    }

    // =========================================================================
    // Result types
    // =========================================================================

    /**
     * Outcome of one execution, folded into the job and handed to delivery.
     */
    public record CronRunOutcome(CronTypes.RunStatus status, String error, String summary) {

        public static CronRunOutcome ok() {
            return new CronRunOutcome(CronTypes.RunStatus.OK, null, null);
        }

        public static CronRunOutcome ok(String summary) {
            return new CronRunOutcome(CronTypes.RunStatus.OK, null, summary);
        }

        public static CronRunOutcome error(String error) {
            return new CronRunOutcome(CronTypes.RunStatus.ERROR, error, null);
        }

        public boolean isOk() {
            return status == CronTypes.RunStatus.OK;
        }
    }

    /** Result of a manual run request. */
    public sealed interface CronRunResult {
        boolean ran();
    }

    public record CronRan(CronRunOutcome outcome) implements CronRunResult {
        @Override
        public boolean ran() {
            return true;
        }
    }

    /** Reason is one of "not-due", "already-running", "concurrency-limit", "stopped". */
    public record CronNotRun(String reason) implements CronRunResult {
        @Override
        public boolean ran() {
            return false;
        }
    }

    /** Result of removing a cron job. */
    public record CronRemoveResult(boolean ok, boolean removed) {
    }

    // =========================================================================
    // Enums
    // =========================================================================

    public enum CronRunMode {
        DUE, FORCE
    }

    // =========================================================================
    // Status
    // =========================================================================

    /**
     * Cron status summary for diagnostics.
     */
    @Data
    @Builder
    public static class CronStatusSummary {
        private boolean enabled;
        private boolean started;
        private String storePath;
        private int jobs;
        private int running;
        private int maxConcurrentRuns;
        private Instant nextWakeAt;
    }
}
