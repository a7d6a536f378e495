package com.clawcron.cron;

import com.clawcron.common.infra.Durations;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Run loop: selects due jobs, admits them through the concurrency gate,
 * invokes the execution backend and folds the outcome back into the store.
 *
 * <p>
 * All store and gate access happens while holding the store monitor. Backend
 * invocation and delivery run outside it, so a slow job never stalls a tick.
 * </p>
 */
@Slf4j
class CronDispatcher {

    private final CronStore store;
    private final CronConcurrencyGate gate;
    private final CronDeliveryRouter router;
    private final CronState.CronJobRunner runner;
    private final Executor runExecutor;
    private final Clock clock;
    private final long runTimeoutMs;
    private final Runnable persist;
    private final BooleanSupplier alive;
    private final Consumer<CronState.CronEvent> events;
    /** Ids handed to the runner and not yet completed; guarded by the store monitor. */
    private final Set<String> inFlight = new HashSet<>();

    CronDispatcher(CronStore store,
            CronConcurrencyGate gate,
            CronDeliveryRouter router,
            CronState.CronServiceDeps deps,
            Executor runExecutor,
            Runnable persist,
            BooleanSupplier alive,
            Consumer<CronState.CronEvent> events) {
        this.store = store;
        this.gate = gate;
        this.router = router;
        this.runner = deps.getRunner();
        this.runExecutor = runExecutor;
        this.clock = deps.getClock();
        this.runTimeoutMs = deps.getRunTimeoutMs();
        this.persist = persist;
        this.alive = alive;
        this.events = events;
    }

    /**
     * One pass over the store.
     *
     * @return ids of the jobs dispatched by this tick, in dispatch order
     */
    List<String> tick() {
        Instant now = clock.instant();
        List<CronJob> admitted = new ArrayList<>();

        synchronized (store) {
            boolean changed = false;
            for (CronJob job : store.list()) {
                if (!isDue(job, now)) {
                    continue;
                }
                if (!gate.tryAcquire()) {
                    if (job.getState() != CronTypes.JobState.DUE) {
                        job.setState(CronTypes.JobState.DUE);
                        changed = true;
                    }
                    log.debug("cron: job {} due but concurrency limit {} reached", job.getId(), gate.capacity());
                    continue;
                }
                markRunning(job, now);
                admitted.add(job.copy());
                changed = true;
            }
            if (changed) {
                persist.run();
            }
        }

        List<String> ids = new ArrayList<>(admitted.size());
        for (CronJob job : admitted) {
            ids.add(job.getId());
            launch(job, now);
        }
        return ids;
    }

    /**
     * Run one job outside the timer.
     *
     * @throws CronErrors.ValidationError for an unknown id
     */
    CompletableFuture<CronState.CronRunResult> runNow(String id, CronState.CronRunMode mode) {
        Instant now = clock.instant();
        CronJob admitted;
        synchronized (store) {
            CronJob job = store.get(id);
            if (job == null) {
                throw new CronErrors.ValidationError("unknown cron job id: " + id);
            }
            if (!alive.getAsBoolean()) {
                return CompletableFuture.completedFuture(new CronState.CronNotRun("stopped"));
            }
            if (job.isRunning()) {
                return CompletableFuture.completedFuture(new CronState.CronNotRun("already-running"));
            }
            if (mode != CronState.CronRunMode.FORCE && !isDue(job, now)) {
                return CompletableFuture.completedFuture(new CronState.CronNotRun("not-due"));
            }
            if (!gate.tryAcquire()) {
                return CompletableFuture.completedFuture(new CronState.CronNotRun("concurrency-limit"));
            }
            markRunning(job, now);
            persist.run();
            admitted = job.copy();
        }
        return launch(admitted, now).thenApply(CronState.CronRan::new);
    }

    static boolean isDue(CronJob job, Instant now) {
        return job.isEnabled()
                && job.getState() != CronTypes.JobState.RUNNING
                && job.getState() != CronTypes.JobState.DISABLED
                && job.getNextRunAt() != null
                && !job.getNextRunAt().isAfter(now);
    }

    /** Caller holds the store monitor. */
    boolean isInFlight(String jobId) {
        return inFlight.contains(jobId);
    }

    /** nextRunAt stays put while running so a crash mid-run re-dispatches the job. */
    private void markRunning(CronJob job, Instant now) {
        job.setState(CronTypes.JobState.RUNNING);
        job.setLastRunAt(now);
        inFlight.add(job.getId());
    }

    private CompletableFuture<CronState.CronRunOutcome> launch(CronJob job, Instant startedAt) {
        CompletableFuture<CronState.CronRunOutcome> done = new CompletableFuture<>();
        emit(CronState.CronEvent.builder()
                .jobId(job.getId())
                .action(CronState.CronAction.STARTED)
                .runAt(startedAt)
                .build());
        log.info("cron: running job {} ({})", job.getId(), job.getName());

        try {
            runExecutor.execute(() -> invoke(job)
                    .handle((outcome, err) -> toOutcome(job, outcome, err))
                    .thenAccept(outcome -> finish(job.getId(), startedAt, outcome, done)));
        } catch (RejectedExecutionException e) {
            finish(job.getId(), startedAt,
                    toOutcome(job, null, new CronErrors.ExecutionError(job.getId(), "run executor rejected job", e)),
                    done);
        }
        return done;
    }

    private CompletableFuture<CronState.CronRunOutcome> invoke(CronJob job) {
        CompletableFuture<CronState.CronRunOutcome> future;
        try {
            future = runner.run(job);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            return CompletableFuture.failedFuture(
                    new CronErrors.ExecutionError(job.getId(), "runner returned no result", null));
        }
        if (runTimeoutMs > 0) {
            return future.copy().orTimeout(runTimeoutMs, TimeUnit.MILLISECONDS);
        }
        return future;
    }

    private CronState.CronRunOutcome toOutcome(CronJob job, CronState.CronRunOutcome outcome, Throwable err) {
        if (err == null) {
            if (outcome == null) {
                return CronState.CronRunOutcome.ok();
            }
            if (outcome.status() == null) {
                log.warn("cron: job {} returned an outcome without status", job.getId());
                return new CronState.CronRunOutcome(CronTypes.RunStatus.ERROR,
                        "runner returned no status", outcome.summary());
            }
            return outcome;
        }
        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
        String message = cause instanceof TimeoutException
                ? "run timed out after " + Durations.formatMs(runTimeoutMs)
                : String.valueOf(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        CronErrors.ExecutionError error = cause instanceof CronErrors.ExecutionError ee
                ? ee
                : new CronErrors.ExecutionError(job.getId(), message, cause);
        log.warn("cron: job {} failed: {}", job.getId(), error.getMessage());
        return CronState.CronRunOutcome.error(message);
    }

    private void finish(String jobId, Instant startedAt, CronState.CronRunOutcome outcome,
            CompletableFuture<CronState.CronRunOutcome> done) {
        try {
            CronJob snapshot = applyOutcome(jobId, startedAt, outcome);
            if (snapshot != null) {
                emit(CronState.CronEvent.builder()
                        .jobId(jobId)
                        .action(CronState.CronAction.FINISHED)
                        .runAt(startedAt)
                        .durationMs(snapshot.getLastDurationMs())
                        .status(outcome.status())
                        .error(outcome.error())
                        .summary(outcome.summary())
                        .nextRunAt(snapshot.getNextRunAt())
                        .build());
                router.deliver(snapshot, outcome);
            }
        } catch (RuntimeException e) {
            log.error("cron: completing job {} failed", jobId, e);
        } finally {
            done.complete(outcome);
        }
    }

    /**
     * Fold an outcome into the stored job.
     *
     * @return a snapshot to deliver, or null when the service stopped or the
     *         job is gone
     */
    private CronJob applyOutcome(String jobId, Instant startedAt, CronState.CronRunOutcome outcome) {
        synchronized (store) {
            gate.release();
            inFlight.remove(jobId);
            if (!alive.getAsBoolean()) {
                log.debug("cron: service stopped, dropping completion of job {}", jobId);
                return null;
            }
            CronJob job = store.get(jobId);
            if (job == null) {
                log.info("cron: job {} was removed while running", jobId);
                return null;
            }

            Instant endedAt = clock.instant();
            long durationMs = Math.max(0, Duration.between(startedAt, endedAt).toMillis());
            job.setLastStatus(outcome.status());
            job.setLastError(outcome.error());
            job.setLastDurationMs(durationMs);

            CronJob snapshot;
            if (job.isOneShot()) {
                job.setEnabled(false);
                job.setNextRunAt(null);
                job.setState(CronTypes.JobState.DISABLED);
                snapshot = job.copy();
                if (outcome.isOk() && Boolean.TRUE.equals(job.getDeleteAfterRun())) {
                    store.delete(jobId);
                    log.info("cron: one-shot job {} deleted after run", jobId);
                }
            } else if (!job.isEnabled()) {
                job.setNextRunAt(null);
                job.setState(CronTypes.JobState.DISABLED);
                snapshot = job.copy();
            } else {
                Instant next = CronSchedules.nextDue(job.getSchedule(), job.getLastRunAt(), endedAt).orElse(null);
                job.setNextRunAt(next);
                job.setState(next != null ? CronTypes.JobState.IDLE : CronTypes.JobState.DISABLED);
                if (next == null) {
                    job.setEnabled(false);
                }
                snapshot = job.copy();
            }
            persist.run();
            log.info("cron: job {} finished {} in {}", jobId, outcome.status().key(), Durations.formatMs(durationMs));
            return snapshot;
        }
    }

    private void emit(CronState.CronEvent event) {
        events.accept(event);
    }
}
