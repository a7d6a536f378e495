package com.clawcron.cron;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manages cron jobs: lifecycle, CRUD, persistence and the dispatch timer.
 *
 * <p>
 * The store monitor is the single writer lock: every mutation of the job table
 * and the concurrency gate, whether from a caller, the timer or a completing
 * run, happens while holding it, and each mutation is flushed to disk before
 * the lock is released.
 * </p>
 */
@Slf4j
public class CronService implements AutoCloseable {

    private final CronState.CronServiceDeps deps;
    private final CronStore store;
    private final CronConcurrencyGate gate;
    private final CronDispatcher dispatcher;
    private final ScheduledExecutorService timer;
    private final ExecutorService ownedRunExecutor;

    private volatile boolean started;
    private ScheduledFuture<?> tickTask;

    public CronService(CronState.CronServiceDeps deps) {
        Objects.requireNonNull(deps.getStorePath(), "storePath");
        Objects.requireNonNull(deps.getRunner(), "runner");
        Objects.requireNonNull(deps.getClock(), "clock");
        this.deps = deps;
        this.store = new CronStore(deps.getStorePath());
        this.gate = new CronConcurrencyGate(deps.getMaxConcurrentRuns());
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cron-timer");
            t.setDaemon(true);
            return t;
        });
        if (deps.getRunExecutor() != null) {
            this.ownedRunExecutor = null;
        } else {
            AtomicInteger counter = new AtomicInteger();
            this.ownedRunExecutor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "cron-run-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
        CronDeliveryRouter router = new CronDeliveryRouter(
                deps.getHttpClient(),
                deps.getLegacyWebhook(),
                deps.getWebhookToken(),
                deps.getSystemEventSink(),
                deps.getHeartbeatRequester());
        this.dispatcher = new CronDispatcher(
                store,
                gate,
                router,
                deps,
                deps.getRunExecutor() != null ? deps.getRunExecutor() : ownedRunExecutor,
                this::persist,
                () -> started,
                this::emit);
    }

    // --- Lifecycle ---

    /**
     * Load the store and arm the dispatch timer. Calling it again while
     * started is a no-op. Restarting a stopped instance keeps its in-memory
     * table; runs still in flight stay {@code running}.
     *
     * @throws CronErrors.CorruptStoreError when the store file is unreadable
     */
    public void start() {
        synchronized (store) {
            if (started) {
                return;
            }
            if (!store.isLoaded()) {
                store.load();
            }
            recoverLoadedJobs();
            started = true;
        }
        if (!deps.isCronEnabled()) {
            log.info("cron: disabled, timer not armed ({} jobs loaded)", store.size());
            return;
        }
        tickTask = timer.scheduleWithFixedDelay(this::safeTick, 0, deps.getTickIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("cron: started with {} jobs, tick {}ms, maxConcurrentRuns {}",
                store.size(), deps.getTickIntervalMs(), gate.capacity());
    }

    /**
     * Stop ticking. In-flight runs are not cancelled; their completions are
     * neither persisted nor delivered.
     */
    public void stop() {
        synchronized (store) {
            if (!started) {
                return;
            }
            started = false;
        }
        ScheduledFuture<?> task = tickTask;
        if (task != null) {
            task.cancel(false);
            tickTask = null;
        }
        log.info("cron: stopped");
    }

    @Override
    public void close() {
        stop();
        shutdown(timer);
        if (ownedRunExecutor != null) {
            shutdown(ownedRunExecutor);
        }
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * One dispatcher pass. The timer calls this; callers that drive time
     * themselves may too. {@code cronEnabled} only governs the timer, so an
     * explicit call dispatches even when it is off.
     *
     * @return ids dispatched by this pass, empty when not started
     */
    public List<String> tick() {
        synchronized (store) {
            if (!started) {
                return List.of();
            }
        }
        return dispatcher.tick();
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("cron: tick failed", e);
        }
    }

    // --- CRUD ---

    /**
     * Validate, assign an id, compute the first due time and persist.
     *
     * @throws CronErrors.ValidationError for malformed input
     */
    public CronJob add(CronTypes.CronJobCreate create) {
        CronValidation.validateCreate(create);
        CronJob created;
        synchronized (store) {
            ensureLoaded();
            Instant now = deps.getClock().instant();
            CronJob job = CronJob.builder()
                    .id(UUID.randomUUID().toString())
                    .agentId(create.getAgentId())
                    .name(create.getName().trim())
                    .description(create.getDescription())
                    .enabled(create.isEnabled())
                    .deleteAfterRun(create.getDeleteAfterRun())
                    .legacyNotify(create.getLegacyNotify())
                    .createdAt(now)
                    .updatedAt(now)
                    .schedule(create.getSchedule())
                    .sessionTarget(create.getSessionTarget())
                    .wakeMode(create.getWakeMode() != null ? create.getWakeMode() : CronTypes.WakeMode.NEXT_HEARTBEAT)
                    .payload(create.getPayload())
                    .delivery(create.getDelivery())
                    .build();
            rearm(job, now);
            store.upsert(job);
            persist();
            created = job.copy();
        }
        log.info("cron: added job {} ({}, {})", created.getId(), created.getName(), created.getSchedule().getKind().key());
        emit(CronState.CronEvent.builder()
                .jobId(created.getId())
                .action(CronState.CronAction.ADDED)
                .nextRunAt(created.getNextRunAt())
                .build());
        return created;
    }

    /**
     * Add from loosely-typed input (tool or RPC parameters).
     *
     * @throws CronErrors.ValidationError for malformed input
     */
    public CronJob add(Map<String, Object> raw) {
        return add(CronNormalize.toCreate(raw));
    }

    public Optional<CronJob> getJob(String id) {
        synchronized (store) {
            ensureLoaded();
            return Optional.ofNullable(store.get(id)).map(CronJob::copy);
        }
    }

    /**
     * Enabled jobs in store order.
     */
    public List<CronJob> list() {
        return list(false);
    }

    public List<CronJob> list(boolean includeDisabled) {
        synchronized (store) {
            ensureLoaded();
            List<CronJob> out = new ArrayList<>();
            for (CronJob job : store.list()) {
                if (includeDisabled || job.isEnabled()) {
                    out.add(job.copy());
                }
            }
            return out;
        }
    }

    /**
     * Apply a patch. A schedule or enabled change recomputes {@code nextRunAt};
     * a running job keeps running and is re-armed by its completion.
     *
     * @throws CronErrors.ValidationError for an unknown id, an invalid result,
     *                                    or enabling a schedule with no future
     *                                    run time
     */
    public CronJob update(String id, CronTypes.CronJobPatch patch) {
        if (patch == null) {
            throw new CronErrors.ValidationError("patch is required");
        }
        CronJob updated;
        synchronized (store) {
            ensureLoaded();
            CronJob current = store.get(id);
            if (current == null) {
                throw new CronErrors.ValidationError("unknown cron job id: " + id);
            }
            CronJob next = current.copy();
            applyPatch(next, patch);
            CronValidation.validateJob(next);

            Instant now = deps.getClock().instant();
            next.setUpdatedAt(now);
            boolean rescheduled = !Objects.equals(current.getSchedule(), next.getSchedule())
                    || current.isEnabled() != next.isEnabled();
            if (rescheduled && !next.isRunning()) {
                boolean wantEnabled = next.isEnabled();
                rearm(next, now);
                if (wantEnabled && !next.isEnabled()) {
                    throw new CronErrors.ValidationError("schedule exhausted for cron job " + id
                            + ": it has no future run time");
                }
            }
            store.upsert(next);
            persist();
            updated = next.copy();
        }
        log.info("cron: updated job {}", id);
        emit(CronState.CronEvent.builder()
                .jobId(id)
                .action(CronState.CronAction.UPDATED)
                .nextRunAt(updated.getNextRunAt())
                .build());
        return updated;
    }

    /**
     * Patch from loosely-typed input.
     *
     * @throws CronErrors.ValidationError for an unknown id or malformed input
     */
    public CronJob update(String id, Map<String, Object> rawPatch) {
        return update(id, CronNormalize.toPatch(rawPatch));
    }

    /**
     * Remove a job. A running job finishes its current run and is not
     * scheduled again.
     */
    public CronState.CronRemoveResult remove(String id) {
        boolean removed;
        synchronized (store) {
            ensureLoaded();
            removed = store.delete(id) != null;
            if (removed) {
                persist();
            }
        }
        if (removed) {
            log.info("cron: removed job {}", id);
            emit(CronState.CronEvent.builder()
                    .jobId(id)
                    .action(CronState.CronAction.REMOVED)
                    .build());
        }
        return new CronState.CronRemoveResult(true, removed);
    }

    // --- Execution ---

    /**
     * Run a job now. {@link CronState.CronRunMode#FORCE} ignores the due time;
     * both modes respect the concurrency gate.
     *
     * @return completes after the run has been folded into the store
     * @throws CronErrors.ValidationError for an unknown id
     */
    public CompletableFuture<CronState.CronRunResult> run(String id, CronState.CronRunMode mode) {
        synchronized (store) {
            ensureLoaded();
        }
        return dispatcher.runNow(id, mode != null ? mode : CronState.CronRunMode.DUE);
    }

    public CronState.CronStatusSummary status() {
        synchronized (store) {
            Instant nextWake = store.list().stream()
                    .filter(j -> j.isEnabled() && !j.isRunning() && j.getNextRunAt() != null)
                    .map(CronJob::getNextRunAt)
                    .min(Comparator.naturalOrder())
                    .orElse(null);
            return CronState.CronStatusSummary.builder()
                    .enabled(deps.isCronEnabled())
                    .started(started)
                    .storePath(store.getStorePath().toString())
                    .jobs(store.size())
                    .running(gate.inFlight())
                    .maxConcurrentRuns(gate.capacity())
                    .nextWakeAt(nextWake)
                    .build();
        }
    }

    // --- Internals ---

    private void ensureLoaded() {
        if (!store.isLoaded()) {
            store.load();
            recoverLoadedJobs();
        }
    }

    /**
     * Make loaded state consistent: runs interrupted by a crash become due
     * again, and missing due times are filled in. Persisted due times are
     * kept as-is. Jobs this instance is still running are left alone.
     */
    private void recoverLoadedJobs() {
        Instant now = deps.getClock().instant();
        boolean changed = false;
        for (CronJob job : store.list()) {
            if (job.isRunning() && !dispatcher.isInFlight(job.getId())) {
                log.warn("cron: job {} was running at shutdown, re-evaluating", job.getId());
                job.setState(CronTypes.JobState.DUE);
                changed = true;
            }
            if (!job.isEnabled()) {
                if (job.getState() != CronTypes.JobState.DISABLED) {
                    job.setState(CronTypes.JobState.DISABLED);
                    changed = true;
                }
                continue;
            }
            if (job.getState() == null) {
                job.setState(CronTypes.JobState.IDLE);
                changed = true;
            }
            if (job.getNextRunAt() == null && job.getState() != CronTypes.JobState.DISABLED) {
                rearm(job, now);
                changed = true;
            }
        }
        if (changed) {
            persist();
        }
    }

    /** Recompute state and nextRunAt from the schedule and lastRunAt. */
    private void rearm(CronJob job, Instant now) {
        if (!job.isEnabled()) {
            job.setNextRunAt(null);
            job.setState(CronTypes.JobState.DISABLED);
            return;
        }
        Optional<Instant> next = CronSchedules.nextDue(job.getSchedule(), job.getLastRunAt(), now);
        if (next.isPresent()) {
            job.setNextRunAt(next.get());
            job.setState(CronTypes.JobState.IDLE);
        } else {
            job.setEnabled(false);
            job.setNextRunAt(null);
            job.setState(CronTypes.JobState.DISABLED);
        }
    }

    private static void applyPatch(CronJob job, CronTypes.CronJobPatch patch) {
        if (patch.getAgentId() != null)
            job.setAgentId(patch.getAgentId());
        if (patch.getName() != null)
            job.setName(patch.getName().trim());
        if (patch.getDescription() != null)
            job.setDescription(patch.getDescription());
        if (patch.getEnabled() != null)
            job.setEnabled(patch.getEnabled());
        if (patch.getDeleteAfterRun() != null)
            job.setDeleteAfterRun(patch.getDeleteAfterRun());
        if (patch.getLegacyNotify() != null)
            job.setLegacyNotify(patch.getLegacyNotify());
        if (patch.getSchedule() != null)
            job.setSchedule(patch.getSchedule());
        if (patch.getSessionTarget() != null)
            job.setSessionTarget(patch.getSessionTarget());
        if (patch.getWakeMode() != null)
            job.setWakeMode(patch.getWakeMode());
        if (patch.getPayload() != null)
            job.setPayload(patch.getPayload());
        if (patch.getDelivery() != null)
            job.setDelivery(patch.getDelivery());
    }

    /** Flush the store; a failed write is logged and the in-memory state kept. */
    private void persist() {
        try {
            store.save();
        } catch (IOException e) {
            log.error("cron: failed to persist store {}: {}", store.getStorePath(), e.getMessage(), e);
        }
    }

    private void emit(CronState.CronEvent event) {
        if (deps.getOnEvent() == null) {
            return;
        }
        try {
            deps.getOnEvent().accept(event);
        } catch (RuntimeException e) {
            log.warn("cron: event listener failed on {} for job {}: {}",
                    event.getAction(), event.getJobId(), e.getMessage());
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
