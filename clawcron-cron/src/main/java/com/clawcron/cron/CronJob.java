package com.clawcron.cron;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A named, independently schedulable unit as held in the cron store.
 *
 * <p>
 * {@code lastRunAt}, {@code nextRunAt}, {@code state} and the {@code last*}
 * outcome fields are derived: only the dispatcher (and the service when a
 * schedule changes) writes them.
 * </p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CronJob {
    private String id;
    private String agentId;
    private String name;
    private String description;
    @Builder.Default
    private boolean enabled = true;
    private Boolean deleteAfterRun;
    /** Legacy opt-out from the process-wide webhook fallback. */
    @JsonProperty("notify")
    private Boolean legacyNotify;
    private Instant createdAt;
    private Instant updatedAt;

    private CronTypes.CronSchedule schedule;
    private CronTypes.SessionTarget sessionTarget;
    private CronTypes.WakeMode wakeMode;
    private CronTypes.CronPayload payload;
    private CronTypes.CronDelivery delivery;

    private Instant lastRunAt;
    private Instant nextRunAt;
    private CronTypes.JobState state;
    private CronTypes.RunStatus lastStatus;
    private String lastError;
    private Long lastDurationMs;

    /**
     * Detached copy for callers outside the service. Nested values are shared;
     * the service replaces them rather than mutating them in place.
     */
    public CronJob copy() {
        return toBuilder().build();
    }

    @JsonIgnore
    public boolean isOneShot() {
        return schedule != null && schedule.getKind() == CronTypes.ScheduleKind.AT;
    }

    @JsonIgnore
    public boolean isRunning() {
        return state == CronTypes.JobState.RUNNING;
    }
}
