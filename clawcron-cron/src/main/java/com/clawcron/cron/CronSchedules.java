package com.clawcron.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Schedule calculator: maps a schedule and the last run time to the next due
 * time. Pure apart from the parsed-expression cache.
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private static final Cache<String, ExecutionTime> EXECUTION_TIMES = Caffeine.newBuilder()
            .maximumSize(256)
            .build();

    /**
     * Next due time of {@code schedule}.
     *
     * <ul>
     * <li>every: due now if never run (or at a future anchor), else
     * {@code lastRunAt + everyMs}. When that time lies more than one interval
     * in the past the job is due {@code now} once; missed runs are not
     * replayed.</li>
     * <li>at: the timestamp until a run has started at or after it, then
     * empty.</li>
     * <li>cron: first slot strictly after {@code max(now, lastRunAt)}.</li>
     * </ul>
     *
     * @return the due time, or empty when the schedule is exhausted
     */
    public static Optional<Instant> nextDue(CronTypes.CronSchedule schedule, Instant lastRunAt, Instant now) {
        if (schedule == null || schedule.getKind() == null) {
            return Optional.empty();
        }
        return switch (schedule.getKind()) {
            case EVERY -> schedule.getEveryMs() == null
                    ? Optional.empty()
                    : Optional.of(nextEvery(schedule, lastRunAt, now));
            case AT -> nextAt(schedule, lastRunAt);
            case CRON -> nextCron(schedule, lastRunAt, now);
        };
    }

    private static Instant nextEvery(CronTypes.CronSchedule schedule, Instant lastRunAt, Instant now) {
        long everyMs = Math.max(1, schedule.getEveryMs());
        if (lastRunAt == null) {
            if (schedule.getAnchorMs() != null) {
                Instant anchor = Instant.ofEpochMilli(schedule.getAnchorMs());
                return anchor.isAfter(now) ? anchor : now;
            }
            return now;
        }
        Instant due = lastRunAt.plusMillis(everyMs);
        if (due.plusMillis(everyMs).isBefore(now)) {
            return now;
        }
        return due;
    }

    private static Optional<Instant> nextAt(CronTypes.CronSchedule schedule, Instant lastRunAt) {
        Instant at = CronParse.parseAbsoluteTime(schedule.getAt());
        if (at == null) {
            return Optional.empty();
        }
        if (lastRunAt != null && !lastRunAt.isBefore(at)) {
            return Optional.empty();
        }
        return Optional.of(at);
    }

    private static Optional<Instant> nextCron(CronTypes.CronSchedule schedule, Instant lastRunAt, Instant now) {
        if (schedule.getExpr() == null) {
            return Optional.empty();
        }
        Instant from = lastRunAt != null && lastRunAt.isAfter(now) ? lastRunAt : now;
        try {
            ZonedDateTime base = from.atZone(zoneOf(schedule));
            return executionTime(schedule.getExpr()).nextExecution(base).map(ZonedDateTime::toInstant);
        } catch (IllegalArgumentException | DateTimeException e) {
            // stored expression no longer parses; treat as exhausted
            return Optional.empty();
        }
    }

    /**
     * Reject a schedule that can never be evaluated.
     *
     * @throws CronErrors.ValidationError naming the offending field
     */
    public static void validate(CronTypes.CronSchedule schedule) {
        if (schedule == null) {
            throw new CronErrors.ValidationError("schedule is required");
        }
        if (schedule.getKind() == null) {
            throw new CronErrors.ValidationError("schedule.kind must be one of at, every, cron");
        }
        switch (schedule.getKind()) {
            case EVERY -> {
                if (schedule.getEveryMs() == null || schedule.getEveryMs() <= 0) {
                    throw new CronErrors.ValidationError("schedule.everyMs must be a positive integer");
                }
            }
            case AT -> {
                if (CronParse.parseAbsoluteTime(schedule.getAt()) == null) {
                    throw new CronErrors.ValidationError("schedule.at is not a valid timestamp: " + schedule.getAt());
                }
            }
            case CRON -> {
                if (schedule.getExpr() == null || schedule.getExpr().isBlank()) {
                    throw new CronErrors.ValidationError("schedule.expr is required for cron schedules");
                }
                try {
                    executionTime(schedule.getExpr());
                } catch (IllegalArgumentException e) {
                    throw new CronErrors.ValidationError("schedule.expr is invalid: " + e.getMessage(), e);
                }
                try {
                    zoneOf(schedule);
                } catch (DateTimeException e) {
                    throw new CronErrors.ValidationError("schedule.tz is not a known time zone: " + schedule.getTz(), e);
                }
            }
        }
    }

    private static ExecutionTime executionTime(String expr) {
        String key = expr.trim().replaceAll("\\s+", " ");
        return EXECUTION_TIMES.get(key, k -> ExecutionTime.forCron(PARSER.parse(k)));
    }

    private static ZoneId zoneOf(CronTypes.CronSchedule schedule) {
        String tz = schedule.getTz();
        if (tz == null || tz.isBlank()) {
            return ZoneOffset.UTC;
        }
        return ZoneId.of(tz.trim());
    }
}
