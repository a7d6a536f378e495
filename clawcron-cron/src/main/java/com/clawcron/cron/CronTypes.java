package com.clawcron.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;

/**
 * Cron job type definitions: schedule variants, session/wake modes, opaque
 * payloads, delivery configuration and the create/patch DTOs.
 *
 * <p>
 * Every enum serializes as its wire key ({@code "every"},
 * {@code "next-heartbeat"}, {@code "systemEvent"}, ...) so the store file stays
 * readable and stable across renames of the Java constants.
 * </p>
 */
public final class CronTypes {

    private CronTypes() {
    }

    // =========================================================================
    // Schedule
    // =========================================================================

    public enum ScheduleKind {
        AT("at"), EVERY("every"), CRON("cron");

        private final String key;

        ScheduleKind(String key) {
            this.key = key;
        }

        @JsonValue
        public String key() {
            return key;
        }

        @JsonCreator
        public static ScheduleKind fromKey(String key) {
            if (key == null)
                return null;
            for (ScheduleKind kind : values()) {
                if (kind.key.equalsIgnoreCase(key.trim()))
                    return kind;
            }
            return null;
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronSchedule {
        private ScheduleKind kind;
        /** ISO-8601 timestamp for "at" schedules. */
        private String at;
        /** Interval in milliseconds for "every" schedules. */
        private Long everyMs;
        /** First due time (epoch ms) of a never-run "every" schedule. */
        private Long anchorMs;
        /** Five-field cron expression for "cron" schedules (e.g. "0 0 * * *"). */
        private String expr;
        /** IANA time zone for "cron" schedules, UTC when absent. */
        private String tz;

        public static CronSchedule every(long everyMs) {
            return CronSchedule.builder().kind(ScheduleKind.EVERY).everyMs(everyMs).build();
        }

        public static CronSchedule at(String at) {
            return CronSchedule.builder().kind(ScheduleKind.AT).at(at).build();
        }

        public static CronSchedule cron(String expr, String tz) {
            return CronSchedule.builder().kind(ScheduleKind.CRON).expr(expr).tz(tz).build();
        }
    }

    // =========================================================================
    // Session/wake modes
    // =========================================================================

    public enum SessionTarget {
        MAIN, ISOLATED;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static SessionTarget fromKey(String key) {
            if (key == null)
                return null;
            return switch (key.trim().toLowerCase(Locale.ROOT)) {
                case "main" -> MAIN;
                case "isolated" -> ISOLATED;
                default -> null;
            };
        }
    }

    public enum WakeMode {
        NEXT_HEARTBEAT, NOW;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }

        @JsonCreator
        public static WakeMode fromKey(String key) {
            if ("now".equalsIgnoreCase(key))
                return NOW;
            return NEXT_HEARTBEAT;
        }
    }

    // =========================================================================
    // Payload
    // =========================================================================

    public enum PayloadKind {
        SYSTEM_EVENT, AGENT_TURN;

        @JsonValue
        public String key() {
            return this == SYSTEM_EVENT ? "systemEvent" : "agentTurn";
        }

        @JsonCreator
        public static PayloadKind fromKey(String key) {
            if (key == null)
                return null;
            if ("agentTurn".equalsIgnoreCase(key.trim()))
                return AGENT_TURN;
            if ("systemEvent".equalsIgnoreCase(key.trim()))
                return SYSTEM_EVENT;
            return null;
        }
    }

    /**
     * Opaque job payload. Only the execution backend gives these fields meaning.
     */
    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronPayload {
        private PayloadKind kind;
        /** Text for systemEvent payloads. */
        private String text;
        /** Prompt for agentTurn payloads. */
        private String message;
        private String model;
        private String thinking;
        private Integer timeoutSeconds;

        public static CronPayload systemEvent(String text) {
            return CronPayload.builder().kind(PayloadKind.SYSTEM_EVENT).text(text).build();
        }

        public static CronPayload agentTurn(String message) {
            return CronPayload.builder().kind(PayloadKind.AGENT_TURN).message(message).build();
        }
    }

    // =========================================================================
    // Delivery
    // =========================================================================

    public enum DeliveryMode {
        WEBHOOK("webhook"), SYSTEM_EVENT("systemEvent"), NONE("none");

        private final String key;

        DeliveryMode(String key) {
            this.key = key;
        }

        @JsonValue
        public String key() {
            return key;
        }

        /**
         * Accepts the wire key plus the spellings older clients send
         * ("system-event", "system_event", "off").
         */
        @JsonCreator
        public static DeliveryMode fromKey(String key) {
            if (key == null)
                return null;
            String normalized = key.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
            return switch (normalized) {
                case "webhook" -> WEBHOOK;
                case "systemevent" -> SYSTEM_EVENT;
                case "none", "off" -> NONE;
                default -> null;
            };
        }
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronDelivery {
        private DeliveryMode mode;
        /** Target URL for webhook delivery. */
        private String to;

        public static CronDelivery webhook(String to) {
            return new CronDelivery(DeliveryMode.WEBHOOK, to);
        }

        public static CronDelivery systemEvent() {
            return new CronDelivery(DeliveryMode.SYSTEM_EVENT, null);
        }

        public static CronDelivery none() {
            return new CronDelivery(DeliveryMode.NONE, null);
        }
    }

    // =========================================================================
    // Job state
    // =========================================================================

    public enum JobState {
        IDLE, DUE, RUNNING, DISABLED;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static JobState fromKey(String key) {
            if (key == null)
                return null;
            for (JobState state : values()) {
                if (state.key().equalsIgnoreCase(key.trim()))
                    return state;
            }
            return null;
        }
    }

    public enum RunStatus {
        OK, ERROR;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static RunStatus fromKey(String key) {
            if ("ok".equalsIgnoreCase(key))
                return OK;
            if ("error".equalsIgnoreCase(key))
                return ERROR;
            return null;
        }
    }

    // =========================================================================
    // Create/Patch DTOs
    // =========================================================================

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobCreate {
        private String agentId;
        private String name;
        private String description;
        @Builder.Default
        private boolean enabled = true;
        private Boolean deleteAfterRun;
        @JsonProperty("notify")
        private Boolean legacyNotify;
        private CronSchedule schedule;
        private SessionTarget sessionTarget;
        private WakeMode wakeMode;
        private CronPayload payload;
        private CronDelivery delivery;
    }

    /**
     * Partial update; null fields are left untouched.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobPatch {
        private String agentId;
        private String name;
        private String description;
        private Boolean enabled;
        private Boolean deleteAfterRun;
        @JsonProperty("notify")
        private Boolean legacyNotify;
        private CronSchedule schedule;
        private SessionTarget sessionTarget;
        private WakeMode wakeMode;
        private CronPayload payload;
        private CronDelivery delivery;
    }

    // =========================================================================
    // Store format
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronStoreFile {
        public static final int CURRENT_VERSION = 1;

        @Builder.Default
        private int version = CURRENT_VERSION;
        private List<CronJob> jobs;
    }
}
