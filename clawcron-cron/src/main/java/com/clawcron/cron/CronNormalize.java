package com.clawcron.cron;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cron job input normalization: coerces loosely-typed input (tool calls,
 * JSON-RPC params) into well-typed create/patch objects.
 */
public final class CronNormalize {

    private CronNormalize() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Normalize a raw schedule map: infer the kind, fold {@code atMs} into an
     * ISO {@code at}, accept numeric strings for {@code everyMs}.
     */
    public static Map<String, Object> coerceSchedule(Map<String, Object> schedule) {
        Map<String, Object> next = new LinkedHashMap<>(schedule);
        String kind = schedule.get("kind") instanceof String k ? k.trim() : null;

        Object atMsRaw = schedule.get("atMs");
        Object atRaw = schedule.get("at");
        String atString = atRaw instanceof String s ? s.trim() : "";

        Instant parsedAt = null;
        if (atMsRaw instanceof Number n) {
            parsedAt = n.longValue() > 0 ? Instant.ofEpochMilli(n.longValue()) : null;
        } else if (atMsRaw instanceof String s) {
            parsedAt = CronParse.parseAbsoluteTime(s);
        } else if (!atString.isEmpty()) {
            parsedAt = CronParse.parseAbsoluteTime(atString);
        }

        if (kind == null || kind.isEmpty()) {
            if (schedule.containsKey("atMs") || atRaw instanceof String) {
                next.put("kind", "at");
            } else if (schedule.containsKey("everyMs")) {
                next.put("kind", "every");
            } else if (schedule.get("expr") instanceof String) {
                next.put("kind", "cron");
            }
        } else {
            next.put("kind", kind.toLowerCase());
        }

        if (parsedAt != null) {
            next.put("at", parsedAt.toString());
        } else if (!atString.isEmpty()) {
            next.put("at", atString);
        }
        next.remove("atMs");

        if (schedule.get("everyMs") instanceof String s && s.trim().matches("\\d+")) {
            next.put("everyMs", Long.parseLong(s.trim()));
        }
        return next;
    }

    /**
     * Normalize delivery config: trim mode and target, drop an empty target.
     */
    public static Map<String, Object> coerceDelivery(Map<String, Object> delivery) {
        Map<String, Object> next = new LinkedHashMap<>(delivery);

        if (delivery.get("mode") instanceof String mode) {
            CronTypes.DeliveryMode parsed = CronTypes.DeliveryMode.fromKey(mode);
            next.put("mode", parsed != null ? parsed.key() : mode.trim());
        } else if (!delivery.containsKey("mode") && delivery.get("to") instanceof String) {
            next.put("mode", CronTypes.DeliveryMode.WEBHOOK.key());
        }
        if (delivery.get("to") instanceof String to) {
            String trimmed = to.trim();
            if (trimmed.isEmpty())
                next.remove("to");
            else
                next.put("to", trimmed);
        }
        return next;
    }

    /**
     * Normalize payload: infer kind from {@code text} or {@code message}.
     */
    public static Map<String, Object> coercePayload(Map<String, Object> payload) {
        Map<String, Object> next = new LinkedHashMap<>(payload);
        if (!(payload.get("kind") instanceof String)) {
            if (payload.get("message") instanceof String) {
                next.put("kind", CronTypes.PayloadKind.AGENT_TURN.key());
            } else if (payload.get("text") instanceof String) {
                next.put("kind", CronTypes.PayloadKind.SYSTEM_EVENT.key());
            }
        }
        return next;
    }

    /**
     * Normalize a cron job create map: coerce nested objects and apply
     * defaults ({@code enabled=true}, {@code wakeMode=next-heartbeat}, session
     * target inferred from the payload kind).
     */
    public static Map<String, Object> normalizeCronJobCreate(Map<String, Object> raw) {
        if (raw == null)
            return null;
        Map<String, Object> next = coerceNested(unwrapJob(raw));

        if (!next.containsKey("wakeMode")) {
            next.put("wakeMode", CronTypes.WakeMode.NEXT_HEARTBEAT.key());
        }
        if (!(next.get("enabled") instanceof Boolean)) {
            next.put("enabled", true);
        }
        if (!next.containsKey("sessionTarget") && next.get("payload") instanceof Map<?, ?> payload) {
            Object kind = payload.get("kind");
            if (CronTypes.PayloadKind.SYSTEM_EVENT.key().equals(kind)) {
                next.put("sessionTarget", CronTypes.SessionTarget.MAIN.key());
            } else if (CronTypes.PayloadKind.AGENT_TURN.key().equals(kind)) {
                next.put("sessionTarget", CronTypes.SessionTarget.ISOLATED.key());
            }
        }
        return next;
    }

    /**
     * Normalize a cron job patch map: coerce but do NOT apply defaults.
     */
    public static Map<String, Object> normalizeCronJobPatch(Map<String, Object> raw) {
        if (raw == null)
            return null;
        Map<String, Object> next = coerceNested(unwrapJob(raw));
        next.remove("id");
        return next;
    }

    /**
     * Normalize and bind a raw create map.
     *
     * @throws CronErrors.ValidationError when a field has the wrong type
     */
    public static CronTypes.CronJobCreate toCreate(Map<String, Object> raw) {
        if (raw == null) {
            throw new CronErrors.ValidationError("job is required");
        }
        return bind(normalizeCronJobCreate(raw), CronTypes.CronJobCreate.class);
    }

    /**
     * Normalize and bind a raw patch map.
     *
     * @throws CronErrors.ValidationError when a field has the wrong type
     */
    public static CronTypes.CronJobPatch toPatch(Map<String, Object> raw) {
        if (raw == null) {
            throw new CronErrors.ValidationError("patch is required");
        }
        return bind(normalizeCronJobPatch(raw), CronTypes.CronJobPatch.class);
    }

    private static <T> T bind(Map<String, Object> normalized, Class<T> type) {
        try {
            return MAPPER.convertValue(normalized, type);
        } catch (IllegalArgumentException e) {
            throw new CronErrors.ValidationError("invalid cron job: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> coerceNested(Map<String, Object> next) {
        if (next.get("schedule") instanceof Map<?, ?> sched) {
            next.put("schedule", coerceSchedule((Map<String, Object>) sched));
        }
        if (next.get("delivery") instanceof Map<?, ?> del) {
            next.put("delivery", coerceDelivery((Map<String, Object>) del));
        }
        if (next.get("payload") instanceof Map<?, ?> payload) {
            next.put("payload", coercePayload((Map<String, Object>) payload));
        }
        return next;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> unwrapJob(Map<String, Object> raw) {
        if (raw.get("data") instanceof Map<?, ?> data) {
            return new LinkedHashMap<>((Map<String, Object>) data);
        }
        if (raw.get("job") instanceof Map<?, ?> job) {
            return new LinkedHashMap<>((Map<String, Object>) job);
        }
        return new LinkedHashMap<>(raw);
    }
}
