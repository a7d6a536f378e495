package com.clawcron.cron;

import okhttp3.HttpUrl;

/**
 * Structural checks applied before a job is persisted.
 */
public final class CronValidation {

    private CronValidation() {
    }

    /**
     * @throws CronErrors.ValidationError describing the first problem found
     */
    public static void validateCreate(CronTypes.CronJobCreate create) {
        if (create == null) {
            throw new CronErrors.ValidationError("job is required");
        }
        validateFields(create.getName(), create.getSchedule(), create.getSessionTarget(),
                create.getPayload(), create.getDelivery());
    }

    /**
     * Check a job after a patch has been merged into it.
     *
     * @throws CronErrors.ValidationError describing the first problem found
     */
    public static void validateJob(CronJob job) {
        validateFields(job.getName(), job.getSchedule(), job.getSessionTarget(),
                job.getPayload(), job.getDelivery());
    }

    private static void validateFields(String name,
            CronTypes.CronSchedule schedule,
            CronTypes.SessionTarget sessionTarget,
            CronTypes.CronPayload payload,
            CronTypes.CronDelivery delivery) {
        if (name == null || name.isBlank()) {
            throw new CronErrors.ValidationError("name is required");
        }
        CronSchedules.validate(schedule);
        if (sessionTarget == null) {
            throw new CronErrors.ValidationError("sessionTarget must be main or isolated");
        }
        if (payload == null || payload.getKind() == null) {
            throw new CronErrors.ValidationError("payload.kind must be systemEvent or agentTurn");
        }
        if (sessionTarget == CronTypes.SessionTarget.MAIN
                && payload.getKind() != CronTypes.PayloadKind.SYSTEM_EVENT) {
            throw new CronErrors.ValidationError("main session jobs require a systemEvent payload");
        }
        if (sessionTarget == CronTypes.SessionTarget.ISOLATED
                && payload.getKind() != CronTypes.PayloadKind.AGENT_TURN) {
            throw new CronErrors.ValidationError("isolated session jobs require an agentTurn payload");
        }
        validateDelivery(delivery);
    }

    private static void validateDelivery(CronTypes.CronDelivery delivery) {
        if (delivery == null) {
            return;
        }
        if (delivery.getMode() == null) {
            throw new CronErrors.ValidationError("delivery.mode must be webhook, systemEvent or none");
        }
        if (delivery.getMode() == CronTypes.DeliveryMode.WEBHOOK) {
            String to = delivery.getTo();
            if (to == null || to.isBlank()) {
                throw new CronErrors.ValidationError("delivery.to is required for webhook delivery");
            }
            if (HttpUrl.parse(to.trim()) == null) {
                throw new CronErrors.ValidationError("delivery.to must be an http(s) URL: " + to);
            }
        }
    }
}
