package com.clawcron.cron;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cron delivery plan resolution: decides whether and where a finished run's
 * outcome goes.
 */
public final class CronDeliveryResolver {

    private CronDeliveryResolver() {
    }

    public enum PlanSource {
        /** Per-job {@code delivery} block. */
        DELIVERY,
        /** Deprecated process-wide webhook fallback. */
        LEGACY,
        /** Nothing configured. */
        NONE
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeliveryPlan {
        private CronTypes.DeliveryMode mode;
        private String to;
        private PlanSource source;

        public boolean isRequested() {
            return mode != null && mode != CronTypes.DeliveryMode.NONE;
        }
    }

    /**
     * Resolve the delivery plan for a job.
     *
     * @param legacyWebhook deprecated fallback URL, may be null
     */
    public static DeliveryPlan resolve(CronJob job, String legacyWebhook) {
        CronTypes.CronDelivery delivery = job.getDelivery();

        if (delivery != null) {
            CronTypes.DeliveryMode mode = delivery.getMode() != null
                    ? delivery.getMode()
                    : CronTypes.DeliveryMode.NONE;
            return DeliveryPlan.builder()
                    .mode(mode)
                    .to(mode == CronTypes.DeliveryMode.WEBHOOK ? normalizeTo(delivery.getTo()) : null)
                    .source(PlanSource.DELIVERY)
                    .build();
        }

        String legacy = normalizeTo(legacyWebhook);
        if (legacy != null && !Boolean.FALSE.equals(job.getLegacyNotify())) {
            return DeliveryPlan.builder()
                    .mode(CronTypes.DeliveryMode.WEBHOOK)
                    .to(legacy)
                    .source(PlanSource.LEGACY)
                    .build();
        }

        return DeliveryPlan.builder()
                .mode(CronTypes.DeliveryMode.NONE)
                .source(PlanSource.NONE)
                .build();
    }

    private static String normalizeTo(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
