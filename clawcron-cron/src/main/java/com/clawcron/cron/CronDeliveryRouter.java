package com.clawcron.cron;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Routes a finished run's outcome to the job's delivery target and wakes the
 * main session for {@code wakeMode=now} jobs.
 *
 * <p>
 * Delivery is best-effort: failures are logged and dropped, never retried,
 * and never change job state. The returned futures always complete normally.
 * </p>
 */
@Slf4j
public class CronDeliveryRouter {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String legacyWebhook;
    private final String webhookToken;
    private final CronState.SystemEventSink systemEventSink;
    private final CronState.HeartbeatRequester heartbeatRequester;

    public CronDeliveryRouter(OkHttpClient httpClient,
            String legacyWebhook,
            String webhookToken,
            CronState.SystemEventSink systemEventSink,
            CronState.HeartbeatRequester heartbeatRequester) {
        this.httpClient = httpClient != null ? httpClient : defaultClient();
        this.objectMapper = CronStore.MAPPER;
        this.legacyWebhook = legacyWebhook;
        this.webhookToken = webhookToken != null && !webhookToken.isBlank() ? webhookToken.trim() : null;
        this.systemEventSink = systemEventSink;
        this.heartbeatRequester = heartbeatRequester;
    }

    static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .build();
    }

    /**
     * Deliver {@code outcome} for {@code job}.
     *
     * @return completes once the delivery attempt has finished
     */
    public CompletableFuture<Void> deliver(CronJob job, CronState.CronRunOutcome outcome) {
        CronDeliveryResolver.DeliveryPlan plan = CronDeliveryResolver.resolve(job, legacyWebhook);

        CompletableFuture<Void> delivered;
        try {
            delivered = switch (plan.getMode()) {
                case WEBHOOK -> postWebhook(job, outcome, plan.getTo());
                case SYSTEM_EVENT -> {
                    enqueueSystemEvent(job, outcome);
                    yield CompletableFuture.completedFuture(null);
                }
                case NONE -> {
                    log.debug("cron: no delivery for job {}", job.getId());
                    yield CompletableFuture.completedFuture(null);
                }
            };
        } catch (CronErrors.DeliveryError e) {
            logDropped(e);
            delivered = CompletableFuture.completedFuture(null);
        }

        return delivered
                .exceptionally(err -> {
                    logDropped(err instanceof CronErrors.DeliveryError de ? de
                            : new CronErrors.DeliveryError(job.getId(), String.valueOf(err.getMessage()), err));
                    return null;
                })
                .thenRun(() -> wakeIfRequested(job));
    }

    private CompletableFuture<Void> postWebhook(CronJob job, CronState.CronRunOutcome outcome, String url) {
        if (url == null) {
            throw new CronErrors.DeliveryError(job.getId(), "webhook delivery without target URL");
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(webhookBody(job, outcome));
        } catch (JsonProcessingException e) {
            throw new CronErrors.DeliveryError(job.getId(), "cannot encode webhook body", e);
        }

        Request.Builder request;
        try {
            request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(json, JSON));
        } catch (IllegalArgumentException e) {
            throw new CronErrors.DeliveryError(job.getId(), "invalid webhook URL " + url, e);
        }
        if (webhookToken != null) {
            request.header("Authorization", "Bearer " + webhookToken);
        }

        CompletableFuture<Void> future = new CompletableFuture<>();
        httpClient.newCall(request.build()).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(new CronErrors.DeliveryError(job.getId(),
                        "webhook POST to " + url + " failed: " + e.getMessage(), e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (ResponseBody ignored = response.body()) {
                    if (!response.isSuccessful()) {
                        future.completeExceptionally(new CronErrors.DeliveryError(job.getId(),
                                "webhook POST to " + url + " returned " + response.code()));
                    } else {
                        log.debug("cron: webhook delivered for job {} ({})", job.getId(), response.code());
                        future.complete(null);
                    }
                }
            }
        });
        return future;
    }

    Map<String, Object> webhookBody(CronJob job, CronState.CronRunOutcome outcome) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jobId", job.getId());
        body.put("jobName", job.getName());
        body.put("action", "finished");
        body.put("status", outcome.status());
        putIfPresent(body, "error", outcome.error());
        putIfPresent(body, "summary", outcome.summary());
        putIfPresent(body, "runAt", job.getLastRunAt());
        putIfPresent(body, "durationMs", job.getLastDurationMs());
        putIfPresent(body, "nextRunAt", job.getNextRunAt());
        return body;
    }

    private void enqueueSystemEvent(CronJob job, CronState.CronRunOutcome outcome) {
        if (systemEventSink == null) {
            throw new CronErrors.DeliveryError(job.getId(), "no system-event sink configured");
        }
        try {
            systemEventSink.enqueue(systemEventText(job, outcome), contextKey(job));
        } catch (RuntimeException e) {
            throw new CronErrors.DeliveryError(job.getId(), "system-event enqueue failed: " + e.getMessage(), e);
        }
    }

    static String systemEventText(CronJob job, CronState.CronRunOutcome outcome) {
        String label = job.getName() != null ? job.getName() : job.getId();
        if (outcome.isOk()) {
            String summary = outcome.summary();
            return summary != null && !summary.isBlank()
                    ? "Cron job \"" + label + "\" ok: " + summary.trim()
                    : "Cron job \"" + label + "\" ok";
        }
        String error = outcome.error() != null ? outcome.error() : "unknown error";
        return "Cron job \"" + label + "\" error: " + error;
    }

    static String contextKey(CronJob job) {
        return "cron:" + job.getId();
    }

    private void wakeIfRequested(CronJob job) {
        if (job.getWakeMode() != CronTypes.WakeMode.NOW) {
            return;
        }
        if (heartbeatRequester == null) {
            log.warn("cron: job {} wants an immediate wake but no heartbeat requester is configured", job.getId());
            return;
        }
        try {
            heartbeatRequester.requestNow(contextKey(job));
        } catch (RuntimeException e) {
            log.warn("cron: heartbeat request for job {} failed: {}", job.getId(), e.getMessage());
        }
    }

    private void logDropped(CronErrors.DeliveryError e) {
        log.warn("cron: delivery dropped for job {}: {}", e.getJobId(), e.getMessage());
    }

    private static void putIfPresent(Map<String, Object> body, String key, Object value) {
        if (value != null) {
            body.put(key, value);
        }
    }
}
