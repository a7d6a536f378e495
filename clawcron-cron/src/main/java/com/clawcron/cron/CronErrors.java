package com.clawcron.cron;

/**
 * Cron error taxonomy. Only {@link ValidationError} and
 * {@link CorruptStoreError} reach callers of {@link CronService}; execution
 * and delivery failures are absorbed and show up in logs and job state.
 */
public final class CronErrors {

    private CronErrors() {
    }

    public static class CronError extends RuntimeException {
        public CronError(String message) {
            super(message);
        }

        public CronError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** Malformed job input on add/update; nothing is persisted. */
    public static class ValidationError extends CronError {
        public ValidationError(String message) {
            super(message);
        }

        public ValidationError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** Unreadable store file; the file is left as-is. */
    public static class CorruptStoreError extends CronError {
        private final String storePath;

        public CorruptStoreError(String storePath, String message, Throwable cause) {
            super("cron store " + storePath + " is corrupt: " + message, cause);
            this.storePath = storePath;
        }

        public String getStorePath() {
            return storePath;
        }
    }

    /** Backend run failure, recorded as an error outcome. */
    public static class ExecutionError extends CronError {
        private final String jobId;

        public ExecutionError(String jobId, String message, Throwable cause) {
            super(message, cause);
            this.jobId = jobId;
        }

        public String getJobId() {
            return jobId;
        }
    }

    /** Webhook or system-event delivery failure; logged and dropped. */
    public static class DeliveryError extends CronError {
        private final String jobId;

        public DeliveryError(String jobId, String message) {
            super(message);
            this.jobId = jobId;
        }

        public DeliveryError(String jobId, String message, Throwable cause) {
            super(message, cause);
            this.jobId = jobId;
        }

        public String getJobId() {
            return jobId;
        }
    }
}
