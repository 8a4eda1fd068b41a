package com.github.dimitryivaniuta.gateway.jobs.config;

import java.net.URI;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level configuration properties.
 *
 * <p>We use {@link ConfigurationProperties} instead of sprinkling {@code @Value} across the codebase,
 * which is easier to validate, test, and evolve. Environment variables are mapped onto these keys in
 * {@code application.yml}.</p>
 */
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    /** Where operators find the queue setup guide; quoted in every startup/transport error. */
    public static final String QUEUE_SETUP_DOC = "docs/DEPLOYMENT.md#queue-configuration-modes";

    /**
     * Deployment environment ({@code development} or {@code production}).
     */
    private String environment = "development";

    private final Queue queue = new Queue();
    private final Jobs jobs = new Jobs();
    private final Worker worker = new Worker();

    public boolean isProduction() {
        return "production".equalsIgnoreCase(environment);
    }

    /**
     * Validates queue and retry settings. Called once while the transport bean is created, so a bad
     * configuration stops the application instead of degrading at send time.
     *
     * @throws IllegalStateException with an actionable message
     */
    public void validate() {
        if (queue.getMode() == null) {
            throw new IllegalStateException("QUEUE_MODE (app.queue.mode) must be 'local' or 'external'; see " + QUEUE_SETUP_DOC);
        }
        if (queue.getMode() == QueueMode.LOCAL && isProduction()) {
            throw new IllegalStateException("QUEUE_MODE=local is not allowed in production; see " + QUEUE_SETUP_DOC);
        }
        if (queue.getMode() == QueueMode.EXTERNAL) {
            require(queue.getAccountId(), "CF_ACCOUNT_ID (app.queue.account-id)");
            require(queue.getApiToken(), "CF_API_TOKEN (app.queue.api-token)");
            require(queue.getQueueName(), "CF_QUEUE_NAME (app.queue.queue-name)");
            require(queue.getDeadLetterQueueName(), "CF_QUEUE_DLQ (app.queue.dead-letter-queue-name)");
            requireHttpUrl(queue.getApiBaseUrl());
        }
        if (jobs.getMaxJobRetries() < 1) {
            throw new IllegalStateException("MAX_JOB_RETRIES (app.jobs.max-job-retries) must be >= 1, was " + jobs.getMaxJobRetries());
        }
        if (jobs.getBaseBackoff() == null || jobs.getBaseBackoff().isNegative() || jobs.getBaseBackoff().isZero()) {
            throw new IllegalStateException("app.jobs.base-backoff must be positive");
        }
        if (jobs.getMaxBackoff() == null || jobs.getMaxBackoff().compareTo(jobs.getBaseBackoff()) < 0) {
            throw new IllegalStateException("app.jobs.max-backoff must be >= app.jobs.base-backoff");
        }
        if (jobs.getHandlerTimeout() == null || jobs.getHandlerTimeout().isNegative() || jobs.getHandlerTimeout().isZero()) {
            throw new IllegalStateException("app.jobs.handler-timeout must be positive");
        }
        if (jobs.getClaimClockSkew() == null || jobs.getClaimClockSkew().isNegative()) {
            throw new IllegalStateException("app.jobs.claim-clock-skew must be >= 0");
        }
        // a shorter threshold re-queues jobs whose handler is still running
        if (worker.getStaleProcessingAfter() == null
                || worker.getStaleProcessingAfter().compareTo(jobs.getHandlerTimeout()) <= 0) {
            throw new IllegalStateException("app.worker.stale-processing-after (" + worker.getStaleProcessingAfter()
                    + ") must be greater than app.jobs.handler-timeout (" + jobs.getHandlerTimeout() + ")");
        }
    }

    private static void require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(name + " is required when QUEUE_MODE=external; see " + QUEUE_SETUP_DOC);
        }
    }

    private static void requireHttpUrl(String value) {
        try {
            URI uri = URI.create(value);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("https".equalsIgnoreCase(scheme) || "http".equalsIgnoreCase(scheme))) {
                throw new IllegalArgumentException("not an absolute http(s) URL");
            }
        } catch (RuntimeException e) {
            throw new IllegalStateException("app.queue.api-base-url '" + value + "' is not a valid http(s) URL; see " + QUEUE_SETUP_DOC, e);
        }
    }

    @Getter
    @Setter
    public static class Queue {
        /**
         * {@code local}: jobs are delivered by the DB polling worker. {@code external}: jobs are pushed to the
         * managed queue over HTTP. Mutually exclusive.
         */
        private QueueMode mode = QueueMode.LOCAL;

        /**
         * Managed queue account identifier.
         */
        private String accountId;

        /**
         * Bearer token for the queue API.
         */
        private String apiToken;

        /**
         * Primary job queue.
         */
        private String queueName;

        /**
         * Dead-letter queue.
         */
        private String deadLetterQueueName;

        /**
         * Queue API root; {@code /accounts/{id}/queues/{name}/messages} is appended.
         */
        private String apiBaseUrl = "https://api.cloudflare.com/client/v4";

        /**
         * Connect/read timeout for queue API calls.
         */
        private Duration sendTimeout = Duration.ofSeconds(10);

        /**
         * Shared secret expected in {@code X-Queue-Secret} on push delivery endpoints. Blank disables the check.
         */
        private String pushSecret;
    }

    @Getter
    @Setter
    public static class Jobs {
        /**
         * Total attempts (including the first) before a job is dead-lettered.
         */
        private int maxJobRetries = 3;

        /**
         * Delay after the first failed attempt; doubles per attempt.
         */
        private Duration baseBackoff = Duration.ofSeconds(5);

        /**
         * Maximum backoff cap.
         */
        private Duration maxBackoff = Duration.ofMinutes(5);

        /**
         * Upper bound for one handler invocation; exceeding it counts as a retryable failure.
         */
        private Duration handlerTimeout = Duration.ofMinutes(10);

        /**
         * How far ahead of {@code next_attempt_at} a delivery may still claim a re-queued job; absorbs clock
         * differences between this service and the queue.
         */
        private Duration claimClockSkew = Duration.ofSeconds(1);

        /**
         * Registers the deterministic stub handler for every job type (local development).
         */
        private boolean stubHandlersEnabled = false;
    }

    @Getter
    @Setter
    public static class Worker {
        /**
         * Runs the DB polling loop in this process. Must be switched on explicitly by the operator.
         */
        private boolean enabled = false;

        /**
         * Fixed delay between polls in milliseconds.
         */
        private long pollIntervalMs = 1000L;

        /**
         * Max number of due jobs per poll.
         */
        private int batchSize = 10;

        /**
         * Drain pending jobs once when the worker starts.
         */
        private boolean recoverOnStartup = true;

        /**
         * Batch size for the startup drain.
         */
        private int recoverBatchSize = 50;

        /**
         * A PROCESSING job not updated for this long is considered stalled and re-queued.
         */
        private Duration staleProcessingAfter = Duration.ofMinutes(15);

        /**
         * Fixed delay between stalled-job sweeps in milliseconds.
         */
        private long staleCheckIntervalMs = 60_000L;

        /**
         * Worker and handler thread pool size.
         */
        private int threads = 4;
    }
}
