package com.github.dimitryivaniuta.gateway.jobs.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.gateway.jobs.domain.FailureKind;
import com.github.dimitryivaniuta.gateway.jobs.domain.Job;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobStatus;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobType;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobConflictException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobNotDueException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobNotFoundException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.MalformedJobMessageException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.QueueTransportException;
import com.github.dimitryivaniuta.gateway.jobs.service.handler.JobContext;
import com.github.dimitryivaniuta.gateway.jobs.service.handler.JobHandler;
import com.github.dimitryivaniuta.gateway.jobs.service.handler.JobHandlerException;
import com.github.dimitryivaniuta.gateway.jobs.service.handler.JobHandlerInvoker;
import com.github.dimitryivaniuta.gateway.jobs.service.handler.JobHandlerRegistry;
import com.github.dimitryivaniuta.gateway.jobs.service.handler.JobResult;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessage;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessageCodec;
import com.github.dimitryivaniuta.gateway.jobs.service.transport.QueueTransport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Consumes job messages: claim, dispatch to the handler, then resolve as completed, retry or dead letter.
 *
 * <p>Delivery is at-least-once. The claim is the only coordination between consumers, so a redelivered or
 * concurrently delivered message is skipped rather than run twice. Nothing thrown while consuming escapes to
 * the caller; every message ends in a {@link ConsumeOutcome}.</p>
 */
@Service
public class JobConsumer {

    private static final Logger log = LoggerFactory.getLogger(JobConsumer.class);

    /**
     * MDC key holding the job id while a message is consumed.
     */
    public static final String MDC_JOB_ID = "jobId";

    private static final int MAX_ERROR_LENGTH = 2000;

    private final JobStore jobStore;
    private final JobHandlerRegistry registry;
    private final JobHandlerInvoker invoker;
    private final RetryPolicy retryPolicy;
    private final DeadLetterService deadLetterService;
    private final QueueTransport transport;
    private final JobMessageCodec codec;
    private final Clock clock;

    private final Counter completedCounter;
    private final Counter retryCounter;
    private final Counter deadCounter;
    private final Counter skippedCounter;
    private final Counter malformedCounter;

    public JobConsumer(
            JobStore jobStore,
            JobHandlerRegistry registry,
            JobHandlerInvoker invoker,
            RetryPolicy retryPolicy,
            DeadLetterService deadLetterService,
            QueueTransport transport,
            JobMessageCodec codec,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.jobStore = jobStore;
        this.registry = registry;
        this.invoker = invoker;
        this.retryPolicy = retryPolicy;
        this.deadLetterService = deadLetterService;
        this.transport = transport;
        this.codec = codec;
        this.clock = clock;

        this.completedCounter = Counter.builder("jobs.consumer.completed").register(meterRegistry);
        this.retryCounter = Counter.builder("jobs.consumer.retry").register(meterRegistry);
        this.deadCounter = Counter.builder("jobs.consumer.dead").register(meterRegistry);
        this.skippedCounter = Counter.builder("jobs.consumer.skipped").register(meterRegistry);
        this.malformedCounter = Counter.builder("jobs.consumer.malformed").register(meterRegistry);
    }

    /**
     * Consumes a raw message body.
     *
     * @param rawMessage body as delivered
     * @return outcome
     */
    public ConsumeOutcome handleRaw(String rawMessage) {
        JobMessage message;
        try {
            message = codec.parse(rawMessage);
        } catch (MalformedJobMessageException e) {
            return rejectMalformed(e);
        }
        return handle(message);
    }

    /**
     * Consumes one already parsed message (e.g. an element of a push batch).
     *
     * @param node message tree
     * @return outcome
     */
    public ConsumeOutcome handleTree(JsonNode node) {
        JobMessage message;
        try {
            message = codec.fromTree(node);
        } catch (MalformedJobMessageException e) {
            return rejectMalformed(e);
        }
        return handle(message);
    }

    /**
     * Consumes a job message.
     *
     * @param message message
     * @return outcome
     */
    public ConsumeOutcome handle(JobMessage message) {
        if (isBlank(message.jobId()) || isBlank(message.userId()) || isBlank(message.jobType())) {
            return rejectMalformed(new MalformedJobMessageException("Queue message is missing job_id/user_id/job_type",
                    codec.write(message)));
        }

        MDC.put(MDC_JOB_ID, message.jobId());
        try {
            return process(message);
        } catch (RuntimeException e) {
            log.error("Unexpected error while consuming job {}; message must be redelivered", message.jobId(), e);
            return ConsumeOutcome.ERROR;
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }

    /**
     * Resolves a job that stayed in processing past the stale threshold as a retryable failure.
     *
     * @param job stalled job
     * @return outcome
     */
    public ConsumeOutcome resolveStalled(Job job) {
        MDC.put(MDC_JOB_ID, job.getId());
        try {
            String error = "Stalled in processing since " + job.getUpdatedAt() + " (worker crashed or timed out)";
            log.warn("Recovering stalled job {} attempt={}", job.getId(), job.getAttemptCount());
            return onRetryable(job, codec.fromJob(job), error);
        } catch (RuntimeException e) {
            log.error("Failed to recover stalled job {}", job.getId(), e);
            return ConsumeOutcome.ERROR;
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }

    private ConsumeOutcome process(JobMessage message) {
        String jobId = message.jobId();

        Job job;
        try {
            job = jobStore.markProcessing(jobId);
        } catch (JobNotFoundException e) {
            skippedCounter.increment();
            log.warn("Queue message references unknown job {}; dropped", jobId);
            return ConsumeOutcome.SKIPPED_UNKNOWN_JOB;
        } catch (JobNotDueException e) {
            return deferEarlyDelivery(message, e);
        } catch (JobConflictException e) {
            return skip(e);
        }

        try {
            return dispatch(job, message);
        } catch (RuntimeException e) {
            release(job, e);
            throw e;
        }
    }

    private ConsumeOutcome dispatch(Job job, JobMessage message) {
        String jobId = job.getId();

        // cancel may land between the claim and the dispatch
        if (jobStore.currentStatus(jobId) == JobStatus.CANCELLED) {
            skippedCounter.increment();
            log.info("Job {} cancelled before dispatch; handler not invoked", jobId);
            return ConsumeOutcome.SKIPPED_CANCELLED;
        }

        Optional<JobType> messageType = JobType.fromWire(message.jobType());
        if (messageType.isEmpty()) {
            return onFatal(job, message, "Unknown job type '" + message.jobType() + "'");
        }
        Optional<JobHandler> handler = registry.find(job.getJobType());
        if (handler.isEmpty()) {
            return onFatal(job, message, "No handler registered for job type '" + job.getJobType().wireName() + "'");
        }

        JobContext context = new JobContext(jobId, job.getUserId(), job.getJobType(), job.getDocumentId(),
                codec.readPayload(job.getPayload()), job.getAttemptCount());
        log.debug("Dispatching job {} type={} attempt={}", jobId, job.getJobType().wireName(), job.getAttemptCount());

        JobResult result;
        try {
            result = invoker.invoke(handler.get(), context);
        } catch (JobHandlerException e) {
            return e.isRetryable()
                    ? onRetryable(job, message, safeError(e))
                    : onFatal(job, message, safeError(e));
        }
        return onSuccess(job, result);
    }

    /**
     * Hands a claimed job back to pending after an infrastructure failure, so the redelivered message can claim
     * it again instead of being skipped as a duplicate. The attempt stays counted.
     */
    private void release(Job job, RuntimeException cause) {
        try {
            jobStore.markRetry(job.getId(), safeError(cause), clock.instant());
            log.warn("Job {} released to pending after error: {}", job.getId(), cause.toString());
        } catch (JobConflictException e) {
            log.debug("Job {} already {}; not released", job.getId(), e.getCurrentStatus());
        } catch (RuntimeException e) {
            log.error("Job {} could not be released; left for stalled-job recovery", job.getId(), e);
        }
    }

    private ConsumeOutcome deferEarlyDelivery(JobMessage message, JobNotDueException e) {
        skippedCounter.increment();
        Duration remaining = Duration.between(clock.instant(), e.getNextAttemptAt());
        if (remaining.isNegative()) {
            remaining = Duration.ZERO;
        }
        if (transport.supportsDelayedDelivery()) {
            try {
                transport.sendDelayed(message, remaining);
            } catch (QueueTransportException ex) {
                log.error("Early delivery of job {} could not be deferred; error={}", e.getJobId(), ex.getMessage());
                return ConsumeOutcome.ERROR;
            }
        }
        log.info("Job {} delivered before its retry gate {}; deferred by {}", e.getJobId(), e.getNextAttemptAt(), remaining);
        return ConsumeOutcome.SKIPPED_NOT_DUE;
    }

    private ConsumeOutcome onSuccess(Job job, JobResult result) {
        try {
            jobStore.markCompleted(job.getId(), codec.write(result.output()));
        } catch (JobConflictException e) {
            return skip(e);
        }
        completedCounter.increment();
        log.info("Job {} completed. attempt={}", job.getId(), job.getAttemptCount());
        return ConsumeOutcome.COMPLETED;
    }

    private ConsumeOutcome onRetryable(Job job, JobMessage message, String error) {
        int attempts = job.getAttemptCount();
        if (retryPolicy.shouldDeadLetter(attempts)) {
            return deadLetter(job, message, error, FailureKind.RETRIES_EXHAUSTED);
        }

        Duration delay = retryPolicy.nextDelay(attempts);
        Instant nextAttemptAt = clock.instant().plus(delay);
        try {
            jobStore.markRetry(job.getId(), error, nextAttemptAt);
        } catch (JobConflictException e) {
            return skip(e);
        }
        retryCounter.increment();
        log.warn("Job {} failed. attempt={}/{} nextAttemptAt={} error={}",
                job.getId(), attempts, retryPolicy.getMaxAttempts(), nextAttemptAt, error);

        if (transport.supportsDelayedDelivery()) {
            try {
                transport.sendDelayed(message, delay);
            } catch (QueueTransportException e) {
                log.error("Retry of job {} not re-sent to the queue; it stays pending until a worker polls it. error={}",
                        job.getId(), e.getMessage());
            }
        }
        return ConsumeOutcome.RETRY_SCHEDULED;
    }

    private ConsumeOutcome onFatal(Job job, JobMessage message, String error) {
        return deadLetter(job, message, error, FailureKind.FATAL);
    }

    private ConsumeOutcome deadLetter(Job job, JobMessage message, String error, FailureKind kind) {
        try {
            deadLetterService.deadLetter(job.getId(), message, error, kind);
        } catch (JobConflictException e) {
            return skip(e);
        }
        deadCounter.increment();
        return ConsumeOutcome.DEAD_LETTERED;
    }

    private ConsumeOutcome skip(JobConflictException e) {
        skippedCounter.increment();
        if (e.getCurrentStatus() == JobStatus.CANCELLED) {
            log.info("Job {} is cancelled; {} skipped", e.getJobId(), e.getAttempted());
            return ConsumeOutcome.SKIPPED_CANCELLED;
        }
        log.debug("Job {} is {}; {} skipped (duplicate delivery)", e.getJobId(), e.getCurrentStatus(), e.getAttempted());
        return ConsumeOutcome.SKIPPED_DUPLICATE;
    }

    private ConsumeOutcome rejectMalformed(MalformedJobMessageException e) {
        malformedCounter.increment();
        try {
            deadLetterService.deadLetterRaw(e.getRawMessage(), e.getMessage());
        } catch (RuntimeException ex) {
            log.error("Failed to record malformed queue message: {}", e.getMessage(), ex);
        }
        return ConsumeOutcome.REJECTED_MALFORMED;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String safeError(Exception ex) {
        String msg = ex.getMessage();
        if (msg == null) {
            msg = ex.getClass().getSimpleName();
        }
        if (msg.length() > MAX_ERROR_LENGTH) {
            msg = msg.substring(0, MAX_ERROR_LENGTH);
        }
        return msg;
    }
}
