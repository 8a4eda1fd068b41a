package com.github.dimitryivaniuta.gateway.jobs.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.gateway.jobs.config.AppProperties;
import com.github.dimitryivaniuta.gateway.jobs.domain.Job;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobType;
import com.github.dimitryivaniuta.gateway.jobs.service.dto.EnqueueResult;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobValidationException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.QueueTransportException;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessageCodec;
import com.github.dimitryivaniuta.gateway.jobs.service.transport.QueueTransport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Creates jobs and hands them to the queue transport.
 *
 * <p>The row is committed before the send. A failed send never removes it: the job stays pending and the
 * caller gets {@code dispatched=false}.</p>
 */
@Slf4j
@Service
public class JobProducer {

    private final JobStore jobStore;
    private final QueueTransport transport;
    private final JobMessageCodec codec;

    private final Counter enqueuedCounter;
    private final Counter dispatchFailedCounter;

    /**
     * Creates the producer.
     *
     * @param jobStore store
     * @param transport queue transport
     * @param codec message codec
     * @param meterRegistry metrics
     */
    public JobProducer(JobStore jobStore, QueueTransport transport, JobMessageCodec codec, MeterRegistry meterRegistry) {
        this.jobStore = jobStore;
        this.transport = transport;
        this.codec = codec;

        this.enqueuedCounter = Counter.builder("jobs.producer.enqueued").register(meterRegistry);
        this.dispatchFailedCounter = Counter.builder("jobs.producer.dispatch_failed").register(meterRegistry);
    }

    /**
     * Validates, persists and dispatches a job.
     *
     * @param jobType wire job type
     * @param userId owner
     * @param payload handler input (JSON object)
     * @param documentId optional artifact reference
     * @return result
     * @throws JobValidationException invalid type, user or payload
     */
    public EnqueueResult enqueue(String jobType, String userId, JsonNode payload, String documentId) {
        return enqueue(jobType, userId, payload, documentId, null);
    }

    EnqueueResult enqueue(String jobType, String userId, JsonNode payload, String documentId, String replayOf) {
        JobType type = JobType.fromWire(jobType)
                .orElseThrow(() -> new JobValidationException("Unknown job type '" + jobType + "'"));
        if (userId == null || userId.isBlank()) {
            throw new JobValidationException("userId is required");
        }
        if (payload == null || !payload.isObject()) {
            throw new JobValidationException("payload must be a JSON object");
        }

        Job job = jobStore.create(type, userId, codec.write(payload), documentId, replayOf);
        enqueuedCounter.increment();

        boolean dispatched = true;
        try {
            transport.send(codec.fromJob(job));
        } catch (QueueTransportException e) {
            dispatched = false;
            dispatchFailedCounter.increment();
            log.error("Job {} stored but not dispatched (mode={}, httpStatus={}): {}. The job stays pending; "
                            + "check app.queue.* settings or run a worker with app.worker.enabled=true. See {}",
                    job.getId(), transport.mode(), e.getHttpStatus(), e.getMessage(), AppProperties.QUEUE_SETUP_DOC);
        }

        log.info("Enqueued job {} type={} user={} dispatched={}", job.getId(), type.wireName(), job.getUserId(), dispatched);
        return new EnqueueResult(job.getId(), job.getStatus(), dispatched);
    }
}
