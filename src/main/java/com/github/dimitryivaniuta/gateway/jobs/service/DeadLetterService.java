package com.github.dimitryivaniuta.gateway.jobs.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.gateway.jobs.domain.DeadLetterRecord;
import com.github.dimitryivaniuta.gateway.jobs.domain.FailureKind;
import com.github.dimitryivaniuta.gateway.jobs.repo.DeadLetterRecordRepository;
import com.github.dimitryivaniuta.gateway.jobs.service.dto.EnqueueResult;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobNotFoundException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobValidationException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.QueueTransportException;
import com.github.dimitryivaniuta.gateway.jobs.service.message.DeadLetterMessage;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessage;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessageCodec;
import com.github.dimitryivaniuta.gateway.jobs.service.transport.QueueTransport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Terminal failure path.
 *
 * <p>The dead-letter record is written together with the FAILED transition; forwarding to the external
 * dead-letter queue afterwards is best effort and only logged on failure.</p>
 */
@Service
public class DeadLetterService {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterService.class);

    private final JobStore jobStore;
    private final DeadLetterRecordRepository repository;
    private final QueueTransport transport;
    private final JobMessageCodec codec;
    private final JobProducer producer;
    private final Clock clock;

    private final Counter recordedCounter;
    private final Counter forwardFailedCounter;
    private final Counter replayedCounter;

    public DeadLetterService(
            JobStore jobStore,
            DeadLetterRecordRepository repository,
            QueueTransport transport,
            JobMessageCodec codec,
            JobProducer producer,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.jobStore = jobStore;
        this.repository = repository;
        this.transport = transport;
        this.codec = codec;
        this.producer = producer;
        this.clock = clock;

        this.recordedCounter = Counter.builder("jobs.dead_letter.recorded").register(meterRegistry);
        this.forwardFailedCounter = Counter.builder("jobs.dead_letter.forward_failed").register(meterRegistry);
        this.replayedCounter = Counter.builder("jobs.dead_letter.replayed").register(meterRegistry);
    }

    /**
     * Fails a processing job and records it.
     *
     * @param jobId job id
     * @param original message as delivered
     * @param error last error
     * @param kind failure kind
     * @return stored record
     */
    public DeadLetterRecord deadLetter(String jobId, JobMessage original, String error, FailureKind kind) {
        DeadLetterRecord record = jobStore.markFailed(jobId, error, kind);
        recordedCounter.increment();
        log.error("Job {} dead-lettered. kind={} attempts={} error={}", jobId, kind, record.getAttemptCount(), error);

        forward(new DeadLetterMessage(record.getJobId(), record.getUserId(), record.getJobType(), error, kind,
                record.getAttemptCount(), original == null ? null : codec.toTree(original), record.getCreatedAt()));
        return record;
    }

    /**
     * Records a message that could not be mapped onto a job. The job store is not touched.
     *
     * @param rawMessage body as received
     * @param reason parse/validation error
     * @return stored record
     */
    public DeadLetterRecord deadLetterRaw(String rawMessage, String reason) {
        DeadLetterRecord record = repository.save(DeadLetterRecord.forRawMessage(rawMessage, reason, clock.instant()));
        recordedCounter.increment();
        log.warn("Malformed queue message dead-lettered. record={} reason={}", record.getId(), reason);

        forward(new DeadLetterMessage(null, null, null, reason, FailureKind.MALFORMED_MESSAGE, 0,
                codec.readPayload(record.getPayload()), record.getCreatedAt()));
        return record;
    }

    public List<DeadLetterRecord> list(String userId, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, JobStore.MAX_PAGE_SIZE)));
        if (userId == null || userId.isBlank()) {
            return repository.findAllByOrderByCreatedAtDesc(page);
        }
        return repository.findByUserIdOrderByCreatedAtDesc(userId, page);
    }

    public DeadLetterRecord get(String id) {
        return repository.findById(id).orElseThrow(() -> new JobNotFoundException("Dead-letter record", id));
    }

    /**
     * Re-submits a dead-lettered job as a new job; the failed job itself stays failed.
     *
     * @param id dead-letter record id
     * @return enqueue result of the new job
     * @throws JobValidationException when the record came from a malformed message
     */
    public EnqueueResult replay(String id) {
        DeadLetterRecord record = get(id);
        if (record.getJobId() == null) {
            throw new JobValidationException("Dead-letter record '" + id + "' holds a malformed message and cannot be replayed");
        }
        JsonNode payload = codec.readPayload(record.getPayload());
        EnqueueResult result = producer.enqueue(record.getJobType(), record.getUserId(), payload,
                record.getDocumentId(), record.getJobId());
        replayedCounter.increment();
        log.info("Replayed dead-lettered job {} as {}", record.getJobId(), result.jobId());
        return result;
    }

    private void forward(DeadLetterMessage message) {
        try {
            transport.sendToDeadLetter(message);
        } catch (QueueTransportException e) {
            forwardFailedCounter.increment();
            log.error("Dead-letter forward failed for job {}; record kept in dead_letter_records. error={}",
                    message.jobId(), e.getMessage());
        }
    }
}
