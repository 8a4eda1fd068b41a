package com.github.dimitryivaniuta.gateway.jobs.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.github.dimitryivaniuta.gateway.jobs.domain.DeadLetterRecord;
import com.github.dimitryivaniuta.gateway.jobs.domain.FailureKind;
import com.github.dimitryivaniuta.gateway.jobs.domain.Job;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobStatus;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobType;
import com.github.dimitryivaniuta.gateway.jobs.repo.DeadLetterRecordRepository;
import com.github.dimitryivaniuta.gateway.jobs.service.dto.EnqueueResult;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobNotFoundException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobValidationException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.QueueTransportException;
import com.github.dimitryivaniuta.gateway.jobs.service.message.DeadLetterMessage;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessage;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessageCodec;
import com.github.dimitryivaniuta.gateway.jobs.service.transport.QueueTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.data.domain.PageRequest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;

class DeadLetterServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final JobMessageCodec codec = new JobMessageCodec(new ObjectMapper().findAndRegisterModules());
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private JobStore jobStore;
    private DeadLetterRecordRepository repository;
    private QueueTransport transport;
    private JobProducer producer;
    private DeadLetterService service;

    @BeforeEach
    void setUp() {
        jobStore = Mockito.mock(JobStore.class);
        repository = Mockito.mock(DeadLetterRecordRepository.class);
        transport = Mockito.mock(QueueTransport.class);
        producer = Mockito.mock(JobProducer.class);
        service = new DeadLetterService(jobStore, repository, transport, codec, producer,
                Clock.fixed(NOW, ZoneOffset.UTC), meterRegistry);
    }

    @Test
    void deadLetterFailsJobAndForwardsOriginalMessage() {
        Job job = Job.newPending(JobType.INGEST_DRIVE, "user-1", "doc-1", "{\"folder\":\"f\"}", null, NOW);
        DeadLetterRecord record = DeadLetterRecord.forJob(job, "boom", FailureKind.FATAL, NOW);
        Mockito.when(jobStore.markFailed(job.getId(), "boom", FailureKind.FATAL)).thenReturn(record);
        JobMessage original = codec.fromJob(job);

        DeadLetterRecord result = service.deadLetter(job.getId(), original, "boom", FailureKind.FATAL);

        Assertions.assertSame(record, result);
        ArgumentCaptor<DeadLetterMessage> forwarded = ArgumentCaptor.forClass(DeadLetterMessage.class);
        Mockito.verify(transport).sendToDeadLetter(forwarded.capture());
        Assertions.assertEquals(job.getId(), forwarded.getValue().jobId());
        Assertions.assertEquals(FailureKind.FATAL, forwarded.getValue().failureKind());
        Assertions.assertEquals("f", forwarded.getValue().originalMessage().path("payload").path("folder").asText());
        Assertions.assertEquals(1.0, meterRegistry.counter("jobs.dead_letter.recorded").count());
    }

    @Test
    void forwardFailureKeepsRecord() {
        Job job = Job.newPending(JobType.INGEST_TEXT, "user-1", null, "{}", null, NOW);
        DeadLetterRecord record = DeadLetterRecord.forJob(job, "exhausted", FailureKind.RETRIES_EXHAUSTED, NOW);
        Mockito.when(jobStore.markFailed(any(), any(), any())).thenReturn(record);
        Mockito.doThrow(new QueueTransportException("dlq down", 503, null)).when(transport).sendToDeadLetter(any());

        DeadLetterRecord result = service.deadLetter(job.getId(), null, "exhausted", FailureKind.RETRIES_EXHAUSTED);

        Assertions.assertSame(record, result);
        Assertions.assertEquals(1.0, meterRegistry.counter("jobs.dead_letter.forward_failed").count());
    }

    @Test
    void rawMessageIsStoredWithoutTouchingJobs() {
        Mockito.when(repository.save(any(DeadLetterRecord.class))).thenAnswer(inv -> inv.getArgument(0));

        DeadLetterRecord record = service.deadLetterRaw("{broken", "Queue message is not valid JSON");

        Assertions.assertNull(record.getJobId());
        Assertions.assertEquals("{broken", record.getPayload());
        Assertions.assertEquals(FailureKind.MALFORMED_MESSAGE, record.getFailureKind());
        Mockito.verifyNoInteractions(jobStore);
        ArgumentCaptor<DeadLetterMessage> forwarded = ArgumentCaptor.forClass(DeadLetterMessage.class);
        Mockito.verify(transport).sendToDeadLetter(forwarded.capture());
        Assertions.assertEquals("{broken", forwarded.getValue().originalMessage().asText());
    }

    @Test
    void replayEnqueuesNewJobLinkedToFailedOne() {
        Job job = Job.newPending(JobType.GENERATE_BLOG, "user-2", "doc-7", "{\"topic\":\"t\"}", null, NOW);
        DeadLetterRecord record = DeadLetterRecord.forJob(job, "boom", FailureKind.FATAL, NOW);
        Mockito.when(repository.findById(record.getId())).thenReturn(Optional.of(record));
        EnqueueResult enqueued = new EnqueueResult("new-job", JobStatus.PENDING, true);
        Mockito.when(producer.enqueue(eq("generate_blog"), eq("user-2"), any(), eq("doc-7"), eq(job.getId())))
                .thenReturn(enqueued);

        EnqueueResult result = service.replay(record.getId());

        Assertions.assertSame(enqueued, result);
        Assertions.assertEquals(1.0, meterRegistry.counter("jobs.dead_letter.replayed").count());
    }

    @Test
    void malformedRecordCannotBeReplayed() {
        DeadLetterRecord raw = DeadLetterRecord.forRawMessage("nope", "bad", NOW);
        Mockito.when(repository.findById(raw.getId())).thenReturn(Optional.of(raw));

        Assertions.assertThrows(JobValidationException.class, () -> service.replay(raw.getId()));
        Mockito.verifyNoInteractions(producer);
    }

    @Test
    void unknownRecordIsNotFound() {
        Mockito.when(repository.findById("missing")).thenReturn(Optional.empty());

        Assertions.assertThrows(JobNotFoundException.class, () -> service.get("missing"));
    }

    @Test
    void listClampsLimit() {
        service.list("user-1", 1000);

        Mockito.verify(repository).findByUserIdOrderByCreatedAtDesc(eq("user-1"),
                eq(PageRequest.of(0, JobStore.MAX_PAGE_SIZE)));
    }
}
