package com.github.dimitryivaniuta.gateway.jobs.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.github.dimitryivaniuta.gateway.jobs.config.QueueMode;
import com.github.dimitryivaniuta.gateway.jobs.domain.Job;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobStatus;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobType;
import com.github.dimitryivaniuta.gateway.jobs.service.dto.EnqueueResult;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobValidationException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.QueueTransportException;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessage;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessageCodec;
import com.github.dimitryivaniuta.gateway.jobs.service.transport.QueueTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;

class JobProducerTest {

    private final JobMessageCodec codec = new JobMessageCodec(new ObjectMapper());
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private JobStore jobStore;
    private QueueTransport transport;
    private JobProducer producer;

    @BeforeEach
    void setUp() {
        jobStore = Mockito.mock(JobStore.class);
        transport = Mockito.mock(QueueTransport.class);
        Mockito.when(transport.mode()).thenReturn(QueueMode.EXTERNAL);
        producer = new JobProducer(jobStore, transport, codec, meterRegistry);
    }

    @Test
    void enqueueStoresThenSends() {
        Job stored = Job.newPending(JobType.INGEST_YOUTUBE, "user-1", "doc-1", "{\"url\":\"u\"}", null, Instant.now());
        Mockito.when(jobStore.create(eq(JobType.INGEST_YOUTUBE), eq("user-1"), anyString(), eq("doc-1"), isNull()))
                .thenReturn(stored);

        EnqueueResult result = producer.enqueue("ingest_youtube", "user-1",
                JsonNodeFactory.instance.objectNode().put("url", "u"), "doc-1");

        Assertions.assertEquals(stored.getId(), result.jobId());
        Assertions.assertEquals(JobStatus.PENDING, result.status());
        Assertions.assertTrue(result.dispatched());

        ArgumentCaptor<JobMessage> sent = ArgumentCaptor.forClass(JobMessage.class);
        Mockito.verify(transport).send(sent.capture());
        Assertions.assertEquals(stored.getId(), sent.getValue().jobId());
        Assertions.assertEquals("ingest_youtube", sent.getValue().jobType());
    }

    @Test
    void sendFailureKeepsPendingRowAndReportsNotDispatched() {
        Job stored = Job.newPending(JobType.INGEST_TEXT, "user-1", null, "{}", null, Instant.now());
        Mockito.when(jobStore.create(any(JobType.class), anyString(), anyString(), any(), any())).thenReturn(stored);
        Mockito.doThrow(new QueueTransportException("unauthorized", 401, null)).when(transport).send(any());

        EnqueueResult result = producer.enqueue("ingest_text", "user-1", JsonNodeFactory.instance.objectNode(), null);

        Assertions.assertFalse(result.dispatched());
        Assertions.assertEquals(JobStatus.PENDING, result.status());
        Assertions.assertEquals(1.0, meterRegistry.counter("jobs.producer.dispatch_failed").count());
    }

    @Test
    void invalidRequestsAreRejectedBeforeStoring() {
        Assertions.assertThrows(JobValidationException.class,
                () -> producer.enqueue("transcode_video", "user-1", JsonNodeFactory.instance.objectNode(), null));
        Assertions.assertThrows(JobValidationException.class,
                () -> producer.enqueue("ingest_text", " ", JsonNodeFactory.instance.objectNode(), null));
        Assertions.assertThrows(JobValidationException.class,
                () -> producer.enqueue("ingest_text", "user-1", JsonNodeFactory.instance.arrayNode(), null));
        Assertions.assertThrows(JobValidationException.class,
                () -> producer.enqueue("ingest_text", "user-1", null, null));

        Mockito.verifyNoInteractions(jobStore);
        Mockito.verify(transport, Mockito.never()).send(any());
    }
}
