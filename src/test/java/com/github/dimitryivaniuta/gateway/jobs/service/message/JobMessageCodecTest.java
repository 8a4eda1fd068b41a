package com.github.dimitryivaniuta.gateway.jobs.service.message;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.jobs.domain.Job;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobType;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.MalformedJobMessageException;
import java.time.Instant;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class JobMessageCodecTest {

    private final JobMessageCodec codec = new JobMessageCodec(new ObjectMapper());

    @Test
    void parsesWireMessage() {
        JobMessage m = codec.parse("""
                {"job_id":"j1","user_id":"u1","job_type":"ingest_youtube","document_id":"d1","payload":{"url":"https://youtu.be/x"}}
                """);

        Assertions.assertEquals("j1", m.jobId());
        Assertions.assertEquals("u1", m.userId());
        Assertions.assertEquals("ingest_youtube", m.jobType());
        Assertions.assertEquals("d1", m.documentId());
        Assertions.assertEquals("https://youtu.be/x", m.payload().get("url").asText());
    }

    @Test
    void missingPayloadBecomesEmptyObject() {
        JobMessage m = codec.parse("{\"job_id\":\"j1\",\"user_id\":\"u1\",\"job_type\":\"ingest_text\"}");

        Assertions.assertTrue(m.payload().isObject());
        Assertions.assertEquals(0, m.payload().size());
        Assertions.assertNull(m.documentId());
    }

    @Test
    void rejectsMissingOrBlankEnvelopeFields() {
        MalformedJobMessageException e = Assertions.assertThrows(MalformedJobMessageException.class,
                () -> codec.parse("{\"job_id\":\"j1\",\"user_id\":\" \",\"job_type\":\"ingest_text\"}"));
        Assertions.assertTrue(e.getMessage().contains("user_id"));

        Assertions.assertThrows(MalformedJobMessageException.class,
                () -> codec.parse("{\"user_id\":\"u1\",\"job_type\":\"ingest_text\"}"));
        Assertions.assertThrows(MalformedJobMessageException.class,
                () -> codec.parse("{\"job_id\":7,\"user_id\":\"u1\",\"job_type\":\"ingest_text\"}"));
    }

    @Test
    void rejectsNonObjectBodiesAndKeepsRawText() {
        MalformedJobMessageException e = Assertions.assertThrows(MalformedJobMessageException.class,
                () -> codec.parse("not json"));
        Assertions.assertEquals("not json", e.getRawMessage());

        Assertions.assertThrows(MalformedJobMessageException.class, () -> codec.parse("[1,2]"));
        Assertions.assertThrows(MalformedJobMessageException.class, () -> codec.parse(""));
    }

    @Test
    void buildsMessageFromStoredJob() {
        Job job = Job.newPending(JobType.GENERATE_BLOG, "u1", "doc-1", "{\"tone\":\"casual\"}", null, Instant.now());

        JobMessage m = codec.fromJob(job);

        Assertions.assertEquals(job.getId(), m.jobId());
        Assertions.assertEquals("generate_blog", m.jobType());
        Assertions.assertEquals("casual", m.payload().get("tone").asText());
        Assertions.assertTrue(codec.write(m).contains("\"document_id\":\"doc-1\""));
    }

    @Test
    void corruptStoredPayloadIsReturnedAsText() {
        Assertions.assertTrue(codec.readPayload("{broken").isTextual());
        Assertions.assertNull(codec.readPayload(null));
    }
}
