package com.github.dimitryivaniuta.gateway.jobs.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.jobs.config.AppProperties;
import com.github.dimitryivaniuta.gateway.jobs.service.ConsumeOutcome;
import com.github.dimitryivaniuta.gateway.jobs.service.JobConsumer;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobValidationException;
import com.github.dimitryivaniuta.gateway.jobs.web.dto.ConsumeResponse;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Push delivery endpoint for the external queue's consumer (e.g. an HTTP push subscription).
 *
 * <p>Answers 200 with the outcome once the message has been handled, including dead-lettered and malformed
 * messages, so the queue does not redeliver them. An {@link ConsumeOutcome#ERROR} answers 503 so the queue
 * retries the delivery; for a batch, one failed element fails the whole request and the elements that did run
 * are skipped as duplicates on redelivery.</p>
 */
@RestController
@RequestMapping("/api/queue/messages")
public class QueuePushController {

    /** Header carrying {@code app.queue.push-secret}. */
    public static final String QUEUE_SECRET_HEADER = "X-Queue-Secret";

    private final JobConsumer consumer;
    private final ObjectMapper objectMapper;
    private final AppProperties properties;
    private final Executor executor;

    public QueuePushController(
            JobConsumer consumer,
            ObjectMapper objectMapper,
            AppProperties properties,
            @Qualifier("jobWorkerExecutor") Executor executor
    ) {
        this.consumer = consumer;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.executor = executor;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ConsumeResponse> push(
            @RequestHeader(value = QUEUE_SECRET_HEADER, required = false) String secret,
            @RequestBody String body
    ) {
        checkSecret(secret);
        ConsumeOutcome outcome = consumer.handleRaw(body);
        return ResponseEntity.status(statusFor(outcome == ConsumeOutcome.ERROR))
                .body(new ConsumeResponse(0, outcome));
    }

    /**
     * Consumes a JSON array of wire messages; each message is an independent task.
     *
     * @param secret shared secret
     * @param body JSON array
     * @return one outcome per message, in input order; 503 when any of them ended in {@code ERROR}
     */
    @PostMapping(value = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ConsumeResponse>> pushBatch(
            @RequestHeader(value = QUEUE_SECRET_HEADER, required = false) String secret,
            @RequestBody String body
    ) {
        checkSecret(secret);
        JsonNode batch;
        try {
            batch = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new JobValidationException("Batch body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (batch == null || !batch.isArray()) {
            throw new JobValidationException("Batch body must be a JSON array of queue messages");
        }

        List<CompletableFuture<ConsumeOutcome>> tasks = new ArrayList<>();
        for (JsonNode message : batch) {
            tasks.add(CompletableFuture.supplyAsync(() -> consumer.handleTree(message), executor));
        }

        List<ConsumeResponse> out = new ArrayList<>(tasks.size());
        boolean failed = false;
        for (int i = 0; i < tasks.size(); i++) {
            ConsumeOutcome outcome = tasks.get(i).join();
            failed |= outcome == ConsumeOutcome.ERROR;
            out.add(new ConsumeResponse(i, outcome));
        }
        return ResponseEntity.status(statusFor(failed)).body(out);
    }

    private static HttpStatus statusFor(boolean failed) {
        return failed ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
    }

    private void checkSecret(String provided) {
        String expected = properties.getQueue().getPushSecret();
        if (expected == null || expected.isBlank()) {
            return;
        }
        boolean ok = provided != null && MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8));
        if (!ok) {
            throw new ErrorResponseException(HttpStatus.UNAUTHORIZED,
                    ProblemDetail.forStatusAndDetail(HttpStatus.UNAUTHORIZED, "Missing or invalid " + QUEUE_SECRET_HEADER),
                    null);
        }
    }
}
