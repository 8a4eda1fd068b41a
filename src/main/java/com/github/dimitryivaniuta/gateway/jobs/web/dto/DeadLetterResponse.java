package com.github.dimitryivaniuta.gateway.jobs.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.gateway.jobs.domain.DeadLetterRecord;
import com.github.dimitryivaniuta.gateway.jobs.domain.FailureKind;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessageCodec;
import java.time.Instant;

/**
 * Dead-letter record view. {@code payload} is a string node when the original message was not valid JSON.
 */
public record DeadLetterResponse(
        String id,
        String jobId,
        String userId,
        String jobType,
        String documentId,
        JsonNode payload,
        String error,
        int attemptCount,
        FailureKind failureKind,
        Instant createdAt
) {

    public static DeadLetterResponse from(DeadLetterRecord r, JobMessageCodec codec) {
        return new DeadLetterResponse(r.getId(), r.getJobId(), r.getUserId(), r.getJobType(), r.getDocumentId(),
                codec.readPayload(r.getPayload()), r.getError(), r.getAttemptCount(), r.getFailureKind(),
                r.getCreatedAt());
    }
}
