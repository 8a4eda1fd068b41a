package com.github.dimitryivaniuta.gateway.jobs.web.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.gateway.jobs.domain.Job;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobStatus;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobType;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessageCodec;
import java.time.Instant;

/**
 * Job view.
 */
public record JobResponse(
        String jobId,
        JobType jobType,
        JobStatus status,
        String userId,
        String documentId,
        JsonNode payload,
        JsonNode output,
        String error,
        int attemptCount,
        Instant nextAttemptAt,
        String replayOf,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt
) {

    /**
     * Maps an entity to its view.
     *
     * @param j job
     * @param codec JSON codec for payload and output
     * @return view
     */
    public static JobResponse from(Job j, JobMessageCodec codec) {
        return new JobResponse(
                j.getId(),
                j.getJobType(),
                j.getStatus(),
                j.getUserId(),
                j.getDocumentId(),
                codec.readPayload(j.getPayload()),
                codec.readPayload(j.getOutput()),
                j.getError(),
                j.getAttemptCount(),
                j.getNextAttemptAt(),
                j.getReplayOf(),
                j.getCreatedAt(),
                j.getUpdatedAt(),
                j.getCompletedAt()
        );
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
