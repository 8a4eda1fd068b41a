package com.github.dimitryivaniuta.gateway.jobs.service.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.gateway.jobs.domain.FailureKind;
import java.time.Instant;

/**
 * Message forwarded to the dead-letter queue.
 *
 * @param jobId failed job, null for malformed raw messages
 * @param userId owner, if known
 * @param jobType wire job type, if known
 * @param error last error
 * @param failureKind failure classification
 * @param attemptCount attempts used
 * @param originalMessage message as delivered (JSON, or a text node for unparseable bodies)
 * @param failedAt dead-letter time
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeadLetterMessage(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("job_type") String jobType,
        @JsonProperty("error") String error,
        @JsonProperty("failure_kind") FailureKind failureKind,
        @JsonProperty("attempt_count") int attemptCount,
        @JsonProperty("original_message") JsonNode originalMessage,
        @JsonProperty("failed_at") Instant failedAt
) {}
