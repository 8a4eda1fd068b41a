package com.github.dimitryivaniuta.gateway.jobs.service.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Queue wire message.
 *
 * <pre>{ "job_id": "...", "user_id": "...", "job_type": "ingest_youtube", "document_id": "...", "payload": {...} }</pre>
 *
 * @param jobId job id
 * @param userId owner
 * @param jobType wire job type (kept as a string; unknown types are resolved as fatal by the consumer)
 * @param documentId optional artifact reference
 * @param payload handler input
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobMessage(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("job_type") String jobType,
        @JsonProperty("document_id") String documentId,
        @JsonProperty("payload") JsonNode payload
) {}
