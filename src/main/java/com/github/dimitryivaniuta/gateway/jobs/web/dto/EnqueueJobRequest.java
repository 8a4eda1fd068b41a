package com.github.dimitryivaniuta.gateway.jobs.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Enqueue request.
 *
 * @param jobType wire job type, e.g. {@code ingest_text}
 * @param userId owner
 * @param payload handler input; must be a JSON object
 * @param documentId optional artifact reference
 */
public record EnqueueJobRequest(
        @NotBlank @Size(max = 64) String jobType,
        @NotBlank @Size(max = 128) String userId,
        @NotNull JsonNode payload,
        @Size(max = 128) String documentId
) {}
