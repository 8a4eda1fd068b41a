package com.github.dimitryivaniuta.gateway.jobs.service.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobType;

/**
 * Input for one handler attempt.
 *
 * @param jobId job id
 * @param userId owner
 * @param jobType job type
 * @param documentId optional artifact reference
 * @param payload handler input
 * @param attempt 1-based attempt number
 */
public record JobContext(String jobId, String userId, JobType jobType, String documentId, JsonNode payload, int attempt) {}
