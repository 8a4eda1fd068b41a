package com.github.dimitryivaniuta.gateway.jobs.service.dto;

import com.github.dimitryivaniuta.gateway.jobs.domain.JobStatus;

/**
 * Producer result.
 *
 * @param jobId created job id
 * @param status status after creation (always pending)
 * @param dispatched false when the row was stored but the queue send failed
 */
public record EnqueueResult(String jobId, JobStatus status, boolean dispatched) {}
