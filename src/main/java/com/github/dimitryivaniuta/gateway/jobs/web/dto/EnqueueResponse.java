package com.github.dimitryivaniuta.gateway.jobs.web.dto;

import com.github.dimitryivaniuta.gateway.jobs.domain.JobStatus;
import com.github.dimitryivaniuta.gateway.jobs.service.dto.EnqueueResult;

/**
 * Enqueue response.
 *
 * @param jobId created job id
 * @param status job status (pending)
 * @param dispatched whether the queue accepted the message
 */
public record EnqueueResponse(String jobId, JobStatus status, boolean dispatched) {

    public static EnqueueResponse from(EnqueueResult r) {
        return new EnqueueResponse(r.jobId(), r.status(), r.dispatched());
    }
}
